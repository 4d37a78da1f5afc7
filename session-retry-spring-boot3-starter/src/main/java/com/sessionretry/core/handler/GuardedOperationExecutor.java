package com.sessionretry.core.handler;

import com.sessionretry.config.SessionRetryGuardProperties;
import com.sessionretry.core.context.ExecutionContext;
import com.sessionretry.core.spi.SessionOperation;
import com.sessionretry.exception.BackendException;
import com.sessionretry.exception.guard.DownstreamBulkheadFullException;
import com.sessionretry.exception.guard.DownstreamOpenCircuitException;
import com.sessionretry.exception.guard.DownstreamRateLimitedException;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;

import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 按 label 对单次尝试做 RateLimiter → Bulkhead → CircuitBreaker 装饰
 */
public class GuardedOperationExecutor {

    private final SessionRetryGuardProperties props;

    private final ConcurrentHashMap<String, CircuitBreaker> cbCache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Bulkhead>      bhCache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, RateLimiter>   rlCache = new ConcurrentHashMap<>();

    public GuardedOperationExecutor(SessionRetryGuardProperties props) {
        this.props = props;
    }

    /**
     * 统一入口
     * guard 拒绝时抛出 Downstream*Exception, 装配了 guard 的 ErrorClassifier 判为可重试
     */
    public <S, R> R execute(String label, ExecutionContext ctx, S session,
                            SessionOperation<S, R> op) throws Exception {
        Callable<R> decorated = () -> op.execute(ctx, session);

        // RateLimit最外层限流，抑制突发流量
        SessionRetryGuardProperties.RateLimit rl = props.rateLimiterFor(label);
        if (rl.isEnabled()) {
            decorated = RateLimiter.decorateCallable(rlCache.computeIfAbsent(label, k -> buildRl(k, rl)), decorated);
        }

        // Bulkhead 限制后端并发
        SessionRetryGuardProperties.BulkheadLimit bh = props.bulkheadFor(label);
        if (bh.isEnabled()) {
            decorated = Bulkhead.decorateCallable(bhCache.computeIfAbsent(label, k -> buildBh(k, bh)), decorated);
        }

        // CircuitBreaker fail-fast 熔断器
        SessionRetryGuardProperties.CircuitBreakerLimit cb = props.circuitBreakerFor(label);
        if (cb.isEnabled()) {
            decorated = CircuitBreaker.decorateCallable(cbCache.computeIfAbsent(label, k -> buildCb(k, cb)), decorated);
        }

        try {
            return decorated.call();
        } catch (CallNotPermittedException open) {
            throw new DownstreamOpenCircuitException(label, open);
        } catch (BulkheadFullException full) {
            throw new DownstreamBulkheadFullException(label, full);
        } catch (RequestNotPermitted rnp) {
            throw new DownstreamRateLimitedException(label, rnp);
        }
    }

    /** 仅在 guard 已为该 label 创建熔断器时返回 */
    public CircuitBreaker getCircuitBreaker(String label) {
        return cbCache.get(label);
    }

    private RateLimiter buildRl(String label, SessionRetryGuardProperties.RateLimit r) {
        RateLimiterConfig cfg = RateLimiterConfig.custom()
                .limitForPeriod(r.getLimitForPeriod())
                .limitRefreshPeriod(r.getLimitRefreshPeriod())
                .timeoutDuration(r.getTimeoutDuration())
                .build();
        return RateLimiter.of("rl:" + label, cfg);
    }

    private Bulkhead buildBh(String label, SessionRetryGuardProperties.BulkheadLimit b) {
        BulkheadConfig cfg = BulkheadConfig.custom()
                .maxConcurrentCalls(b.getMaxConcurrentCalls())
                .maxWaitDuration(b.getMaxWaitDuration())
                .fairCallHandlingStrategyEnabled(true)
                .build();
        return Bulkhead.of("bh:" + label, cfg);
    }

    private CircuitBreaker buildCb(String label, SessionRetryGuardProperties.CircuitBreakerLimit c) {
        CircuitBreakerConfig cfg = CircuitBreakerConfig.custom()
                .failureRateThreshold(c.getFailureRateThreshold())
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(c.getSlidingWindowSize())
                .minimumNumberOfCalls(c.getMinimumNumberOfCalls())
                .waitDurationInOpenState(c.getWaitDurationInOpenState())
                .permittedNumberOfCallsInHalfOpenState(c.getPermittedNumberOfCallsInHalfOpenState())
                // 只有后端错误计入失败率, 本地错误不触发熔断
                .recordExceptions(BackendException.class)
                .build();
        return CircuitBreaker.of("cb:" + label, cfg);
    }
}
