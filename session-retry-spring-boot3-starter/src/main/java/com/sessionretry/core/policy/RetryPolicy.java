package com.sessionretry.core.policy;

import com.sessionretry.core.backoff.BackoffRegistry;
import com.sessionretry.model.Classification;
import com.sessionretry.model.RetryDecision;
import com.sessionretry.model.enums.StopReason;

import java.time.Duration;

/**
 * 重试策略, 无状态, 可在并发循环间共享
 */
public class RetryPolicy {

    private final int maxAttempts;

    /** 可为 null */
    private final Duration maxElapsed;

    private final BackoffRegistry backoff;

    public RetryPolicy(int maxAttempts, Duration maxElapsed, BackoffRegistry backoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("session.retry.max-attempts must be >= 1");
        }
        if (maxElapsed != null && maxElapsed.isNegative()) {
            throw new IllegalArgumentException("session.retry.max-elapsed must not be negative");
        }
        this.maxAttempts = maxAttempts;
        this.maxElapsed = maxElapsed;
        this.backoff = backoff;
    }

    /**
     * @param c             最后一次错误的判定
     * @param idempotent    操作是否幂等
     * @param attemptCount  已执行的尝试次数（从 1 开始）
     * @param elapsed       循环已耗时
     * @param cancelled     上下文是否已取消
     */
    public RetryDecision shouldContinue(Classification c, boolean idempotent, int attemptCount,
                                        Duration elapsed, boolean cancelled) {
        if (cancelled) {
            return RetryDecision.stop(StopReason.CANCELLED);
        }
        if (!c.mustRetry(idempotent)) {
            return RetryDecision.stop(StopReason.NOT_RETRYABLE);
        }
        if (attemptCount >= maxAttempts) {
            return RetryDecision.stop(StopReason.MAX_ATTEMPTS);
        }
        Duration delay = backoff.delay(attemptCount);
        // 退避后会超出时间预算, 不再等待
        if (maxElapsed != null && elapsed.plus(delay).compareTo(maxElapsed) > 0) {
            return RetryDecision.stop(StopReason.TIME_BUDGET);
        }
        return RetryDecision.retryAfter(delay);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getMaxElapsed() {
        return maxElapsed;
    }
}
