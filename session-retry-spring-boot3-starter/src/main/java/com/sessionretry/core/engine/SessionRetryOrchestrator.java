package com.sessionretry.core.engine;

import com.sessionretry.core.context.ExecutionContext;
import com.sessionretry.core.failure.ErrorClassifier;
import com.sessionretry.core.handler.GuardedOperationExecutor;
import com.sessionretry.core.policy.RetryPolicy;
import com.sessionretry.core.spi.RetryObserver;
import com.sessionretry.core.spi.SessionOperation;
import com.sessionretry.core.spi.SessionPool;
import com.sessionretry.core.trace.ObserverRegistry;
import com.sessionretry.core.trace.Registration;
import com.sessionretry.exception.SessionRetryException;
import com.sessionretry.model.Classification;
import com.sessionretry.model.RetryDecision;
import com.sessionretry.model.RetryOptions;
import com.sessionretry.model.enums.FailureKind;
import com.sessionretry.model.enums.Retryability;
import com.sessionretry.model.enums.StopReason;
import com.sessionretry.model.trace.AttemptInfo;
import com.sessionretry.model.trace.LoopDoneInfo;
import com.sessionretry.model.trace.LoopStartInfo;
import io.netty.util.Timeout;
import io.netty.util.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 重试编排器
 * 每次尝试: 获取会话 → 执行操作 → 判定错误 → 释放/丢弃会话 → 由策略决定是否退避重试
 * 退避等待基于 HashedWheelTimer, 可被上下文取消或编排器停机提前唤醒
 *
 * @param <S> 会话类型
 */
@Slf4j
public class SessionRetryOrchestrator<S> {

    private final SessionPool<S> pool;

    private final ErrorClassifier classifier;

    private final RetryPolicy policy;

    private final ObserverRegistry observers;

    private final Timer timer;

    /** 可为 null, 未开启 guard */
    private final GuardedOperationExecutor guard;

    private final AtomicBoolean running = new AtomicBoolean(true);

    /** 退避中的循环, 停机时统一唤醒 */
    private final Set<CompletableFuture<Void>> sleepers = ConcurrentHashMap.newKeySet();

    public SessionRetryOrchestrator(SessionPool<S> pool,
                                    ErrorClassifier classifier,
                                    RetryPolicy policy,
                                    ObserverRegistry observers,
                                    Timer timer,
                                    @Nullable GuardedOperationExecutor guard) {
        this.pool = pool;
        this.classifier = classifier;
        this.policy = policy;
        this.observers = observers;
        this.timer = timer;
        this.guard = guard;
    }

    public <R> R run(ExecutionContext ctx, boolean idempotent, SessionOperation<S, R> op) {
        return run(ctx, RetryOptions.of(idempotent), op);
    }

    /**
     * 执行重试循环
     *
     * @return 第一次成功尝试的结果
     * @throws SessionRetryException 终态失败, 见 {@link FailureKind}
     * @throws IllegalStateException 编排器已停止
     */
    public <R> R run(ExecutionContext ctx, RetryOptions options, SessionOperation<S, R> op) {
        if (!running.get()) {
            throw new IllegalStateException("session retry orchestrator is stopped");
        }
        RetryLoopContext loop = new RetryLoopContext(UUID.randomUUID().toString(),
                options.getLabel(), options.isIdempotent());
        ObserverRegistry.LoopTrace trace = observers.open(
                new LoopStartInfo(loop.getLoopId(), loop.getLabel(), loop.isIdempotent()));
        try {
            R result = loop(ctx, loop, trace, op);
            trace.done(doneInfo(loop, null));
            return result;
        } catch (RuntimeException | Error e) {
            trace.done(doneInfo(loop, e));
            throw e;
        }
    }

    public Registration registerObserver(RetryObserver observer) {
        return observers.register(observer);
    }

    /**
     * 停机: 拒绝新循环, 退避中的循环以 CANCELLED 结束
     */
    public void shutdown() {
        if (running.compareAndSet(true, false)) {
            sleepers.forEach(wake -> wake.complete(null));
            log.info("[SessionRetry] orchestrator stopped, pending backoffs released");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private <R> R loop(ExecutionContext ctx, RetryLoopContext loop,
                       ObserverRegistry.LoopTrace trace, SessionOperation<S, R> op) {
        Classification lastClassification = null;
        Throwable lastError = null;
        while (true) {
            if (ctx.isCancelled()) {
                throw new SessionRetryException(FailureKind.CANCELLED, loop.getAttempts(), lastClassification, lastError);
            }
            int attempt = loop.nextAttempt();
            long attemptStart = System.nanoTime();
            S session = null;
            Throwable error;
            boolean interrupted = false;
            try {
                session = pool.acquire(ctx);
                R result = invoke(ctx, loop, session, op);
                releaseQuietly(session);
                trace.attempt(attemptInfo(loop, attempt, attemptStart, null, null));
                return result;
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                interrupted = true;
                error = ie;
            } catch (CancellationException ce) {
                interrupted = true;
                error = ce;
            } catch (Exception e) {
                error = e;
            } catch (Error fatal) {
                // 会话状态未知, 不放回池
                if (session != null) {
                    discardQuietly(session);
                }
                trace.attempt(attemptInfo(loop, attempt, attemptStart, fatal, null));
                throw fatal;
            }

            Classification c = classifier.classify(error);
            if (session != null) {
                if (c.isMustDiscardSession()) {
                    discardQuietly(session);
                } else {
                    releaseQuietly(session);
                }
            }
            trace.attempt(attemptInfo(loop, attempt, attemptStart, error, c));
            lastClassification = c;
            lastError = error;

            boolean cancelled = interrupted || ctx.isCancelled();
            RetryDecision decision = policy.shouldContinue(c, loop.isIdempotent(), attempt, loop.elapsed(), cancelled);
            if (!decision.isProceed()) {
                throw new SessionRetryException(toKind(decision.getStopReason(), c, loop.isIdempotent()),
                        attempt, c, error);
            }
            if (!sleep(ctx, loop, decision.getBackoff())) {
                throw new SessionRetryException(FailureKind.CANCELLED, attempt, c, error);
            }
        }
    }

    private <R> R invoke(ExecutionContext ctx, RetryLoopContext loop, S session,
                         SessionOperation<S, R> op) throws Exception {
        if (guard != null) {
            return guard.execute(loop.getLabel(), ctx, session, op);
        }
        return op.execute(ctx, session);
    }

    /**
     * 退避等待
     *
     * @return false 表示等待期间被取消/中断/停机
     */
    private boolean sleep(ExecutionContext ctx, RetryLoopContext loop, Duration backoff) {
        Duration wait = backoff;
        Duration remaining = ctx.remaining();
        if (remaining != null && remaining.compareTo(wait) < 0) {
            wait = remaining;
        }
        if (wait.isZero() || wait.isNegative()) {
            return !ctx.isCancelled() && running.get();
        }

        CompletableFuture<Void> wake = new CompletableFuture<>();
        Timeout timeout;
        try {
            timeout = timer.newTimeout(t -> wake.complete(null), wait.toNanos(), TimeUnit.NANOSECONDS);
        } catch (IllegalStateException | RejectedExecutionException e) {
            // 时间轮已停止或排队已满, 视为停机
            log.warn("[SessionRetry] loopId={} backoff rejected by timer, stopping loop", loop.getLoopId(), e);
            return false;
        }
        // 定时器、上下文取消、停机三者都只完成同一个 wake, 结束后全部解除挂载
        Registration onCancel = ctx.onCancel(() -> wake.complete(null));
        sleepers.add(wake);
        try {
            if (!running.get()) {
                wake.complete(null);
            }
            wake.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("backoff wait failed", e.getCause());
        } finally {
            sleepers.remove(wake);
            onCancel.close();
            timeout.cancel();
        }
        return !ctx.isCancelled() && running.get();
    }

    private static FailureKind toKind(StopReason reason, Classification c, boolean idempotent) {
        return switch (reason) {
            case CANCELLED -> FailureKind.CANCELLED;
            case NOT_RETRYABLE -> (!idempotent && c.getRetryability() == Retryability.IDEMPOTENT_ONLY)
                    ? FailureKind.NOT_RETRIED_NON_IDEMPOTENT
                    : FailureKind.PERMANENT;
            case MAX_ATTEMPTS, TIME_BUDGET -> FailureKind.EXHAUSTED;
        };
    }

    private void releaseQuietly(S session) {
        try {
            pool.release(session);
        } catch (RuntimeException e) {
            log.warn("[SessionRetry] session release failed", e);
        }
    }

    private void discardQuietly(S session) {
        try {
            pool.discard(session);
        } catch (RuntimeException e) {
            log.warn("[SessionRetry] session discard failed", e);
        }
    }

    private static AttemptInfo attemptInfo(RetryLoopContext loop, int attempt, long attemptStart,
                                           Throwable error, Classification c) {
        return AttemptInfo.builder()
                .loopId(loop.getLoopId())
                .idempotent(loop.isIdempotent())
                .attempt(attempt)
                .error(error)
                .classification(c)
                .latency(Duration.ofNanos(System.nanoTime() - attemptStart))
                .elapsed(loop.elapsed())
                .build();
    }

    private static LoopDoneInfo doneInfo(RetryLoopContext loop, Throwable error) {
        return LoopDoneInfo.builder()
                .loopId(loop.getLoopId())
                .idempotent(loop.isIdempotent())
                .error(error)
                .attempts(loop.getAttempts())
                .totalLatency(loop.elapsed())
                .build();
    }
}
