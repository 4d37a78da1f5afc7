package com.sessionretry.core.engine;

import com.sessionretry.config.SessionRetryGuardProperties;
import com.sessionretry.config.SessionRetryProperties;
import com.sessionretry.core.backoff.BackoffRegistry;
import com.sessionretry.core.context.ExecutionContext;
import com.sessionretry.core.failure.ErrorClassifier;
import com.sessionretry.core.handler.GuardedOperationExecutor;
import com.sessionretry.core.policy.RetryPolicy;
import com.sessionretry.core.spi.RetryObserver;
import com.sessionretry.core.spi.SessionOperation;
import com.sessionretry.core.trace.ObserverRegistry;
import com.sessionretry.core.trace.Registration;
import com.sessionretry.exception.BackendException;
import com.sessionretry.exception.SessionRetryException;
import com.sessionretry.model.RetryOptions;
import com.sessionretry.model.enums.FailureKind;
import com.sessionretry.model.enums.StatusCode;
import com.sessionretry.model.trace.AttemptInfo;
import com.sessionretry.model.trace.LoopStartInfo;
import io.netty.util.HashedWheelTimer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.awaitility.Awaitility.await;

@DisplayName("SessionRetryOrchestrator")
class SessionRetryOrchestratorTest {

    private HashedWheelTimer timer;
    private RecordingSessionPool pool;
    private RecordingObserver observer;
    private ObserverRegistry registry;

    @BeforeEach
    void setUp() {
        timer = new HashedWheelTimer(1, TimeUnit.MILLISECONDS);
        pool = new RecordingSessionPool();
        observer = new RecordingObserver();
        registry = new ObserverRegistry(null, List.of(observer));
    }

    @AfterEach
    void tearDown() {
        timer.stop();
    }

    private SessionRetryOrchestrator<String> orchestrator(int maxAttempts, Duration maxElapsed, Duration base) {
        return orchestrator(maxAttempts, maxElapsed, base, new ErrorClassifier());
    }

    private SessionRetryOrchestrator<String> orchestrator(int maxAttempts, Duration maxElapsed, Duration base,
                                                          ErrorClassifier classifier) {
        SessionRetryProperties props = new SessionRetryProperties();
        props.getBackoff().setBase(base);
        props.getBackoff().setMax(base);
        RetryPolicy policy = new RetryPolicy(maxAttempts, maxElapsed, new BackoffRegistry(props));
        return new SessionRetryOrchestrator<>(pool, classifier, policy, registry, timer, null);
    }

    private SessionRetryOrchestrator<String> fast() {
        return orchestrator(5, null, Duration.ofMillis(1));
    }

    /** 前 n 次抛出给定错误, 之后返回 "ok" */
    private static SessionOperation<String, String> failing(int n, Exception error) {
        AtomicInteger calls = new AtomicInteger();
        return (ctx, session) -> {
            if (calls.incrementAndGet() <= n) {
                throw error;
            }
            return "ok";
        };
    }

    @Nested
    @DisplayName("Scenarios")
    class Scenarios {

        @Test
        @DisplayName("maxAttempts=3, two transient failures then success")
        void succeedsOnThird() {
            AtomicInteger invocations = new AtomicInteger();
            SessionRetryOrchestrator<String> o = orchestrator(3, null, Duration.ofMillis(1));

            String result = o.run(ExecutionContext.background(), true, (ctx, s) -> {
                if (invocations.incrementAndGet() < 3) {
                    throw new BackendException(StatusCode.UNAVAILABLE, "down");
                }
                return "done";
            });

            assertThat(result).isEqualTo("done");
            assertThat(observer.done.get(0).getAttempts()).isEqualTo(3).isEqualTo(invocations.get());
        }

        @Test
        @DisplayName("permanent error returns on attempt 1")
        void permanentOnFirst() {
            AtomicInteger invocations = new AtomicInteger();

            SessionRetryException e = catchThrowableOfType(() -> fast().run(ExecutionContext.background(), true,
                    (ctx, s) -> {
                        invocations.incrementAndGet();
                        throw new BackendException(StatusCode.SCHEME_ERROR, "no such table");
                    }), SessionRetryException.class);

            assertThat(e.getKind()).isEqualTo(FailureKind.PERMANENT);
            assertThat(invocations).hasValue(1);
            assertThat(observer.done.get(0).getAttempts()).isEqualTo(1);
        }

        @Test
        @DisplayName("maxAttempts=2, transient failures exhaust after exactly 2 attempts")
        void exhaustsAfterTwo() {
            AtomicInteger invocations = new AtomicInteger();
            SessionRetryOrchestrator<String> o = orchestrator(2, null, Duration.ofMillis(1));

            SessionRetryException e = catchThrowableOfType(() -> o.run(ExecutionContext.background(), true,
                    (ctx, s) -> {
                        invocations.incrementAndGet();
                        throw new BackendException(StatusCode.OVERLOADED, "busy");
                    }), SessionRetryException.class);

            assertThat(e.getKind()).isEqualTo(FailureKind.EXHAUSTED);
            assertThat(e.getAttempts()).isEqualTo(2);
            assertThat(invocations).hasValue(2);
            assertThat(observer.events).containsExactly("start", "attempt:1:fail", "attempt:2:fail", "done:fail");
        }
    }

    @Nested
    @DisplayName("Successful loops")
    class Success {

        @Test
        @DisplayName("first attempt success returns result and releases the session")
        void firstAttemptSuccess() {
            String result = fast().run(ExecutionContext.background(), false, (ctx, s) -> "value:" + s);

            assertThat(result).isEqualTo("value:session-1");
            assertThat(pool.released).containsExactly("session-1");
            assertThat(pool.discarded).isEmpty();
            assertThat(observer.events).containsExactly("start", "attempt:1:ok", "done:ok");
            assertThat(observer.done.get(0).getAttempts()).isEqualTo(1);
        }

        @Test
        @DisplayName("retryable backend errors are retried until success")
        void retriesUntilSuccess() {
            String result = fast().run(ExecutionContext.background(), false,
                    failing(2, new BackendException(StatusCode.UNAVAILABLE, "down")));

            assertThat(result).isEqualTo("ok");
            assertThat(pool.acquired).hasSize(3);
            assertThat(pool.released).hasSize(3);
            assertThat(observer.events).containsExactly(
                    "start", "attempt:1:fail", "attempt:2:fail", "attempt:3:ok", "done:ok");
            assertThat(observer.done.get(0).getAttempts()).isEqualTo(3);
        }

        @Test
        @DisplayName("a broken session is discarded and a fresh one is used for the retry")
        void discardsBrokenSession() {
            String result = fast().run(ExecutionContext.background(), false,
                    failing(1, new BackendException(StatusCode.BAD_SESSION, "gone")));

            assertThat(result).isEqualTo("ok");
            assertThat(pool.discarded).containsExactly("session-1");
            assertThat(pool.released).containsExactly("session-2");
        }

        @Test
        @DisplayName("idempotent-only errors are retried for idempotent operations")
        void idempotentRetried() {
            String result = fast().run(ExecutionContext.background(), true,
                    failing(1, new BackendException(StatusCode.TIMEOUT, "slow")));

            assertThat(result).isEqualTo("ok");
            assertThat(pool.acquired).hasSize(2);
        }

        @Test
        @DisplayName("configured local exceptions are retried")
        void retryableLocalException() {
            SessionRetryOrchestrator<String> o = orchestrator(5, null, Duration.ofMillis(1),
                    new ErrorClassifier(null, List.of(IOException.class)));

            String result = o.run(ExecutionContext.background(), false, failing(2, new IOException("reset")));

            assertThat(result).isEqualTo("ok");
            assertThat(observer.attempts.get(0).getClassification().isBackendError()).isFalse();
        }

        @Test
        @DisplayName("failed acquisition is retried without releasing anything")
        void acquireFailureRetried() {
            pool.failAcquire(new BackendException(StatusCode.OVERLOADED, "busy"));

            String result = fast().run(ExecutionContext.background(), false, (ctx, s) -> s);

            assertThat(result).isEqualTo("session-1");
            assertThat(pool.released).containsExactly("session-1");
            assertThat(pool.discarded).isEmpty();
            assertThat(observer.events).containsExactly("start", "attempt:1:fail", "attempt:2:ok", "done:ok");
        }
    }

    @Nested
    @DisplayName("Terminal failures")
    class Failures {

        @Test
        @DisplayName("non-retryable backend error stops after one attempt as PERMANENT")
        void permanent() {
            BackendException error = new BackendException(StatusCode.BAD_REQUEST, "bad query");

            SessionRetryException e = catchThrowableOfType(
                    () -> fast().run(ExecutionContext.background(), true, failing(10, error)),
                    SessionRetryException.class);

            assertThat(e.getKind()).isEqualTo(FailureKind.PERMANENT);
            assertThat(e.getAttempts()).isEqualTo(1);
            assertThat(e.getCause()).isSameAs(error);
            assertThat(e.getLastClassification().getStatus()).isEqualTo(StatusCode.BAD_REQUEST);
            assertThat(pool.released).containsExactly("session-1");
            assertThat(observer.events).containsExactly("start", "attempt:1:fail", "done:fail");
            assertThat(observer.done.get(0).getError()).isSameAs(e);
        }

        @Test
        @DisplayName("idempotent-only error on a non-idempotent operation is not retried")
        void notRetriedNonIdempotent() {
            SessionRetryException e = catchThrowableOfType(
                    () -> fast().run(ExecutionContext.background(), false,
                            failing(10, new BackendException(StatusCode.UNDETERMINED, "commit unknown"))),
                    SessionRetryException.class);

            assertThat(e.getKind()).isEqualTo(FailureKind.NOT_RETRIED_NON_IDEMPOTENT);
            assertThat(e.isNotRetriedDueToNonIdempotency()).isTrue();
            assertThat(e.getAttempts()).isEqualTo(1);
        }

        @Test
        @DisplayName("local errors outside the retryable list are PERMANENT")
        void localPermanent() {
            SessionRetryException e = catchThrowableOfType(
                    () -> fast().run(ExecutionContext.background(), true,
                            failing(10, new IllegalArgumentException("bad input"))),
                    SessionRetryException.class);

            assertThat(e.getKind()).isEqualTo(FailureKind.PERMANENT);
            assertThat(e.getLastClassification().isBackendError()).isFalse();
            assertThat(pool.released).containsExactly("session-1");
        }

        @Test
        @DisplayName("attempt limit yields EXHAUSTED with exactly maxAttempts attempts")
        void exhausted() {
            SessionRetryException e = catchThrowableOfType(
                    () -> fast().run(ExecutionContext.background(), false,
                            failing(100, new BackendException(StatusCode.UNAVAILABLE, "down"))),
                    SessionRetryException.class);

            assertThat(e.getKind()).isEqualTo(FailureKind.EXHAUSTED);
            assertThat(e.getAttempts()).isEqualTo(5);
            assertThat(pool.acquired).hasSize(5);
            assertThat(pool.released).hasSize(5);
            assertThat(observer.attempts).hasSize(5);
            assertThat(observer.done).hasSize(1);
        }

        @Test
        @DisplayName("time budget stops the loop before sleeping past it")
        void timeBudget() {
            SessionRetryOrchestrator<String> o = orchestrator(100, Duration.ZERO, Duration.ofMillis(5));

            SessionRetryException e = catchThrowableOfType(
                    () -> o.run(ExecutionContext.background(), false,
                            failing(100, new BackendException(StatusCode.UNAVAILABLE, "down"))),
                    SessionRetryException.class);

            assertThat(e.getKind()).isEqualTo(FailureKind.EXHAUSTED);
            assertThat(e.getAttempts()).isEqualTo(1);
        }

        @Test
        @DisplayName("JVM errors propagate and still close the loop")
        void errorPropagates() {
            LinkageError fatal = new LinkageError("boom");

            assertThatThrownBy(() -> fast().run(ExecutionContext.background(), true, (ctx, s) -> {
                throw fatal;
            })).isSameAs(fatal);

            assertThat(pool.discarded).containsExactly("session-1");
            assertThat(observer.events).containsExactly("start", "attempt:1:fail", "done:fail");
            assertThat(observer.attempts.get(0).getError()).isSameAs(fatal);
            assertThat(observer.done.get(0).getError()).isSameAs(fatal);
            assertThat(observer.done.get(0).getAttempts()).isEqualTo(observer.attempts.size());
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("a context cancelled before the call never touches the pool")
        void cancelledBeforeStart() {
            ExecutionContext ctx = ExecutionContext.background();
            ctx.cancel();

            SessionRetryException e = catchThrowableOfType(
                    () -> fast().run(ctx, true, (c, s) -> "never"), SessionRetryException.class);

            assertThat(e.getKind()).isEqualTo(FailureKind.CANCELLED);
            assertThat(e.getAttempts()).isZero();
            assertThat(e.getLastClassification()).isNull();
            assertThat(pool.acquired).isEmpty();
            assertThat(observer.events).containsExactly("start", "done:fail");
        }

        @Test
        @DisplayName("cancellation wakes a loop sleeping in backoff")
        void cancelDuringBackoff() {
            SessionRetryOrchestrator<String> o = orchestrator(10, null, Duration.ofSeconds(30));
            ExecutionContext ctx = ExecutionContext.background();

            CompletableFuture<String> future = CompletableFuture.supplyAsync(() -> o.run(ctx, false,
                    failing(100, new BackendException(StatusCode.UNAVAILABLE, "down"))));
            await().atMost(Duration.ofSeconds(5)).until(() -> observer.attempts.size() == 1);
            ctx.cancel();

            ExecutionException e = catchThrowableOfType(() -> future.get(5, TimeUnit.SECONDS), ExecutionException.class);
            assertThat(e.getCause()).isInstanceOf(SessionRetryException.class);
            SessionRetryException sre = (SessionRetryException) e.getCause();
            assertThat(sre.getKind()).isEqualTo(FailureKind.CANCELLED);
            assertThat(sre.getAttempts()).isEqualTo(1);
            assertThat(pool.acquired).hasSize(1);
        }

        @Test
        @DisplayName("a deadline shorter than the backoff ends the loop at the deadline")
        void deadlineCapsBackoff() {
            SessionRetryOrchestrator<String> o = orchestrator(10, null, Duration.ofSeconds(30));
            ExecutionContext ctx = ExecutionContext.background().withTimeout(Duration.ofMillis(100));
            long start = System.nanoTime();

            SessionRetryException e = catchThrowableOfType(() -> o.run(ctx, false,
                    failing(100, new BackendException(StatusCode.UNAVAILABLE, "down"))), SessionRetryException.class);

            assertThat(e.getKind()).isEqualTo(FailureKind.CANCELLED);
            assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(10));
        }

        @Test
        @DisplayName("interrupting the operation ends the loop as CANCELLED")
        void interrupted() {
            try {
                SessionRetryException e = catchThrowableOfType(() -> fast().run(ExecutionContext.background(), true,
                        failing(10, new InterruptedException("stop"))), SessionRetryException.class);

                assertThat(e.getKind()).isEqualTo(FailureKind.CANCELLED);
                assertThat(e.getAttempts()).isEqualTo(1);
                assertThat(Thread.currentThread().isInterrupted()).isTrue();
            } finally {
                Thread.interrupted();
            }
        }

        @Test
        @DisplayName("backoffs on a shared context leave no callbacks behind")
        void sharedContextStaysClean() {
            ExecutionContext shared = ExecutionContext.background();
            SessionRetryOrchestrator<String> o = fast();

            for (int i = 0; i < 500; i++) {
                o.run(shared, true, failing(1, new BackendException(StatusCode.UNAVAILABLE, "down")));
            }

            assertThat(shared.pendingCallbacks()).isZero();
            assertThat(observer.done).hasSize(500);
        }

        @Test
        @DisplayName("shutdown releases sleeping loops and rejects new ones")
        void shutdown() {
            SessionRetryOrchestrator<String> o = orchestrator(10, null, Duration.ofSeconds(30));

            CompletableFuture<String> future = CompletableFuture.supplyAsync(() -> o.run(ExecutionContext.background(),
                    false, failing(100, new BackendException(StatusCode.UNAVAILABLE, "down"))));
            await().atMost(Duration.ofSeconds(5)).until(() -> observer.attempts.size() == 1);
            o.shutdown();

            ExecutionException e = catchThrowableOfType(() -> future.get(5, TimeUnit.SECONDS), ExecutionException.class);
            assertThat(((SessionRetryException) e.getCause()).getKind()).isEqualTo(FailureKind.CANCELLED);
            assertThat(o.isRunning()).isFalse();
            assertThatThrownBy(() -> o.run(ExecutionContext.background(), true, (c, s) -> "x"))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("Observers")
    class Observers {

        @Test
        @DisplayName("a failing observer does not affect the loop or other observers")
        void observerIsolation() {
            registry.register(new RetryObserver() {
                @Override
                public void onAttempt(AttemptInfo info) {
                    throw new IllegalStateException("observer bug");
                }
            });

            String result = fast().run(ExecutionContext.background(), false,
                    failing(1, new BackendException(StatusCode.ABORTED, "tx aborted")));

            assertThat(result).isEqualTo("ok");
            assertThat(observer.events).containsExactly("start", "attempt:1:fail", "attempt:2:ok", "done:ok");
        }

        @Test
        @DisplayName("observers registered at runtime can be removed")
        void registration() {
            SessionRetryOrchestrator<String> o = fast();
            RecordingObserver extra = new RecordingObserver();
            Registration registration = o.registerObserver(extra);

            o.run(ExecutionContext.background(), RetryOptions.of(true, "read"), (c, s) -> s);
            registration.close();
            registration.close();
            o.run(ExecutionContext.background(), true, (c, s) -> s);

            assertThat(extra.events).containsExactly("start", "attempt:1:ok", "done:ok");
            assertThat(observer.done).hasSize(2);
        }

        @Test
        @DisplayName("a run without a label is reported and guarded under the default label")
        void missingLabel() {
            List<String> labels = new CopyOnWriteArrayList<>();
            registry.register(new RetryObserver() {
                @Override
                public void onLoopStart(LoopStartInfo info) {
                    labels.add(info.getLabel());
                }
            });
            SessionRetryProperties props = new SessionRetryProperties();
            props.getBackoff().setBase(Duration.ofMillis(1));
            props.getBackoff().setMax(Duration.ofMillis(1));
            GuardedOperationExecutor guard = new GuardedOperationExecutor(new SessionRetryGuardProperties());
            SessionRetryOrchestrator<String> o = new SessionRetryOrchestrator<>(pool, new ErrorClassifier(),
                    new RetryPolicy(3, null, new BackoffRegistry(props)), registry, timer, guard);

            String result = o.run(ExecutionContext.background(), RetryOptions.of(true, null), (c, s) -> "ok");

            assertThat(result).isEqualTo("ok");
            assertThat(labels).containsExactly(RetryOptions.DEFAULT_LABEL);
            assertThat(guard.getCircuitBreaker(RetryOptions.DEFAULT_LABEL)).isNotNull();
        }

        @Test
        @DisplayName("loop ids are unique and shared by all events of one loop")
        void loopIds() {
            List<String> starts = new CopyOnWriteArrayList<>();
            registry.register(new RetryObserver() {
                @Override
                public void onLoopStart(LoopStartInfo info) {
                    starts.add(info.getLoopId());
                }
            });
            SessionRetryOrchestrator<String> o = fast();

            o.run(ExecutionContext.background(), true, failing(1, new BackendException(StatusCode.UNAVAILABLE, "x")));
            o.run(ExecutionContext.background(), true, (c, s) -> s);

            assertThat(starts).hasSize(2).doesNotHaveDuplicates();
            assertThat(observer.attempts.get(0).getLoopId()).isEqualTo(starts.get(0));
            assertThat(observer.attempts.get(1).getLoopId()).isEqualTo(starts.get(0));
            assertThat(observer.done.get(1).getLoopId()).isEqualTo(starts.get(1));
        }
    }
}
