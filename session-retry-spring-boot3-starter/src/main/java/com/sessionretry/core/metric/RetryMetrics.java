package com.sessionretry.core.metric;

import com.sessionretry.model.enums.FailureKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

public final class RetryMetrics {
    private final Counter loopStarted;
    private final Counter loopSucceeded;
    private final Map<FailureKind, Counter> loopFailed = new EnumMap<>(FailureKind.class);
    private final Counter attemptFailedBackend;
    private final Counter attemptFailedLocal;
    private final Counter observerFailed;
    private final DistributionSummary attempts;
    private final Timer loopTimer;
    private final Timer attemptTimer;

    private RetryMetrics(MeterRegistry reg) {
        this.loopStarted   = Counter.builder("session.retry.loop.started").description("retry loops started").register(reg);
        this.loopSucceeded = Counter.builder("session.retry.loop.succeeded").description("retry loops succeeded").register(reg);
        for (FailureKind k : FailureKind.values()) {
            loopFailed.put(k, Counter.builder("session.retry.loop.failed")
                    .tag("kind", k.name().toLowerCase(Locale.ROOT))
                    .description("retry loops failed").register(reg));
        }
        this.attemptFailedBackend = Counter.builder("session.retry.attempt.failed")
                .tag("backend", "true").description("failed attempts").register(reg);
        this.attemptFailedLocal = Counter.builder("session.retry.attempt.failed")
                .tag("backend", "false").description("failed attempts").register(reg);
        this.observerFailed = Counter.builder("session.retry.observer.failed").description("observer callbacks failed").register(reg);
        this.attempts = DistributionSummary.builder("session.retry.attempts")
                .description("attempt count per loop").baseUnit("times").register(reg);
        this.loopTimer    = Timer.builder("session.retry.loop.time").description("retry loop latency").register(reg);
        this.attemptTimer = Timer.builder("session.retry.attempt.time").description("single attempt latency").register(reg);
    }

    public static RetryMetrics create(MeterRegistry reg) { return new RetryMetrics(reg); }

    public void incLoopStarted(){ loopStarted.increment(); }
    public void incLoopSucceeded(){ loopSucceeded.increment(); }
    public void incLoopFailed(FailureKind kind){ loopFailed.get(kind).increment(); }
    public void incAttemptFailed(boolean backend){ (backend ? attemptFailedBackend : attemptFailedLocal).increment(); }
    public void incObserverFailed(){ observerFailed.increment(); }
    public void recordAttempts(int n){ attempts.record(n); }
    public void recordLoopLatency(Duration d){ loopTimer.record(d); }
    public void recordAttemptLatency(Duration d){ attemptTimer.record(d); }
}
