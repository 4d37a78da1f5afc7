package com.sessionretry.core.backoff;

import com.sessionretry.config.SessionRetryProperties;
import com.sessionretry.core.spi.BackoffPolicy;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 固定间隔策略（同样带 [0.5, 1.0) 抖动）
 */
public class FixedBackoffPolicy implements BackoffPolicy {
    @Override
    public String name() {
        return "fixed";
    }

    @Override
    public Duration delay(int attempt, SessionRetryProperties.Backoff backoff) {
        long base = Math.min(backoff.getBase().toNanos(), backoff.getMax().toNanos());
        long delay = (long) (base * ThreadLocalRandom.current().nextDouble(0.5, 1.0));
        return Duration.ofNanos(Math.max(0, delay));
    }
}
