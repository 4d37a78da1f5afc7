package com.sessionretry.core.backoff;

import com.sessionretry.config.SessionRetryProperties;
import com.sessionretry.core.spi.BackoffPolicy;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 有界指数退避 + 抖动
 * delay = min(max, base * 2^(attempt-1)) * random[0.5, 1.0)
 */
public class ExponentialJitterBackoffPolicy implements BackoffPolicy {

    /** 2^62 已超过任何合理上限, 避免移位溢出 */
    private static final int MAX_SHIFT = 62;

    @Override
    public String name() {
        return "exponential";
    }

    @Override
    public Duration delay(int attempt, SessionRetryProperties.Backoff backoff) {
        long base = backoff.getBase().toNanos(), cap = backoff.getMax().toNanos();

        // attempt从1开始计数：1 -> base, 2 -> base * 2 ...
        int shift = Math.min(MAX_SHIFT, Math.max(0, attempt - 1));
        double ideal = Math.min((double) cap, base * Math.pow(2.0, shift));

        double jitter = ThreadLocalRandom.current().nextDouble(0.5, 1.0);
        long delay = (long) (ideal * jitter);
        return Duration.ofNanos(Math.max(0, Math.min(delay, cap)));
    }
}
