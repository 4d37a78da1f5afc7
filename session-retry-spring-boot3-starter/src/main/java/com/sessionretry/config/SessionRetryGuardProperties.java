package com.sessionretry.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * 单次尝试的保护配置（绑定前缀：session.retry.guard）
 *
 * session:
 *   retry:
 *     guard:
 *       enabled: true
 *       defaults:
 *         circuit-breaker:
 *           failure-rate-threshold: 60
 *           wait-duration-in-open-state: 5s
 *       labels:
 *         write:
 *           bulkhead: { enabled: true, max-concurrent-calls: 16 }
 *           rate-limiter: { enabled: true, limit-for-period: 50 }
 */
@Data
@ConfigurationProperties(prefix = "session.retry.guard")
public class SessionRetryGuardProperties {

    private boolean enabled = false;

    /** 所有 label 共用 */
    private Limits defaults = Limits.standard();

    /** 按 label 覆盖, 未配置的组件沿用 defaults */
    private Map<String, Limits> labels = new HashMap<>();

    public CircuitBreakerLimit circuitBreakerFor(String label) {
        Limits l = labels.get(label);
        return l != null && l.getCircuitBreaker() != null ? l.getCircuitBreaker() : defaults.getCircuitBreaker();
    }

    public BulkheadLimit bulkheadFor(String label) {
        Limits l = labels.get(label);
        return l != null && l.getBulkhead() != null ? l.getBulkhead() : defaults.getBulkhead();
    }

    public RateLimit rateLimiterFor(String label) {
        Limits l = labels.get(label);
        return l != null && l.getRateLimiter() != null ? l.getRateLimiter() : defaults.getRateLimiter();
    }

    /**
     * 一组限制, label 下的组件为 null 表示继承
     */
    @Data
    public static class Limits {
        private CircuitBreakerLimit circuitBreaker;
        private BulkheadLimit bulkhead;
        private RateLimit rateLimiter;

        static Limits standard() {
            Limits l = new Limits();
            l.setCircuitBreaker(new CircuitBreakerLimit());
            l.setBulkhead(new BulkheadLimit());
            l.setRateLimiter(new RateLimit());
            return l;
        }
    }

    /** 只统计后端错误 */
    @Data
    public static class CircuitBreakerLimit {
        private boolean enabled = true;
        private float failureRateThreshold = 50f;
        private int slidingWindowSize = 100;
        private int minimumNumberOfCalls = 20;
        private Duration waitDurationInOpenState = Duration.ofSeconds(10);
        private int permittedNumberOfCallsInHalfOpenState = 5;
    }

    @Data
    public static class BulkheadLimit {
        private boolean enabled = false;
        private int maxConcurrentCalls = 64;
        // 0 = 不等待直接拒绝
        private Duration maxWaitDuration = Duration.ZERO;
    }

    @Data
    public static class RateLimit {
        private boolean enabled = false;
        private int limitForPeriod = 200;
        private Duration limitRefreshPeriod = Duration.ofMillis(100);
        private Duration timeoutDuration = Duration.ofMillis(20);
    }
}
