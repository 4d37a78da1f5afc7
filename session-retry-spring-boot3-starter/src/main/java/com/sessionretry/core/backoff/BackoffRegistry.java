package com.sessionretry.core.backoff;

import com.sessionretry.config.SessionRetryProperties;
import com.sessionretry.core.spi.BackoffPolicy;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 策略注册中心：
 * - 内置 fixed / exponential
 * - 解析 "spi:{name}" 映射到外部注册的 BackoffPolicy（name() 返回的名字）
 * - 线程安全
 */
public class BackoffRegistry implements InitializingBean {

    private static final String PREFIX_SPI = "spi:";

    private static final String DEFAULT = "exponential";

    private final Map<String, BackoffPolicy> policies = new ConcurrentHashMap<>(16);

    private final SessionRetryProperties props;

    public BackoffRegistry(SessionRetryProperties props, @Nullable List<BackoffPolicy> discovered) {
        this.props = Objects.requireNonNull(props, "props");
        if (discovered != null) {
            discovered.forEach(p -> registry(p.name(), p));
        }
        // 内置策略
        policies.putIfAbsent("fixed", new FixedBackoffPolicy());
        policies.putIfAbsent(DEFAULT, new ExponentialJitterBackoffPolicy());
    }

    public BackoffRegistry(SessionRetryProperties props) {
        this(props, null);
    }

    /**
     * 注册或覆盖策略
     */
    public BackoffRegistry registry(String name, BackoffPolicy policy) {
        policies.put(normalize(name), policy);
        return this;
    }

    /**
     * 按名称解析策略
     * 支持 spi:{name} 前缀, 未找到时退回 exponential
     */
    public BackoffPolicy resolve(String strategy) {
        if (strategy == null || strategy.isBlank()) {
            return policies.get(DEFAULT);
        }
        String s = strategy.trim();
        if (s.regionMatches(true, 0, PREFIX_SPI, 0, PREFIX_SPI.length())) {
            s = s.substring(PREFIX_SPI.length());
        }
        return policies.getOrDefault(normalize(s), policies.get(DEFAULT));
    }

    /**
     * 按配置的策略计算退避, 结果不超过 backoff.max
     */
    public Duration delay(int attempt) {
        SessionRetryProperties.Backoff backoff = props.getBackoff();
        Duration d = resolve(backoff.getStrategy()).delay(attempt, backoff);
        if (d == null || d.isNegative()) {
            return Duration.ZERO;
        }
        return d.compareTo(backoff.getMax()) > 0 ? backoff.getMax() : d;
    }

    /** 列出已注册策略 */
    public Set<String> names() { return Collections.unmodifiableSet(policies.keySet()); }

    private static String normalize(String n) { return n.toLowerCase(Locale.ROOT).trim(); }

    @Override
    public void afterPropertiesSet() {
        // 参数校验
        long base = props.backoffBaseMillis(), max = props.backoffMaxMillis();
        if (props.getBackoff().getBase().isNegative()) {
            throw new IllegalArgumentException("session.retry.backoff.base must be >= 0");
        }
        if (max < base) {
            throw new IllegalArgumentException("session.retry.backoff.max must be >= session.retry.backoff.base");
        }
    }
}
