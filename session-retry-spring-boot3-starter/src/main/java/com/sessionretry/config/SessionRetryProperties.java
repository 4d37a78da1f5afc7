package com.sessionretry.config;

import com.sessionretry.model.enums.LogFormat;
import com.sessionretry.model.enums.Verbosity;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 会话重试配置（绑定前缀：session.retry）
 *
 * YAML 示例：
 * session:
 *   retry:
 *     enabled: true
 *     max-attempts: 10
 *     max-elapsed: 30s
 *     backoff:
 *       strategy: exponential
 *       base: 10ms
 *       max: 5s
 *     retryable-status-overrides:
 *       400130: true
 *     retryable-exceptions:
 *       - java.net.SocketTimeoutException
 *     logger:
 *       enabled: true
 *       verbosity: FAILURES
 *       format: TEXT
 *     timer:
 *       tick-duration: 10ms
 *       ticks-per-wheel: 512
 */
@ConfigurationProperties(prefix = "session.retry")
public class SessionRetryProperties {

    /** 总开关 */
    private boolean enabled = true;

    /** 单个循环最大尝试次数（含首次） */
    private int maxAttempts = 10;

    /** 单个循环的时间预算, 为空表示不限制 */
    private Duration maxElapsed;

    private Backoff backoff = new Backoff();

    /** 按数值状态码覆盖可重试性: true=总是重试, false=从不重试 */
    private Map<Integer, Boolean> retryableStatusOverrides = new HashMap<>();

    /** 视为可重试的非后端异常（全限定类名） */
    private List<String> retryableExceptions = new ArrayList<>();

    private Logger logger = new Logger();

    private Timer timer = new Timer();

    // ----------------- 嵌套配置对象 -----------------

    public static class Backoff {
        /** 策略：fixed | exponential | spi:{name} */
        private String strategy = "exponential";

        /** 基础间隔 */
        private Duration base = Duration.ofMillis(10);

        /** 最大间隔 */
        private Duration max = Duration.ofSeconds(5);

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }
        public Duration getBase() { return base; }
        public void setBase(Duration base) { this.base = base; }
        public Duration getMax() { return max; }
        public void setMax(Duration max) { this.max = max; }
    }

    public static class Logger {
        private boolean enabled = true;

        private Verbosity verbosity = Verbosity.FAILURES;

        private LogFormat format = LogFormat.TEXT;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Verbosity getVerbosity() { return verbosity; }
        public void setVerbosity(Verbosity verbosity) { this.verbosity = verbosity; }
        public LogFormat getFormat() { return format; }
        public void setFormat(LogFormat format) { this.format = format; }
    }

    public static class Timer {
        /** 退避时间轮刻度 */
        private Duration tickDuration = Duration.ofMillis(10);

        /** 槽位数量（2^n 较佳） */
        private int ticksPerWheel = 512;

        /** 允许挂起的最大 timeout 数量（Netty 参数, <=0 不限制） */
        private long maxPendingTimeouts = -1;

        public Duration getTickDuration() { return tickDuration; }
        public void setTickDuration(Duration tickDuration) { this.tickDuration = tickDuration; }
        public int getTicksPerWheel() { return ticksPerWheel; }
        public void setTicksPerWheel(int ticksPerWheel) { this.ticksPerWheel = ticksPerWheel; }
        public long getMaxPendingTimeouts() { return maxPendingTimeouts; }
        public void setMaxPendingTimeouts(long maxPendingTimeouts) { this.maxPendingTimeouts = maxPendingTimeouts; }
    }

    // ----------------- getters/setters 顶层 -----------------

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

    public Duration getMaxElapsed() { return maxElapsed; }
    public void setMaxElapsed(Duration maxElapsed) { this.maxElapsed = maxElapsed; }

    public Backoff getBackoff() { return backoff; }
    public void setBackoff(Backoff backoff) { this.backoff = backoff; }

    public Map<Integer, Boolean> getRetryableStatusOverrides() { return retryableStatusOverrides; }
    public void setRetryableStatusOverrides(Map<Integer, Boolean> retryableStatusOverrides) {
        this.retryableStatusOverrides = retryableStatusOverrides;
    }

    public List<String> getRetryableExceptions() { return retryableExceptions; }
    public void setRetryableExceptions(List<String> retryableExceptions) { this.retryableExceptions = retryableExceptions; }

    public Logger getLogger() { return logger; }
    public void setLogger(Logger logger) { this.logger = logger; }

    public Timer getTimer() { return timer; }
    public void setTimer(Timer timer) { this.timer = timer; }

    // ----------------- 便捷换算 -----------------

    public long backoffBaseMillis() { return backoff.getBase().toMillis(); }
    public long backoffMaxMillis() { return backoff.getMax().toMillis(); }
}
