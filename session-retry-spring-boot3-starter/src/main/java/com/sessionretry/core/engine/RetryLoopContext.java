package com.sessionretry.core.engine;

import lombok.Getter;

import java.time.Duration;

/**
 * 单个重试循环的运行态, 仅由执行循环的线程访问
 */
@Getter
public class RetryLoopContext {

    private final String loopId;

    private final String label;

    private final boolean idempotent;

    private final long startNanos;

    private int attempts;

    RetryLoopContext(String loopId, String label, boolean idempotent) {
        this.loopId = loopId;
        this.label = label;
        this.idempotent = idempotent;
        this.startNanos = System.nanoTime();
    }

    /** 递增并返回本次尝试序号 */
    int nextAttempt() {
        return ++attempts;
    }

    public Duration elapsed() {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
