package com.sessionretry.model;

import com.sessionretry.model.enums.StopReason;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 重试策略的决策: 继续(带退避) 或 停止(带原因)
 */
@Getter
@ToString
public final class RetryDecision {

    private final boolean proceed;
    private final Duration backoff;
    private final StopReason stopReason;

    private RetryDecision(boolean proceed, Duration backoff, StopReason stopReason) {
        this.proceed = proceed;
        this.backoff = backoff;
        this.stopReason = stopReason;
    }

    public static RetryDecision retryAfter(Duration backoff) {
        return new RetryDecision(true, backoff, null);
    }

    public static RetryDecision stop(StopReason reason) {
        return new RetryDecision(false, Duration.ZERO, reason);
    }
}
