package com.sessionretry.model.enums;

/**
 * 策略判定停止的原因
 */
public enum StopReason {
    CANCELLED,
    NOT_RETRYABLE,
    MAX_ATTEMPTS,
    TIME_BUDGET
}
