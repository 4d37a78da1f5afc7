package com.sessionretry.exception;

import com.sessionretry.model.Classification;
import com.sessionretry.model.enums.FailureKind;

/**
 * 重试循环的终态错误
 * 携带失败类型、尝试次数以及最后一次错误的判定结果
 */
public class SessionRetryException extends RuntimeException {

    private final FailureKind kind;

    private final int attempts;

    /** 尝试前即被取消时为 null */
    private final Classification lastClassification;

    public SessionRetryException(FailureKind kind, int attempts, Classification lastClassification, Throwable cause) {
        super(buildMessage(kind, attempts, cause), cause);
        this.kind = kind;
        this.attempts = attempts;
        this.lastClassification = lastClassification;
    }

    public FailureKind getKind() {
        return kind;
    }

    public int getAttempts() {
        return attempts;
    }

    public Classification getLastClassification() {
        return lastClassification;
    }

    /** 结果不确定且未重试 */
    public boolean isNotRetriedDueToNonIdempotency() {
        return kind == FailureKind.NOT_RETRIED_NON_IDEMPOTENT;
    }

    private static String buildMessage(FailureKind kind, int attempts, Throwable cause) {
        String base = switch (kind) {
            case PERMANENT -> "operation failed with non-retryable error";
            case NOT_RETRIED_NON_IDEMPOTENT -> "not retried: non-idempotent operation";
            case CANCELLED -> "retry loop cancelled";
            case EXHAUSTED -> "retry attempts exhausted";
        };
        String msg = base + " (attempts=" + attempts + ")";
        if (cause != null && cause.getMessage() != null) {
            msg += ": " + cause.getMessage();
        }
        return msg;
    }
}
