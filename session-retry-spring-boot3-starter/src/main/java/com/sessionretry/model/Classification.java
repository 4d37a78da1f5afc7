package com.sessionretry.model;

import com.sessionretry.model.enums.Retryability;
import com.sessionretry.model.enums.StatusCode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 错误判定结果
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Classification {

    /** 非后端错误且不在可重试名单内 */
    public static final Classification LOCAL_NON_RETRYABLE =
            new Classification(false, Retryability.NEVER, StatusCode.UNDEFINED, StatusCode.UNDEFINED.getCode(), false);

    /** 非后端错误, 命中可重试异常名单 */
    public static final Classification LOCAL_RETRYABLE =
            new Classification(false, Retryability.ALWAYS, StatusCode.UNDEFINED, StatusCode.UNDEFINED.getCode(), false);

    private final boolean backendError;
    private final Retryability retryability;
    private final StatusCode status;
    private final int statusCode;
    private final boolean mustDiscardSession;

    private Classification(boolean backendError, Retryability retryability, StatusCode status,
                           int statusCode, boolean mustDiscardSession) {
        this.backendError = backendError;
        this.retryability = retryability;
        this.status = status;
        this.statusCode = statusCode;
        this.mustDiscardSession = mustDiscardSession;
    }

    public static Classification backend(StatusCode status, int rawCode, Retryability r, boolean discard) {
        return new Classification(true, r, status, rawCode, discard);
    }

    public Classification withRetryability(Retryability r) {
        return new Classification(backendError, r, status, statusCode, mustDiscardSession);
    }

    /** 结合幂等性判断是否可重试 */
    public boolean mustRetry(boolean idempotent) {
        return retryability.permits(idempotent);
    }
}
