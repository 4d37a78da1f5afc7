package com.sessionretry.exception;

import com.sessionretry.model.enums.StatusCode;
import com.sessionretry.model.enums.StatusOrigin;

/**
 * 后端返回的错误
 * 所有后端失败都以此类型表达, 由 ErrorClassifier 按状态码判定
 */
public class BackendException extends RuntimeException {

    private final StatusCode status;

    /** 原始数值, 未识别时 status 为 UNKNOWN 但保留原值 */
    private final int rawCode;

    public BackendException(StatusCode status, String message) {
        this(status, status.getCode(), message, null);
    }

    public BackendException(StatusCode status, String message, Throwable cause) {
        this(status, status.getCode(), message, cause);
    }

    private BackendException(StatusCode status, int rawCode, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.rawCode = rawCode;
    }

    /**
     * 由后端返回的原始状态码构造
     */
    public static BackendException ofCode(int rawCode, String message) {
        return new BackendException(StatusCode.fromCode(rawCode), rawCode, message, null);
    }

    public StatusCode getStatus() {
        return status;
    }

    public int getRawCode() {
        return rawCode;
    }

    public StatusOrigin getOrigin() {
        return status.getOrigin();
    }

    @Override
    public String getMessage() {
        return "[" + status + "/" + rawCode + "] " + super.getMessage();
    }
}
