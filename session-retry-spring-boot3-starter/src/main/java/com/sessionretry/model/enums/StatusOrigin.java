package com.sessionretry.model.enums;

/**
 * 状态码来源
 */
public enum StatusOrigin {
    /** 后端执行返回的业务状态 */
    OPERATION,

    /** 传输层（连接/流）错误 */
    TRANSPORT,

    /** 非后端错误或无法识别的状态 */
    NONE
}
