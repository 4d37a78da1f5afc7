package com.sessionretry.model.enums;

/**
 * 重试循环的终态失败类型
 */
public enum FailureKind {
    /** 永久性失败, 未重试 */
    PERMANENT,

    /** 结果可能已部分生效, 因操作非幂等而未重试 */
    NOT_RETRIED_NON_IDEMPOTENT,

    /** 调用方取消或截止时间到达 */
    CANCELLED,

    /** 达到最大尝试次数或超出时间预算 */
    EXHAUSTED
}
