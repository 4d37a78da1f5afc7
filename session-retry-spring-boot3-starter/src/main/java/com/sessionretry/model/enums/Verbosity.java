package com.sessionretry.model.enums;

/**
 * 重试日志详细程度
 */
public enum Verbosity {
    /** 不输出 */
    OFF,

    /** 仅失败的尝试及失败的循环 */
    FAILURES,

    /** 全部事件（开始/成功为 TRACE 级别） */
    ALL
}
