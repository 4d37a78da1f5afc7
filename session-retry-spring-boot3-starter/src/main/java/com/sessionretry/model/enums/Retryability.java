package com.sessionretry.model.enums;

/**
 * 可重试性
 */
public enum Retryability {
    /** 总是可重试 */
    ALWAYS,

    /** 仅幂等操作可重试（可能已部分生效） */
    IDEMPOTENT_ONLY,

    /** 不可重试 */
    NEVER;

    public boolean permits(boolean idempotent) {
        return switch (this) {
            case ALWAYS -> true;
            case IDEMPOTENT_ONLY -> idempotent;
            case NEVER -> false;
        };
    }
}
