package com.sessionretry.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 单次 run 调用的选项
 */
@Getter
@ToString
public class RetryOptions {

    public static final String DEFAULT_LABEL = "default";

    /** 操作是否幂等 */
    private final boolean idempotent;

    /** 操作名, 用于日志与 guard 分组; 空值归为 default */
    private final String label;

    @Builder
    private RetryOptions(boolean idempotent, String label) {
        this.idempotent = idempotent;
        this.label = label == null || label.isBlank() ? DEFAULT_LABEL : label;
    }

    public static RetryOptions of(boolean idempotent) {
        return new RetryOptions(idempotent, null);
    }

    public static RetryOptions of(boolean idempotent, String label) {
        return new RetryOptions(idempotent, label);
    }
}
