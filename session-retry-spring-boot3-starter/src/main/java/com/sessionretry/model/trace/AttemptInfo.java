package com.sessionretry.model.trace;

import com.sessionretry.model.Classification;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 单次尝试结束事件
 */
@Getter
@Builder
@ToString
public class AttemptInfo {

    private final String loopId;

    private final boolean idempotent;

    /** 从 1 开始 */
    private final int attempt;

    /** 成功时为 null */
    private final Throwable error;

    /** 成功时为 null */
    private final Classification classification;

    /** 本次尝试耗时 */
    private final Duration latency;

    /** 自循环开始累计耗时 */
    private final Duration elapsed;

    public boolean isSuccess() {
        return error == null;
    }
}
