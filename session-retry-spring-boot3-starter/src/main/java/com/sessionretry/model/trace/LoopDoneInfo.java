package com.sessionretry.model.trace;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 重试循环结束事件, 每个循环恰好一次
 */
@Getter
@Builder
@ToString
public class LoopDoneInfo {

    private final String loopId;

    private final boolean idempotent;

    /** 终态错误, 成功时为 null */
    private final Throwable error;

    private final int attempts;

    private final Duration totalLatency;

    public boolean isSuccess() {
        return error == null;
    }
}
