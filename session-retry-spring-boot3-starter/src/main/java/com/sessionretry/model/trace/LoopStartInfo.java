package com.sessionretry.model.trace;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 重试循环开始事件
 */
@Getter
@ToString
@AllArgsConstructor
public class LoopStartInfo {
    private final String loopId;
    private final String label;
    private final boolean idempotent;
}
