package com.sessionretry.core.spi;

import com.sessionretry.config.SessionRetryProperties;

import java.time.Duration;

/**
 * 退避策略（计算下一次尝试前的等待时长）
 */
public interface BackoffPolicy {

    /** 策略唯一名称（如 "fixed"、"exponential"、"myPolicy"） */
    String name();

    /**
     * 计算退避时长
     * @param attempt  已失败的尝试序号, 从 1 开始
     * @param backoff  退避配置（base/max）
     * @return 等待时长, 不得超过 backoff.max
     */
    Duration delay(int attempt, SessionRetryProperties.Backoff backoff);
}
