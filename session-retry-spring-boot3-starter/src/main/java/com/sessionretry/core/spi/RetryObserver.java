package com.sessionretry.core.spi;

import com.sessionretry.model.trace.AttemptInfo;
import com.sessionretry.model.trace.LoopDoneInfo;
import com.sessionretry.model.trace.LoopStartInfo;

/**
 * 重试生命周期观察者
 * 每个循环: 一次 onLoopStart, 按序若干次 onAttempt, 一次 onLoopDone, 事件均携带 loopId
 * 多个循环并发时同一实例会被并发调用, 实现需自行保证线程安全
 */
public interface RetryObserver {

    default void onLoopStart(LoopStartInfo info) {
    }

    default void onAttempt(AttemptInfo info) {
    }

    default void onLoopDone(LoopDoneInfo info) {
    }
}
