package com.sessionretry.core.trace.observer;

import com.sessionretry.core.metric.RetryMetrics;
import com.sessionretry.core.spi.RetryObserver;
import com.sessionretry.exception.SessionRetryException;
import com.sessionretry.model.enums.FailureKind;
import com.sessionretry.model.trace.AttemptInfo;
import com.sessionretry.model.trace.LoopDoneInfo;
import com.sessionretry.model.trace.LoopStartInfo;

/**
 * 将重试生命周期事件记录为 Micrometer 指标
 */
public class MetricsRetryObserver implements RetryObserver {

    private final RetryMetrics metrics;

    public MetricsRetryObserver(RetryMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public void onLoopStart(LoopStartInfo info) {
        metrics.incLoopStarted();
    }

    @Override
    public void onAttempt(AttemptInfo info) {
        metrics.recordAttemptLatency(info.getLatency());
        if (!info.isSuccess()) {
            metrics.incAttemptFailed(info.getClassification() != null && info.getClassification().isBackendError());
        }
    }

    @Override
    public void onLoopDone(LoopDoneInfo info) {
        metrics.recordAttempts(info.getAttempts());
        metrics.recordLoopLatency(info.getTotalLatency());
        if (info.isSuccess()) {
            metrics.incLoopSucceeded();
        } else if (info.getError() instanceof SessionRetryException sre) {
            metrics.incLoopFailed(sre.getKind());
        } else {
            metrics.incLoopFailed(FailureKind.PERMANENT);
        }
    }
}
