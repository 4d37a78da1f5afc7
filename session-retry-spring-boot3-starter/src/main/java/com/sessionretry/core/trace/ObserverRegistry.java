package com.sessionretry.core.trace;

import com.sessionretry.core.metric.RetryMetrics;
import com.sessionretry.core.spi.RetryObserver;
import com.sessionretry.model.trace.AttemptInfo;
import com.sessionretry.model.trace.LoopDoneInfo;
import com.sessionretry.model.trace.LoopStartInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * 观察者注册中心
 * 同步派发, 单个观察者异常只记录日志, 不影响重试循环及其他观察者
 */
@Slf4j
public class ObserverRegistry {

    private final List<RetryObserver> observers = new CopyOnWriteArrayList<>();

    private final RetryMetrics metrics;

    public ObserverRegistry(@Nullable RetryMetrics metrics, @Nullable List<RetryObserver> discovered) {
        this.metrics = metrics;
        if (discovered != null) {
            discovered.forEach(this::register);
        }
    }

    public ObserverRegistry() {
        this(null, null);
    }

    public Registration register(RetryObserver observer) {
        if (observer == null) {
            throw new IllegalArgumentException("observer must not be null");
        }
        observers.add(observer);
        AtomicBoolean closed = new AtomicBoolean(false);
        return () -> {
            if (closed.compareAndSet(false, true)) {
                observers.remove(observer);
            }
        };
    }

    public int size() {
        return observers.size();
    }

    /**
     * 开启一个循环的观察范围
     * 观察者集合在此刻快照, 保证开始/结束事件成对
     */
    public LoopTrace open(LoopStartInfo info) {
        List<RetryObserver> snapshot = List.copyOf(observers);
        LoopTrace trace = new LoopTrace(info.getLoopId(), snapshot);
        trace.fire("onLoopStart", o -> o.onLoopStart(info));
        return trace;
    }

    /**
     * 单个循环内的事件派发
     */
    public final class LoopTrace {

        private final String loopId;

        private final List<RetryObserver> snapshot;

        private final AtomicBoolean done = new AtomicBoolean(false);

        private LoopTrace(String loopId, List<RetryObserver> snapshot) {
            this.loopId = loopId;
            this.snapshot = snapshot;
        }

        public void attempt(AttemptInfo info) {
            if (done.get()) {
                return;
            }
            fire("onAttempt", o -> o.onAttempt(info));
        }

        /** 仅第一次调用生效 */
        public void done(LoopDoneInfo info) {
            if (!done.compareAndSet(false, true)) {
                return;
            }
            fire("onLoopDone", o -> o.onLoopDone(info));
        }

        private void fire(String event, Consumer<RetryObserver> call) {
            for (RetryObserver o : snapshot) {
                try {
                    call.accept(o);
                } catch (RuntimeException e) {
                    if (metrics != null) {
                        metrics.incObserverFailed();
                    }
                    log.warn("[Observer] observer={} event={} loopId={} failed", o.getClass().getName(), event, loopId, e);
                }
            }
        }
    }
}
