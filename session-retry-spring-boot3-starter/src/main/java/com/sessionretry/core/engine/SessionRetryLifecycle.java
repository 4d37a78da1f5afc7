package com.sessionretry.core.engine;

import com.sessionretry.config.SessionRetryProperties;
import io.netty.util.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.lang.Nullable;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 编排器生命周期: 启动时打印关键配置, 停机时拒绝新循环并释放退避中的循环, 最后停止时间轮
 */
public class SessionRetryLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(SessionRetryLifecycle.class);

    /** 未配置 SessionPool 时为 null */
    private final SessionRetryOrchestrator<?> orchestrator;

    private final Timer timer;

    private final SessionRetryProperties props;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public SessionRetryLifecycle(@Nullable SessionRetryOrchestrator<?> orchestrator, Timer timer,
                                 SessionRetryProperties props) {
        this.orchestrator = orchestrator;
        this.timer = timer;
        this.props = props;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            log.info("┌──────────────────────────────────────────────┐");
            log.info("│ SessionRetry starting...");
            log.info("├──────────────────────────────────────────────┤");
            log.info("│ orchestrator       : {}", orchestrator != null ? "enabled" : "skipped (no SessionPool)");
            log.info("│ maxAttempts        : {}", props.getMaxAttempts());
            log.info("│ maxElapsed         : {}", props.getMaxElapsed() == null ? "unbounded" : props.getMaxElapsed());
            log.info("│ backoff.strategy   : {}", props.getBackoff().getStrategy());
            log.info("│ backoff.base/max   : {} ms / {} ms", props.backoffBaseMillis(), props.backoffMaxMillis());
            log.info("│ timer.tick         : {} ms", props.getTimer().getTickDuration().toMillis());
            log.info("│ logger             : {} ({}, {})", props.getLogger().isEnabled(),
                    props.getLogger().getVerbosity(), props.getLogger().getFormat());
            log.info("└──────────────────────────────────────────────┘");
        } catch (RuntimeException e) {
            // 启动日志打印本身不应阻断启动
            log.warn("[SessionRetry] failed to render startup banner: {}", e.toString());
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.info("[SessionRetry] stop skipped: already stopped");
            return;
        }
        log.info("[SessionRetry] stopping...");
        try {
            if (orchestrator != null) {
                orchestrator.shutdown();
            }
        } finally {
            int unprocessed = timer.stop().size();
            log.info("[SessionRetry] stopped, dropped {} pending timeouts", unprocessed);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
