package com.sessionretry.core.trace.observer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sessionretry.core.failure.ErrorClassifier;
import com.sessionretry.core.spi.RetryObserver;
import com.sessionretry.exception.SessionRetryException;
import com.sessionretry.model.Classification;
import com.sessionretry.model.enums.LogFormat;
import com.sessionretry.model.enums.Verbosity;
import com.sessionretry.model.trace.AttemptInfo;
import com.sessionretry.model.trace.LoopDoneInfo;
import com.sessionretry.model.trace.LoopStartInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 结构化重试日志
 * 失败的尝试: 后端错误 ERROR, 其他 DEBUG; 开始与成功事件为 TRACE
 */
public class StructuredRetryLogger implements RetryObserver {

    private final Logger log;

    private final Verbosity verbosity;

    private final LogFormat format;

    private final ErrorClassifier classifier;

    private final ObjectMapper mapper = new ObjectMapper();

    public StructuredRetryLogger(Verbosity verbosity, LogFormat format, ErrorClassifier classifier) {
        this(LoggerFactory.getLogger(StructuredRetryLogger.class), verbosity, format, classifier);
    }

    public StructuredRetryLogger(Logger log, Verbosity verbosity, LogFormat format, ErrorClassifier classifier) {
        this.log = log;
        this.verbosity = verbosity;
        this.format = format;
        this.classifier = classifier;
    }

    @Override
    public void onLoopStart(LoopStartInfo info) {
        if (verbosity != Verbosity.ALL) {
            return;
        }
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("id", info.getLoopId());
        f.put("label", info.getLabel());
        f.put("idempotent", info.isIdempotent());
        emit(Level.TRACE, "start", f);
    }

    @Override
    public void onAttempt(AttemptInfo info) {
        if (verbosity == Verbosity.OFF) {
            return;
        }
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("id", info.getLoopId());
        f.put("attempt", info.getAttempt());
        f.put("latency", formatDuration(info.getLatency()));
        f.put("elapsed", formatDuration(info.getElapsed()));
        if (info.isSuccess()) {
            if (verbosity == Verbosity.ALL) {
                emit(Level.TRACE, "attempt done", f);
            }
            return;
        }
        Classification c = info.getClassification() != null
                ? info.getClassification() : classifier.classify(info.getError());
        f.put("error", String.valueOf(info.getError()));
        putClassification(f, c, info.isIdempotent());
        emit(c.isBackendError() ? Level.ERROR : Level.DEBUG, "attempt failed", f);
    }

    @Override
    public void onLoopDone(LoopDoneInfo info) {
        if (verbosity == Verbosity.OFF) {
            return;
        }
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("id", info.getLoopId());
        f.put("latency", formatDuration(info.getTotalLatency()));
        f.put("attempts", info.getAttempts());
        if (info.isSuccess()) {
            if (verbosity == Verbosity.ALL) {
                emit(Level.TRACE, "done", f);
            }
            return;
        }
        Classification c = null;
        if (info.getError() instanceof SessionRetryException sre) {
            f.put("kind", sre.getKind());
            c = sre.getLastClassification();
        } else {
            c = classifier.classify(info.getError());
        }
        f.put("error", String.valueOf(info.getError()));
        if (c != null) {
            putClassification(f, c, info.isIdempotent());
        }
        emit(c != null && c.isBackendError() ? Level.ERROR : Level.DEBUG, "failed", f);
    }

    private static void putClassification(Map<String, Object> f, Classification c, boolean idempotent) {
        f.put("retryable", c.mustRetry(idempotent));
        f.put("code", c.getStatusCode());
        f.put("status", c.getStatus());
        f.put("deleteSession", c.isMustDiscardSession());
    }

    private void emit(Level level, String event, Map<String, Object> fields) {
        if (!log.isEnabledForLevel(level)) {
            return;
        }
        log.atLevel(level).log("[Retry] {} {}", event, render(fields));
    }

    private String render(Map<String, Object> fields) {
        if (format == LogFormat.JSON) {
            Map<String, String> json = new LinkedHashMap<>();
            fields.forEach((k, v) -> json.put(k, String.valueOf(v)));
            try {
                return mapper.writeValueAsString(json);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("failed to render retry event", e);
            }
        }
        StringBuilder sb = new StringBuilder();
        fields.forEach((k, v) -> {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(k).append('=').append(v);
        });
        return sb.toString();
    }

    static String formatDuration(Duration d) {
        if (d == null) {
            return "0ms";
        }
        return String.format(Locale.ROOT, "%.3fms", d.toNanos() / 1_000_000.0);
    }
}
