package com.sessionretry.core.failure;

import com.sessionretry.exception.BackendException;
import com.sessionretry.model.Classification;
import com.sessionretry.model.enums.Retryability;
import com.sessionretry.model.enums.StatusCode;
import org.springframework.util.ClassUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 错误判定器
 * 对任意错误给出唯一的 Classification: 是否后端错误、可重试性、状态码、是否丢弃会话
 */
public class ErrorClassifier {

    /** cause 链最大展开深度 */
    private static final int MAX_CAUSE_DEPTH = 32;

    private final Map<Integer, Boolean> statusOverrides;

    private final List<Class<? extends Throwable>> retryableLocal;

    public ErrorClassifier(Map<Integer, Boolean> statusOverrides,
                           Collection<Class<? extends Throwable>> retryableLocal) {
        this.statusOverrides = statusOverrides == null ? Map.of() : Map.copyOf(statusOverrides);
        this.retryableLocal = retryableLocal == null ? List.of() : List.copyOf(retryableLocal);
    }

    public ErrorClassifier() {
        this(Map.of(), List.of());
    }

    /**
     * 由配置的类名构造, 类不存在或不是 Throwable 时快速失败
     */
    public static ErrorClassifier of(Map<Integer, Boolean> statusOverrides, Collection<String> exceptionClassNames) {
        List<Class<? extends Throwable>> types = new ArrayList<>();
        if (exceptionClassNames != null) {
            for (String name : exceptionClassNames) {
                types.add(resolveThrowable(name));
            }
        }
        return new ErrorClassifier(statusOverrides, types);
    }

    /**
     * 追加可重试的本地异常类型, 返回新实例
     */
    public ErrorClassifier withRetryable(Class<? extends Throwable> type) {
        List<Class<? extends Throwable>> types = new ArrayList<>(retryableLocal);
        types.add(type);
        return new ErrorClassifier(statusOverrides, types);
    }

    public Classification classify(Throwable t) {
        if (t == null) {
            return Classification.LOCAL_NON_RETRYABLE;
        }
        // 展开 cause 链 先本体, 再逐级cause
        Throwable root = unwrap(t);
        int depth = 0;
        for (Throwable e = root; e != null && depth < MAX_CAUSE_DEPTH; e = next(e), depth++) {
            if (e instanceof BackendException be) {
                return classifyBackend(be);
            }
        }
        depth = 0;
        for (Throwable e = root; e != null && depth < MAX_CAUSE_DEPTH; e = next(e), depth++) {
            if (isRetryableLocal(e)) {
                return Classification.LOCAL_RETRYABLE;
            }
        }
        return Classification.LOCAL_NON_RETRYABLE;
    }

    private Classification classifyBackend(BackendException be) {
        StatusCode status = be.getStatus();
        Classification c = Classification.backend(status, be.getRawCode(),
                defaultRetryability(status), mustDiscardSession(status));
        Boolean override = statusOverrides.get(be.getRawCode());
        if (override != null) {
            c = c.withRetryability(override ? Retryability.ALWAYS : Retryability.NEVER);
        }
        return c;
    }

    /**
     * 状态码 → 可重试性（默认表）
     */
    public static Retryability defaultRetryability(StatusCode status) {
        return switch (status) {
            case ABORTED, UNAVAILABLE, OVERLOADED, BAD_SESSION, SESSION_EXPIRED, SESSION_BUSY,
                 TRANSPORT_UNAVAILABLE, TRANSPORT_RESOURCE_EXHAUSTED -> Retryability.ALWAYS;
            case TIMEOUT, CANCELLED, UNDETERMINED,
                 TRANSPORT_DEADLINE_EXCEEDED, TRANSPORT_CANCELLED, TRANSPORT_INTERNAL -> Retryability.IDEMPOTENT_ONLY;
            case UNDEFINED, UNKNOWN, BAD_REQUEST, UNAUTHORIZED, INTERNAL_ERROR, SCHEME_ERROR, GENERIC_ERROR,
                 PRECONDITION_FAILED, ALREADY_EXISTS, NOT_FOUND, UNSUPPORTED,
                 TRANSPORT_UNAUTHENTICATED -> Retryability.NEVER;
        };
    }

    /**
     * 会话/连接已失效的状态码, 与可重试性无关
     */
    public static boolean mustDiscardSession(StatusCode status) {
        return switch (status) {
            case BAD_SESSION, SESSION_EXPIRED, SESSION_BUSY,
                 TRANSPORT_UNAVAILABLE, TRANSPORT_DEADLINE_EXCEEDED, TRANSPORT_CANCELLED,
                 TRANSPORT_INTERNAL, TRANSPORT_UNAUTHENTICATED -> true;
            case UNDEFINED, UNKNOWN, BAD_REQUEST, UNAUTHORIZED, INTERNAL_ERROR, ABORTED, UNAVAILABLE,
                 OVERLOADED, SCHEME_ERROR, GENERIC_ERROR, TIMEOUT, PRECONDITION_FAILED, ALREADY_EXISTS,
                 NOT_FOUND, CANCELLED, UNDETERMINED, UNSUPPORTED, TRANSPORT_RESOURCE_EXHAUSTED -> false;
        };
    }

    private boolean isRetryableLocal(Throwable e) {
        for (Class<? extends Throwable> type : retryableLocal) {
            if (type.isInstance(e)) {
                return true;
            }
        }
        return false;
    }

    private static Throwable next(Throwable e) {
        Throwable c = e.getCause();
        return c == e ? null : c;
    }

    /**
     * 剥离 CompletionException/ExecutionException 外壳
     */
    private static Throwable unwrap(Throwable ex) {
        Throwable e = ex;
        while ((e instanceof CompletionException || e instanceof ExecutionException) && e.getCause() != null) {
            e = e.getCause();
        }
        return e;
    }

    @SuppressWarnings("unchecked")
    private static Class<? extends Throwable> resolveThrowable(String name) {
        Class<?> type;
        try {
            type = ClassUtils.forName(name.trim(), ErrorClassifier.class.getClassLoader());
        } catch (ClassNotFoundException | LinkageError e) {
            throw new IllegalArgumentException("session.retry.retryable-exceptions: class not found: " + name, e);
        }
        if (!Throwable.class.isAssignableFrom(type)) {
            throw new IllegalArgumentException("session.retry.retryable-exceptions: not a Throwable: " + name);
        }
        return (Class<? extends Throwable>) type;
    }
}
