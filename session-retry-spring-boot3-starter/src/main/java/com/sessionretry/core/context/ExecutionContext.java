package com.sessionretry.core.context;

import com.sessionretry.core.trace.Registration;

import java.lang.ref.WeakReference;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 执行上下文: 携带取消信号与截止时间
 * 子上下文随父上下文一起取消, 反之不成立
 * 父上下文对子上下文只持有弱引用, 已取消/已过期/已回收的子上下文在下次注册时清理
 */
public final class ExecutionContext {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /** 取消回调, 触发或 close 后移除 */
    private final Set<CancelHook> hooks = ConcurrentHashMap.newKeySet();

    /** 可为 null */
    private final Instant deadline;

    private final Clock clock;

    private ExecutionContext(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    public static ExecutionContext background() {
        return new ExecutionContext(null, Clock.systemUTC());
    }

    public static ExecutionContext background(Clock clock) {
        return new ExecutionContext(null, Objects.requireNonNull(clock, "clock"));
    }

    /**
     * 派生带超时的子上下文, 取更早的截止时间
     */
    public ExecutionContext withTimeout(Duration timeout) {
        return withDeadline(clock.instant().plus(timeout));
    }

    public ExecutionContext withDeadline(Instant at) {
        Instant effective = (deadline != null && deadline.isBefore(at)) ? deadline : at;
        ExecutionContext child = new ExecutionContext(effective, clock);
        attach(new CancelHook(null, new WeakReference<>(child)));
        return child;
    }

    /**
     * 注册取消回调, 已取消时立即在当前线程执行
     * 截止时间到达不会触发回调, 等待方需自行以 remaining() 为上限
     *
     * @return 句柄, close 后回调不再执行
     */
    public Registration onCancel(Runnable action) {
        CancelHook hook = new CancelHook(Objects.requireNonNull(action, "action"), null);
        attach(hook);
        return () -> hooks.remove(hook);
    }

    /** 主动取消, 重复调用无副作用 */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (CancelHook hook : hooks) {
            if (hooks.remove(hook)) {
                hook.fire();
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get() || isDeadlineExceeded();
    }

    public boolean isDeadlineExceeded() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    public Instant deadline() {
        return deadline;
    }

    /**
     * 距截止时间的剩余时长, 无截止时间返回 null
     */
    public Duration remaining() {
        if (deadline == null) {
            return null;
        }
        Duration d = Duration.between(clock.instant(), deadline);
        return d.isNegative() ? Duration.ZERO : d;
    }

    /** 当前挂载的取消回调数（含子上下文） */
    public int pendingCallbacks() {
        return hooks.size();
    }

    private void attach(CancelHook hook) {
        hooks.removeIf(CancelHook::isStale);
        hooks.add(hook);
        // 与 cancel 并发时保证只执行一次
        if (cancelled.get() && hooks.remove(hook)) {
            hook.fire();
        }
    }

    private static final class CancelHook {

        private final Runnable action;

        private final WeakReference<ExecutionContext> child;

        private CancelHook(Runnable action, WeakReference<ExecutionContext> child) {
            this.action = action;
            this.child = child;
        }

        void fire() {
            if (action != null) {
                action.run();
                return;
            }
            ExecutionContext c = child.get();
            if (c != null) {
                c.cancel();
            }
        }

        /** 子上下文已回收、已取消或已过期 */
        boolean isStale() {
            if (child == null) {
                return false;
            }
            ExecutionContext c = child.get();
            return c == null || c.isCancelled();
        }
    }
}
