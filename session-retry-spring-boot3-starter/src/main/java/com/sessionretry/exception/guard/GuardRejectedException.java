package com.sessionretry.exception.guard;

/**
 * guard 拒绝执行的公共父类
 * 默认在可重试异常名单内
 */
public abstract class GuardRejectedException extends RuntimeException {

    private final String label;

    protected GuardRejectedException(String message, String label, Throwable cause) {
        super(message + ", label=" + label, cause);
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
