package com.sessionretry.exception.guard;

/**
 * 熔断打开, 本次尝试未到达后端
 */
public class DownstreamOpenCircuitException extends GuardRejectedException {

    public DownstreamOpenCircuitException(String label, Throwable cause) {
        super("backend circuit open", label, cause);
    }
}
