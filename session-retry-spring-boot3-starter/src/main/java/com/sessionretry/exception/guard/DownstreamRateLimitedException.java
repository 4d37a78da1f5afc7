package com.sessionretry.exception.guard;

public class DownstreamRateLimitedException extends GuardRejectedException {
    public DownstreamRateLimitedException(String label, Throwable cause) { super("backend rate limited", label, cause); }
}
