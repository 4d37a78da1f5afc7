package com.sessionretry.exception.guard;

public class DownstreamBulkheadFullException extends GuardRejectedException {
    public DownstreamBulkheadFullException(String label, Throwable cause) { super("backend bulkhead full", label, cause); }
}
