package com.sessionretry.core.spi;

import com.sessionretry.core.context.ExecutionContext;

/**
 * 在一个会话上执行的操作体
 */
@FunctionalInterface
public interface SessionOperation<S, R> {

    R execute(ExecutionContext ctx, S session) throws Exception;
}
