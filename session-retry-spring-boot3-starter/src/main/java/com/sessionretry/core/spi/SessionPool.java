package com.sessionretry.core.spi;

import com.sessionretry.core.context.ExecutionContext;

/**
 * 外部会话池
 * 重试引擎只负责: 每次尝试前获取, 尝试后归还, 会话失效时丢弃
 *
 * @param <S> 会话类型
 */
public interface SessionPool<S> {

    /**
     * 获取会话, 应响应上下文取消
     */
    S acquire(ExecutionContext ctx) throws Exception;

    /** 归还会话以复用 */
    void release(S session);

    /** 丢弃会话, 不再放回池中 */
    void discard(S session);
}
