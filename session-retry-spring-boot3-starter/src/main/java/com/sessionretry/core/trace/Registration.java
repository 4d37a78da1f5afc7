package com.sessionretry.core.trace;

/**
 * 注册句柄（观察者、取消回调）, close 幂等
 */
public interface Registration extends AutoCloseable {

    @Override
    void close();
}
