package com.orbitframe.api.event;

/**
 * 同步事件监听器
 *
 * @param <T> 事件载荷类型
 */
@FunctionalInterface
public interface EventListener<T> {

    void onEvent(T payload) throws Exception;
}
