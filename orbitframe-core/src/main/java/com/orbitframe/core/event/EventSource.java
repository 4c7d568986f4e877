package com.orbitframe.core.event;

import com.orbitframe.api.event.AsyncEventListener;
import com.orbitframe.api.event.EventListener;
import com.orbitframe.api.event.EventType;
import com.orbitframe.api.event.Subscription;

import java.util.concurrent.CompletableFuture;

/**
 * 持有事件总线的组件
 * 各管理器组合一条 {@link EventBus}，通过本接口对外暴露订阅能力
 */
public interface EventSource {

    EventBus events();

    default <T> Subscription on(EventType<T> type, EventListener<? super T> listener) {
        return events().on(type, listener);
    }

    default <T> Subscription onAsync(EventType<T> type, AsyncEventListener<? super T> listener) {
        return events().onAsync(type, listener);
    }

    default <T> Subscription once(EventType<T> type, EventListener<? super T> listener) {
        return events().once(type, listener);
    }

    default boolean off(EventType<?> type, Object listener) {
        return events().off(type, listener);
    }

    default <T> boolean emit(EventType<T> type, T payload) {
        return events().emit(type, payload);
    }

    default <T> CompletableFuture<Void> emitAsync(EventType<T> type, T payload) {
        return events().emitAsync(type, payload);
    }
}
