package com.orbitframe.api.event;

import java.util.concurrent.CompletionStage;

/**
 * 异步事件监听器
 * <p>
 * emit 不等待返回的 stage；emitAsync 会等它完成后再通知下一个监听器。
 * </p>
 *
 * @param <T> 事件载荷类型
 */
@FunctionalInterface
public interface AsyncEventListener<T> {

    CompletionStage<Void> onEvent(T payload) throws Exception;
}
