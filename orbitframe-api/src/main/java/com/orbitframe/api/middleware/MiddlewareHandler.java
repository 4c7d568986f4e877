package com.orbitframe.api.middleware;

import java.util.concurrent.CompletionStage;

/**
 * 中间件处理器（责任链）
 * <p>
 * 不调用 {@code next.proceed()} 即短路后续中间件。需要在下游完成后继续处理时，
 * 可返回 {@code next.proceed().thenRun(...)}。
 * </p>
 */
@FunctionalInterface
public interface MiddlewareHandler {

    CompletionStage<Void> handle(MiddlewareContext context, Next next) throws Exception;
}
