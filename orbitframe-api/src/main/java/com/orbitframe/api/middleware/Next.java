package com.orbitframe.api.middleware;

import java.util.concurrent.CompletionStage;

/**
 * 中间件链的后续调用
 * <p>
 * 调用即执行下一个中间件，返回的 stage 在下游全部完成后完成。每个中间件最多调用一次。
 * </p>
 */
@FunctionalInterface
public interface Next {

    CompletionStage<Void> proceed();
}
