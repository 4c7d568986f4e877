package com.orbitframe.api.lifecycle;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 生命周期钩子
 * <p>
 * 返回的 CompletionStage 完成即视为钩子结束。超时后管理器只是不再等待，该 stage 不会被取消，
 * 超时后的后续钩子也不在计时线程上执行。
 * </p>
 */
@FunctionalInterface
public interface LifecycleHook {

    CompletionStage<Void> run() throws Exception;

    /**
     * 把同步动作包装成钩子
     */
    static LifecycleHook of(ThrowingRunnable action) {
        return () -> {
            action.run();
            return CompletableFuture.completedFuture(null);
        };
    }

    @FunctionalInterface
    interface ThrowingRunnable {
        void run() throws Exception;
    }
}
