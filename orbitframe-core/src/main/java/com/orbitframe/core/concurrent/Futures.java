package com.orbitframe.core.concurrent;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * 异步辅助方法
 * <p>
 * 所有超时都挂在同一个守护定时线程上，定时线程只负责计时，超时后的回调都在 {@link #executor()} 上执行。
 * 超时只放弃等待，不取消也不中断被等待的任务。
 * </p>
 */
@Slf4j
public final class Futures {

    private static final ScheduledExecutorService TIMER = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "orbitframe-timer");
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler((t, e) ->
                log.error("[{}] Uncaught exception: {}", t.getName(), e.getMessage(), e));
        return thread;
    });

    private static final AtomicInteger ASYNC_THREADS = new AtomicInteger(1);

    private static final ExecutorService ASYNC = new ThreadPoolExecutor(
            0, Integer.MAX_VALUE,
            60L, TimeUnit.SECONDS,
            new SynchronousQueue<>(),
            r -> {
                Thread thread = new Thread(r, "orbitframe-async-" + ASYNC_THREADS.getAndIncrement());
                thread.setDaemon(true);
                thread.setUncaughtExceptionHandler((t, e) ->
                        log.error("[{}] Uncaught exception: {}", t.getName(), e.getMessage(), e));
                return thread;
            });

    private Futures() {
    }

    public static ScheduledExecutorService timer() {
        return TIMER;
    }

    /**
     * 执行定时回调和超时后续逻辑的线程池，不能阻塞定时线程
     */
    public static Executor executor() {
        return ASYNC;
    }

    @FunctionalInterface
    public interface AsyncCall {
        CompletionStage<Void> call() throws Exception;
    }

    /**
     * 调用异步动作，同步抛出的异常转成失败的 future，返回 null 视为已完成
     */
    public static CompletableFuture<Void> call(AsyncCall action) {
        try {
            CompletionStage<Void> stage = action.call();
            return stage == null ? CompletableFuture.completedFuture(null) : stage.toCompletableFuture();
        } catch (Throwable e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * 让 stage 与定时器赛跑
     * <p>
     * 返回新的 future，原 stage 不会被取消（它可能被其他调用方共享）。
     * </p>
     *
     * @param timeoutMs 超时毫秒数，小于等于 0 表示不限时
     * @param onTimeout 超时时的异常（仅在真正超时时调用，可附带副作用）
     */
    public static <T> CompletableFuture<T> race(CompletionStage<T> stage, long timeoutMs,
                                                Supplier<? extends Throwable> onTimeout) {
        CompletableFuture<T> source = stage.toCompletableFuture();
        if (timeoutMs <= 0) {
            return source;
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        ScheduledFuture<?> timeout = TIMER.schedule(() -> ASYNC.execute(() -> {
            if (!result.isDone()) {
                result.completeExceptionally(onTimeout.get());
            }
        }), timeoutMs, TimeUnit.MILLISECONDS);
        source.whenComplete((value, error) -> {
            timeout.cancel(false);
            if (error != null) {
                result.completeExceptionally(unwrap(error));
            } else {
                result.complete(value);
            }
        });
        return result;
    }

    /**
     * 剥掉 CompletionException / ExecutionException 外壳
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
