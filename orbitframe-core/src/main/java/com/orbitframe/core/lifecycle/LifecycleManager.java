package com.orbitframe.core.lifecycle;

import com.orbitframe.api.event.LifecycleEvents;
import com.orbitframe.api.event.SystemEvents;
import com.orbitframe.api.exception.LifecycleException;
import com.orbitframe.api.lifecycle.LifecycleHook;
import com.orbitframe.api.lifecycle.LifecyclePhase;
import com.orbitframe.api.lifecycle.LifecycleState;
import com.orbitframe.core.concurrent.Futures;
import com.orbitframe.core.event.EventBus;
import com.orbitframe.core.event.EventSource;
import jakarta.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 生命周期管理器
 * 职责：状态机推进、启动/停止钩子的顺序执行与超时控制
 * <p>
 * 启动钩子按注册顺序执行，任一失败即中止；停止钩子按注册的逆序执行，失败不中止，最后汇总。
 * 并发调用 start/stop 时共享同一个未完成的 future，钩子不会重复执行。
 * </p>
 */
@Slf4j
public class LifecycleManager implements EventSource, AutoCloseable {

    private static final String OWNER = "lifecycle";

    private final LifecycleOptions options;
    private final EventBus events = new EventBus(OWNER);

    private final List<HookEntry> startHooks = new CopyOnWriteArrayList<>();
    private final List<HookEntry> stopHooks = new CopyOnWriteArrayList<>();
    private final AtomicInteger hookCounter = new AtomicInteger();

    private final ReentrantLock stateLock = new ReentrantLock();
    private volatile LifecycleState state = LifecycleState.CREATED;
    private CompletableFuture<Void> startFuture;
    private CompletableFuture<Void> stopFuture;

    private Thread shutdownHook;

    public LifecycleManager() {
        this(LifecycleOptions.defaults());
    }

    public LifecycleManager(LifecycleOptions options) {
        this.options = options != null ? options : LifecycleOptions.defaults();
        if (this.options.isGracefulShutdown()) {
            enableGracefulShutdown(this::stop);
        }
    }

    @Override
    public EventBus events() {
        return events;
    }

    // ==================== 钩子注册 ====================

    public void onStart(LifecycleHook hook) {
        onStart(null, hook, null);
    }

    public void onStart(String name, LifecycleHook hook) {
        onStart(name, hook, null);
    }

    /**
     * 注册启动钩子
     *
     * @param name      钩子名，为空时自动生成
     * @param timeoutMs 超时毫秒数，为 null 时使用 startTimeout
     */
    public void onStart(String name, LifecycleHook hook, Long timeoutMs) {
        startHooks.add(newHook("start", name, hook, timeoutMs));
    }

    public void onStop(LifecycleHook hook) {
        onStop(null, hook, null);
    }

    public void onStop(String name, LifecycleHook hook) {
        onStop(name, hook, null);
    }

    /**
     * 注册停止钩子（停止时后注册的先执行）
     *
     * @param timeoutMs 超时毫秒数，为 null 时使用 stopTimeout
     */
    public void onStop(String name, LifecycleHook hook, Long timeoutMs) {
        stopHooks.add(newHook("stop", name, hook, timeoutMs));
    }

    /**
     * 按名称移除启动钩子
     *
     * @return 是否有钩子被移除
     */
    public boolean removeStartHook(String name) {
        return startHooks.removeIf(h -> h.name().equals(name));
    }

    public boolean removeStopHook(String name) {
        return stopHooks.removeIf(h -> h.name().equals(name));
    }

    public List<String> getStartHooks() {
        return startHooks.stream().map(HookEntry::name).collect(Collectors.toUnmodifiableList());
    }

    public List<String> getStopHooks() {
        return stopHooks.stream().map(HookEntry::name).collect(Collectors.toUnmodifiableList());
    }

    // ==================== 状态推进 ====================

    /**
     * 启动
     * <p>
     * 已启动时直接完成；启动进行中时返回同一个 future；ERROR 状态下拒绝启动。
     * </p>
     */
    public CompletableFuture<Void> start() {
        CompletableFuture<Void> future;
        LifecycleState previous;
        stateLock.lock();
        try {
            if (state == LifecycleState.STARTED) {
                return CompletableFuture.completedFuture(null);
            }
            if (state == LifecycleState.STARTING && startFuture != null) {
                return startFuture;
            }
            if (state != LifecycleState.CREATED && state != LifecycleState.STOPPED) {
                return CompletableFuture.failedFuture(new LifecycleException(LifecyclePhase.START,
                        "Cannot start from state " + state.getValue()));
            }
            future = new CompletableFuture<>();
            startFuture = future;
            previous = state;
            state = LifecycleState.STARTING;
        } finally {
            stateLock.unlock();
        }

        log.info("[{}] Starting ({} start hook(s))", OWNER, startHooks.size());
        long begin = System.currentTimeMillis();
        stateChanged(previous, LifecycleState.STARTING);
        events.emit(LifecycleEvents.STARTING, LifecycleState.STARTING);

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (HookEntry hook : List.copyOf(startHooks)) {
            chain = chain.thenCompose(v -> runHook(LifecyclePhase.START, hook));
        }
        chain.whenComplete((v, error) -> {
            if (error == null) {
                transition(LifecycleState.STARTED);
                events.emit(LifecycleEvents.STARTED, LifecycleState.STARTED);
                log.info("[{}] Started in {} ms", OWNER, System.currentTimeMillis() - begin);
                future.complete(null);
            } else {
                Throwable cause = Futures.unwrap(error);
                LifecycleException failure = cause instanceof LifecycleException le
                        ? le
                        : LifecycleException.hookFailed(LifecyclePhase.START, "unknown", cause);
                transition(LifecycleState.ERROR);
                events.emit(SystemEvents.ERROR, new SystemEvents.ErrorEvent(failure, LifecyclePhase.START.getValue()));
                log.error("[{}] Start failed: {}", OWNER, failure.getMessage(), failure);
                future.completeExceptionally(failure);
            }
        });
        return future;
    }

    /**
     * 停止（尽力而为）
     * <p>
     * 允许从 STARTED 和 ERROR 停止；启动进行中时先等启动结束。所有停止钩子都会执行，
     * 有失败时最终进入 ERROR 并抛出汇总的 {@link LifecycleException}。
     * </p>
     */
    public CompletableFuture<Void> stop() {
        CompletableFuture<Void> future;
        LifecycleState previous;
        stateLock.lock();
        try {
            if (state == LifecycleState.STOPPED) {
                return CompletableFuture.completedFuture(null);
            }
            if (state == LifecycleState.STOPPING && stopFuture != null) {
                return stopFuture;
            }
            if (state == LifecycleState.STARTING && startFuture != null) {
                CompletableFuture<Void> pending = startFuture;
                return pending.handle((v, e) -> null).thenCompose(v -> stop());
            }
            if (state != LifecycleState.STARTED && state != LifecycleState.ERROR) {
                return CompletableFuture.failedFuture(new LifecycleException(LifecyclePhase.STOP,
                        "Cannot stop from state " + state.getValue()));
            }
            future = new CompletableFuture<>();
            stopFuture = future;
            previous = state;
            state = LifecycleState.STOPPING;
        } finally {
            stateLock.unlock();
        }

        log.info("[{}] Stopping ({} stop hook(s))", OWNER, stopHooks.size());
        long begin = System.currentTimeMillis();
        stateChanged(previous, LifecycleState.STOPPING);
        events.emit(LifecycleEvents.STOPPING, LifecycleState.STOPPING);

        List<HookEntry> hooks = new ArrayList<>(stopHooks);
        Collections.reverse(hooks);
        List<LifecycleException> failures = Collections.synchronizedList(new ArrayList<>());

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (HookEntry hook : hooks) {
            chain = chain.thenCompose(v -> runHook(LifecyclePhase.STOP, hook)
                    .handle((ignored, error) -> {
                        if (error != null) {
                            failures.add((LifecycleException) Futures.unwrap(error));
                        }
                        return null;
                    }));
        }
        chain.whenComplete((v, error) -> {
            if (failures.isEmpty()) {
                transition(LifecycleState.STOPPED);
                events.emit(LifecycleEvents.STOPPED, LifecycleState.STOPPED);
                log.info("[{}] Stopped in {} ms", OWNER, System.currentTimeMillis() - begin);
                future.complete(null);
            } else {
                LifecycleException failure = aggregateStopFailure(failures);
                transition(LifecycleState.ERROR);
                events.emit(SystemEvents.ERROR, new SystemEvents.ErrorEvent(failure, LifecyclePhase.STOP.getValue()));
                log.error("[{}] Stop finished with errors: {}", OWNER, failure.getMessage());
                future.completeExceptionally(failure);
            }
        });
        return future;
    }

    /**
     * 重启：已启动时先停止，再启动
     * <p>
     * 停止失败时 future 以 phase=STOP 的异常结束，不再尝试启动。
     * </p>
     */
    public CompletableFuture<Void> restart() {
        LifecycleState current = state;
        CompletableFuture<Void> stopPhase = current == LifecycleState.STARTED || current == LifecycleState.STARTING
                ? stop()
                : CompletableFuture.completedFuture(null);
        return stopPhase.thenCompose(v -> start());
    }

    // ==================== 优雅停机 ====================

    /**
     * 注册 JVM 关闭钩子，进程退出时执行一次 stopAction 并等待其结束
     */
    public synchronized void enableGracefulShutdown(Supplier<? extends CompletionStage<Void>> stopAction) {
        if (shutdownHook != null) {
            return;
        }
        AtomicBoolean invoked = new AtomicBoolean(false);
        Thread hook = new Thread(() -> {
            if (!invoked.compareAndSet(false, true)) {
                return;
            }
            log.info("[{}] JVM shutdown detected, stopping gracefully...", OWNER);
            try {
                stopAction.get().toCompletableFuture().get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[{}] Graceful shutdown interrupted", OWNER);
            } catch (ExecutionException e) {
                log.error("[{}] Graceful shutdown failed: {}", OWNER, e.getCause().getMessage(), e.getCause());
            }
        }, "orbitframe-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        shutdownHook = hook;
        log.debug("[{}] Graceful shutdown enabled", OWNER);
    }

    public synchronized boolean isGracefulShutdownEnabled() {
        return shutdownHook != null;
    }

    /**
     * 移除 JVM 关闭钩子
     */
    @Override
    public synchronized void close() {
        if (shutdownHook == null) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            log.debug("[{}] JVM already shutting down, hook kept", OWNER);
        }
        shutdownHook = null;
    }

    // ==================== 查询 ====================

    public LifecycleState getState() {
        return state;
    }

    public boolean isStarted() {
        return state == LifecycleState.STARTED;
    }

    public LifecycleOptions getOptions() {
        return options;
    }

    // ==================== 内部方法 ====================

    private HookEntry newHook(String kind, String name, LifecycleHook hook, Long timeoutMs) {
        if (hook == null) {
            throw new IllegalArgumentException("Lifecycle hook cannot be null");
        }
        if (timeoutMs != null && timeoutMs < 0) {
            throw new IllegalArgumentException("Hook timeout must not be negative: " + timeoutMs);
        }
        String hookName = name == null || name.isBlank()
                ? kind + "-hook-" + hookCounter.incrementAndGet()
                : name;
        return new HookEntry(hookName, hook, timeoutMs);
    }

    private CompletableFuture<Void> runHook(LifecyclePhase phase, HookEntry hook) {
        long timeout = hook.timeoutMs() != null
                ? hook.timeoutMs()
                : phase == LifecyclePhase.START ? options.getStartTimeout() : options.getStopTimeout();
        events.emit(LifecycleEvents.HOOK_EXECUTING, new LifecycleEvents.HookEvent(hook.name(), phase));
        log.debug("[{}] Running {} hook '{}' (timeout {} ms)", OWNER, phase.getValue(), hook.name(), timeout);

        LifecycleException timedOut = LifecycleException.hookTimedOut(phase, hook.name(), timeout);
        return Futures.race(Futures.call(hook.handler()::run), timeout, () -> timedOut)
                .handle((v, error) -> {
                    if (error == null) {
                        events.emit(LifecycleEvents.HOOK_EXECUTED, new LifecycleEvents.HookEvent(hook.name(), phase));
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    Throwable cause = Futures.unwrap(error);
                    LifecycleException failure = cause == timedOut
                            ? timedOut
                            : LifecycleException.hookFailed(phase, hook.name(), cause);
                    events.emit(LifecycleEvents.HOOK_ERROR, new LifecycleEvents.HookError(hook.name(), phase, cause));
                    log.warn("[{}] {}", OWNER, failure.getMessage());
                    return CompletableFuture.<Void>failedFuture(failure);
                })
                .thenCompose(f -> f);
    }

    private LifecycleException aggregateStopFailure(List<LifecycleException> failures) {
        List<String> failedHooks = failures.stream().map(LifecycleException::getHookName).collect(Collectors.toList());
        LifecycleException first = failures.get(0);
        boolean anyTimedOut = failures.stream().anyMatch(LifecycleException::isTimedOut);
        LifecycleException aggregate = new LifecycleException(LifecyclePhase.STOP, first.getHookName(), anyTimedOut,
                failedHooks, String.format("%d stop hook(s) failed: %s", failures.size(), failedHooks), first);
        failures.stream().skip(1).forEach(aggregate::addSuppressed);
        return aggregate;
    }

    private void transition(LifecycleState next) {
        LifecycleState previous;
        stateLock.lock();
        try {
            previous = state;
            state = next;
        } finally {
            stateLock.unlock();
        }
        stateChanged(previous, next);
    }

    private void stateChanged(LifecycleState previous, LifecycleState next) {
        if (previous != next) {
            log.debug("[{}] State {} -> {}", OWNER, previous.getValue(), next.getValue());
            events.emit(LifecycleEvents.STATE_CHANGED, new LifecycleEvents.StateChanged(previous, next));
        }
    }

    private record HookEntry(String name, LifecycleHook handler, Long timeoutMs) {
        @Override
        @Nonnull
        public String toString() {
            return String.format("Hook{name='%s', timeout=%s}", name, timeoutMs);
        }
    }
}
