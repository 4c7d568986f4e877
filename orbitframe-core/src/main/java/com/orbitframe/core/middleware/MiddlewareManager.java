package com.orbitframe.core.middleware;

import com.orbitframe.api.event.MiddlewareEvents;
import com.orbitframe.api.exception.MiddlewareException;
import com.orbitframe.api.exception.MiddlewareTimeoutException;
import com.orbitframe.api.middleware.MiddlewareContext;
import com.orbitframe.api.middleware.MiddlewareHandler;
import com.orbitframe.api.middleware.MiddlewareInfo;
import com.orbitframe.api.middleware.Next;
import com.orbitframe.core.concurrent.Futures;
import com.orbitframe.core.event.EventBus;
import com.orbitframe.core.event.EventSource;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * 中间件管理器
 * <p>
 * 按优先级升序执行（数值越小越先执行），同优先级保持登记顺序。
 * 每次执行先对启用的中间件做快照，执行过程中增删中间件不影响本次执行。
 * </p>
 */
@Slf4j
public class MiddlewareManager implements EventSource {

    private static final String OWNER = "middleware";

    private final EventBus events = new EventBus(OWNER);

    // 原始登记顺序
    private final List<MiddlewareRegistration> registrations = new ArrayList<>();
    // 排序视图，失效时为 null
    private List<MiddlewareRegistration> sorted;

    private final ReentrantLock lock = new ReentrantLock();

    @Override
    public EventBus events() {
        return events;
    }

    // ==================== 登记 ====================

    public MiddlewareManager use(MiddlewareHandler handler) {
        return use(handler, MiddlewareOptions.defaults());
    }

    public MiddlewareManager use(String name, MiddlewareHandler handler) {
        return use(handler, MiddlewareOptions.named(name));
    }

    public MiddlewareManager use(MiddlewareHandler handler, MiddlewareOptions options) {
        MiddlewareRegistration registration = newRegistration(handler, options, null);
        lock.lock();
        try {
            registrations.add(registration);
            sorted = null;
        } finally {
            lock.unlock();
        }
        log.debug("[{}] Middleware added: {} (priority {})", OWNER, registration.getName(), registration.getPriority());
        events.emit(MiddlewareEvents.ADDED, registration.toInfo());
        return this;
    }

    /**
     * 插入到锚点之前，继承锚点的优先级
     *
     * @param anchor 锚点名称或处理器引用
     * @return 锚点不存在时返回 false
     */
    public boolean insertBefore(Object anchor, MiddlewareHandler handler, MiddlewareOptions options) {
        return insert(anchor, handler, options, true);
    }

    /**
     * 插入到锚点之后，继承锚点的优先级
     *
     * @return 锚点不存在时返回 false
     */
    public boolean insertAfter(Object anchor, MiddlewareHandler handler, MiddlewareOptions options) {
        return insert(anchor, handler, options, false);
    }

    /**
     * 移除中间件
     *
     * @param key 名称或处理器引用
     */
    public boolean remove(Object key) {
        MiddlewareRegistration removed;
        lock.lock();
        try {
            removed = find(key);
            if (removed == null) {
                return false;
            }
            registrations.remove(removed);
            sorted = null;
        } finally {
            lock.unlock();
        }
        log.debug("[{}] Middleware removed: {}", OWNER, removed.getName());
        events.emit(MiddlewareEvents.REMOVED, removed.toInfo());
        return true;
    }

    public boolean enable(Object key) {
        return toggle(key, true);
    }

    public boolean disable(Object key) {
        return toggle(key, false);
    }

    /**
     * 清空全部中间件
     *
     * @return 被清除的数量
     */
    public int clear() {
        int count;
        lock.lock();
        try {
            count = registrations.size();
            registrations.clear();
            sorted = null;
        } finally {
            lock.unlock();
        }
        log.debug("[{}] {} middleware(s) cleared", OWNER, count);
        events.emit(MiddlewareEvents.CLEARED, count);
        return count;
    }

    // ==================== 执行 ====================

    /**
     * 执行中间件链
     * <p>
     * 失败时 future 以 {@link MiddlewareException} 结束，携带出错的中间件名和已进入的中间件列表。
     * </p>
     */
    public CompletableFuture<Void> execute(MiddlewareContext context) {
        return run(context, new CopyOnWriteArrayList<>());
    }

    /**
     * 限时执行中间件链
     * <p>
     * 超时后上下文被标记为取消，不再启动新的中间件；正在执行的中间件不会被中断。
     * </p>
     *
     * @param timeoutMs 超时毫秒数，小于等于 0 表示不限时
     */
    public CompletableFuture<Void> executeWithTimeout(MiddlewareContext context, long timeoutMs) {
        List<String> executed = new CopyOnWriteArrayList<>();
        CompletableFuture<Void> chain = run(context, executed);
        return Futures.race(chain, timeoutMs, () -> {
            context.cancel();
            log.warn("[{}] Middleware chain timed out after {} ms, executed: {}", OWNER, timeoutMs, executed);
            events.emit(MiddlewareEvents.TIMEOUT, new MiddlewareEvents.Timeout(timeoutMs, context));
            return new MiddlewareTimeoutException(timeoutMs, List.copyOf(executed));
        });
    }

    // ==================== 查询 ====================

    /**
     * 全部中间件，按执行顺序
     */
    public List<MiddlewareInfo> getMiddlewares() {
        return sortedView().stream().map(MiddlewareRegistration::toInfo).collect(Collectors.toList());
    }

    public List<MiddlewareInfo> getEnabledMiddlewares() {
        return enabledChain().stream().map(MiddlewareRegistration::toInfo).collect(Collectors.toList());
    }

    public int getMiddlewareCount() {
        lock.lock();
        try {
            return registrations.size();
        } finally {
            lock.unlock();
        }
    }

    public int getEnabledMiddlewareCount() {
        return enabledChain().size();
    }

    public boolean hasMiddleware(Object key) {
        lock.lock();
        try {
            return find(key) != null;
        } finally {
            lock.unlock();
        }
    }

    // ==================== 内部方法 ====================

    private CompletableFuture<Void> run(MiddlewareContext context, List<String> executed) {
        if (context == null) {
            return CompletableFuture.failedFuture(new MiddlewareException("Middleware context cannot be null"));
        }
        List<MiddlewareRegistration> chain = enabledChain();
        log.debug("[{}] Executing {} middleware(s) for request {}", OWNER, chain.size(), context.getRequestId());

        return dispatch(0, chain, context, executed, ConcurrentHashMap.newKeySet())
                .handle((v, error) -> {
                    if (error == null) {
                        events.emit(MiddlewareEvents.CHAIN_COMPLETED,
                                new MiddlewareEvents.ChainCompleted(List.copyOf(executed), context));
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    Throwable cause = Futures.unwrap(error);
                    MiddlewareException failure = cause instanceof MiddlewareException me
                            ? me
                            : new MiddlewareException(null, List.copyOf(executed), cause.getMessage(), cause);
                    events.emit(MiddlewareEvents.CHAIN_FAILED,
                            new MiddlewareEvents.ChainFailed(failure, List.copyOf(executed), context));
                    return CompletableFuture.<Void>failedFuture(failure);
                })
                .thenCompose(f -> f);
    }

    /**
     * @param reported 本次执行中已发出 middlewareError 的异常（按引用比较）
     */
    private CompletableFuture<Void> dispatch(int index, List<MiddlewareRegistration> chain,
                                             MiddlewareContext context, List<String> executed,
                                             Set<MiddlewareException> reported) {
        if (index >= chain.size() || context.isCancelled()) {
            return CompletableFuture.completedFuture(null);
        }
        MiddlewareRegistration middleware = chain.get(index);
        String name = middleware.displayName(index);
        executed.add(name);
        events.emit(MiddlewareEvents.EXECUTING, new MiddlewareEvents.Step(name, context));

        AtomicBoolean nextCalled = new AtomicBoolean(false);
        Next next = () -> {
            if (!nextCalled.compareAndSet(false, true)) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("next() called multiple times in middleware " + name));
            }
            return dispatch(index + 1, chain, context, executed, reported);
        };

        return Futures.call(() -> middleware.getHandler().handle(context, next))
                .handle((v, error) -> {
                    if (error == null) {
                        events.emit(MiddlewareEvents.EXECUTED, new MiddlewareEvents.Step(name, context));
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    Throwable cause = Futures.unwrap(error);
                    if (cause instanceof MiddlewareException downstream && reported.contains(downstream)) {
                        return CompletableFuture.<Void>failedFuture(downstream);
                    }
                    log.error("[{}] Middleware {} failed: {}", OWNER, name, cause.getMessage(), cause);
                    events.emit(MiddlewareEvents.ERROR, new MiddlewareEvents.StepFailed(name, cause, context));
                    MiddlewareException failure = new MiddlewareException(name, List.copyOf(executed),
                            "Middleware \"" + name + "\" failed: " + cause.getMessage(), cause);
                    reported.add(failure);
                    return CompletableFuture.<Void>failedFuture(failure);
                })
                .thenCompose(f -> f);
    }

    private boolean insert(Object anchor, MiddlewareHandler handler, MiddlewareOptions options, boolean before) {
        MiddlewareRegistration registration;
        lock.lock();
        try {
            MiddlewareRegistration target = find(anchor);
            if (target == null) {
                return false;
            }
            registration = newRegistration(handler, options, target.getPriority());
            int index = registrations.indexOf(target);
            registrations.add(before ? index : index + 1, registration);
            sorted = null;
        } finally {
            lock.unlock();
        }
        log.debug("[{}] Middleware {} inserted {} {}", OWNER, registration.getName(), before ? "before" : "after", anchor);
        events.emit(MiddlewareEvents.INSERTED,
                new MiddlewareEvents.Inserted(registration.toInfo(), String.valueOf(anchor), before));
        return true;
    }

    private boolean toggle(Object key, boolean enabled) {
        MiddlewareRegistration registration;
        lock.lock();
        try {
            registration = find(key);
            if (registration == null) {
                return false;
            }
            if (registration.isEnabled() == enabled) {
                return true;
            }
            registration.setEnabled(enabled);
        } finally {
            lock.unlock();
        }
        events.emit(enabled ? MiddlewareEvents.ENABLED : MiddlewareEvents.DISABLED, registration.toInfo());
        return true;
    }

    private MiddlewareRegistration newRegistration(MiddlewareHandler handler, MiddlewareOptions options,
                                                   Integer inheritedPriority) {
        if (handler == null) {
            throw new MiddlewareException("Middleware handler cannot be null");
        }
        MiddlewareOptions effective = options != null ? options : MiddlewareOptions.defaults();
        int priority = inheritedPriority != null ? inheritedPriority : effective.getPriority();
        return new MiddlewareRegistration(handler, effective.getName(), priority, effective.isEnabled());
    }

    private MiddlewareRegistration find(Object key) {
        for (MiddlewareRegistration registration : registrations) {
            if (registration.matches(key)) {
                return registration;
            }
        }
        return null;
    }

    private List<MiddlewareRegistration> sortedView() {
        lock.lock();
        try {
            if (sorted == null) {
                List<MiddlewareRegistration> view = new ArrayList<>(registrations);
                // List.sort 是稳定排序
                view.sort(Comparator.comparingInt(MiddlewareRegistration::getPriority));
                sorted = List.copyOf(view);
            }
            return sorted;
        } finally {
            lock.unlock();
        }
    }

    private List<MiddlewareRegistration> enabledChain() {
        return sortedView().stream().filter(MiddlewareRegistration::isEnabled).collect(Collectors.toList());
    }
}
