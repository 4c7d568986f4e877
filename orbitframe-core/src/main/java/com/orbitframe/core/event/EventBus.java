package com.orbitframe.core.event;

import com.orbitframe.api.event.AsyncEventListener;
import com.orbitframe.api.event.EventListener;
import com.orbitframe.api.event.EventType;
import com.orbitframe.api.event.Subscription;
import com.orbitframe.api.event.SystemEvents;
import com.orbitframe.api.exception.ErrorCode;
import com.orbitframe.api.exception.OrbitException;
import com.orbitframe.core.concurrent.Futures;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 事件总线
 * <p>
 * 特点：
 * - 按事件名登记，同一事件的普通监听器和一次性监听器共用一个有序列表
 * - emit 同步派发，不等待异步监听器
 * - emitAsync 逐个等待监听器完成
 * - 监听器异常转为 {@link SystemEvents#ERROR} 事件，不影响其余监听器
 * </p>
 */
@Slf4j
public class EventBus {

    public static final int DEFAULT_MAX_LISTENERS = 10;

    private final String owner;
    private final Map<String, List<Registration>> listeners = new ConcurrentHashMap<>();
    private final Set<String> overflowWarned = ConcurrentHashMap.newKeySet();
    private final List<EventBus> forwards = new CopyOnWriteArrayList<>();
    private volatile int maxListeners = DEFAULT_MAX_LISTENERS;

    public EventBus() {
        this("event-bus");
    }

    public EventBus(String owner) {
        this.owner = owner;
    }

    // ==================== 订阅 ====================

    public <T> Subscription on(EventType<T> type, EventListener<? super T> listener) {
        checkListener(type, listener);
        return add(type, listener, syncAdapter(listener), false);
    }

    public <T> Subscription onAsync(EventType<T> type, AsyncEventListener<? super T> listener) {
        checkListener(type, listener);
        return add(type, listener, asyncAdapter(listener), false);
    }

    /**
     * 一次性监听器，在首次调用前移除
     */
    public <T> Subscription once(EventType<T> type, EventListener<? super T> listener) {
        checkListener(type, listener);
        return add(type, listener, syncAdapter(listener), true);
    }

    public <T> Subscription onceAsync(EventType<T> type, AsyncEventListener<? super T> listener) {
        checkListener(type, listener);
        return add(type, listener, asyncAdapter(listener), true);
    }

    /**
     * 按引用移除监听器（只移除最早登记的一个）
     *
     * @return 是否移除
     */
    public boolean off(EventType<?> type, Object listener) {
        checkType(type);
        List<Registration> list = listeners.get(type.getName());
        if (list == null) {
            return false;
        }
        for (Registration registration : list) {
            if (registration.listener == listener) {
                remove(type.getName(), registration);
                return true;
            }
        }
        return false;
    }

    /**
     * 移除某事件的全部监听器
     */
    public void off(EventType<?> type) {
        checkType(type);
        removeAllListeners(type);
    }

    public void removeAllListeners(EventType<?> type) {
        checkType(type);
        List<Registration> removed = listeners.remove(type.getName());
        if (removed != null) {
            removed.forEach(r -> r.active.set(false));
            log.debug("[{}] Removed {} listener(s) of {}", owner, removed.size(), type.getName());
        }
    }

    public void removeAllListeners() {
        listeners.values().forEach(list -> list.forEach(r -> r.active.set(false)));
        listeners.clear();
        log.debug("[{}] All listeners removed", owner);
    }

    // ==================== 派发 ====================

    /**
     * 同步派发
     *
     * @return 是否存在监听器
     */
    public <T> boolean emit(EventType<T> type, T payload) {
        checkType(type);
        List<Registration> list = listeners.get(type.getName());
        boolean hasListeners = list != null && !list.isEmpty();
        if (hasListeners) {
            // CopyOnWriteArrayList 迭代即快照
            for (Registration registration : list) {
                if (!claim(type.getName(), registration)) {
                    continue;
                }
                Futures.call(() -> registration.invoker.onEvent(payload))
                        .whenComplete((v, error) -> {
                            if (error != null) {
                                handleListenerError(type.getName(), Futures.unwrap(error));
                            }
                        });
            }
        }
        for (EventBus target : forwards) {
            target.emit(type, payload);
        }
        return hasListeners;
    }

    /**
     * 顺序派发并等待每个监听器完成
     */
    public <T> CompletableFuture<Void> emitAsync(EventType<T> type, T payload) {
        checkType(type);
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        List<Registration> list = listeners.get(type.getName());
        if (list != null) {
            for (Registration registration : List.copyOf(list)) {
                chain = chain.thenCompose(v -> {
                    if (!claim(type.getName(), registration)) {
                        return CompletableFuture.completedFuture(null);
                    }
                    return Futures.call(() -> registration.invoker.onEvent(payload))
                            .handle((ignored, error) -> {
                                if (error != null) {
                                    handleListenerError(type.getName(), Futures.unwrap(error));
                                }
                                return null;
                            });
                });
            }
        }
        for (EventBus target : forwards) {
            chain = chain.thenCompose(v -> target.emitAsync(type, payload));
        }
        return chain;
    }

    /**
     * 把本总线上的所有事件转发到另一条总线
     */
    public Subscription forwardTo(EventBus target) {
        if (target == null || target == this) {
            throw new OrbitException(ErrorCode.EVENT_ERROR, "Invalid forward target");
        }
        forwards.add(target);
        return () -> forwards.remove(target);
    }

    // ==================== 查询 ====================

    public int listenerCount(EventType<?> type) {
        checkType(type);
        List<Registration> list = listeners.get(type.getName());
        return list == null ? 0 : list.size();
    }

    public Set<String> eventNames() {
        Set<String> names = new LinkedHashSet<>();
        listeners.forEach((name, list) -> {
            if (!list.isEmpty()) {
                names.add(name);
            }
        });
        return Collections.unmodifiableSet(names);
    }

    /**
     * 单个事件的监听器上限，超出只告警；0 表示不限
     */
    public void setMaxListeners(int maxListeners) {
        if (maxListeners < 0) {
            throw new OrbitException(ErrorCode.EVENT_ERROR, "maxListeners must not be negative: " + maxListeners);
        }
        this.maxListeners = maxListeners;
    }

    public int getMaxListeners() {
        return maxListeners;
    }

    // ==================== 内部方法 ====================

    private Subscription add(EventType<?> type, Object listener, AsyncEventListener<Object> invoker, boolean once) {
        String name = type.getName();
        Registration registration = new Registration(listener, invoker, once);
        List<Registration> list = listeners.computeIfAbsent(name, k -> new CopyOnWriteArrayList<>());
        list.add(registration);

        int limit = maxListeners;
        if (limit > 0 && list.size() > limit && overflowWarned.add(name)) {
            log.warn("[{}] Possible listener leak: {} listeners added for event '{}', max is {}",
                    owner, list.size(), name, limit);
        }
        log.debug("[{}] Subscribed to {}{}", owner, name, once ? " (once)" : "");
        return () -> remove(name, registration);
    }

    /**
     * 取得本次调用权：已移除的不再调用，一次性监听器先摘除再调用
     */
    private boolean claim(String name, Registration registration) {
        if (!registration.once) {
            return registration.active.get();
        }
        if (registration.active.compareAndSet(true, false)) {
            List<Registration> list = listeners.get(name);
            if (list != null) {
                list.remove(registration);
            }
            return true;
        }
        return false;
    }

    private void remove(String name, Registration registration) {
        registration.active.set(false);
        List<Registration> list = listeners.get(name);
        if (list != null) {
            list.remove(registration);
        }
    }

    private void handleListenerError(String eventName, Throwable error) {
        if (SystemEvents.ERROR.getName().equals(eventName)) {
            log.error("[{}] Error listener failed: {}", owner, error.getMessage(), error);
            return;
        }
        log.debug("[{}] Listener of '{}' failed: {}", owner, eventName, error.getMessage());
        boolean handled = emit(SystemEvents.ERROR, new SystemEvents.ErrorEvent(error, eventName));
        if (!handled && forwards.isEmpty()) {
            log.error("[{}] Error handling event {}: {}", owner, eventName, error.getMessage(), error);
        }
    }

    private static void checkType(EventType<?> type) {
        if (type == null) {
            throw new OrbitException(ErrorCode.EVENT_ERROR, "Event type cannot be null");
        }
    }

    private static void checkListener(EventType<?> type, Object listener) {
        checkType(type);
        if (listener == null) {
            throw new OrbitException(ErrorCode.EVENT_ERROR, "Listener cannot be null for event " + type.getName());
        }
    }

    @SuppressWarnings("unchecked")
    private static AsyncEventListener<Object> syncAdapter(EventListener<?> listener) {
        EventListener<Object> target = (EventListener<Object>) listener;
        return payload -> {
            target.onEvent(payload);
            return CompletableFuture.completedFuture(null);
        };
    }

    @SuppressWarnings("unchecked")
    private static AsyncEventListener<Object> asyncAdapter(AsyncEventListener<?> listener) {
        return (AsyncEventListener<Object>) listener;
    }

    private static final class Registration {
        private final Object listener;
        private final AsyncEventListener<Object> invoker;
        private final boolean once;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private Registration(Object listener, AsyncEventListener<Object> invoker, boolean once) {
            this.listener = listener;
            this.invoker = invoker;
            this.once = once;
        }
    }
}
