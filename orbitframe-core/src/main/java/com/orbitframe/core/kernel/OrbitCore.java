package com.orbitframe.core.kernel;

import com.orbitframe.api.context.Kernel;
import com.orbitframe.api.event.EventType;
import com.orbitframe.api.exception.PluginException;
import com.orbitframe.api.lifecycle.LifecycleState;
import com.orbitframe.api.plugin.OrbitPlugin;
import com.orbitframe.core.concurrent.Futures;
import com.orbitframe.core.config.ConfigStore;
import com.orbitframe.core.event.EventBus;
import com.orbitframe.core.event.EventSource;
import com.orbitframe.core.lifecycle.LifecycleManager;
import com.orbitframe.core.lifecycle.LifecycleOptions;
import com.orbitframe.core.middleware.MiddlewareManager;
import com.orbitframe.core.plugin.PluginManager;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * OrbitFrame 内核
 * <p>
 * 组合根：持有事件总线、配置、生命周期、插件和中间件管理器各一个实例，负责整体启停顺序。
 * 启动：initializeAll → lifecycle.start，任一失败则按逆序销毁已初始化的插件。
 * 停止：lifecycle.stop → destroyAll，两步都会执行，错误合并后抛出。
 * </p>
 */
@Slf4j
public class OrbitCore implements Kernel, EventSource, AutoCloseable {

    private final CoreOptions options;
    private final EventBus events = new EventBus("core");
    private final ConfigStore config;
    private final LifecycleManager lifecycle;
    private final PluginManager pluginManager;
    private final MiddlewareManager middlewareManager;

    private volatile long startedAt;
    private CompletableFuture<Void> pendingStart;
    private CompletableFuture<Void> pendingStop;
    private MemoryMonitor memoryMonitor;

    public OrbitCore(CoreOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("CoreOptions cannot be null");
        }
        options.validate();
        this.options = options;

        LifecycleOptions lifecycleOptions = options.getLifecycle() != null
                ? options.getLifecycle()
                : LifecycleOptions.defaults();
        // 关闭钩子由内核自己注册，停止时还要销毁插件
        this.lifecycle = new LifecycleManager(LifecycleOptions.builder()
                .startTimeout(lifecycleOptions.getStartTimeout())
                .stopTimeout(lifecycleOptions.getStopTimeout())
                .gracefulShutdown(false)
                .build());
        this.config = new ConfigStore(options.getConfig(), options.getConfigValidator());
        this.pluginManager = new PluginManager(this);
        this.middlewareManager = new MiddlewareManager();

        if (options.isBridgeEvents()) {
            lifecycle.events().forwardTo(events);
            pluginManager.events().forwardTo(events);
            middlewareManager.events().forwardTo(events);
            config.events().forwardTo(events);
        }

        if (options.getPlugins() != null) {
            for (PluginDescriptor descriptor : options.getPlugins()) {
                OrbitPlugin<?> plugin = descriptor.resolvePlugin();
                String name = descriptor.resolveName(plugin);
                pluginManager.register(name, plugin, descriptor.toConfig(name));
            }
        }

        if (lifecycleOptions.isGracefulShutdown()) {
            lifecycle.enableGracefulShutdown(this::stop);
        }

        log.info("[{}] Core initialized: version={}, environment={}, plugins={}",
                getServiceName(), getVersion(), getEnvironment(), pluginManager.getRegisteredPlugins());
        events.emit(CoreEvents.INITIALIZED, getInfo());
    }

    @Override
    public EventBus events() {
        return events;
    }

    // ==================== 启停 ====================

    /**
     * 启动内核
     * <p>
     * 已启动时直接完成，启动进行中时返回同一个 future。
     * </p>
     */
    public CompletableFuture<Void> start() {
        CompletableFuture<Void> future;
        synchronized (this) {
            if (pendingStart != null) {
                return pendingStart;
            }
            if (lifecycle.getState() == LifecycleState.STARTED) {
                return CompletableFuture.completedFuture(null);
            }
            future = new CompletableFuture<>();
            pendingStart = future;
        }

        long begin = System.currentTimeMillis();
        log.info("[{}] Starting...", getServiceName());
        events.emit(CoreEvents.STARTING, getInfo());

        CompletableFuture<Void> run;
        try {
            pluginManager.initializeAll();
            run = lifecycle.start();
        } catch (Throwable e) {
            // 同步抛出的失败同样走回滚路径
            run = CompletableFuture.failedFuture(e);
        }

        run.whenComplete((v, error) -> {
            synchronized (this) {
                pendingStart = null;
            }
            if (error == null) {
                startedAt = System.currentTimeMillis();
                log.info("[{}] Started in {} ms", getServiceName(), startedAt - begin);
                events.emit(CoreEvents.STARTED, getInfo());
                future.complete(null);
                return;
            }
            Throwable cause = Futures.unwrap(error);
            rollback(cause);
            log.error("[{}] Start failed: {}", getServiceName(), cause.getMessage(), cause);
            events.emit(CoreEvents.START_FAILED, cause);
            future.completeExceptionally(cause);
        });
        return future;
    }

    /**
     * 停止内核
     * <p>
     * 未启动过（或已停止）时直接完成。生命周期停止失败时仍会销毁插件，错误合并：
     * 先发生的作为主异常，其余挂在 suppressed 上。
     * </p>
     */
    public CompletableFuture<Void> stop() {
        CompletableFuture<Void> future;
        synchronized (this) {
            if (pendingStop != null) {
                return pendingStop;
            }
            LifecycleState state = lifecycle.getState();
            if (state == LifecycleState.CREATED || state == LifecycleState.STOPPED) {
                return CompletableFuture.completedFuture(null);
            }
            future = new CompletableFuture<>();
            pendingStop = future;
        }

        long begin = System.currentTimeMillis();
        log.info("[{}] Stopping...", getServiceName());
        events.emit(CoreEvents.STOPPING, getInfo());

        lifecycle.stop()
                .handle((v, error) -> error == null ? null : Futures.unwrap(error))
                .thenApply(this::destroyPlugins)
                .whenComplete((error, unexpected) -> {
                    Throwable failure = error != null ? error : unexpected;
                    synchronized (this) {
                        pendingStop = null;
                    }
                    startedAt = 0;
                    if (failure == null) {
                        log.info("[{}] Stopped in {} ms", getServiceName(), System.currentTimeMillis() - begin);
                        events.emit(CoreEvents.STOPPED, getInfo());
                        future.complete(null);
                    } else {
                        log.error("[{}] Stop failed: {}", getServiceName(), failure.getMessage(), failure);
                        events.emit(CoreEvents.STOP_FAILED, failure);
                        future.completeExceptionally(failure);
                    }
                });
        return future;
    }

    /**
     * 重启：已启动时先停止再启动
     */
    public CompletableFuture<Void> restart() {
        log.info("[{}] Restarting...", getServiceName());
        events.emit(CoreEvents.RESTARTING, getInfo());
        CompletableFuture<Void> stopPhase = lifecycle.getState() == LifecycleState.STARTED
                ? stop()
                : CompletableFuture.completedFuture(null);
        return stopPhase.thenCompose(v -> start())
                .whenComplete((v, error) -> {
                    if (error == null) {
                        events.emit(CoreEvents.RESTARTED, getInfo());
                    } else {
                        events.emit(CoreEvents.RESTART_FAILED, Futures.unwrap(error));
                    }
                });
    }

    /**
     * 停止内存监控并移除 JVM 关闭钩子（不会停止内核）
     */
    @Override
    public void close() {
        disableMemoryMonitoring();
        lifecycle.close();
    }

    // ==================== 内存监控 ====================

    /**
     * 开启堆内存监控，重复调用会以新参数重新开始
     *
     * @param intervalMs 采样间隔
     * @param threshold  使用率阈值 (0, 1]
     */
    public synchronized MemoryMonitor enableMemoryMonitoring(long intervalMs, double threshold) {
        MemoryMonitor monitor = new MemoryMonitor(events, intervalMs, threshold);
        disableMemoryMonitoring();
        monitor.start();
        memoryMonitor = monitor;
        return monitor;
    }

    public synchronized void disableMemoryMonitoring() {
        if (memoryMonitor != null) {
            memoryMonitor.stop();
            memoryMonitor = null;
        }
    }

    // ==================== Kernel ====================

    @Override
    public String getServiceName() {
        return options.getServiceName();
    }

    @Override
    public String getVersion() {
        return options.getVersion();
    }

    @Override
    public String getEnvironment() {
        return options.getEnvironment() != null ? options.getEnvironment() : "development";
    }

    @Override
    public LifecycleState getState() {
        return lifecycle.getState();
    }

    @Override
    public <T> Optional<T> findPlugin(String name, Class<T> type) {
        return pluginManager.get(name, type);
    }

    @Override
    public <T> void publish(EventType<T> type, T payload) {
        events.emit(type, payload);
    }

    // ==================== 访问器 ====================

    public LifecycleManager getLifecycle() {
        return lifecycle;
    }

    public PluginManager getPluginManager() {
        return pluginManager;
    }

    public MiddlewareManager getMiddlewareManager() {
        return middlewareManager;
    }

    public ConfigStore getConfig() {
        return config;
    }

    public CoreOptions getOptions() {
        return options;
    }

    public Optional<Object> getPlugin(String name) {
        return pluginManager.get(name);
    }

    public <T> Optional<T> getPlugin(String name, Class<T> type) {
        return pluginManager.get(name, type);
    }

    public boolean hasPlugin(String name) {
        return pluginManager.has(name);
    }

    /**
     * 以服务名为前缀的命名日志
     */
    public Logger getLogger(String name) {
        return LoggerFactory.getLogger(name == null || name.isBlank() ? getServiceName() : getServiceName() + "." + name);
    }

    public long getUptime() {
        long started = startedAt;
        return started == 0 ? 0 : System.currentTimeMillis() - started;
    }

    public CoreInfo getInfo() {
        return new CoreInfo(getServiceName(), getVersion(), getEnvironment(), getState(), getUptime(),
                pluginManager.getInitializedPlugins(), config.getAll());
    }

    // ==================== 内部方法 ====================

    private void rollback(Throwable cause) {
        if (pluginManager.getInitializedPlugins().isEmpty()) {
            return;
        }
        log.warn("[{}] Rolling back initialized plugins: {}", getServiceName(), pluginManager.getInitializedPlugins());
        try {
            pluginManager.destroyAll();
        } catch (PluginException e) {
            log.error("[{}] Rollback incomplete: {}", getServiceName(), e.getMessage(), e);
            cause.addSuppressed(e);
        }
    }

    private Throwable destroyPlugins(Throwable lifecycleError) {
        try {
            pluginManager.destroyAll();
            return lifecycleError;
        } catch (PluginException e) {
            if (lifecycleError == null) {
                return e;
            }
            lifecycleError.addSuppressed(e);
            return lifecycleError;
        }
    }
}
