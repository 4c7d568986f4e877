package com.orbitframe.core.plugin;

import com.orbitframe.api.config.PluginConfig;
import com.orbitframe.api.context.Kernel;
import com.orbitframe.api.event.PluginEvents;
import com.orbitframe.api.exception.PluginBatchException;
import com.orbitframe.api.exception.PluginException;
import com.orbitframe.api.plugin.OrbitPlugin;
import com.orbitframe.api.plugin.PluginPhase;
import com.orbitframe.core.event.EventBus;
import com.orbitframe.core.event.EventSource;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * 插件管理器
 * <p>
 * 职责：
 * 1. 插件登记与注销（注册不会自动初始化）
 * 2. 按注册顺序初始化，按初始化逆序销毁
 * 3. 批量操作单个失败不中断，结束后统一抛出 {@link PluginBatchException}
 * </p>
 */
@Slf4j
public class PluginManager implements EventSource {

    private static final String OWNER = "plugins";

    private final Kernel kernel;
    private final EventBus events = new EventBus(OWNER);

    // 注册顺序
    private final Map<String, PluginRecord> plugins = new LinkedHashMap<>();
    // 初始化顺序，所有记录共享
    private final List<String> initializationOrder = new ArrayList<>();

    private final ReentrantLock registryLock = new ReentrantLock();

    public PluginManager() {
        this(null);
    }

    /**
     * @param kernel 注入插件上下文的内核视图，可以为 null
     */
    public PluginManager(Kernel kernel) {
        this.kernel = kernel;
    }

    @Override
    public EventBus events() {
        return events;
    }

    // ==================== 登记 ====================

    public void register(OrbitPlugin<?> plugin) {
        register(plugin != null ? plugin.getName() : null, plugin, null);
    }

    public void register(String name, OrbitPlugin<?> plugin) {
        register(name, plugin, null);
    }

    /**
     * 登记插件（不初始化）
     *
     * @param config 为 null 时使用默认配置（启用、无配置项）
     */
    public void register(String name, OrbitPlugin<?> plugin, PluginConfig config) {
        if (name == null || name.isBlank()) {
            throw new PluginException(name, PluginPhase.REGISTER, "Plugin name cannot be empty");
        }
        if (plugin == null) {
            throw new PluginException(name, PluginPhase.REGISTER, "Plugin " + name + " has no initializer");
        }
        PluginConfig effective = config != null ? config : PluginConfig.of(name);

        PluginRecord record;
        registryLock.lock();
        try {
            if (plugins.containsKey(name)) {
                throw new PluginException(name, PluginPhase.REGISTER, "Plugin " + name + " is already registered");
            }
            CorePluginContext context = new CorePluginContext(name, kernel, effective.getOptions(),
                    LoggerFactory.getLogger("orbitframe.plugin." + name));
            record = new PluginRecord(name, plugin, effective, context);
            plugins.put(name, record);
        } finally {
            registryLock.unlock();
        }

        log.info("[{}] Plugin registered: {} (enabled={})", OWNER, name, effective.isEnabled());
        events.emit(PluginEvents.REGISTERED, new PluginEvents.Registered(name, plugin, effective));
    }

    /**
     * 注销插件
     *
     * @return 是否注销了插件；未知插件返回 false
     * @throws PluginException 插件仍处于初始化状态
     */
    public boolean unregister(String name) {
        registryLock.lock();
        try {
            PluginRecord record = plugins.get(name);
            if (record == null) {
                return false;
            }
            if (record.isInitialized() || record.isTransitioning()) {
                throw new PluginException(name, PluginPhase.UNREGISTER,
                        "Cannot unregister initialized plugin: " + name + ", destroy it first");
            }
            plugins.remove(name);
        } finally {
            registryLock.unlock();
        }
        log.info("[{}] Plugin unregistered: {}", OWNER, name);
        events.emit(PluginEvents.UNREGISTERED, new PluginEvents.PluginRef(name));
        return true;
    }

    // ==================== 初始化 / 销毁 ====================

    /**
     * 初始化单个插件
     * <p>
     * 已初始化或正在初始化时不做任何事；配置为禁用时发出 pluginSkipped 后返回。
     * 插件的 initialize 在登记锁之外执行，插件可以在其他线程上查询已初始化的插件。
     * </p>
     */
    public void initialize(String name) {
        PluginRecord record;
        boolean enabled;
        registryLock.lock();
        try {
            record = require(name, PluginPhase.INITIALIZE);
            if (record.isInitialized() || record.isTransitioning()) {
                return;
            }
            enabled = record.getConfig().isEnabled();
            if (enabled) {
                record.beginTransition();
            }
        } finally {
            registryLock.unlock();
        }
        if (!enabled) {
            log.info("[{}] Plugin {} is disabled, skipped", OWNER, name);
            events.emit(PluginEvents.SKIPPED, new PluginEvents.Skipped(name, "disabled"));
            return;
        }

        events.emit(PluginEvents.INITIALIZING, new PluginEvents.PluginRef(name));
        long begin = System.currentTimeMillis();
        Object instance;
        try {
            instance = record.getPlugin().initialize(record.getContext());
        } catch (Throwable e) {
            record.endTransition();
            log.error("[{}] Failed to initialize plugin {}", OWNER, name, e);
            events.emit(PluginEvents.ERROR, new PluginEvents.Failure(name, e, PluginPhase.INITIALIZE));
            throw new PluginException(name, PluginPhase.INITIALIZE,
                    "Failed to initialize plugin " + name + ": " + e.getMessage(), e);
        }

        registryLock.lock();
        try {
            record.markInitialized(instance);
            initializationOrder.add(name);
        } finally {
            registryLock.unlock();
        }
        log.info("[{}] Plugin {} initialized in {} ms", OWNER, name, System.currentTimeMillis() - begin);
        events.emit(PluginEvents.INITIALIZED, new PluginEvents.PluginRef(name));
    }

    /**
     * 按注册顺序初始化全部插件
     *
     * @throws PluginBatchException 至少一个插件初始化失败（其余插件照常初始化）
     */
    public void initializeAll() {
        List<PluginException> failures = new ArrayList<>();
        for (String name : getRegisteredPlugins()) {
            try {
                initialize(name);
            } catch (PluginException e) {
                failures.add(e);
            }
        }
        if (!failures.isEmpty()) {
            throw new PluginBatchException(PluginPhase.INITIALIZE, failures);
        }
    }

    /**
     * 销毁单个插件
     * <p>
     * 未知、未初始化或正在变更状态的插件不做任何事；destroy 失败时插件保持已初始化状态。
     * </p>
     */
    public void destroy(String name) {
        PluginRecord record;
        registryLock.lock();
        try {
            record = plugins.get(name);
            if (record == null || !record.isInitialized() || record.isTransitioning()) {
                return;
            }
            record.beginTransition();
        } finally {
            registryLock.unlock();
        }

        events.emit(PluginEvents.DESTROYING, new PluginEvents.PluginRef(name));
        try {
            record.getPlugin().destroy();
        } catch (Throwable e) {
            record.endTransition();
            log.error("[{}] Failed to destroy plugin {}", OWNER, name, e);
            events.emit(PluginEvents.ERROR, new PluginEvents.Failure(name, e, PluginPhase.DESTROY));
            throw new PluginException(name, PluginPhase.DESTROY,
                    "Failed to destroy plugin " + name + ": " + e.getMessage(), e);
        }

        registryLock.lock();
        try {
            record.markDestroyed();
            initializationOrder.remove(name);
        } finally {
            registryLock.unlock();
        }
        log.info("[{}] Plugin {} destroyed", OWNER, name);
        events.emit(PluginEvents.DESTROYED, new PluginEvents.PluginRef(name));
    }

    /**
     * 按初始化逆序销毁全部插件
     *
     * @throws PluginBatchException 至少一个插件销毁失败
     */
    public void destroyAll() {
        List<String> order = new ArrayList<>(getInitializedPlugins());
        Collections.reverse(order);
        List<PluginException> failures = new ArrayList<>();
        for (String name : order) {
            try {
                destroy(name);
            } catch (PluginException e) {
                failures.add(e);
            }
        }
        if (!failures.isEmpty()) {
            throw new PluginBatchException(PluginPhase.DESTROY, failures);
        }
    }

    // ==================== 启用 / 禁用 ====================

    /**
     * 启用并初始化插件（幂等）
     */
    public void enable(String name) {
        PluginRecord record = lookup(name, PluginPhase.INITIALIZE);
        if (!record.getConfig().isEnabled()) {
            record.getConfig().setEnabled(true);
            log.info("[{}] Plugin {} enabled", OWNER, name);
            events.emit(PluginEvents.ENABLED, new PluginEvents.PluginRef(name));
        }
        initialize(name);
    }

    /**
     * 销毁并禁用插件（幂等）
     * <p>
     * 销毁失败时保持启用状态并抛出异常。
     * </p>
     */
    public void disable(String name) {
        PluginRecord record = lookup(name, PluginPhase.DESTROY);
        destroy(name);
        if (record.getConfig().isEnabled()) {
            record.getConfig().setEnabled(false);
            log.info("[{}] Plugin {} disabled", OWNER, name);
            events.emit(PluginEvents.DISABLED, new PluginEvents.PluginRef(name));
        }
    }

    // ==================== 配置 ====================

    /**
     * 合并新的配置项（插件上下文中的配置同步可见）
     */
    public void updatePluginConfig(String name, Map<String, ?> options) {
        PluginRecord record = lookup(name, PluginPhase.CONFIGURE);
        Map<String, Object> oldConfig = record.getConfig().getOptions().snapshot();
        record.getConfig().getOptions().putAll(options);
        Map<String, Object> newConfig = record.getConfig().getOptions().snapshot();
        log.debug("[{}] Plugin {} config updated: {}", OWNER, name, newConfig.keySet());
        events.emit(PluginEvents.CONFIG_UPDATED, new PluginEvents.ConfigUpdated(name, oldConfig, newConfig));
    }

    // ==================== 查询 ====================

    /**
     * 获取插件产出的实例
     */
    public Optional<Object> get(String name) {
        registryLock.lock();
        try {
            PluginRecord record = plugins.get(name);
            return record == null ? Optional.empty() : Optional.ofNullable(record.getInstance());
        } finally {
            registryLock.unlock();
        }
    }

    public <T> Optional<T> get(String name, Class<T> type) {
        return get(name).filter(type::isInstance).map(type::cast);
    }

    public boolean has(String name) {
        registryLock.lock();
        try {
            return plugins.containsKey(name);
        } finally {
            registryLock.unlock();
        }
    }

    public boolean isInitialized(String name) {
        registryLock.lock();
        try {
            PluginRecord record = plugins.get(name);
            return record != null && record.isInitialized();
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * 已登记的插件名，按注册顺序
     */
    public List<String> getRegisteredPlugins() {
        registryLock.lock();
        try {
            return List.copyOf(plugins.keySet());
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * 已初始化的插件名，按初始化顺序
     */
    public List<String> getInitializedPlugins() {
        registryLock.lock();
        try {
            return List.copyOf(initializationOrder);
        } finally {
            registryLock.unlock();
        }
    }

    public Optional<PluginConfig> getPluginConfig(String name) {
        registryLock.lock();
        try {
            return Optional.ofNullable(plugins.get(name)).map(PluginRecord::getConfig);
        } finally {
            registryLock.unlock();
        }
    }

    public List<PluginInfo> getAllPluginInfo() {
        registryLock.lock();
        try {
            return plugins.values().stream().map(PluginRecord::toInfo).collect(Collectors.toList());
        } finally {
            registryLock.unlock();
        }
    }

    // ==================== 内部方法 ====================

    private PluginRecord lookup(String name, PluginPhase phase) {
        registryLock.lock();
        try {
            return require(name, phase);
        } finally {
            registryLock.unlock();
        }
    }

    private PluginRecord require(String name, PluginPhase phase) {
        PluginRecord record = plugins.get(name);
        if (record == null) {
            throw new PluginException(name, phase, "Plugin not found: " + name);
        }
        return record;
    }
}
