package com.orbitframe.core.config;

import com.orbitframe.api.event.Subscription;
import com.orbitframe.api.exception.ErrorCode;
import com.orbitframe.api.exception.OrbitException;
import com.orbitframe.core.event.EventBus;
import com.orbitframe.core.event.EventSource;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Predicate;

/**
 * 已解析配置的内存存储
 * <p>
 * 默认值与覆盖值分层保存，键为点分名称（例如 {@code server.port}）。
 * 读取时覆盖值优先；覆盖值变化时发出 change 事件并通知该键的观察者。
 * 可选的校验器作用于合并后的快照，构造时校验一次，之后由调用方按需调用 {@link #validate()}。
 * </p>
 */
@Slf4j
public class ConfigStore implements EventSource {

    private static final String OWNER = "config";

    private final EventBus events = new EventBus(OWNER);
    private final Map<String, Object> defaults;
    private final Map<String, Object> overrides = new LinkedHashMap<>();
    private final Map<String, List<BiConsumer<Object, Object>>> watchers = new ConcurrentHashMap<>();
    private final Predicate<Map<String, Object>> validator;

    public ConfigStore() {
        this(null);
    }

    public ConfigStore(Map<String, ?> defaults) {
        this(defaults, null);
    }

    /**
     * @param validator 为 null 时不做校验
     * @throws OrbitException CONFIG_ERROR，默认值未通过校验
     */
    public ConfigStore(Map<String, ?> defaults, Predicate<Map<String, Object>> validator) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (defaults != null) {
            defaults.forEach((k, v) -> {
                if (v != null) {
                    copy.put(k, v);
                }
            });
        }
        this.defaults = Collections.unmodifiableMap(copy);
        this.validator = validator;
        if (!validate()) {
            throw new OrbitException(ErrorCode.CONFIG_ERROR, "Configuration validation failed",
                    Map.of("config", getAll()), null);
        }
    }

    @Override
    public EventBus events() {
        return events;
    }

    // ==================== 读取 ====================

    public synchronized Optional<Object> get(String key) {
        Object value = overrides.containsKey(key) ? overrides.get(key) : defaults.get(key);
        return Optional.ofNullable(value);
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key).filter(type::isInstance).map(type::cast);
    }

    public String getString(String key, String defaultValue) {
        return get(key).map(String::valueOf).orElse(defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        return get(key).map(v -> toNumber(key, v).intValue()).orElse(defaultValue);
    }

    public long getLong(String key, long defaultValue) {
        return get(key).map(v -> toNumber(key, v).longValue()).orElse(defaultValue);
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        return get(key).map(v -> v instanceof Boolean b ? b : Boolean.parseBoolean(String.valueOf(v)))
                .orElse(defaultValue);
    }

    public synchronized boolean has(String key) {
        return overrides.containsKey(key) || defaults.containsKey(key);
    }

    /**
     * 合并后的配置快照（默认值之上叠加覆盖值）
     */
    public synchronized Map<String, Object> getAll() {
        Map<String, Object> merged = new LinkedHashMap<>(defaults);
        merged.putAll(overrides);
        return Collections.unmodifiableMap(merged);
    }

    /**
     * 用校验器检查当前合并配置
     *
     * @return 没有校验器时恒为 true
     * @throws OrbitException CONFIG_ERROR，校验器自身抛出异常
     */
    public boolean validate() {
        if (validator == null) {
            return true;
        }
        Map<String, Object> snapshot = getAll();
        try {
            return validator.test(snapshot);
        } catch (RuntimeException e) {
            throw new OrbitException(ErrorCode.CONFIG_ERROR, "Configuration validation failed",
                    Map.of("config", snapshot), e);
        }
    }

    // ==================== 写入 ====================

    /**
     * 设置覆盖值，值未变化时不发事件
     *
     * @param value 为 null 时等价于 {@link #delete(String)}
     */
    public void set(String key, Object value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Config key cannot be empty");
        }
        if (value == null) {
            delete(key);
            return;
        }
        Object oldValue;
        synchronized (this) {
            oldValue = get(key).orElse(null);
            overrides.put(key, value);
        }
        if (!Objects.equals(oldValue, value)) {
            fireChange(key, value, oldValue);
        }
    }

    /**
     * 删除覆盖值（恢复为默认值）
     */
    public void delete(String key) {
        Object oldValue;
        Object newValue;
        synchronized (this) {
            if (!overrides.containsKey(key)) {
                return;
            }
            oldValue = overrides.remove(key);
            newValue = defaults.get(key);
        }
        if (!Objects.equals(oldValue, newValue)) {
            fireChange(key, newValue, oldValue);
        }
    }

    /**
     * 清空覆盖值
     */
    public void reset() {
        Map<String, Object> oldConfig;
        synchronized (this) {
            oldConfig = getAll();
            overrides.clear();
        }
        log.info("[{}] Config reset to defaults", OWNER);
        events.emit(ConfigEvents.RESET, new ConfigEvents.Reset(oldConfig, getAll()));
    }

    /**
     * 观察单个键的变化
     *
     * @param watcher (新值, 旧值)
     */
    public Subscription onChange(String key, BiConsumer<Object, Object> watcher) {
        Objects.requireNonNull(watcher, "watcher");
        List<BiConsumer<Object, Object>> list = watchers.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>());
        list.add(watcher);
        return () -> list.remove(watcher);
    }

    // ==================== 内部方法 ====================

    private void fireChange(String key, Object value, Object oldValue) {
        log.debug("[{}] {} changed: {} -> {}", OWNER, key, oldValue, value);
        events.emit(ConfigEvents.CHANGE, new ConfigEvents.Change(key, value, oldValue));
        List<BiConsumer<Object, Object>> list = watchers.get(key);
        if (list == null) {
            return;
        }
        for (BiConsumer<Object, Object> watcher : list) {
            try {
                watcher.accept(value, oldValue);
            } catch (RuntimeException e) {
                log.error("[{}] Watcher of {} failed: {}", OWNER, key, e.getMessage(), e);
            }
        }
    }

    private static Number toNumber(String key, Object value) {
        if (value instanceof Number n) {
            return n;
        }
        String s = String.valueOf(value).trim();
        try {
            return s.contains(".") ? Double.valueOf(s) : Long.valueOf(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Config '" + key + "' is not numeric: " + s, e);
        }
    }
}
