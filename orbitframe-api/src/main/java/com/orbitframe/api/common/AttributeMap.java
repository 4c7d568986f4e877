package com.orbitframe.api.common;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 带类型访问器的键值存储
 * <p>
 * 用于插件配置项和中间件元数据。按插入顺序保存，不保存 null 值（put null 等价于 remove）。
 * 数值和布尔访问器接受对应的字符串形式，便于承载来自 YAML / 环境的配置。
 * </p>
 */
public class AttributeMap {

    private final Map<String, Object> values = new LinkedHashMap<>();

    public AttributeMap() {
    }

    public AttributeMap(Map<String, ?> initial) {
        putAll(initial);
    }

    public static AttributeMap of(Map<String, ?> initial) {
        return new AttributeMap(initial);
    }

    // ==================== 写入 ====================

    public synchronized AttributeMap put(String key, Object value) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Attribute key cannot be empty");
        }
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
        return this;
    }

    public synchronized AttributeMap putAll(Map<String, ?> other) {
        if (other != null) {
            other.forEach(this::put);
        }
        return this;
    }

    public synchronized Object remove(String key) {
        return values.remove(key);
    }

    public synchronized void clear() {
        values.clear();
    }

    // ==================== 读取 ====================

    public synchronized Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * 按类型读取，类型不符时返回 empty
     */
    public synchronized <T> Optional<T> get(String key, Class<T> type) {
        Object value = values.get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    public synchronized Optional<String> getString(String key) {
        Object value = values.get(key);
        return value == null ? Optional.empty() : Optional.of(String.valueOf(value));
    }

    public String getString(String key, String defaultValue) {
        return getString(key).orElse(defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        Number number = toNumber(key);
        return number != null ? number.intValue() : defaultValue;
    }

    public long getLong(String key, long defaultValue) {
        Number number = toNumber(key);
        return number != null ? number.longValue() : defaultValue;
    }

    public double getDouble(String key, double defaultValue) {
        Number number = toNumber(key);
        return number != null ? number.doubleValue() : defaultValue;
    }

    public synchronized boolean getBoolean(String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            if ("true".equalsIgnoreCase(s)) return true;
            if ("false".equalsIgnoreCase(s)) return false;
        }
        return defaultValue;
    }

    public synchronized boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public synchronized Set<String> keys() {
        return Collections.unmodifiableSet(new LinkedHashMap<>(values).keySet());
    }

    public synchronized int size() {
        return values.size();
    }

    public synchronized boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * 当前内容的只读快照
     */
    public synchronized Map<String, Object> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public synchronized AttributeMap copy() {
        return new AttributeMap(values);
    }

    private synchronized Number toNumber(String key) {
        Object value = values.get(key);
        if (value instanceof Number n) {
            return n;
        }
        if (value instanceof String s) {
            try {
                return s.contains(".") ? Double.valueOf(s.trim()) : Long.valueOf(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Attribute '" + key + "' is not numeric: " + s, e);
            }
        }
        return null;
    }

    @Override
    public synchronized String toString() {
        return values.toString();
    }
}
