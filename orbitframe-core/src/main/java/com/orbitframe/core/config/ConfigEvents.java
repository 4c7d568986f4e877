package com.orbitframe.core.config;

import com.orbitframe.api.event.EventType;

import java.util.Map;

/**
 * 配置事件目录
 */
public final class ConfigEvents {

    public static final EventType<Change> CHANGE = EventType.of("change", Change.class);
    public static final EventType<Reset> RESET = EventType.of("reset", Reset.class);

    private ConfigEvents() {
    }

    /**
     * @param value    新值，删除时为 null
     * @param oldValue 旧值，新增时为 null
     */
    public record Change(String key, Object value, Object oldValue) {
    }

    public record Reset(Map<String, Object> oldConfig, Map<String, Object> newConfig) {
    }
}
