package com.orbitframe.api.event;

import com.orbitframe.api.config.PluginConfig;
import com.orbitframe.api.plugin.OrbitPlugin;
import com.orbitframe.api.plugin.PluginPhase;

import java.util.Map;

/**
 * 插件事件目录
 */
public final class PluginEvents {

    public static final EventType<Registered> REGISTERED = EventType.of("pluginRegistered", Registered.class);
    public static final EventType<PluginRef> UNREGISTERED = EventType.of("pluginUnregistered", PluginRef.class);
    public static final EventType<Skipped> SKIPPED = EventType.of("pluginSkipped", Skipped.class);
    public static final EventType<PluginRef> INITIALIZING = EventType.of("pluginInitializing", PluginRef.class);
    public static final EventType<PluginRef> INITIALIZED = EventType.of("pluginInitialized", PluginRef.class);
    public static final EventType<Failure> ERROR = EventType.of("pluginError", Failure.class);
    public static final EventType<PluginRef> DESTROYING = EventType.of("pluginDestroying", PluginRef.class);
    public static final EventType<PluginRef> DESTROYED = EventType.of("pluginDestroyed", PluginRef.class);
    public static final EventType<PluginRef> ENABLED = EventType.of("pluginEnabled", PluginRef.class);
    public static final EventType<PluginRef> DISABLED = EventType.of("pluginDisabled", PluginRef.class);
    public static final EventType<ConfigUpdated> CONFIG_UPDATED = EventType.of("pluginConfigUpdated", ConfigUpdated.class);

    private PluginEvents() {
    }

    public record PluginRef(String name) {
    }

    public record Registered(String name, OrbitPlugin<?> plugin, PluginConfig config) {
    }

    public record Skipped(String name, String reason) {
    }

    public record Failure(String name, Throwable error, PluginPhase phase) {
    }

    public record ConfigUpdated(String name, Map<String, Object> oldConfig, Map<String, Object> newConfig) {
    }
}
