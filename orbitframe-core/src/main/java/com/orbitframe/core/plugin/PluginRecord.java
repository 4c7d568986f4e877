package com.orbitframe.core.plugin;

import com.orbitframe.api.config.PluginConfig;
import com.orbitframe.api.context.PluginContext;
import com.orbitframe.api.plugin.OrbitPlugin;
import lombok.Getter;

/**
 * 插件登记记录
 * 由 PluginManager 独占，instance 的生命周期与记录的 initialized 状态绑定
 */
@Getter
class PluginRecord {

    private final String name;
    private final OrbitPlugin<?> plugin;
    private final PluginConfig config;
    private final PluginContext context;

    private volatile boolean initialized;
    private volatile Object instance;

    // 正在执行插件的 initialize / destroy（此时不持有登记锁）
    private volatile boolean transitioning;

    PluginRecord(String name, OrbitPlugin<?> plugin, PluginConfig config, PluginContext context) {
        this.name = name;
        this.plugin = plugin;
        this.config = config;
        this.context = context;
    }

    void beginTransition() {
        this.transitioning = true;
    }

    void endTransition() {
        this.transitioning = false;
    }

    void markInitialized(Object instance) {
        this.instance = instance;
        this.initialized = true;
        this.transitioning = false;
    }

    void markDestroyed() {
        this.instance = null;
        this.initialized = false;
        this.transitioning = false;
    }

    PluginInfo toInfo() {
        return new PluginInfo(name, plugin.getVersion(), config.getClassName(), config.isEnabled(), initialized);
    }
}
