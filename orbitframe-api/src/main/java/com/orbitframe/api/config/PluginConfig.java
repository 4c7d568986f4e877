package com.orbitframe.api.config;

import com.orbitframe.api.common.AttributeMap;
import lombok.Getter;
import lombok.Setter;

import java.util.Map;

/**
 * 插件配置
 * <p>
 * enabled=false 的插件仍然登记在册，只是不会被初始化。
 * </p>
 */
@Getter
public class PluginConfig {

    private final String name;

    /**
     * 插件入口类全限定名（通过实例直接注册时为 null）
     */
    private final String className;

    @Setter
    private volatile boolean enabled;

    private final AttributeMap options;

    public PluginConfig(String name, String className, boolean enabled, Map<String, ?> options) {
        this.name = name;
        this.className = className;
        this.enabled = enabled;
        this.options = new AttributeMap(options);
    }

    public static PluginConfig of(String name) {
        return new PluginConfig(name, null, true, null);
    }

    public static PluginConfig of(String name, Map<String, ?> options) {
        return new PluginConfig(name, null, true, options);
    }

    public static PluginConfig disabled(String name) {
        return new PluginConfig(name, null, false, null);
    }

    @Override
    public String toString() {
        return String.format("PluginConfig{name='%s', enabled=%s, options=%s}", name, enabled, options);
    }
}
