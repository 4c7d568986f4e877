package com.orbitframe.core.kernel;

import com.orbitframe.api.config.PluginConfig;
import com.orbitframe.api.exception.PluginException;
import com.orbitframe.api.plugin.OrbitPlugin;
import com.orbitframe.api.plugin.PluginPhase;
import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 插件描述
 * <p>
 * 通过实例或入口类名声明插件，二者择一；同时提供时以实例为准。
 * 入口类必须实现 {@link OrbitPlugin} 并提供无参构造器。
 * </p>
 */
@Data
@Builder
public class PluginDescriptor {

    /**
     * 注册名，为空时取插件的 getName()
     */
    private String name;

    private String className;

    private OrbitPlugin<?> instance;

    @Builder.Default
    private Map<String, Object> options = new LinkedHashMap<>();

    @Builder.Default
    private boolean enabled = true;

    public static PluginDescriptor of(String name, OrbitPlugin<?> instance) {
        return PluginDescriptor.builder().name(name).instance(instance).build();
    }

    /**
     * 解析插件实例
     *
     * @throws PluginException 类不存在、未实现 OrbitPlugin 或无法实例化
     */
    public OrbitPlugin<?> resolvePlugin() {
        if (instance != null) {
            return instance;
        }
        if (className == null || className.isBlank()) {
            throw new PluginException(name, PluginPhase.REGISTER,
                    "Plugin " + name + " declares neither an instance nor a class name");
        }
        try {
            ClassLoader loader = Thread.currentThread().getContextClassLoader();
            Class<?> type = Class.forName(className, true,
                    loader != null ? loader : PluginDescriptor.class.getClassLoader());
            if (!OrbitPlugin.class.isAssignableFrom(type)) {
                throw new PluginException(name, PluginPhase.REGISTER,
                        "Plugin class " + className + " does not implement " + OrbitPlugin.class.getName());
            }
            return (OrbitPlugin<?>) type.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException | LinkageError e) {
            throw new PluginException(name, PluginPhase.REGISTER,
                    "Failed to load plugin class " + className + ": " + e.getMessage(), e);
        }
    }

    /**
     * 注册名：显式名称优先，否则取插件自身的名称
     */
    public String resolveName(OrbitPlugin<?> plugin) {
        return name != null && !name.isBlank() ? name : plugin.getName();
    }

    public PluginConfig toConfig(String registeredName) {
        return new PluginConfig(registeredName, className, enabled, options);
    }
}
