package com.orbitframe.api.plugin;

import com.orbitframe.api.context.PluginContext;

/**
 * 插件契约
 * <p>
 * 所有插件的主入口类必须实现此接口。{@link #initialize(PluginContext)} 的返回值即插件对外暴露的实例，
 * 其生命周期由 PluginManager 托管，直到 {@link #destroy()} 被调用。
 * </p>
 *
 * @param <I> 插件产出的实例类型
 * @author OrbitFrame
 */
@FunctionalInterface
public interface OrbitPlugin<I> {

    /**
     * 插件名（元数据，注册键以注册时的名称为准）
     */
    default String getName() {
        return getClass().getSimpleName();
    }

    default String getVersion() {
        return "0.0.0";
    }

    /**
     * 插件初始化时调用
     *
     * @param context 插件上下文，提供内核、配置和日志
     * @return 插件实例，可以为 null
     */
    I initialize(PluginContext context) throws Exception;

    /**
     * 插件销毁时调用，用于释放资源
     */
    default void destroy() throws Exception {
        // Default empty implementation
    }
}
