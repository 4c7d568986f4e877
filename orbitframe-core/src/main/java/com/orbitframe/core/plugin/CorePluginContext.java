package com.orbitframe.core.plugin;

import com.orbitframe.api.common.AttributeMap;
import com.orbitframe.api.context.Kernel;
import com.orbitframe.api.context.PluginContext;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;

/**
 * 插件上下文的内核实现
 * 配置项与 PluginConfig 共享同一个 AttributeMap，更新配置后插件立即可见
 */
@RequiredArgsConstructor
public class CorePluginContext implements PluginContext {

    private final String pluginName;
    private final Kernel kernel;
    private final AttributeMap config;
    private final Logger logger;

    @Override
    public String getPluginName() {
        return pluginName;
    }

    @Override
    public Kernel getKernel() {
        return kernel;
    }

    @Override
    public AttributeMap getConfig() {
        return config;
    }

    @Override
    public Logger getLogger() {
        return logger;
    }
}
