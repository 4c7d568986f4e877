package com.orbitframe.core.plugin;

/**
 * 插件信息快照
 *
 * @param className 入口类名，通过实例注册时为 null
 */
public record PluginInfo(String name, String version, String className, boolean enabled, boolean initialized) {
}
