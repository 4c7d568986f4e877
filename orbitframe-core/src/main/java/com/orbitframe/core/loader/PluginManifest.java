package com.orbitframe.core.loader;

import com.orbitframe.core.kernel.PluginDescriptor;
import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 清单中的单个插件声明
 */
@Getter
@Setter
public class PluginManifest {

    private String name;

    /**
     * 插件入口类全限定名，必须实现 OrbitPlugin
     */
    private String className;

    private boolean enabled = true;

    private Map<String, Object> options = new LinkedHashMap<>();

    public PluginDescriptor toDescriptor() {
        return PluginDescriptor.builder()
                .name(name)
                .className(className)
                .enabled(enabled)
                .options(options != null ? new LinkedHashMap<>(options) : new LinkedHashMap<>())
                .build();
    }
}
