package com.orbitframe.api.exception;

import com.orbitframe.api.plugin.PluginPhase;
import lombok.Getter;

import java.util.Map;

/**
 * 插件异常
 * 携带出错的插件名和所处阶段
 */
@Getter
public class PluginException extends OrbitException {

    private final String pluginName;

    private final PluginPhase phase;

    public PluginException(String message) {
        this(null, null, message, null);
    }

    public PluginException(String pluginName, PluginPhase phase, String message) {
        this(pluginName, phase, message, null);
    }

    public PluginException(String pluginName, PluginPhase phase, String message, Throwable cause) {
        super(ErrorCode.PLUGIN_ERROR, message, detailsOf(pluginName, phase), cause);
        this.pluginName = pluginName;
        this.phase = phase;
    }

    private static Map<String, Object> detailsOf(String pluginName, PluginPhase phase) {
        if (pluginName == null) {
            return null;
        }
        return phase == null
                ? Map.of("name", pluginName)
                : Map.of("name", pluginName, "phase", phase.getValue());
    }
}
