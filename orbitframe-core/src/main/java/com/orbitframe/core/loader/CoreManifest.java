package com.orbitframe.core.loader;

import com.orbitframe.core.kernel.CoreOptions;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 内核清单（YAML 根对象）
 * <pre>
 * serviceName: order-service
 * version: 1.0.0
 * environment: production
 * lifecycle:
 *   startTimeout: 5000
 * config:
 *   server.port: 8080
 * plugins:
 *   - name: cache
 *     className: com.example.CachePlugin
 *     options:
 *       size: 128
 * </pre>
 */
@Getter
@Setter
public class CoreManifest {

    private String serviceName;
    private String version;
    private String environment;
    private Boolean bridgeEvents;
    private LifecycleManifest lifecycle;
    private Map<String, Object> config = new LinkedHashMap<>();
    private List<PluginManifest> plugins = new ArrayList<>();

    public CoreOptions toOptions() {
        CoreOptions.CoreOptionsBuilder builder = CoreOptions.builder()
                .serviceName(serviceName)
                .version(version);
        if (environment != null) {
            builder.environment(environment);
        }
        if (bridgeEvents != null) {
            builder.bridgeEvents(bridgeEvents);
        }
        if (lifecycle != null) {
            builder.lifecycle(lifecycle.toOptions());
        }
        if (config != null) {
            builder.config(new LinkedHashMap<>(config));
        }
        if (plugins != null) {
            builder.plugins(plugins.stream().map(PluginManifest::toDescriptor).collect(Collectors.toList()));
        }
        return builder.build();
    }
}
