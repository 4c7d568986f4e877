package com.orbitframe.core.kernel;

import com.orbitframe.api.exception.ErrorCode;
import com.orbitframe.api.exception.OrbitException;
import com.orbitframe.core.lifecycle.LifecycleOptions;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * 内核构造选项
 */
@Data
@Builder
public class CoreOptions {

    /**
     * 服务名（必填）
     */
    private String serviceName;

    /**
     * 服务版本（必填）
     */
    private String version;

    @Builder.Default
    private String environment = "development";

    /**
     * 插件描述，按列表顺序注册
     */
    @Builder.Default
    private List<PluginDescriptor> plugins = new ArrayList<>();

    @Builder.Default
    private LifecycleOptions lifecycle = LifecycleOptions.defaults();

    /**
     * 初始配置，作为 ConfigStore 的默认值
     */
    @Builder.Default
    private Map<String, Object> config = new LinkedHashMap<>();

    /**
     * 配置校验器，可为空
     */
    private Predicate<Map<String, Object>> configValidator;

    /**
     * 是否把各管理器的事件转发到内核总线
     */
    @Builder.Default
    private boolean bridgeEvents = true;

    /**
     * 校验必填项
     *
     * @throws OrbitException CONFIG_ERROR
     */
    public void validate() {
        if (serviceName == null || serviceName.isBlank()) {
            throw new OrbitException(ErrorCode.CONFIG_ERROR, "serviceName is required");
        }
        if (version == null || version.isBlank()) {
            throw new OrbitException(ErrorCode.CONFIG_ERROR, "version is required");
        }
        if (lifecycle != null && (lifecycle.getStartTimeout() < 0 || lifecycle.getStopTimeout() < 0)) {
            throw new OrbitException(ErrorCode.CONFIG_ERROR, "Lifecycle timeouts must not be negative");
        }
    }
}
