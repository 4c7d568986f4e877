package com.orbitframe.core.kernel;

import com.orbitframe.api.lifecycle.LifecycleState;
import jakarta.annotation.Nonnull;

import java.util.List;
import java.util.Map;

/**
 * 内核信息快照
 *
 * @param uptime 启动以来的毫秒数，未启动时为 0
 * @param config 合并后的配置
 */
public record CoreInfo(
        String serviceName,
        String version,
        String environment,
        LifecycleState state,
        long uptime,
        List<String> plugins,
        Map<String, Object> config
) {
    @Override
    @Nonnull
    public String toString() {
        return String.format("%s@%s [%s] state=%s uptime=%dms plugins=%s",
                serviceName, version, environment, state.getValue(), uptime, plugins);
    }
}
