package com.orbitframe.api.exception;

import com.orbitframe.api.plugin.PluginPhase;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 批量插件操作的聚合异常
 * <p>
 * initializeAll / destroyAll 在遍历结束后统一抛出，单个失败同时挂在 suppressed 上。
 * </p>
 */
public class PluginBatchException extends PluginException {

    private final List<PluginException> failures;

    public PluginBatchException(PluginPhase phase, List<PluginException> failures) {
        super(null, phase, buildMessage(phase, failures));
        this.failures = List.copyOf(failures);
        this.failures.forEach(this::addSuppressed);
    }

    public List<PluginException> getFailures() {
        return failures;
    }

    /**
     * 失败的插件名，按失败发生顺序
     */
    public List<String> getFailedPlugins() {
        return failures.stream().map(PluginException::getPluginName).collect(Collectors.toList());
    }

    private static String buildMessage(PluginPhase phase, List<PluginException> failures) {
        String names = failures.stream()
                .map(PluginException::getPluginName)
                .collect(Collectors.joining(", ", "[", "]"));
        return String.format("Failed to %s %d plugin(s): %s", phase.getValue(), failures.size(), names);
    }
}
