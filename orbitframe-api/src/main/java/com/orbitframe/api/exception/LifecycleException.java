package com.orbitframe.api.exception;

import com.orbitframe.api.lifecycle.LifecyclePhase;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 生命周期异常
 * <p>
 * 启动阶段快速失败，只对应一个钩子；停止阶段尽力而为，可能汇总多个失败钩子。
 * </p>
 */
@Getter
public class LifecycleException extends OrbitException {

    private final LifecyclePhase phase;

    /**
     * 出错的钩子名（状态不允许时为 null）
     */
    private final String hookName;

    private final boolean timedOut;

    private final List<String> failedHooks;

    public LifecycleException(LifecyclePhase phase, String message) {
        this(phase, null, false, Collections.emptyList(), message, null);
    }

    public LifecycleException(LifecyclePhase phase, String hookName, boolean timedOut,
                              List<String> failedHooks, String message, Throwable cause) {
        super(phase == LifecyclePhase.STOP ? ErrorCode.STOP_FAILED : ErrorCode.START_FAILED,
                message, detailsOf(phase, hookName, timedOut), cause);
        this.phase = phase;
        this.hookName = hookName;
        this.timedOut = timedOut;
        this.failedHooks = failedHooks == null ? Collections.emptyList() : List.copyOf(failedHooks);
    }

    /**
     * 单个钩子失败
     */
    public static LifecycleException hookFailed(LifecyclePhase phase, String hookName, Throwable cause) {
        return new LifecycleException(phase, hookName, false, List.of(hookName),
                String.format("%s hook \"%s\" failed", phase.getValue(), hookName), cause);
    }

    /**
     * 单个钩子超时
     */
    public static LifecycleException hookTimedOut(LifecyclePhase phase, String hookName, long timeoutMs) {
        return new LifecycleException(phase, hookName, true, List.of(hookName),
                String.format("%s hook \"%s\" timed out after %dms", phase.getValue(), hookName, timeoutMs), null);
    }

    private static Map<String, Object> detailsOf(LifecyclePhase phase, String hookName, boolean timedOut) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (phase != null) {
            details.put("phase", phase.getValue());
        }
        if (hookName != null) {
            details.put("hookName", hookName);
        }
        if (timedOut) {
            details.put("timedOut", true);
        }
        return details;
    }
}
