package com.orbitframe.api.event;

import com.orbitframe.api.middleware.MiddlewareContext;
import com.orbitframe.api.middleware.MiddlewareInfo;

import java.util.List;

/**
 * 中间件事件目录
 */
public final class MiddlewareEvents {

    public static final EventType<MiddlewareInfo> ADDED = EventType.of("middlewareAdded", MiddlewareInfo.class);
    public static final EventType<MiddlewareInfo> REMOVED = EventType.of("middlewareRemoved", MiddlewareInfo.class);
    public static final EventType<MiddlewareInfo> ENABLED = EventType.of("middlewareEnabled", MiddlewareInfo.class);
    public static final EventType<MiddlewareInfo> DISABLED = EventType.of("middlewareDisabled", MiddlewareInfo.class);
    public static final EventType<Integer> CLEARED = EventType.of("middlewaresCleared", Integer.class);
    public static final EventType<Inserted> INSERTED = EventType.of("middlewareInserted", Inserted.class);
    public static final EventType<Step> EXECUTING = EventType.of("middlewareExecuting", Step.class);
    public static final EventType<Step> EXECUTED = EventType.of("middlewareExecuted", Step.class);
    public static final EventType<StepFailed> ERROR = EventType.of("middlewareError", StepFailed.class);
    public static final EventType<ChainCompleted> CHAIN_COMPLETED =
            EventType.of("middlewareChainCompleted", ChainCompleted.class);
    public static final EventType<ChainFailed> CHAIN_FAILED = EventType.of("middlewareChainFailed", ChainFailed.class);
    public static final EventType<Timeout> TIMEOUT = EventType.of("middlewareTimeout", Timeout.class);

    private MiddlewareEvents() {
    }

    /**
     * @param anchor 锚点中间件名
     * @param before true 表示插在锚点之前
     */
    public record Inserted(MiddlewareInfo middleware, String anchor, boolean before) {
    }

    public record Step(String name, MiddlewareContext context) {
    }

    public record StepFailed(String name, Throwable error, MiddlewareContext context) {
    }

    public record ChainCompleted(List<String> executedMiddlewares, MiddlewareContext context) {
    }

    public record ChainFailed(Throwable error, List<String> executedMiddlewares, MiddlewareContext context) {
    }

    public record Timeout(long timeoutMs, MiddlewareContext context) {
    }
}
