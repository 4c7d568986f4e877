package com.orbitframe.api.event;

import com.orbitframe.api.lifecycle.LifecyclePhase;
import com.orbitframe.api.lifecycle.LifecycleState;

/**
 * 生命周期事件目录
 */
public final class LifecycleEvents {

    public static final EventType<LifecycleState> STARTING = EventType.of("starting", LifecycleState.class);
    public static final EventType<LifecycleState> STARTED = EventType.of("started", LifecycleState.class);
    public static final EventType<LifecycleState> STOPPING = EventType.of("stopping", LifecycleState.class);
    public static final EventType<LifecycleState> STOPPED = EventType.of("stopped", LifecycleState.class);

    public static final EventType<StateChanged> STATE_CHANGED = EventType.of("stateChanged", StateChanged.class);

    public static final EventType<HookEvent> HOOK_EXECUTING = EventType.of("hookExecuting", HookEvent.class);
    public static final EventType<HookEvent> HOOK_EXECUTED = EventType.of("hookExecuted", HookEvent.class);
    public static final EventType<HookError> HOOK_ERROR = EventType.of("hookError", HookError.class);

    private LifecycleEvents() {
    }

    public record StateChanged(LifecycleState oldState, LifecycleState newState) {
    }

    public record HookEvent(String name, LifecyclePhase phase) {
    }

    public record HookError(String name, LifecyclePhase phase, Throwable error) {
    }
}
