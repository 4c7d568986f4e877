package com.orbitframe.core.kernel;

import com.orbitframe.api.event.EventType;

/**
 * 内核事件目录
 */
public final class CoreEvents {

    public static final EventType<CoreInfo> INITIALIZED = EventType.of("coreInitialized", CoreInfo.class);
    public static final EventType<CoreInfo> STARTING = EventType.of("coreStarting", CoreInfo.class);
    public static final EventType<CoreInfo> STARTED = EventType.of("coreStarted", CoreInfo.class);
    public static final EventType<Throwable> START_FAILED = EventType.of("coreStartFailed", Throwable.class);
    public static final EventType<CoreInfo> STOPPING = EventType.of("coreStopping", CoreInfo.class);
    public static final EventType<CoreInfo> STOPPED = EventType.of("coreStopped", CoreInfo.class);
    public static final EventType<Throwable> STOP_FAILED = EventType.of("coreStopFailed", Throwable.class);
    public static final EventType<CoreInfo> RESTARTING = EventType.of("coreRestarting", CoreInfo.class);
    public static final EventType<CoreInfo> RESTARTED = EventType.of("coreRestarted", CoreInfo.class);
    public static final EventType<Throwable> RESTART_FAILED = EventType.of("coreRestartFailed", Throwable.class);

    private CoreEvents() {
    }
}
