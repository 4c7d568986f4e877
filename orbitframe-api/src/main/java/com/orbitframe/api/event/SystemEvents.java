package com.orbitframe.api.event;

/**
 * 通用系统事件
 */
public final class SystemEvents {

    /**
     * 监听器或内部流程出错
     */
    public static final EventType<ErrorEvent> ERROR = EventType.of("ERROR", ErrorEvent.class);

    /**
     * 内存采样
     */
    public static final EventType<MemoryUsage> MEMORY_USAGE = EventType.of("MEMORY_USAGE", MemoryUsage.class);

    /**
     * 堆内存使用率超过阈值
     */
    public static final EventType<MemoryUsage> MEMORY_THRESHOLD_EXCEEDED =
            EventType.of("memoryThresholdExceeded", MemoryUsage.class);

    private SystemEvents() {
    }

    /**
     * @param error 异常
     * @param event 出错时正在派发（或执行）的事件名
     */
    public record ErrorEvent(Throwable error, String event) {
    }

    public record MemoryUsage(long heapUsed, long heapCommitted, long heapMax, double usage, double threshold) {
    }
}
