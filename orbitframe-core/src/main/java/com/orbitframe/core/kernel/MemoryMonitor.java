package com.orbitframe.core.kernel;

import com.orbitframe.api.event.SystemEvents;
import com.orbitframe.core.concurrent.Futures;
import com.orbitframe.core.event.EventBus;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 堆内存监控
 * 按固定间隔采样，发出 MEMORY_USAGE；使用率超过阈值时额外发出 memoryThresholdExceeded
 */
@Slf4j
public class MemoryMonitor {

    private final EventBus events;
    private final MemoryMXBean memoryBean;
    @Getter
    private final long intervalMs;
    @Getter
    private final double threshold;

    private ScheduledFuture<?> task;

    /**
     * @param threshold 堆使用率阈值，取值 (0, 1]
     */
    public MemoryMonitor(EventBus events, long intervalMs, double threshold) {
        this(events, ManagementFactory.getMemoryMXBean(), intervalMs, threshold);
    }

    MemoryMonitor(EventBus events, MemoryMXBean memoryBean, long intervalMs, double threshold) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("Memory monitor interval must be positive: " + intervalMs);
        }
        if (threshold <= 0 || threshold > 1) {
            throw new IllegalArgumentException("Memory threshold must be in (0, 1]: " + threshold);
        }
        this.events = events;
        this.memoryBean = memoryBean;
        this.intervalMs = intervalMs;
        this.threshold = threshold;
    }

    public synchronized void start() {
        if (task != null) {
            return;
        }
        // 定时线程只负责触发，采样和监听器在线程池上执行
        task = Futures.timer().scheduleAtFixedRate(() -> Futures.executor().execute(this::sampleSafely),
                intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[memory] Monitoring heap every {} ms (threshold {}%)", intervalMs, Math.round(threshold * 100));
    }

    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
            log.info("[memory] Monitoring stopped");
        }
    }

    public synchronized boolean isRunning() {
        return task != null;
    }

    /**
     * 采样一次并发出事件
     */
    public SystemEvents.MemoryUsage sample() {
        MemoryUsage heap = memoryBean.getHeapMemoryUsage();
        long max = heap.getMax() > 0 ? heap.getMax() : heap.getCommitted();
        double usage = max > 0 ? (double) heap.getUsed() / max : 0d;
        SystemEvents.MemoryUsage snapshot = new SystemEvents.MemoryUsage(
                heap.getUsed(), heap.getCommitted(), heap.getMax(), usage, threshold);

        events.emit(SystemEvents.MEMORY_USAGE, snapshot);
        if (usage > threshold) {
            log.warn("[memory] Heap usage {}% exceeds threshold {}%",
                    Math.round(usage * 100), Math.round(threshold * 100));
            events.emit(SystemEvents.MEMORY_THRESHOLD_EXCEEDED, snapshot);
        }
        return snapshot;
    }

    private void sampleSafely() {
        try {
            sample();
        } catch (RuntimeException e) {
            log.error("[memory] Sampling failed: {}", e.getMessage(), e);
        }
    }
}
