package com.orbitframe.core.lifecycle;

import lombok.Builder;
import lombok.Data;

/**
 * 生命周期选项
 */
@Data
@Builder
public class LifecycleOptions {

    /**
     * 启动钩子默认超时（毫秒），0 表示不限时
     */
    @Builder.Default
    private long startTimeout = 30_000L;

    /**
     * 停止钩子默认超时（毫秒），0 表示不限时
     */
    @Builder.Default
    private long stopTimeout = 10_000L;

    /**
     * 是否注册 JVM 关闭钩子，在进程退出时执行 stop
     */
    @Builder.Default
    private boolean gracefulShutdown = true;

    public static LifecycleOptions defaults() {
        return LifecycleOptions.builder().build();
    }
}
