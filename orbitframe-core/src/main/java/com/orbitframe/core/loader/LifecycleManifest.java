package com.orbitframe.core.loader;

import com.orbitframe.core.lifecycle.LifecycleOptions;
import lombok.Getter;
import lombok.Setter;

/**
 * 清单中的 lifecycle 段
 */
@Getter
@Setter
public class LifecycleManifest {

    private Long startTimeout;
    private Long stopTimeout;
    private Boolean gracefulShutdown;

    /**
     * 未声明的项使用默认值
     */
    public LifecycleOptions toOptions() {
        LifecycleOptions options = LifecycleOptions.defaults();
        if (startTimeout != null) {
            options.setStartTimeout(startTimeout);
        }
        if (stopTimeout != null) {
            options.setStopTimeout(stopTimeout);
        }
        if (gracefulShutdown != null) {
            options.setGracefulShutdown(gracefulShutdown);
        }
        return options;
    }
}
