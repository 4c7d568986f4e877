package com.orbitframe.runtime;

import com.orbitframe.core.concurrent.Futures;
import com.orbitframe.core.kernel.CoreOptions;
import com.orbitframe.core.kernel.OrbitCore;
import com.orbitframe.core.loader.CoreManifestLoader;
import lombok.extern.slf4j.Slf4j;

import java.io.InputStream;
import java.util.concurrent.CompletionException;

/**
 * OrbitFrame Native 启动器
 * 宿主应用通过此类一键启动内核
 */
@Slf4j
public class NativeOrbitFrame {

    private static OrbitCore GLOBAL_CORE;

    private NativeOrbitFrame() {
    }

    /**
     * 从 YAML 清单启动
     */
    public static OrbitCore start(InputStream manifest) {
        return start(CoreManifestLoader.load(manifest).toOptions());
    }

    /**
     * 启动 OrbitFrame 并等待启动完成
     * <p>
     * 已启动时直接返回当前实例。启动失败时不保留实例，异常原样抛出。
     * </p>
     */
    public static synchronized OrbitCore start(CoreOptions options) {
        if (GLOBAL_CORE != null) {
            log.warn("OrbitFrame is already started.");
            return GLOBAL_CORE;
        }

        long start = System.currentTimeMillis();
        log.info("Starting OrbitFrame Native Runtime...");

        OrbitCore core = new OrbitCore(options);
        try {
            core.start().join();
        } catch (CompletionException e) {
            core.close();
            Throwable cause = Futures.unwrap(e);
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }

        GLOBAL_CORE = core;
        log.info("OrbitFrame Native started in {} ms", System.currentTimeMillis() - start);
        return core;
    }

    /**
     * 获取当前内核
     */
    public static synchronized OrbitCore getCore() {
        if (GLOBAL_CORE == null) {
            throw new IllegalStateException("OrbitFrame not started");
        }
        return GLOBAL_CORE;
    }

    public static synchronized boolean isStarted() {
        return GLOBAL_CORE != null;
    }

    /**
     * 停止并释放当前内核，未启动时不做任何事
     */
    public static synchronized void stop() {
        OrbitCore core = GLOBAL_CORE;
        if (core == null) {
            return;
        }
        GLOBAL_CORE = null;
        log.info("OrbitFrame shutting down...");
        try {
            core.stop().join();
        } finally {
            core.close();
        }
    }
}
