package com.orbitframe.runtime;

import com.orbitframe.api.exception.PluginBatchException;
import com.orbitframe.api.lifecycle.LifecycleState;
import com.orbitframe.api.plugin.OrbitPlugin;
import com.orbitframe.core.kernel.CoreOptions;
import com.orbitframe.core.kernel.OrbitCore;
import com.orbitframe.core.kernel.PluginDescriptor;
import com.orbitframe.core.lifecycle.LifecycleOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NativeOrbitFrame 单元测试")
public class NativeOrbitFrameTest {

    @AfterEach
    void tearDown() {
        NativeOrbitFrame.stop();
    }

    private static CoreOptions.CoreOptionsBuilder baseOptions() {
        return CoreOptions.builder()
                .serviceName("native-test")
                .version("1.0.0")
                .lifecycle(LifecycleOptions.builder().gracefulShutdown(false).build());
    }

    @Test
    @DisplayName("从清单启动并加载插件")
    void startFromManifest() throws Exception {
        OrbitCore core;
        try (InputStream manifest = NativeOrbitFrameTest.class.getResourceAsStream("/native-manifest.yml")) {
            core = NativeOrbitFrame.start(manifest);
        }

        assertEquals(LifecycleState.STARTED, core.getState());
        assertEquals("native-demo", core.getServiceName());
        assertEquals("test", core.getEnvironment());
        assertTrue(core.getPlugin("clock", Clock.class).isPresent());
        assertSame(core, NativeOrbitFrame.getCore());
    }

    @Test
    @DisplayName("重复启动返回同一个实例")
    void secondStartShouldReturnRunningCore() {
        OrbitCore first = NativeOrbitFrame.start(baseOptions().build());
        OrbitCore second = NativeOrbitFrame.start(baseOptions().serviceName("other").build());

        assertSame(first, second);
        assertEquals("native-test", second.getServiceName());
    }

    @Test
    @DisplayName("stop 后不再持有内核")
    void stopShouldForgetCore() {
        OrbitCore core = NativeOrbitFrame.start(baseOptions().build());

        NativeOrbitFrame.stop();

        assertEquals(LifecycleState.STOPPED, core.getState());
        assertFalse(NativeOrbitFrame.isStarted());
        assertThrows(IllegalStateException.class, NativeOrbitFrame::getCore);
    }

    @Test
    @DisplayName("启动失败时异常原样抛出且不保留实例")
    void failedStartShouldNotKeepCore() {
        OrbitPlugin<Object> failing = context -> {
            throw new IllegalStateException("boom");
        };
        CoreOptions options = baseOptions().plugins(List.of(PluginDescriptor.of("bad", failing))).build();

        assertThrows(PluginBatchException.class, () -> NativeOrbitFrame.start(options));
        assertFalse(NativeOrbitFrame.isStarted());
    }
}
