package com.orbitframe.api.exception;

import com.orbitframe.api.lifecycle.LifecyclePhase;
import com.orbitframe.api.plugin.PluginPhase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("异常体系 单元测试")
public class ExceptionHierarchyTest {

    @Nested
    @DisplayName("PluginBatchException")
    class PluginBatchTests {

        @Test
        @DisplayName("应汇总失败插件并挂在 suppressed 上")
        void shouldAggregateFailures() {
            PluginException a = new PluginException("a", PluginPhase.INITIALIZE, "boom a");
            PluginException b = new PluginException("b", PluginPhase.INITIALIZE, "boom b");

            PluginBatchException batch = new PluginBatchException(PluginPhase.INITIALIZE, List.of(a, b));

            assertEquals(List.of("a", "b"), batch.getFailedPlugins());
            assertEquals(2, batch.getSuppressed().length);
            assertEquals(ErrorCode.PLUGIN_ERROR, batch.getCode());
            assertEquals(PluginPhase.INITIALIZE, batch.getPhase());
            assertTrue(batch.getMessage().contains("initialize 2 plugin(s): [a, b]"));
        }
    }

    @Nested
    @DisplayName("LifecycleException")
    class LifecycleTests {

        @Test
        @DisplayName("超时异常应带 timedOut 标记和钩子名")
        void timedOutShouldCarryFlag() {
            LifecycleException e = LifecycleException.hookTimedOut(LifecyclePhase.START, "db", 50);

            assertTrue(e.isTimedOut());
            assertEquals("db", e.getHookName());
            assertEquals(ErrorCode.START_FAILED, e.getCode());
            assertEquals("db", e.getDetails().get("hookName"));
        }

        @Test
        @DisplayName("停止阶段使用 STOP_FAILED 错误码")
        void stopPhaseShouldUseStopCode() {
            LifecycleException e = LifecycleException.hookFailed(LifecyclePhase.STOP, "cache", new IllegalStateException());

            assertEquals(ErrorCode.STOP_FAILED, e.getCode());
            assertFalse(e.isTimedOut());
            assertEquals(List.of("cache"), e.getFailedHooks());
        }
    }

    @Test
    @DisplayName("details 应为只读")
    void detailsShouldBeReadOnly() {
        OrbitException e = new PluginException("p", PluginPhase.REGISTER, "dup");

        assertThrows(UnsupportedOperationException.class, () -> e.getDetails().put("x", 1));
        assertTrue(e.toString().contains("PLUGIN_ERROR"));
    }

    @Test
    @DisplayName("超时异常是中间件异常的子类")
    void timeoutIsMiddlewareException() {
        MiddlewareTimeoutException e = new MiddlewareTimeoutException(10, List.of("auth"));

        assertInstanceOf(MiddlewareException.class, e);
        assertEquals(10, e.getTimeoutMs());
        assertEquals(List.of("auth"), e.getExecutedMiddlewares());
    }
}
