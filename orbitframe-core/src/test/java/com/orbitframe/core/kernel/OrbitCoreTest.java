package com.orbitframe.core.kernel;

import com.orbitframe.api.context.PluginContext;
import com.orbitframe.api.event.EventType;
import com.orbitframe.api.event.LifecycleEvents;
import com.orbitframe.api.event.MiddlewareEvents;
import com.orbitframe.api.event.PluginEvents;
import com.orbitframe.api.exception.ErrorCode;
import com.orbitframe.api.exception.LifecycleException;
import com.orbitframe.api.exception.OrbitException;
import com.orbitframe.api.exception.PluginBatchException;
import com.orbitframe.api.exception.PluginException;
import com.orbitframe.api.lifecycle.LifecycleHook;
import com.orbitframe.api.lifecycle.LifecycleState;
import com.orbitframe.api.middleware.MiddlewareContext;
import com.orbitframe.api.plugin.OrbitPlugin;
import com.orbitframe.core.concurrent.Futures;
import com.orbitframe.core.lifecycle.LifecycleOptions;
import com.orbitframe.core.loader.GreeterPlugin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OrbitCore 单元测试")
public class OrbitCoreTest {

    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    private OrbitCore core;

    @AfterEach
    void tearDown() {
        if (core != null) {
            core.close();
        }
    }

    // ==================== 辅助方法 ====================

    private OrbitPlugin<String> recording(String name) {
        return new OrbitPlugin<>() {
            @Override
            public String initialize(PluginContext context) {
                calls.add("init:" + name);
                return name;
            }

            @Override
            public void destroy() {
                calls.add("destroy:" + name);
            }
        };
    }

    private CoreOptions.CoreOptionsBuilder options(PluginDescriptor... plugins) {
        return CoreOptions.builder()
                .serviceName("test-service")
                .version("1.0.0")
                .lifecycle(LifecycleOptions.builder().startTimeout(1_000).stopTimeout(1_000).gracefulShutdown(false).build())
                .plugins(new ArrayList<>(List.of(plugins)));
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        CompletionException e = assertThrows(CompletionException.class, future::join);
        return Futures.unwrap(e);
    }

    @Nested
    @DisplayName("构造")
    class ConstructionTests {

        @Test
        @DisplayName("缺少服务名或版本应抛出 CONFIG_ERROR")
        void missingRequiredOptionsShouldFail() {
            OrbitException e = assertThrows(OrbitException.class,
                    () -> new OrbitCore(CoreOptions.builder().version("1").build()));
            assertEquals(ErrorCode.CONFIG_ERROR, e.getCode());
            assertThrows(OrbitException.class, () -> new OrbitCore(CoreOptions.builder().serviceName("s").build()));
        }

        @Test
        @DisplayName("初始配置未通过校验器时构造失败")
        void configValidatorShouldRunOnConstruction() {
            OrbitException e = assertThrows(OrbitException.class, () -> new OrbitCore(CoreOptions.builder()
                    .serviceName("s").version("1")
                    .config(Map.of("db.url", ""))
                    .configValidator(all -> !String.valueOf(all.get("db.url")).isEmpty())
                    .build()));

            assertEquals(ErrorCode.CONFIG_ERROR, e.getCode());
        }

        @Test
        @DisplayName("构造时登记插件（包括禁用的），但不初始化")
        void descriptorsShouldBeRegistered() {
            core = new OrbitCore(options(
                    PluginDescriptor.of("a", recording("a")),
                    PluginDescriptor.builder().name("off").instance(recording("off")).enabled(false).build()).build());

            assertTrue(core.hasPlugin("a"));
            assertTrue(core.hasPlugin("off"));
            assertTrue(calls.isEmpty());
            assertEquals(LifecycleState.CREATED, core.getState());
            assertEquals("development", core.getEnvironment());
        }

        @Test
        @DisplayName("按类名加载插件")
        void pluginShouldBeLoadedByClassName() {
            core = new OrbitCore(options(PluginDescriptor.builder()
                    .name("greeter")
                    .className(GreeterPlugin.class.getName())
                    .options(Map.of("greeting", "hello"))
                    .build()).build());

            core.start().join();

            assertEquals("hello, test-service", core.getPlugin("greeter", String.class).orElseThrow());
        }

        @Test
        @DisplayName("类名无法解析时构造失败")
        void unknownClassShouldFail() {
            PluginException e = assertThrows(PluginException.class, () -> new OrbitCore(options(PluginDescriptor.builder()
                    .name("ghost")
                    .className("com.example.DoesNotExist")
                    .build()).build()));
            assertEquals("ghost", e.getPluginName());
        }
    }

    @Nested
    @DisplayName("启动与停止")
    class StartStopTests {

        @Test
        @DisplayName("启动先初始化插件再执行启动钩子")
        void startShouldInitializePluginsThenRunHooks() {
            core = new OrbitCore(options(
                    PluginDescriptor.of("a", recording("a")),
                    PluginDescriptor.of("b", recording("b"))).build());
            core.getLifecycle().onStart("hook", LifecycleHook.of(() -> calls.add("hook")));
            List<String> coreEvents = new ArrayList<>();
            core.on(CoreEvents.STARTING, info -> coreEvents.add("starting"));
            core.on(CoreEvents.STARTED, info -> coreEvents.add("started:" + info.plugins()));

            core.start().join();

            assertEquals(List.of("init:a", "init:b", "hook"), calls);
            assertEquals(List.of("starting", "started:[a, b]"), coreEvents);
            assertEquals(LifecycleState.STARTED, core.getState());
        }

        @Test
        @DisplayName("停止先执行停止钩子再逆序销毁插件")
        void stopShouldRunHooksThenDestroyPlugins() {
            core = new OrbitCore(options(
                    PluginDescriptor.of("a", recording("a")),
                    PluginDescriptor.of("b", recording("b"))).build());
            core.getLifecycle().onStop("hook", LifecycleHook.of(() -> calls.add("stop-hook")));
            core.start().join();
            calls.clear();

            core.stop().join();

            assertEquals(List.of("stop-hook", "destroy:b", "destroy:a"), calls);
            assertEquals(LifecycleState.STOPPED, core.getState());
            assertEquals(0, core.getUptime());
        }

        @Test
        @DisplayName("未启动时 stop 为空操作")
        void stopBeforeStartShouldBeNoop() {
            core = new OrbitCore(options().build());

            assertDoesNotThrow(() -> core.stop().join());
            assertEquals(LifecycleState.CREATED, core.getState());
        }

        @Test
        @DisplayName("插件初始化失败时回滚已初始化插件")
        void pluginFailureShouldRollBack() {
            OrbitPlugin<Object> failing = context -> {
                throw new IllegalStateException("cannot init");
            };
            core = new OrbitCore(options(
                    PluginDescriptor.of("a", recording("a")),
                    PluginDescriptor.of("bad", failing)).build());
            AtomicReference<Throwable> startFailed = new AtomicReference<>();
            core.on(CoreEvents.START_FAILED, startFailed::set);

            Throwable failure = failureOf(core.start());

            PluginBatchException e = assertInstanceOf(PluginBatchException.class, failure);
            assertEquals(List.of("bad"), e.getFailedPlugins());
            assertEquals(List.of("init:a", "destroy:a"), calls);
            assertTrue(core.getPluginManager().getInitializedPlugins().isEmpty());
            assertSame(failure, startFailed.get());
        }

        @Test
        @DisplayName("插件抛出 Error 时 start 返回失败的 future，且可以再次调用 start")
        void pluginErrorShouldFailFutureAndAllowRetry() {
            OrbitPlugin<Object> broken = context -> {
                throw new NoClassDefFoundError("com/example/Missing");
            };
            core = new OrbitCore(options(
                    PluginDescriptor.of("broken", broken),
                    PluginDescriptor.of("good", recording("good"))).build());

            CompletableFuture<Void> first = assertDoesNotThrow(() -> core.start());
            Throwable failure = failureOf(first);

            PluginBatchException e = assertInstanceOf(PluginBatchException.class, failure);
            assertEquals(List.of("broken"), e.getFailedPlugins());
            assertInstanceOf(NoClassDefFoundError.class, e.getFailures().get(0).getCause());
            assertEquals(List.of("init:good", "destroy:good"), calls);

            CompletableFuture<Void> second = core.start();
            ExecutionException again = assertThrows(ExecutionException.class,
                    () -> second.get(2, TimeUnit.SECONDS));
            assertInstanceOf(PluginBatchException.class, again.getCause());
            assertEquals(LifecycleState.CREATED, core.getState());
        }

        @Test
        @DisplayName("启动钩子失败时同样回滚插件")
        void hookFailureShouldRollBack() {
            core = new OrbitCore(options(PluginDescriptor.of("a", recording("a"))).build());
            core.getLifecycle().onStart("bad", () -> {
                throw new IllegalStateException("hook failed");
            });

            Throwable failure = failureOf(core.start());

            assertInstanceOf(LifecycleException.class, failure);
            assertEquals(List.of("init:a", "destroy:a"), calls);
            assertEquals(LifecycleState.ERROR, core.getState());
        }

        @Test
        @DisplayName("停止钩子失败时仍销毁插件并合并错误")
        void stopShouldAlwaysDestroyPlugins() {
            core = new OrbitCore(options(PluginDescriptor.of("a", recording("a"))).build());
            core.getLifecycle().onStop("bad", () -> {
                throw new IllegalStateException("stop hook failed");
            });
            AtomicReference<Throwable> stopFailed = new AtomicReference<>();
            core.on(CoreEvents.STOP_FAILED, stopFailed::set);
            core.start().join();

            Throwable failure = failureOf(core.stop());

            assertInstanceOf(LifecycleException.class, failure);
            assertTrue(calls.contains("destroy:a"));
            assertFalse(core.getPluginManager().isInitialized("a"));
            assertNotNull(stopFailed.get());
        }

        @Test
        @DisplayName("重启后插件重新初始化")
        void restartShouldReinitializePlugins() {
            core = new OrbitCore(options(PluginDescriptor.of("a", recording("a"))).build());
            AtomicReference<CoreInfo> restarted = new AtomicReference<>();
            core.on(CoreEvents.RESTARTED, restarted::set);
            core.start().join();

            core.restart().join();

            assertEquals(List.of("init:a", "destroy:a", "init:a"), calls);
            assertEquals(LifecycleState.STARTED, restarted.get().state());
        }
    }

    @Nested
    @DisplayName("事件桥接与查询")
    class BridgeAndQueryTests {

        @Test
        @DisplayName("各管理器事件转发到内核总线")
        void managerEventsShouldBeBridged() {
            core = new OrbitCore(options(PluginDescriptor.of("a", recording("a"))).build());
            List<String> seen = new ArrayList<>();
            core.on(PluginEvents.INITIALIZED, e -> seen.add("plugin:" + e.name()));
            core.on(LifecycleEvents.STARTED, s -> seen.add("lifecycle:" + s.getValue()));
            core.getMiddlewareManager().use("m", (ctx, next) -> next.proceed());
            core.on(MiddlewareEvents.CHAIN_COMPLETED, e -> seen.add("middleware"));

            core.start().join();
            core.getMiddlewareManager().execute(new MiddlewareContext()).join();

            assertEquals(List.of("plugin:a", "lifecycle:started", "middleware"), seen);
        }

        @Test
        @DisplayName("关闭桥接后内核总线收不到管理器事件")
        void bridgeCanBeDisabled() {
            core = new OrbitCore(options(PluginDescriptor.of("a", recording("a"))).bridgeEvents(false).build());
            List<String> seen = new ArrayList<>();
            core.on(PluginEvents.INITIALIZED, e -> seen.add(e.name()));

            core.start().join();

            assertTrue(seen.isEmpty());
        }

        @Test
        @DisplayName("插件可通过内核视图查找其他插件并发布事件")
        void pluginShouldSeeKernel() {
            EventType<String> custom = EventType.of("custom", String.class);
            AtomicReference<String> received = new AtomicReference<>();
            OrbitPlugin<Object> consumer = context -> {
                String other = context.getKernel().findPlugin("a", String.class).orElse("missing");
                context.publishEvent(custom, "found " + other);
                return null;
            };
            core = new OrbitCore(options(
                    PluginDescriptor.of("a", recording("a")),
                    PluginDescriptor.of("consumer", consumer)).build());
            core.on(custom, received::set);

            core.start().join();

            assertEquals("found a", received.get());
        }

        @Test
        @DisplayName("信息快照包含状态、已初始化插件和配置")
        void infoShouldDescribeCore() {
            core = new OrbitCore(options(PluginDescriptor.of("a", recording("a")))
                    .environment("production")
                    .config(Map.of("server.port", 8080))
                    .build());
            core.getConfig().set("feature.x", true);
            core.start().join();

            CoreInfo info = core.getInfo();

            assertEquals("test-service", info.serviceName());
            assertEquals("production", info.environment());
            assertEquals(LifecycleState.STARTED, info.state());
            assertEquals(List.of("a"), info.plugins());
            assertEquals(8080, info.config().get("server.port"));
            assertEquals(true, info.config().get("feature.x"));
            assertTrue(info.uptime() >= 0);
        }

        @Test
        @DisplayName("命名日志以服务名为前缀")
        void loggerShouldBePrefixed() {
            core = new OrbitCore(options().build());

            assertEquals("test-service.http", core.getLogger("http").getName());
        }

        @Test
        @DisplayName("内存监控可开启和关闭")
        void memoryMonitoringToggle() {
            core = new OrbitCore(options().build());

            MemoryMonitor monitor = core.enableMemoryMonitoring(60_000, 0.95);
            assertTrue(monitor.isRunning());

            core.disableMemoryMonitoring();
            assertFalse(monitor.isRunning());
        }
    }
}
