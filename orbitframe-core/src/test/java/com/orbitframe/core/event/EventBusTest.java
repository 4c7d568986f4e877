package com.orbitframe.core.event;

import com.orbitframe.api.event.EventListener;
import com.orbitframe.api.event.EventType;
import com.orbitframe.api.event.Subscription;
import com.orbitframe.api.event.SystemEvents;
import com.orbitframe.api.exception.OrbitException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EventBus 单元测试")
public class EventBusTest {

    private static final EventType<String> GREETING = EventType.of("greeting", String.class);
    private static final EventType<Integer> COUNTER = EventType.of("counter", Integer.class);

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus("test-bus");
    }

    @Nested
    @DisplayName("订阅和发布")
    class SubscribeAndEmitTests {

        @Test
        @DisplayName("监听器应按注册顺序收到事件")
        void listenersShouldRunInRegistrationOrder() {
            List<String> calls = new ArrayList<>();

            eventBus.on(GREETING, p -> calls.add("a:" + p));
            eventBus.once(GREETING, p -> calls.add("once:" + p));
            eventBus.on(GREETING, p -> calls.add("b:" + p));

            boolean delivered = eventBus.emit(GREETING, "hi");

            assertTrue(delivered);
            assertEquals(List.of("a:hi", "once:hi", "b:hi"), calls);
        }

        @Test
        @DisplayName("没有监听器时 emit 返回 false")
        void emitWithoutListenersShouldReturnFalse() {
            assertFalse(eventBus.emit(GREETING, "nobody"));
        }

        @Test
        @DisplayName("一次性监听器只触发一次")
        void onceListenerShouldFireOnce() {
            AtomicInteger count = new AtomicInteger();
            eventBus.once(COUNTER, v -> count.incrementAndGet());

            eventBus.emit(COUNTER, 1);
            eventBus.emit(COUNTER, 2);

            assertEquals(1, count.get());
            assertEquals(0, eventBus.listenerCount(COUNTER));
        }

        @Test
        @DisplayName("emit 不等待异步监听器")
        void emitShouldNotAwaitAsyncListeners() {
            CompletableFuture<Void> pending = new CompletableFuture<>();
            AtomicInteger after = new AtomicInteger();

            eventBus.onAsync(GREETING, p -> pending);
            eventBus.on(GREETING, p -> after.incrementAndGet());

            eventBus.emit(GREETING, "x");

            assertEquals(1, after.get());
            assertFalse(pending.isDone());
        }
    }

    @Nested
    @DisplayName("取消订阅")
    class UnsubscribeTests {

        @Test
        @DisplayName("取消订阅后不应收到事件")
        void unsubscribedShouldNotReceive() {
            AtomicInteger count = new AtomicInteger();
            Subscription subscription = eventBus.on(COUNTER, v -> count.incrementAndGet());

            eventBus.emit(COUNTER, 1);
            subscription.unsubscribe();
            eventBus.emit(COUNTER, 2);

            assertEquals(1, count.get());
        }

        @Test
        @DisplayName("按引用移除监听器")
        void offByReference() {
            AtomicInteger count = new AtomicInteger();
            EventListener<Integer> listener = v -> count.incrementAndGet();
            eventBus.on(COUNTER, listener);

            assertTrue(eventBus.off(COUNTER, listener));
            assertFalse(eventBus.off(COUNTER, listener));

            eventBus.emit(COUNTER, 1);
            assertEquals(0, count.get());
        }

        @Test
        @DisplayName("派发过程中被移除的监听器本轮不再调用")
        void removedDuringEmitShouldNotBeCalled() {
            List<String> calls = new ArrayList<>();
            AtomicReference<Subscription> second = new AtomicReference<>();

            eventBus.on(GREETING, p -> {
                calls.add("first");
                second.get().unsubscribe();
            });
            second.set(eventBus.on(GREETING, p -> calls.add("second")));

            eventBus.emit(GREETING, "x");

            assertEquals(List.of("first"), calls);
        }

        @Test
        @DisplayName("removeAllListeners 清空全部事件")
        void removeAllListeners() {
            eventBus.on(GREETING, p -> {
            });
            eventBus.on(COUNTER, v -> {
            });
            assertEquals(Set.of("greeting", "counter"), eventBus.eventNames());

            eventBus.removeAllListeners();

            assertTrue(eventBus.eventNames().isEmpty());
        }
    }

    @Nested
    @DisplayName("异常处理")
    class ExceptionHandlingTests {

        @Test
        @DisplayName("监听器异常应转为 ERROR 事件且不影响其余监听器")
        void listenerErrorShouldBecomeErrorEvent() {
            AtomicReference<SystemEvents.ErrorEvent> error = new AtomicReference<>();
            AtomicInteger delivered = new AtomicInteger();
            eventBus.on(SystemEvents.ERROR, error::set);

            eventBus.on(GREETING, p -> {
                throw new IllegalStateException("boom");
            });
            eventBus.on(GREETING, p -> delivered.incrementAndGet());

            assertDoesNotThrow(() -> eventBus.emit(GREETING, "x"));

            assertEquals(1, delivered.get());
            assertNotNull(error.get());
            assertEquals("greeting", error.get().event());
            assertEquals("boom", error.get().error().getMessage());
        }

        @Test
        @DisplayName("异步监听器失败也应转为 ERROR 事件")
        void asyncFailureShouldBecomeErrorEvent() {
            AtomicReference<SystemEvents.ErrorEvent> error = new AtomicReference<>();
            eventBus.on(SystemEvents.ERROR, error::set);

            eventBus.onAsync(GREETING, p -> CompletableFuture.failedFuture(new IllegalArgumentException("async")));

            eventBus.emitAsync(GREETING, "x").join();

            assertInstanceOf(IllegalArgumentException.class, error.get().error());
        }

        @Test
        @DisplayName("ERROR 监听器自身异常只记录日志，不递归")
        void errorListenerFailureShouldNotRecurse() {
            AtomicInteger errorCalls = new AtomicInteger();
            eventBus.on(SystemEvents.ERROR, e -> {
                errorCalls.incrementAndGet();
                throw new IllegalStateException("error listener failed");
            });
            eventBus.on(GREETING, p -> {
                throw new IllegalStateException("boom");
            });

            assertDoesNotThrow(() -> eventBus.emit(GREETING, "x"));
            assertEquals(1, errorCalls.get());
        }

        @Test
        @DisplayName("非法参数应抛出 OrbitException")
        void invalidArgumentsShouldFail() {
            assertThrows(OrbitException.class, () -> eventBus.on(null, p -> {
            }));
            assertThrows(OrbitException.class, () -> eventBus.on(GREETING, null));
            assertThrows(OrbitException.class, () -> eventBus.setMaxListeners(-1));
        }
    }

    @Nested
    @DisplayName("异步派发")
    class EmitAsyncTests {

        @Test
        @DisplayName("emitAsync 应等待前一个监听器完成后再调用下一个")
        void emitAsyncShouldBeSequential() {
            List<String> calls = new ArrayList<>();
            CompletableFuture<Void> gate = new CompletableFuture<>();

            eventBus.onAsync(GREETING, p -> gate.thenRun(() -> calls.add("slow")));
            eventBus.on(GREETING, p -> calls.add("fast"));

            CompletableFuture<Void> done = eventBus.emitAsync(GREETING, "x");
            assertTrue(calls.isEmpty());
            assertFalse(done.isDone());

            gate.complete(null);
            assertDoesNotThrow(() -> done.get(1, TimeUnit.SECONDS));
            assertEquals(List.of("slow", "fast"), calls);
        }
    }

    @Nested
    @DisplayName("上限与转发")
    class LimitAndForwardTests {

        @Test
        @DisplayName("超过上限只告警，监听器仍然生效")
        void exceedingMaxListenersShouldOnlyWarn() {
            eventBus.setMaxListeners(1);
            AtomicInteger count = new AtomicInteger();

            eventBus.on(COUNTER, v -> count.incrementAndGet());
            eventBus.on(COUNTER, v -> count.incrementAndGet());
            eventBus.emit(COUNTER, 1);

            assertEquals(2, count.get());
            assertEquals(1, eventBus.getMaxListeners());
        }

        @Test
        @DisplayName("0 表示不限制")
        void zeroMeansUnlimited() {
            eventBus.setMaxListeners(0);
            for (int i = 0; i < 20; i++) {
                eventBus.on(COUNTER, v -> {
                });
            }
            assertEquals(20, eventBus.listenerCount(COUNTER));
        }

        @Test
        @DisplayName("转发后目标总线也能收到事件")
        void forwardShouldReEmit() {
            EventBus target = new EventBus("target");
            AtomicReference<String> received = new AtomicReference<>();
            target.on(GREETING, received::set);

            Subscription forward = eventBus.forwardTo(target);
            eventBus.emit(GREETING, "bridged");
            assertEquals("bridged", received.get());

            forward.unsubscribe();
            eventBus.emit(GREETING, "dropped");
            assertEquals("bridged", received.get());
        }
    }
}
