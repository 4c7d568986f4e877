package com.orbitframe.api.middleware;

import com.orbitframe.api.common.AttributeMap;
import lombok.Getter;
import lombok.Setter;

import java.util.Optional;
import java.util.UUID;

/**
 * 中间件上下文
 * <p>
 * 一次处理单元（例如一个请求）独占一个实例，在整条链中按引用传递，不跨处理单元共享。
 * 不使用 ThreadLocal，需要的数据都显式挂在这里。
 * </p>
 */
@Getter
@Setter
public class MiddlewareContext {

    private Object request;

    private Object response;

    private Object data;

    private final AttributeMap metadata = new AttributeMap();

    private String requestId;

    private String traceId;

    private final long startTime = System.currentTimeMillis();

    // 超时放弃等待后置位，链上不再启动新的中间件
    private volatile boolean cancelled;

    public MiddlewareContext() {
        this(null);
    }

    public MiddlewareContext(Object request) {
        this.request = request;
        this.requestId = UUID.randomUUID().toString();
        this.traceId = UUID.randomUUID().toString();
    }

    public static MiddlewareContext of(Object request) {
        return new MiddlewareContext(request);
    }

    public <T> Optional<T> getRequest(Class<T> type) {
        return type.isInstance(request) ? Optional.of(type.cast(request)) : Optional.empty();
    }

    public <T> Optional<T> getResponse(Class<T> type) {
        return type.isInstance(response) ? Optional.of(type.cast(response)) : Optional.empty();
    }

    public <T> Optional<T> getData(Class<T> type) {
        return type.isInstance(data) ? Optional.of(type.cast(data)) : Optional.empty();
    }

    public long getElapsedTime() {
        return System.currentTimeMillis() - startTime;
    }

    /**
     * 标记为已取消（由超时执行调用）
     */
    public void cancel() {
        this.cancelled = true;
    }

    @Override
    public String toString() {
        return String.format("MiddlewareContext{requestId=%s, traceId=%s, metadata=%s}",
                requestId, traceId, metadata.keys());
    }
}
