package com.orbitframe.api.exception;

import lombok.Getter;

import java.util.List;

/**
 * 中间件链执行超时
 * <p>
 * 只表示放弃等待，已在执行的中间件不会被强制中断。
 * </p>
 */
@Getter
public class MiddlewareTimeoutException extends MiddlewareException {

    private final long timeoutMs;

    public MiddlewareTimeoutException(long timeoutMs, List<String> executedMiddlewares) {
        super(null, executedMiddlewares,
                String.format("Middleware execution timed out after %dms", timeoutMs), null);
        this.timeoutMs = timeoutMs;
    }
}
