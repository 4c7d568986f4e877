package com.orbitframe.api.exception;

import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * 中间件链异常
 * 携带出错的中间件名以及出错前已进入的中间件列表
 */
@Getter
public class MiddlewareException extends OrbitException {

    private final String middlewareName;

    private final List<String> executedMiddlewares;

    public MiddlewareException(String message) {
        this(null, List.of(), message, null);
    }

    public MiddlewareException(String middlewareName, List<String> executedMiddlewares, String message, Throwable cause) {
        super(ErrorCode.MIDDLEWARE_ERROR, message,
                middlewareName == null ? null : Map.of("middlewareName", middlewareName), cause);
        this.middlewareName = middlewareName;
        this.executedMiddlewares = List.copyOf(executedMiddlewares);
    }
}
