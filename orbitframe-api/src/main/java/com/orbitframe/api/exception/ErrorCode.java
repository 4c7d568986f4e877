package com.orbitframe.api.exception;

/**
 * 框架错误码
 *
 * @author OrbitFrame
 */
public enum ErrorCode {
    UNKNOWN,
    INITIALIZATION_FAILED,
    START_FAILED,
    STOP_FAILED,
    CONFIG_ERROR,
    PLUGIN_ERROR,
    CONTEXT_ERROR,
    MIDDLEWARE_ERROR,
    EVENT_ERROR
}
