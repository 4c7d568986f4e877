package com.orbitframe.core.middleware;

import com.orbitframe.api.middleware.MiddlewareHandler;
import com.orbitframe.api.middleware.MiddlewareInfo;
import lombok.Getter;

/**
 * 中间件登记项
 */
@Getter
class MiddlewareRegistration {

    private final MiddlewareHandler handler;
    private final String name;
    private final int priority;
    private volatile boolean enabled;

    MiddlewareRegistration(MiddlewareHandler handler, String name, int priority, boolean enabled) {
        this.handler = handler;
        this.name = name == null || name.isBlank() ? null : name;
        this.priority = priority;
        this.enabled = enabled;
    }

    void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * 按名称或处理器引用匹配
     */
    boolean matches(Object key) {
        if (key instanceof String s) {
            return s.equals(name);
        }
        return key != null && key == handler;
    }

    /**
     * 事件和异常中使用的名称，匿名中间件按其在链中的位置（从 1 开始）命名
     */
    String displayName(int index) {
        return name != null ? name : "anonymous-" + (index + 1);
    }

    MiddlewareInfo toInfo() {
        return new MiddlewareInfo(name, priority, enabled);
    }
}
