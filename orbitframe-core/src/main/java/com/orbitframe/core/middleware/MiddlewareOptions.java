package com.orbitframe.core.middleware;

import lombok.Builder;
import lombok.Data;

/**
 * 中间件登记选项
 */
@Data
@Builder
public class MiddlewareOptions {

    /**
     * 名称，用于查找、插入锚点和事件；为空时视为匿名
     */
    private String name;

    /**
     * 优先级，数值越小越先执行
     */
    @Builder.Default
    private int priority = 0;

    @Builder.Default
    private boolean enabled = true;

    public static MiddlewareOptions defaults() {
        return MiddlewareOptions.builder().build();
    }

    public static MiddlewareOptions named(String name) {
        return MiddlewareOptions.builder().name(name).build();
    }

    public static MiddlewareOptions named(String name, int priority) {
        return MiddlewareOptions.builder().name(name).priority(priority).build();
    }
}
