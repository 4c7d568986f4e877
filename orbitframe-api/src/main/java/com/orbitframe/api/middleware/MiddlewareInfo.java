package com.orbitframe.api.middleware;

/**
 * 中间件登记信息快照
 *
 * @param name     名称，匿名中间件为 null
 * @param priority 优先级，数值越小越先执行
 * @param enabled  是否启用
 */
public record MiddlewareInfo(String name, int priority, boolean enabled) {
}
