package com.orbitframe.api.context;

import com.orbitframe.api.common.AttributeMap;
import com.orbitframe.api.event.EventType;
import org.slf4j.Logger;

/**
 * 插件上下文
 * 提供插件运行时的内核、配置和日志入口
 *
 * @author OrbitFrame
 */
public interface PluginContext {

    /**
     * 获取当前插件的注册名
     */
    String getPluginName();

    /**
     * 内核视图，未挂接内核时为 null
     */
    Kernel getKernel();

    /**
     * 插件配置项（实时视图，updatePluginConfig 后立即可见）
     */
    AttributeMap getConfig();

    /**
     * 插件专属日志
     */
    Logger getLogger();

    /**
     * 发布事件
     *
     * @param type    事件类型
     * @param payload 事件载荷
     */
    default <T> void publishEvent(EventType<T> type, T payload) {
        Kernel kernel = getKernel();
        if (kernel != null) {
            kernel.publish(type, payload);
        }
    }
}
