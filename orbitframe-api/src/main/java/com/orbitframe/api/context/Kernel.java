package com.orbitframe.api.context;

import com.orbitframe.api.event.EventType;
import com.orbitframe.api.lifecycle.LifecycleState;

import java.util.Optional;

/**
 * 插件可见的内核视图
 *
 * @author OrbitFrame
 */
public interface Kernel {

    String getServiceName();

    String getVersion();

    String getEnvironment();

    LifecycleState getState();

    /**
     * 查找已初始化插件产出的实例
     *
     * @param name 插件名
     * @param type 期望的实例类型
     * @return 实例；插件不存在、未初始化或类型不符时为 empty
     */
    <T> Optional<T> findPlugin(String name, Class<T> type);

    /**
     * 在内核总线上发布事件
     */
    <T> void publish(EventType<T> type, T payload);
}
