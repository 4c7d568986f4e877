package com.orbitframe.api.event;

import java.util.Objects;

/**
 * 带类型的事件标识
 * <p>
 * 监听器按 {@link #getName()} 登记，payloadType 仅用于编译期约束和调试输出。
 * </p>
 *
 * @param <T> 事件载荷类型
 */
public final class EventType<T> {

    private final String name;
    private final Class<T> payloadType;

    private EventType(String name, Class<T> payloadType) {
        this.name = name;
        this.payloadType = payloadType;
    }

    public static <T> EventType<T> of(String name, Class<T> payloadType) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Event name cannot be blank");
        }
        return new EventType<>(name, Objects.requireNonNull(payloadType, "payloadType"));
    }

    public String getName() {
        return name;
    }

    public Class<T> getPayloadType() {
        return payloadType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventType<?> other)) return false;
        return name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name + "<" + payloadType.getSimpleName() + ">";
    }
}
