package com.orbitframe.api.lifecycle;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 生命周期状态
 * <p>
 * CREATED → STARTING → STARTED → STOPPING → STOPPED，ERROR 可由 STARTING 或 STOPPING 进入。
 * </p>
 */
@Getter
@RequiredArgsConstructor
public enum LifecycleState {
    CREATED("created"),
    STARTING("starting"),
    STARTED("started"),
    STOPPING("stopping"),
    STOPPED("stopped"),
    ERROR("error");

    private final String value;
}
