package com.orbitframe.api.lifecycle;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum LifecyclePhase {
    START("start"),
    STOP("stop");

    private final String value;
}
