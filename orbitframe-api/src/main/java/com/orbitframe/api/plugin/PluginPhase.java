package com.orbitframe.api.plugin;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum PluginPhase {
    REGISTER("register"),
    INITIALIZE("initialize"),
    DESTROY("destroy"),
    UNREGISTER("unregister"),
    CONFIGURE("configure");

    private final String value;
}
