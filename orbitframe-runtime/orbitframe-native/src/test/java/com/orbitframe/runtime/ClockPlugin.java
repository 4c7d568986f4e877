package com.orbitframe.runtime;

import com.orbitframe.api.context.PluginContext;
import com.orbitframe.api.plugin.OrbitPlugin;

import java.time.Clock;
import java.time.ZoneId;

public class ClockPlugin implements OrbitPlugin<Clock> {

    @Override
    public Clock initialize(PluginContext context) {
        context.getLogger().info("Clock zone: {}", context.getConfig().getString("zone", "UTC"));
        return Clock.system(ZoneId.of(context.getConfig().getString("zone", "UTC")));
    }
}
