package com.sandy.aiot.automation.engine.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Optional;

/**
 * {@link StateSnapshot} backed by the live caches; each lookup reads the current value.
 */
@Component
@RequiredArgsConstructor
public class LiveStateView implements StateSnapshot {

    private final DeviceStateCache deviceStateCache;
    private final GroupManager groupManager;
    private final VariableStore variableStore;
    private final Clock clock;

    @Override
    public ZonedDateTime now() {
        return ZonedDateTime.now(clock);
    }

    @Override
    public Optional<Object> deviceProperty(String deviceId, String property) {
        return deviceStateCache.property(deviceId, property);
    }

    @Override
    public Map<String, Object> groupStatus(String groupId) {
        return groupManager.groupStatus(groupId);
    }

    @Override
    public Optional<Object> variable(String name) {
        return variableStore.get(name);
    }
}
