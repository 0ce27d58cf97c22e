package com.sandy.aiot.automation.engine.service;

import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Optional;

/**
 * Read view of live state used to resolve condition leaves.
 */
public interface StateSnapshot {
    ZonedDateTime now();

    Optional<Object> deviceProperty(String deviceId, String property);

    Map<String, Object> groupStatus(String groupId);

    Optional<Object> variable(String name);
}
