package com.sandy.aiot.automation.engine.service;

import com.sandy.aiot.automation.engine.vo.CommandResult;

import java.util.Map;

/**
 * Sends a command to a single device. The transport (MQTT, HTTP, OPC UA ...) lives behind this interface;
 * implementations own their own timeouts and may throw on transport failure.
 */
public interface DeviceChannel {
    CommandResult send(String target, String command, Map<String, Object> parameters);
}
