package com.sandy.aiot.automation.engine.service.impl;

import com.sandy.aiot.automation.engine.service.DeviceChannel;
import com.sandy.aiot.automation.engine.service.DeviceStateCache;
import com.sandy.aiot.automation.engine.vo.CommandResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Stand-alone device channel: logs the command and records it as the device's last command.
 * Replace with a transport backed bean to reach real devices.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LoggingDeviceChannel implements DeviceChannel {

    private final DeviceStateCache deviceStateCache;

    @Override
    public CommandResult send(String target, String command, Map<String, Object> parameters) {
        log.info("Device command target={} command={} params={}", target, command, parameters);
        deviceStateCache.recordCommand(target, command);
        return CommandResult.ok("command " + command + " sent to " + target);
    }
}
