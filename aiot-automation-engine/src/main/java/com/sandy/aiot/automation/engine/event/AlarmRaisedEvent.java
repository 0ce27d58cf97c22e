package com.sandy.aiot.automation.engine.event;

import com.sandy.aiot.automation.engine.entity.Alarm;

/**
 * Published after a new (non duplicate) alarm has been stored.
 */
public record AlarmRaisedEvent(Alarm alarm) {
}
