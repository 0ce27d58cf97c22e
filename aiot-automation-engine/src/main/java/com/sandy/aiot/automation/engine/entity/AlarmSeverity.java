package com.sandy.aiot.automation.engine.entity;

public enum AlarmSeverity {
    WARNING,
    CRITICAL;

    /** A bound or alarm type whose name mentions "critical" is critical, anything else is a warning. */
    public static AlarmSeverity fromName(String boundOrType) {
        return boundOrType != null && boundOrType.toLowerCase().contains("critical") ? CRITICAL : WARNING;
    }
}
