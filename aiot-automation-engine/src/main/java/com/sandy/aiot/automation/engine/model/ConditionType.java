package com.sandy.aiot.automation.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.sandy.aiot.automation.engine.exception.ConfigurationException;

/**
 * Where a condition leaf reads its current value from.
 */
public enum ConditionType {
    TIME("time"),
    DEVICE_STATE("device_state"),
    SENSOR_VALUE("sensor_value"),
    GROUP_STATE("group_state"),
    CUSTOM("custom");

    private final String code;

    ConditionType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static ConditionType fromCode(String code) {
        for (ConditionType t : values()) {
            if (t.code.equalsIgnoreCase(code) || t.name().equalsIgnoreCase(code)) return t;
        }
        throw new ConfigurationException("Unknown condition type: " + code);
    }
}
