package com.sandy.aiot.automation.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.sandy.aiot.automation.engine.exception.ConfigurationException;

public enum ScheduleType {
    CRON("cron"),
    INTERVAL("interval"),
    ONCE("once"),
    DAILY("daily"),
    WEEKLY("weekly");

    private final String code;

    ScheduleType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static ScheduleType fromCode(String code) {
        for (ScheduleType t : values()) {
            if (t.code.equalsIgnoreCase(code) || t.name().equalsIgnoreCase(code)) return t;
        }
        throw new ConfigurationException("Unknown schedule type: " + code);
    }
}
