package com.sandy.aiot.automation.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.sandy.aiot.automation.engine.exception.ConfigurationException;

public enum ActionType {
    DEVICE_CONTROL("device_control"),
    GROUP_CONTROL("group_control"),
    SCENE_ACTIVATE("scene_activate"),
    NOTIFICATION("notification"),
    DELAY("delay"),
    VARIABLE_SET("variable_set"),
    RULE_ENABLE("rule_enable"),
    RULE_DISABLE("rule_disable"),
    CUSTOM_SCRIPT("custom_script");

    private final String code;

    ActionType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /** Whether the action needs a non-blank target to be runnable. */
    public boolean requiresTarget() {
        return this != NOTIFICATION && this != DELAY && this != CUSTOM_SCRIPT;
    }

    @JsonCreator
    public static ActionType fromCode(String code) {
        for (ActionType t : values()) {
            if (t.code.equalsIgnoreCase(code) || t.name().equalsIgnoreCase(code)) return t;
        }
        throw new ConfigurationException("Unknown action type: " + code);
    }
}
