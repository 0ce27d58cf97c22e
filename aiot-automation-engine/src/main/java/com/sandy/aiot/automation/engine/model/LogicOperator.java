package com.sandy.aiot.automation.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.sandy.aiot.automation.engine.exception.ConfigurationException;

/**
 * How the leaves of a rule are combined. NOT negates the conjunction of all leaves,
 * it is not applied per leaf.
 */
public enum LogicOperator {
    AND,
    OR,
    NOT;

    @JsonCreator
    public static LogicOperator fromCode(String code) {
        for (LogicOperator o : values()) {
            if (o.name().equalsIgnoreCase(code)) return o;
        }
        throw new ConfigurationException("Unknown logic operator: " + code);
    }
}
