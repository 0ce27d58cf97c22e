package com.sandy.aiot.automation.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.sandy.aiot.automation.engine.exception.ConfigurationException;

public enum ComparisonOperator {
    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    GREATER_THAN("greater_than"),
    LESS_THAN("less_than"),
    GREATER_EQUAL("greater_equal"),
    LESS_EQUAL("less_equal"),
    CONTAINS("contains"),
    IN_RANGE("in_range"),
    REGEX_MATCH("regex_match");

    private final String code;

    ComparisonOperator(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static ComparisonOperator fromCode(String code) {
        for (ComparisonOperator o : values()) {
            if (o.code.equalsIgnoreCase(code) || o.name().equalsIgnoreCase(code)) return o;
        }
        throw new ConfigurationException("Unknown comparison operator: " + code);
    }
}
