package com.sandy.aiot.automation.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Leaf of a rule's condition tree: {@code target.property operator value}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Condition {
    private String id;
    private ConditionType type;
    /** Device id, group id, variable name or "system" for time conditions. */
    private String target;
    private String property;
    private ComparisonOperator operator;
    /** Scalar to compare with; a two element list for in_range. */
    private Object value;
}
