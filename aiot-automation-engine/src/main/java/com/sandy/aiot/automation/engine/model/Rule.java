package com.sandy.aiot.automation.engine.model;

import com.sandy.aiot.automation.engine.vo.ActionResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Condition tree plus ordered action list, evaluated on every rule tick.
 * <p>
 * Instances held by the rule engine are treated as immutable: every state change
 * publishes a new copy made with {@link #toBuilder()}, so a reader never sees a
 * half-written execution record.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Rule {
    private String id;
    private String name;
    private String description;
    private List<Condition> conditions;
    @Builder.Default
    private LogicOperator logicOperator = LogicOperator.AND;
    private List<Action> actions;
    @Builder.Default
    private boolean enabled = true;
    @Builder.Default
    private int priority = 1;
    private long cooldownSeconds;
    /** Null means no daily cap. */
    private Integer maxExecutionsPerDay;

    private Instant createdAt;
    private Instant updatedAt;

    // execution record, written only by the rule engine
    private Instant lastExecutedAt;
    private long executionCount;
    private int executionCountToday;
    private String lastError;
    private Instant lastErrorAt;
    private List<ActionResult> lastResults;
}
