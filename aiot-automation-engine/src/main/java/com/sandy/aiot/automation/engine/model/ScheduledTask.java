package com.sandy.aiot.automation.engine.model;

import com.sandy.aiot.automation.engine.vo.ActionResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Single action fired by a time trigger. Published copies are never mutated,
 * the scheduler swaps in a new instance on every run.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledTask {
    private String id;
    private String name;
    private String description;
    private ScheduleType scheduleType;
    private Map<String, Object> scheduleConfig;
    private Action action;
    @Builder.Default
    private boolean enabled = true;
    private Instant createdAt;

    // run record, written only by the scheduler
    private Instant nextRunAt;
    private Instant lastRunAt;
    private long runCount;
    /** Null means unlimited. */
    private Long maxRuns;
    private String lastError;
    private Instant lastErrorAt;
    private ActionResult lastResult;
}
