package com.sandy.aiot.automation.engine.vo;

import com.sandy.aiot.automation.engine.model.ActionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Normalized outcome of one action, shared by rule firings and scheduled task runs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionResult {
    private String actionId;
    private ActionType type;
    private String target;
    private String command;
    private boolean success;
    private Object result;
    private String error;
    private Instant startedAt;
    private long durationMs;
}
