package com.sandy.aiot.automation.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Action {
    private String id;
    private ActionType type;
    private String target;
    private String command;
    private Map<String, Object> parameters;
    /** Pause before this action runs; blocks only the firing that owns it. */
    private int delaySeconds;

    public Object parameter(String name) {
        return parameters == null ? null : parameters.get(name);
    }
}
