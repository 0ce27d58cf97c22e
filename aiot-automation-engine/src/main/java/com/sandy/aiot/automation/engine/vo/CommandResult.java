package com.sandy.aiot.automation.engine.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reply of a device, group or scene collaborator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommandResult {
    private boolean success;
    private String message;
    private Object payload;

    public static CommandResult ok(String message) {
        return new CommandResult(true, message, null);
    }

    public static CommandResult ok(String message, Object payload) {
        return new CommandResult(true, message, payload);
    }

    public static CommandResult fail(String message) {
        return new CommandResult(false, message, null);
    }
}
