package com.sandy.aiot.automation.engine.vo;

import lombok.Data;

@Data
public class ActionResp {
    private boolean success;
    private String message;
    private Object data;

    public static ActionResp ok() { ActionResp r = new ActionResp(); r.success = true; return r; }
    public static ActionResp ok(Object data) { ActionResp r = ok(); r.data = data; return r; }
    public static ActionResp fail(String msg) { ActionResp r = new ActionResp(); r.success = false; r.message = msg; return r; }
}
