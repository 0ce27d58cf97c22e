package com.sandy.aiot.automation.engine.controller;

import com.sandy.aiot.automation.engine.model.DeviceGroup;
import com.sandy.aiot.automation.engine.service.impl.DefaultGroupManager;
import com.sandy.aiot.automation.engine.vo.ActionResp;
import com.sandy.aiot.automation.engine.vo.CommandResult;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/groups")
@RequiredArgsConstructor
public class GroupController {

    private final DefaultGroupManager groupManager;

    @GetMapping
    public List<DeviceGroup> list() {
        return groupManager.listGroups();
    }

    @PutMapping
    public ResponseEntity<ActionResp> save(@RequestBody DeviceGroup group) {
        return ResponseEntity.ok(ActionResp.ok(groupManager.saveGroup(group)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ActionResp> remove(@PathVariable String id) {
        if (!groupManager.removeGroup(id)) return ResponseEntity.ok(ActionResp.fail("Group not found"));
        return ResponseEntity.ok(ActionResp.ok());
    }

    @GetMapping("/{id}/status")
    public ResponseEntity<ActionResp> status(@PathVariable String id) {
        Map<String, Object> status = groupManager.groupStatus(id);
        if (status.isEmpty()) return ResponseEntity.ok(ActionResp.fail("Group not found"));
        return ResponseEntity.ok(ActionResp.ok(status));
    }

    @PostMapping("/{id}/control")
    public ResponseEntity<ActionResp> control(@PathVariable String id, @RequestBody ControlReq req) {
        if (req.getCommand() == null || req.getCommand().isBlank()) {
            return ResponseEntity.badRequest().body(ActionResp.fail("command is required"));
        }
        CommandResult r = groupManager.controlGroup(id, req.getCommand(), req.getParameters() == null ? Map.of() : req.getParameters());
        ActionResp resp = r.isSuccess() ? ActionResp.ok(r.getPayload()) : ActionResp.fail(r.getMessage());
        resp.setMessage(r.getMessage());
        return ResponseEntity.ok(resp);
    }

    @Data
    public static class ControlReq {
        private String command;
        private Map<String, Object> parameters;
    }
}
