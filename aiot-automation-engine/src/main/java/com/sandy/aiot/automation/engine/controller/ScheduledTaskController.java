package com.sandy.aiot.automation.engine.controller;

import com.sandy.aiot.automation.engine.model.ScheduledTask;
import com.sandy.aiot.automation.engine.service.impl.SchedulerService;
import com.sandy.aiot.automation.engine.vo.ActionResp;
import com.sandy.aiot.automation.engine.vo.SchedulerStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
public class ScheduledTaskController {

    private final SchedulerService schedulerService;

    @GetMapping
    public List<ScheduledTask> list() {
        return schedulerService.listTasks();
    }

    @GetMapping("/status")
    public SchedulerStatus status() {
        return schedulerService.status();
    }

    @GetMapping("/{id}")
    public ResponseEntity<ActionResp> get(@PathVariable String id) {
        return schedulerService.getTask(id)
                .map(t -> ResponseEntity.ok(ActionResp.ok(t)))
                .orElseGet(() -> ResponseEntity.ok(ActionResp.fail("Task not found")));
    }

    @PostMapping
    public ResponseEntity<ActionResp> save(@RequestBody ScheduledTask task) {
        return ResponseEntity.ok(ActionResp.ok(schedulerService.saveTask(task)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ActionResp> update(@PathVariable String id, @RequestBody ScheduledTask task) {
        task.setId(id);
        return ResponseEntity.ok(ActionResp.ok(schedulerService.saveTask(task)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ActionResp> remove(@PathVariable String id) {
        if (!schedulerService.removeTask(id)) return ResponseEntity.ok(ActionResp.fail("Task not found"));
        return ResponseEntity.ok(ActionResp.ok());
    }

    @PostMapping("/{id}/enable")
    public ResponseEntity<ActionResp> enable(@PathVariable String id) {
        return toggle(id, true);
    }

    @PostMapping("/{id}/disable")
    public ResponseEntity<ActionResp> disable(@PathVariable String id) {
        return toggle(id, false);
    }

    private ResponseEntity<ActionResp> toggle(String id, boolean enabled) {
        return schedulerService.setEnabled(id, enabled)
                .map(t -> ResponseEntity.ok(ActionResp.ok(t)))
                .orElseGet(() -> ResponseEntity.ok(ActionResp.fail("Task not found")));
    }

    @PostMapping("/{id}/run")
    public ResponseEntity<ActionResp> runNow(@PathVariable String id) {
        if (schedulerService.getTask(id).isEmpty()) return ResponseEntity.ok(ActionResp.fail("Task not found"));
        if (!schedulerService.runNow(id)) return ResponseEntity.ok(ActionResp.fail("Task is already running"));
        return ResponseEntity.ok(ActionResp.ok());
    }
}
