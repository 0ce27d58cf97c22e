package com.sandy.aiot.automation.engine.controller;

import com.sandy.aiot.automation.engine.entity.AuditRecord;
import com.sandy.aiot.automation.engine.service.AuditLogService;
import com.sandy.aiot.automation.engine.service.SnapshotPersistenceService;
import com.sandy.aiot.automation.engine.service.impl.RetentionService;
import com.sandy.aiot.automation.engine.vo.ActionResp;
import com.sandy.aiot.automation.engine.worker.WorkerSupervisor;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Worker control, audit trail and manual housekeeping.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class MaintenanceController {

    private final WorkerSupervisor workerSupervisor;
    private final AuditLogService auditLogService;
    private final RetentionService retentionService;
    private final SnapshotPersistenceService snapshotPersistenceService;

    @GetMapping("/workers")
    public List<WorkerSupervisor.WorkerHealth> workers() {
        return workerSupervisor.status();
    }

    @PostMapping("/workers/{name}/start")
    public ResponseEntity<ActionResp> start(@PathVariable String name) {
        return ResponseEntity.ok(workerSupervisor.start(name) ? ActionResp.ok() : ActionResp.fail("Worker not found"));
    }

    @PostMapping("/workers/{name}/stop")
    public ResponseEntity<ActionResp> stop(@PathVariable String name) {
        return ResponseEntity.ok(workerSupervisor.stop(name) ? ActionResp.ok() : ActionResp.fail("Worker not running"));
    }

    @PostMapping("/workers/{name}/tick")
    public ResponseEntity<ActionResp> tick(@PathVariable String name) {
        return ResponseEntity.ok(workerSupervisor.tickNow(name) ? ActionResp.ok() : ActionResp.fail("Worker not found"));
    }

    @GetMapping("/audit")
    public List<AuditRecord> audit(@RequestParam(required = false) String subjectId) {
        return subjectId == null ? auditLogService.recent() : auditLogService.recent(subjectId);
    }

    @PostMapping("/maintenance/retention")
    public ResponseEntity<ActionResp> retention() {
        return ResponseEntity.ok(ActionResp.ok(retentionService.sweepOnce()));
    }

    @PostMapping("/maintenance/flush")
    public ResponseEntity<ActionResp> flush() {
        return ResponseEntity.ok(ActionResp.ok(Map.of("written", snapshotPersistenceService.flush())));
    }
}
