package com.sandy.aiot.automation.engine.controller;

import com.sandy.aiot.automation.engine.entity.Escalation;
import com.sandy.aiot.automation.engine.service.impl.EscalationService;
import com.sandy.aiot.automation.engine.vo.ActionResp;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/escalations")
@RequiredArgsConstructor
public class EscalationController {

    private final EscalationService escalationService;

    @GetMapping
    public List<Escalation> listOpen() {
        return escalationService.open();
    }

    @GetMapping("/recent")
    public List<Escalation> listRecent() {
        return escalationService.recent();
    }

    @GetMapping("/{id}")
    public ResponseEntity<ActionResp> get(@PathVariable Long id) {
        return escalationService.get(id)
                .map(e -> ResponseEntity.ok(ActionResp.ok(e)))
                .orElseGet(() -> ResponseEntity.ok(ActionResp.fail("Escalation not found")));
    }

    @PostMapping("/{id}/resolve")
    public ResponseEntity<ActionResp> resolve(@PathVariable Long id) {
        return escalationService.resolve(id)
                .map(e -> ResponseEntity.ok(ActionResp.ok(e)))
                .orElseGet(() -> ResponseEntity.ok(ActionResp.fail("Escalation not found")));
    }

    @PostMapping("/{id}/renotify")
    public ResponseEntity<ActionResp> renotify(@PathVariable Long id) {
        return escalationService.renotify(id)
                .map(e -> ResponseEntity.ok(ActionResp.ok(e)))
                .orElseGet(() -> ResponseEntity.ok(ActionResp.fail("No open escalation with this id")));
    }

    @PostMapping("/sweep")
    public ResponseEntity<ActionResp> sweep() {
        return ResponseEntity.ok(ActionResp.ok(Map.of("escalated", escalationService.sweep())));
    }
}
