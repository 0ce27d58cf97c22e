package com.sandy.aiot.automation.engine.controller;

import com.sandy.aiot.automation.engine.model.Rule;
import com.sandy.aiot.automation.engine.service.impl.RuleEngineService;
import com.sandy.aiot.automation.engine.vo.ActionResp;
import com.sandy.aiot.automation.engine.vo.RuleEngineStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/rules")
@RequiredArgsConstructor
@Slf4j
public class RuleController {

    private final RuleEngineService ruleEngineService;

    @GetMapping
    public List<Rule> list() {
        return ruleEngineService.listRules();
    }

    @GetMapping("/status")
    public RuleEngineStatus status() {
        return ruleEngineService.status();
    }

    @GetMapping("/{id}")
    public ResponseEntity<ActionResp> get(@PathVariable String id) {
        return ruleEngineService.getRule(id)
                .map(r -> ResponseEntity.ok(ActionResp.ok(r)))
                .orElseGet(() -> ResponseEntity.ok(ActionResp.fail("Rule not found")));
    }

    @PostMapping
    public ResponseEntity<ActionResp> save(@RequestBody Rule rule) {
        return ResponseEntity.ok(ActionResp.ok(ruleEngineService.saveRule(rule)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ActionResp> update(@PathVariable String id, @RequestBody Rule rule) {
        rule.setId(id);
        return ResponseEntity.ok(ActionResp.ok(ruleEngineService.saveRule(rule)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ActionResp> remove(@PathVariable String id) {
        if (!ruleEngineService.removeRule(id)) return ResponseEntity.ok(ActionResp.fail("Rule not found"));
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
        return ruleEngineService.setEnabled(id, enabled)
                .map(r -> ResponseEntity.ok(ActionResp.ok(r)))
                .orElseGet(() -> ResponseEntity.ok(ActionResp.fail("Rule not found")));
    }

    @PostMapping("/{id}/trigger")
    public ResponseEntity<ActionResp> trigger(@PathVariable String id) {
        if (ruleEngineService.getRule(id).isEmpty()) return ResponseEntity.ok(ActionResp.fail("Rule not found"));
        if (!ruleEngineService.trigger(id)) return ResponseEntity.ok(ActionResp.fail("Rule is already firing"));
        return ResponseEntity.ok(ActionResp.ok());
    }
}
