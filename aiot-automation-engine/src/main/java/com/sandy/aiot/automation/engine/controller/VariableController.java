package com.sandy.aiot.automation.engine.controller;

import com.sandy.aiot.automation.engine.service.VariableStore;
import com.sandy.aiot.automation.engine.vo.ActionResp;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/variables")
@RequiredArgsConstructor
public class VariableController {

    private final VariableStore variableStore;

    @GetMapping
    public Map<String, Object> all() {
        return variableStore.all();
    }

    @GetMapping("/{name}")
    public ResponseEntity<ActionResp> get(@PathVariable String name) {
        return variableStore.get(name)
                .map(v -> ResponseEntity.ok(ActionResp.ok(v)))
                .orElseGet(() -> ResponseEntity.ok(ActionResp.fail("Variable not found")));
    }

    @PutMapping("/{name}")
    public ResponseEntity<ActionResp> set(@PathVariable String name, @RequestBody ValueReq req) {
        variableStore.set(name, req.getValue());
        return ResponseEntity.ok(ActionResp.ok());
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<ActionResp> remove(@PathVariable String name) {
        if (!variableStore.remove(name)) return ResponseEntity.ok(ActionResp.fail("Variable not found"));
        return ResponseEntity.ok(ActionResp.ok());
    }

    @Data
    public static class ValueReq {
        private Object value;
    }
}
