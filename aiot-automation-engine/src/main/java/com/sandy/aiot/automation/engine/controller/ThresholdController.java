package com.sandy.aiot.automation.engine.controller;

import com.sandy.aiot.automation.engine.model.Threshold;
import com.sandy.aiot.automation.engine.service.ThresholdRegistry;
import com.sandy.aiot.automation.engine.vo.ActionResp;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/thresholds")
@RequiredArgsConstructor
public class ThresholdController {

    private final ThresholdRegistry thresholdRegistry;

    @GetMapping
    public List<Threshold> list(@RequestParam(required = false) String deviceId) {
        return deviceId == null ? thresholdRegistry.all() : thresholdRegistry.forDevice(deviceId);
    }

    @PutMapping
    public ResponseEntity<ActionResp> save(@RequestBody Threshold threshold) {
        return ResponseEntity.ok(ActionResp.ok(thresholdRegistry.put(threshold)));
    }

    @DeleteMapping("/{deviceId}/{sensorType}")
    public ResponseEntity<ActionResp> remove(@PathVariable String deviceId, @PathVariable String sensorType) {
        if (!thresholdRegistry.remove(deviceId, sensorType)) return ResponseEntity.ok(ActionResp.fail("Threshold not found"));
        return ResponseEntity.ok(ActionResp.ok());
    }
}
