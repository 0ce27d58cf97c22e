package com.sandy.aiot.automation.engine.controller;

import com.sandy.aiot.automation.engine.entity.Alarm;
import com.sandy.aiot.automation.engine.model.SensorReading;
import com.sandy.aiot.automation.engine.service.DeviceStateCache;
import com.sandy.aiot.automation.engine.service.impl.ThresholdMonitorService;
import com.sandy.aiot.automation.engine.vo.ActionResp;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Telemetry intake and live device state.
 */
@RestController
@RequestMapping("/api/telemetry")
@RequiredArgsConstructor
@Slf4j
public class TelemetryController {

    private final ThresholdMonitorService thresholdMonitorService;
    private final DeviceStateCache deviceStateCache;

    @PostMapping
    public ResponseEntity<ActionResp> ingest(@RequestBody SensorReading reading) {
        List<Alarm> alarms = thresholdMonitorService.ingest(reading);
        return ResponseEntity.ok(ActionResp.ok(alarms));
    }

    @PostMapping("/batch")
    public ResponseEntity<ActionResp> ingestBatch(@RequestBody List<SensorReading> readings) {
        List<Alarm> alarms = thresholdMonitorService.ingestAll(readings);
        return ResponseEntity.ok(ActionResp.ok(alarms));
    }

    @GetMapping("/devices")
    public Set<String> devices() {
        return deviceStateCache.deviceIds();
    }

    @GetMapping("/devices/{deviceId}")
    public ResponseEntity<ActionResp> device(@PathVariable String deviceId) {
        Map<String, Object> state = deviceStateCache.device(deviceId);
        if (state.isEmpty()) return ResponseEntity.ok(ActionResp.fail("Device not found"));
        return ResponseEntity.ok(ActionResp.ok(state));
    }

    @PutMapping("/devices/{deviceId}/state")
    public ResponseEntity<ActionResp> updateState(@PathVariable String deviceId, @RequestBody StateUpdate update) {
        if (update.getProperty() == null || update.getProperty().isBlank()) {
            return ResponseEntity.badRequest().body(ActionResp.fail("property is required"));
        }
        deviceStateCache.updateProperty(deviceId, update.getProperty(), update.getValue());
        return ResponseEntity.ok(ActionResp.ok(deviceStateCache.device(deviceId)));
    }

    @Data
    public static class StateUpdate {
        private String property;
        private Object value;
    }
}
