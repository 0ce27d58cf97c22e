package com.sandy.aiot.automation.engine.controller;

import com.sandy.aiot.automation.engine.entity.Alarm;
import com.sandy.aiot.automation.engine.service.impl.ThresholdMonitorService;
import com.sandy.aiot.automation.engine.vo.ActionResp;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Alarm listing and operator acknowledgement.
 */
@RestController
@RequestMapping("/api/alarms")
@RequiredArgsConstructor
@Slf4j
public class AlarmController {

    private final ThresholdMonitorService thresholdMonitorService;

    @GetMapping
    public List<Alarm> listActive() {
        return thresholdMonitorService.active();
    }

    @GetMapping("/recent")
    public List<Alarm> listRecent() {
        return thresholdMonitorService.recent();
    }

    @GetMapping("/device/{deviceId}")
    public List<Alarm> forDevice(@PathVariable String deviceId) {
        return thresholdMonitorService.forDevice(deviceId);
    }

    @GetMapping("/stats")
    public Map<String, Object> stats(@RequestParam(defaultValue = "24") int hours) {
        return thresholdMonitorService.stats(hours);
    }

    @PostMapping("/{id}/ack")
    public ResponseEntity<ActionResp> acknowledge(@PathVariable Long id) {
        return thresholdMonitorService.acknowledge(id)
                .map(a -> ResponseEntity.ok(ActionResp.ok(a)))
                .orElseGet(() -> ResponseEntity.ok(ActionResp.fail("Alarm not found")));
    }

    @PostMapping("/batch-ack")
    public ResponseEntity<ActionResp> batchAcknowledge(@RequestBody BatchAckReq req) {
        if (req.getIds() == null || req.getIds().isEmpty()) return ResponseEntity.ok(ActionResp.fail("No alarm ids given"));
        int acknowledged = thresholdMonitorService.acknowledgeAll(req.getIds());
        return ResponseEntity.ok(ActionResp.ok(Map.of("acknowledged", acknowledged)));
    }

    @Data
    public static class BatchAckReq {
        private List<Long> ids;
    }
}
