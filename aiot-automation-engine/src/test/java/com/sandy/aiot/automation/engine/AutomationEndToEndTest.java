package com.sandy.aiot.automation.engine;

import com.sandy.aiot.automation.engine.entity.Alarm;
import com.sandy.aiot.automation.engine.entity.AlarmSeverity;
import com.sandy.aiot.automation.engine.model.*;
import com.sandy.aiot.automation.engine.repository.AlarmRepository;
import com.sandy.aiot.automation.engine.repository.EscalationRepository;
import com.sandy.aiot.automation.engine.service.ThresholdRegistry;
import com.sandy.aiot.automation.engine.service.impl.RuleEngineService;
import com.sandy.aiot.automation.engine.service.impl.ThresholdMonitorService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Telemetry in, alarm raised, rule fires a shutdown command, cooldown holds back the repeat.
 */
@SpringBootTest
@ActiveProfiles("test")
class AutomationEndToEndTest {

    private static final String RULE_ID = "overheat-shutdown";

    @Autowired ThresholdMonitorService monitor;
    @Autowired ThresholdRegistry thresholdRegistry;
    @Autowired RuleEngineService ruleEngine;
    @Autowired AlarmRepository alarmRepository;
    @Autowired EscalationRepository escalationRepository;
    @Autowired RecordingDeviceChannel deviceChannel;
    @Autowired MutableClock clock;

    @BeforeEach
    void setup() {
        alarmRepository.deleteAll();
        escalationRepository.deleteAll();
        deviceChannel.reset();
        clock.set(Instant.parse("2024-03-04T08:00:00Z"));
        thresholdRegistry.put(Threshold.builder().deviceId("m1").sensorType("temperature").max(85.0).criticalMax(90.0).build());
        ruleEngine.saveRule(Rule.builder()
                .id(RULE_ID)
                .name("Emergency shutdown on overheat")
                .conditions(List.of(
                        Condition.builder().type(ConditionType.SENSOR_VALUE).target("m1").property("temperature")
                                .operator(ComparisonOperator.GREATER_THAN).value(85).build(),
                        Condition.builder().type(ConditionType.DEVICE_STATE).target("m1").property("deviceId")
                                .operator(ComparisonOperator.EQUALS).value("m1").build()))
                .logicOperator(LogicOperator.AND)
                .actions(List.of(Action.builder().type(ActionType.DEVICE_CONTROL).target("m1").command("emergency_shutdown").build()))
                .cooldownSeconds(300)
                .build());
    }

    @AfterEach
    void cleanup() {
        ruleEngine.removeRule(RULE_ID);
        thresholdRegistry.remove("m1", "temperature");
        deviceChannel.reset();
    }

    @Test
    void overheatRaisesCriticalAlarmAndShutsDownOnce() throws InterruptedException {
        monitor.ingest(SensorReading.builder().deviceId("m1").sensorType("temperature").value(92.0).unit("C").build());

        List<Alarm> alarms = alarmRepository.findByDeviceIdOrderByCreatedAtDesc("m1");
        assertEquals(1, alarms.size());
        assertEquals(AlarmSeverity.CRITICAL, alarms.get(0).getSeverity());
        assertEquals("critical_high", alarms.get(0).getAlarmType());
        assertTrue(escalationRepository.findFirstByDeviceIdAndIssueTypeAndResolvedFalse("m1", "critical_high").isPresent());

        ruleEngine.tick();
        awaitFiringDone();
        assertEquals(1, deviceChannel.count("m1", "emergency_shutdown"));

        // same reading again inside the cooldown
        monitor.ingest(SensorReading.builder().deviceId("m1").sensorType("temperature").value(92.0).unit("C").build());
        clock.advance(Duration.ofSeconds(30));
        ruleEngine.tick();
        Thread.sleep(100);
        assertFalse(ruleEngine.isFiring(RULE_ID));
        assertEquals(1, deviceChannel.count("m1", "emergency_shutdown"));
        assertEquals(1, alarmRepository.findByDeviceIdOrderByCreatedAtDesc("m1").size(), "duplicate alarm suppressed");

        clock.advance(Duration.ofMinutes(5));
        ruleEngine.tick();
        awaitFiringDone();
        assertEquals(2, deviceChannel.count("m1", "emergency_shutdown"));
        assertEquals(2, ruleEngine.getRule(RULE_ID).orElseThrow().getExecutionCount());
    }

    @Test
    void normalReadingDoesNotFire() throws InterruptedException {
        monitor.ingest(SensorReading.builder().deviceId("m1").sensorType("temperature").value(70.0).build());
        ruleEngine.tick();
        Thread.sleep(100);
        assertEquals(0, deviceChannel.count("m1", "emergency_shutdown"));
        assertTrue(alarmRepository.findByDeviceIdOrderByCreatedAtDesc("m1").isEmpty());
        assertNull(ruleEngine.getRule(RULE_ID).orElseThrow().getLastExecutedAt());
    }

    @Test
    void failedShutdownIsRecordedOnTheRule() throws InterruptedException {
        deviceChannel.failFor("m1");
        monitor.ingest(SensorReading.builder().deviceId("m1").sensorType("temperature").value(95.0).build());
        ruleEngine.tick();
        awaitFiringDone();
        Rule rule = ruleEngine.getRule(RULE_ID).orElseThrow();
        assertEquals(1, rule.getExecutionCount());
        assertNotNull(rule.getLastError());
        assertFalse(rule.getLastResults().get(0).isSuccess());
    }

    private void awaitFiringDone() throws InterruptedException {
        // tick() marks the rule in flight before returning
        TestAwait.until(() -> !ruleEngine.isFiring(RULE_ID), Duration.ofSeconds(5), "rule firing to complete");
    }
}
