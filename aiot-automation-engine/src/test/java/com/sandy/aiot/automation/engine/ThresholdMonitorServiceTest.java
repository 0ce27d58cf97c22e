package com.sandy.aiot.automation.engine;

import com.sandy.aiot.automation.engine.entity.Alarm;
import com.sandy.aiot.automation.engine.entity.AlarmSeverity;
import com.sandy.aiot.automation.engine.model.SensorReading;
import com.sandy.aiot.automation.engine.model.Threshold;
import com.sandy.aiot.automation.engine.repository.AlarmRepository;
import com.sandy.aiot.automation.engine.repository.EscalationRepository;
import com.sandy.aiot.automation.engine.service.DeviceStateCache;
import com.sandy.aiot.automation.engine.service.ThresholdRegistry;
import com.sandy.aiot.automation.engine.service.impl.ThresholdMonitorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class ThresholdMonitorServiceTest {

    @Autowired ThresholdMonitorService monitor;
    @Autowired ThresholdRegistry thresholdRegistry;
    @Autowired AlarmRepository alarmRepository;
    @Autowired EscalationRepository escalationRepository;
    @Autowired DeviceStateCache deviceStateCache;
    @Autowired MutableClock clock;

    private final Threshold boiler = Threshold.builder().deviceId("boiler").sensorType("pressure")
            .min(2.0).max(8.0).criticalMin(1.0).criticalMax(10.0).build();

    @BeforeEach
    void setup() {
        alarmRepository.deleteAll();
        escalationRepository.deleteAll();
        clock.set(Instant.parse("2024-03-04T08:00:00Z"));
    }

    private SensorReading reading(double value) {
        return SensorReading.builder().deviceId("boiler").sensorType("pressure").value(value).unit("bar").build();
    }

    @Test
    void boundsAreCheckedInPrecedenceOrder() {
        List<Threshold> t = List.of(boiler);
        assertEquals("critical_high", monitor.evaluate(reading(12), t).get(0).getAlarmType());
        assertEquals("critical_low", monitor.evaluate(reading(0.5), t).get(0).getAlarmType());
        assertEquals("warning_high", monitor.evaluate(reading(9), t).get(0).getAlarmType());
        assertEquals("warning_low", monitor.evaluate(reading(1.5), t).get(0).getAlarmType());
        assertTrue(monitor.evaluate(reading(5), t).isEmpty());
        // bounds are strict
        assertTrue(monitor.evaluate(reading(8), t).isEmpty());
    }

    @Test
    void atMostOneAlarmPerSensorAndSeverityFollowsBoundName() {
        Threshold onlyWarn = Threshold.builder().deviceId("boiler").sensorType("pressure").max(3.0).build();
        List<Alarm> alarms = monitor.evaluate(reading(12), List.of(boiler, onlyWarn));
        assertEquals(1, alarms.size());
        Alarm a = alarms.get(0);
        assertEquals(AlarmSeverity.CRITICAL, a.getSeverity());
        assertEquals("pressure critically high: 12", a.getMessage());
        assertEquals(12.0, a.getActualValue());
        assertEquals(10.0, a.getLimitValue());

        Alarm warn = monitor.evaluate(reading(9.5), List.of(boiler)).get(0);
        assertEquals(AlarmSeverity.WARNING, warn.getSeverity());
        assertEquals("pressure high: 9.5", warn.getMessage());
    }

    @Test
    void thresholdsOfOtherSensorsAreIgnored() {
        Threshold other = Threshold.builder().deviceId("boiler").sensorType("temperature").max(1.0).build();
        assertTrue(monitor.evaluate(reading(100), List.of(other)).isEmpty());
    }

    @Test
    void ingestUpdatesLiveStateAndStoresAlarm() {
        thresholdRegistry.put(boiler);
        List<Alarm> stored = monitor.ingest(reading(9));

        assertEquals(1, stored.size());
        assertNotNull(stored.get(0).getId());
        assertEquals(9.0, deviceStateCache.property("boiler", "pressure").orElseThrow());
        assertEquals("bar", deviceStateCache.property("boiler", "pressure_unit").orElseThrow());
        assertEquals("warning_high", deviceStateCache.property("boiler", "last_alarm_type").orElseThrow());
        assertTrue(deviceStateCache.isOnline("boiler"));
    }

    @Test
    void rejectsReadingWithoutValue() {
        assertThrows(IllegalArgumentException.class, () -> monitor.ingest(SensorReading.builder().deviceId("boiler").sensorType("pressure").build()));
    }

    @Test
    void acknowledgeSingleAndBatch() {
        thresholdRegistry.put(boiler);
        Alarm a1 = monitor.ingest(reading(9)).get(0);
        Alarm a2 = monitor.ingest(reading(0.2)).get(0);

        assertTrue(monitor.acknowledge(a1.getId()).orElseThrow().isAcknowledged());
        assertEquals(1, monitor.acknowledgeAll(List.of(a1.getId(), a2.getId())));
        assertTrue(monitor.active().isEmpty());
        assertTrue(monitor.acknowledge(999_999L).isEmpty());
    }

    @Test
    void silentDeviceRaisesOneOfflineAlarm() {
        monitor.ingest(SensorReading.builder().deviceId("meter-7").sensorType("power").value(3.2).build());

        clock.advance(Duration.ofMinutes(4));
        monitor.tick();
        assertTrue(alarmRepository.findByDeviceIdOrderByCreatedAtDesc("meter-7").isEmpty());

        clock.advance(Duration.ofMinutes(2));
        monitor.tick();
        monitor.tick();
        List<Alarm> alarms = alarmRepository.findByDeviceIdOrderByCreatedAtDesc("meter-7");
        assertEquals(1, alarms.size());
        assertEquals("device_offline", alarms.get(0).getAlarmType());
        assertEquals(AlarmSeverity.WARNING, alarms.get(0).getSeverity());
        assertFalse(deviceStateCache.isOnline("meter-7"));

        monitor.ingest(SensorReading.builder().deviceId("meter-7").sensorType("power").value(3.3).build());
        assertTrue(deviceStateCache.isOnline("meter-7"));
    }
}
