package com.sandy.aiot.automation.engine.service.impl;

import com.sandy.aiot.automation.engine.entity.Alarm;
import com.sandy.aiot.automation.engine.entity.AlarmSeverity;
import com.sandy.aiot.automation.engine.event.AlarmRaisedEvent;
import com.sandy.aiot.automation.engine.model.SensorReading;
import com.sandy.aiot.automation.engine.model.Threshold;
import com.sandy.aiot.automation.engine.repository.AlarmRepository;
import com.sandy.aiot.automation.engine.service.DeviceStateCache;
import com.sandy.aiot.automation.engine.service.ThresholdRegistry;
import com.sandy.aiot.automation.engine.worker.AutomationWorker;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.*;

/**
 * Checks incoming telemetry against thresholds and stores the resulting alarms.
 * <p>
 * A reading breaches at most one bound per sensor, checked as criticalMax, criticalMin, max, min.
 * An alarm with the same device, type and message inside the suppression window is dropped.
 * The housekeeping tick raises a {@code device_offline} alarm for devices that stopped reporting.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ThresholdMonitorService implements AutomationWorker {

    public static final String CRITICAL_HIGH = "critical_high";
    public static final String CRITICAL_LOW = "critical_low";
    public static final String WARNING_HIGH = "warning_high";
    public static final String WARNING_LOW = "warning_low";
    public static final String DEVICE_OFFLINE = "device_offline";

    private final ThresholdRegistry thresholdRegistry;
    private final AlarmRepository alarmRepository;
    private final DeviceStateCache deviceStateCache;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Value("${alarm.duplicate-suppress-minutes:5}")
    private int duplicateSuppressMinutes;
    @Value("${monitor.offline-after-minutes:5}")
    private int offlineAfterMinutes;
    @Value("${monitor.housekeeping-interval-ms:60000}")
    private long housekeepingIntervalMs;

    @PostConstruct
    public void init() {
        log.info("Threshold monitor initialized: suppressMinutes={} offlineAfterMinutes={}", duplicateSuppressMinutes, offlineAfterMinutes);
    }

    /**
     * Alarms the reading would raise against the given thresholds; nothing is stored.
     */
    public List<Alarm> evaluate(SensorReading reading, Collection<Threshold> thresholds) {
        if (reading.getValue() == null || thresholds == null) return List.of();
        for (Threshold t : thresholds) {
            if (!Objects.equals(t.getDeviceId(), reading.getDeviceId()) || !Objects.equals(t.getSensorType(), reading.getSensorType())) {
                continue;
            }
            Alarm alarm = breach(reading, t);
            // one alarm per sensor type
            return alarm == null ? List.of() : List.of(alarm);
        }
        return List.of();
    }

    private Alarm breach(SensorReading r, Threshold t) {
        double v = r.getValue();
        String sensor = r.getSensorType();
        if (t.getCriticalMax() != null && v > t.getCriticalMax()) {
            return alarm(r, CRITICAL_HIGH, sensor + " critically high: " + format(v), t.getCriticalMax());
        }
        if (t.getCriticalMin() != null && v < t.getCriticalMin()) {
            return alarm(r, CRITICAL_LOW, sensor + " critically low: " + format(v), t.getCriticalMin());
        }
        if (t.getMax() != null && v > t.getMax()) {
            return alarm(r, WARNING_HIGH, sensor + " high: " + format(v), t.getMax());
        }
        if (t.getMin() != null && v < t.getMin()) {
            return alarm(r, WARNING_LOW, sensor + " low: " + format(v), t.getMin());
        }
        return null;
    }

    private Alarm alarm(SensorReading r, String type, String message, Double limit) {
        return Alarm.builder()
                .deviceId(r.getDeviceId())
                .sensorType(r.getSensorType())
                .alarmType(type)
                .severity(AlarmSeverity.fromName(type))
                .message(message)
                .actualValue(r.getValue())
                .limitValue(limit)
                .createdAt(clock.instant())
                .acknowledged(false)
                .build();
    }

    /**
     * Telemetry intake: updates live state, evaluates the device's thresholds and stores new alarms.
     *
     * @return alarms actually stored (duplicates excluded)
     */
    public List<Alarm> ingest(SensorReading reading) {
        validate(reading);
        SensorReading r = reading.getTimestamp() != null ? reading : SensorReading.builder()
                .deviceId(reading.getDeviceId()).sensorType(reading.getSensorType())
                .value(reading.getValue()).unit(reading.getUnit()).timestamp(clock.instant()).build();
        deviceStateCache.recordReading(r);
        List<Alarm> stored = new ArrayList<>();
        for (Alarm candidate : evaluate(r, thresholdRegistry.forDevice(r.getDeviceId()))) {
            raise(candidate).ifPresent(stored::add);
        }
        return stored;
    }

    public List<Alarm> ingestAll(List<SensorReading> readings) {
        List<Alarm> stored = new ArrayList<>();
        for (SensorReading r : readings) {
            stored.addAll(ingest(r));
        }
        return stored;
    }

    /**
     * Stores the alarm unless an identical one was created inside the suppression window.
     */
    public synchronized Optional<Alarm> raise(Alarm candidate) {
        Instant cutoff = clock.instant().minus(duplicateSuppressMinutes, ChronoUnit.MINUTES);
        if (alarmRepository.existsByDeviceIdAndAlarmTypeAndMessageAndCreatedAtAfter(
                candidate.getDeviceId(), candidate.getAlarmType(), candidate.getMessage(), cutoff)) {
            log.info("Duplicate alarm suppressed deviceId={} type={} message={} since {}",
                    candidate.getDeviceId(), candidate.getAlarmType(), candidate.getMessage(), cutoff);
            return Optional.empty();
        }
        Alarm saved = alarmRepository.save(candidate);
        deviceStateCache.recordAlarm(saved);
        log.warn("Alarm raised id={} deviceId={} type={} severity={} message={}",
                saved.getId(), saved.getDeviceId(), saved.getAlarmType(), saved.getSeverity(), saved.getMessage());
        eventPublisher.publishEvent(new AlarmRaisedEvent(saved));
        return Optional.of(saved);
    }

    public Optional<Alarm> acknowledge(Long id) {
        return alarmRepository.findById(id).map(a -> {
            if (!a.isAcknowledged()) {
                a.setAcknowledged(true);
                a.setAcknowledgedAt(clock.instant());
                a = alarmRepository.save(a);
                log.info("Alarm acknowledged id={}", id);
            }
            return a;
        });
    }

    /** @return number of alarms newly acknowledged */
    public int acknowledgeAll(Collection<Long> ids) {
        int count = 0;
        Instant now = clock.instant();
        for (Alarm a : alarmRepository.findAllById(ids)) {
            if (a.isAcknowledged()) continue;
            a.setAcknowledged(true);
            a.setAcknowledgedAt(now);
            alarmRepository.save(a);
            count++;
        }
        log.info("Alarms batch acknowledged requested={} acknowledged={}", ids.size(), count);
        return count;
    }

    public List<Alarm> active() {
        return alarmRepository.findByAcknowledgedFalseOrderByCreatedAtDesc();
    }

    public List<Alarm> recent() {
        return alarmRepository.findTop50ByOrderByCreatedAtDesc();
    }

    public List<Alarm> forDevice(String deviceId) {
        return alarmRepository.findByDeviceIdOrderByCreatedAtDesc(deviceId);
    }

    /**
     * Alarm counts of the last {@code hours} hours.
     */
    public Map<String, Object> stats(int hours) {
        List<Alarm> window = alarmRepository.findByCreatedAtAfterOrderByCreatedAtAsc(clock.instant().minus(hours, ChronoUnit.HOURS));
        Map<String, Long> byType = new TreeMap<>();
        Map<String, Long> bySeverity = new TreeMap<>();
        Map<String, Long> byDevice = new TreeMap<>();
        long unacknowledged = 0;
        for (Alarm a : window) {
            byType.merge(a.getAlarmType(), 1L, Long::sum);
            bySeverity.merge(a.getSeverity().name(), 1L, Long::sum);
            byDevice.merge(a.getDeviceId(), 1L, Long::sum);
            if (!a.isAcknowledged()) unacknowledged++;
        }
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("hours", hours);
        stats.put("total", window.size());
        stats.put("unacknowledged", unacknowledged);
        stats.put("byType", byType);
        stats.put("bySeverity", bySeverity);
        stats.put("byDevice", byDevice);
        return stats;
    }

    @Override
    public String workerName() {
        return "threshold-monitor";
    }

    @Override
    public Duration tickInterval() {
        return Duration.ofMillis(housekeepingIntervalMs);
    }

    /** Offline detection. */
    @Override
    public void tick() {
        Instant now = clock.instant();
        Map<String, Instant> offline = deviceStateCache.markOffline(now.minus(offlineAfterMinutes, ChronoUnit.MINUTES));
        offline.forEach((deviceId, lastSeen) -> raise(Alarm.builder()
                .deviceId(deviceId)
                .alarmType(DEVICE_OFFLINE)
                .severity(AlarmSeverity.WARNING)
                .message(deviceId + " offline, last seen " + lastSeen)
                .createdAt(now)
                .acknowledged(false)
                .build()));
    }

    private static void validate(SensorReading r) {
        if (r == null) throw new IllegalArgumentException("reading is required");
        if (r.getDeviceId() == null || r.getDeviceId().isBlank()) throw new IllegalArgumentException("deviceId is required");
        if (r.getSensorType() == null || r.getSensorType().isBlank()) throw new IllegalArgumentException("sensorType is required");
        if (r.getValue() == null || r.getValue().isNaN()) throw new IllegalArgumentException("value must be a number");
    }

    private static String format(double v) {
        return BigDecimal.valueOf(v).stripTrailingZeros().toPlainString();
    }
}
