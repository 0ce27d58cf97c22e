package com.sandy.aiot.automation.engine.service;

import com.sandy.aiot.automation.engine.entity.Alarm;
import com.sandy.aiot.automation.engine.model.SensorReading;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live per-device property map fed by telemetry, alarms and commands.
 * <p>
 * Keys: {@code deviceId}, {@code online}, {@code lastSeen}, one key per sensor type holding the latest value,
 * {@code <sensorType>_unit}, {@code last_alarm_type}, {@code last_alarm_severity}, {@code last_command}.
 */
@Service
@Slf4j
public class DeviceStateCache {

    public static final String DEVICE_ID = "deviceId";
    public static final String ONLINE = "online";
    public static final String LAST_SEEN = "lastSeen";
    public static final String LAST_ALARM_TYPE = "last_alarm_type";
    public static final String LAST_ALARM_SEVERITY = "last_alarm_severity";
    public static final String LAST_COMMAND = "last_command";

    private final Map<String, Map<String, Object>> devices = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastSeen = new ConcurrentHashMap<>();

    public void recordReading(SensorReading reading) {
        Map<String, Object> state = state(reading.getDeviceId());
        state.put(reading.getSensorType(), reading.getValue());
        if (reading.getUnit() != null) state.put(reading.getSensorType() + "_unit", reading.getUnit());
        Instant at = reading.getTimestamp();
        lastSeen.merge(reading.getDeviceId(), at, (a, b) -> b.isAfter(a) ? b : a);
        state.put(LAST_SEEN, lastSeen.get(reading.getDeviceId()).toString());
        state.put(ONLINE, true);
    }

    public void recordAlarm(Alarm alarm) {
        Map<String, Object> state = state(alarm.getDeviceId());
        state.put(LAST_ALARM_TYPE, alarm.getAlarmType());
        state.put(LAST_ALARM_SEVERITY, alarm.getSeverity().name());
    }

    public void recordCommand(String deviceId, String command) {
        if (deviceId == null || command == null) return;
        state(deviceId).put(LAST_COMMAND, command);
    }

    /** Direct state update, e.g. a device reporting a switch position. Null removes the property. */
    public void updateProperty(String deviceId, String property, Object value) {
        Map<String, Object> state = state(deviceId);
        if (value == null) {
            state.remove(property);
        } else {
            state.put(property, value);
        }
    }

    public Optional<Object> property(String deviceId, String property) {
        if (deviceId == null || property == null) return Optional.empty();
        Map<String, Object> state = devices.get(deviceId);
        return state == null ? Optional.empty() : Optional.ofNullable(state.get(property));
    }

    public Map<String, Object> device(String deviceId) {
        Map<String, Object> state = devices.get(deviceId);
        return state == null ? Map.of() : new TreeMap<>(state);
    }

    public boolean isOnline(String deviceId) {
        return Boolean.TRUE.equals(property(deviceId, ONLINE).orElse(false));
    }

    public Set<String> deviceIds() {
        return new TreeSet<>(devices.keySet());
    }

    /**
     * Flags devices whose last reading is older than the cutoff.
     *
     * @return devices that went from online to offline in this call, with their last seen time
     */
    public Map<String, Instant> markOffline(Instant cutoff) {
        Map<String, Instant> changed = new LinkedHashMap<>();
        lastSeen.forEach((deviceId, seen) -> {
            if (!seen.isBefore(cutoff)) return;
            Map<String, Object> state = state(deviceId);
            if (Boolean.TRUE.equals(state.put(ONLINE, false))) {
                changed.put(deviceId, seen);
            }
        });
        if (!changed.isEmpty()) log.info("Devices went offline: {}", changed.keySet());
        return changed;
    }

    private Map<String, Object> state(String deviceId) {
        return devices.computeIfAbsent(deviceId, id -> {
            Map<String, Object> m = new ConcurrentHashMap<>();
            m.put(DEVICE_ID, id);
            return m;
        });
    }
}
