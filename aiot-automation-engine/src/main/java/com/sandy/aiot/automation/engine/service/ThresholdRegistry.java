package com.sandy.aiot.automation.engine.service;

import com.sandy.aiot.automation.engine.exception.ConfigurationException;
import com.sandy.aiot.automation.engine.model.Threshold;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sensor limits keyed by (deviceId, sensorType).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ThresholdRegistry {

    public static final String COLLECTION = "thresholds";

    private final SnapshotPersistenceService snapshots;
    private final Map<String, Threshold> thresholds = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        for (Threshold t : snapshots.register(COLLECTION, Threshold.class, this::all)) {
            try {
                validate(t);
                thresholds.put(t.key(), t);
            } catch (ConfigurationException e) {
                log.error("Skipping stored threshold key={} error={}", t.key(), e.getMessage());
            }
        }
    }

    public Threshold put(Threshold threshold) {
        validate(threshold);
        thresholds.put(threshold.key(), threshold);
        snapshots.markDirty(COLLECTION);
        log.info("Threshold saved key={} min={} max={} criticalMin={} criticalMax={}", threshold.key(),
                threshold.getMin(), threshold.getMax(), threshold.getCriticalMin(), threshold.getCriticalMax());
        return threshold;
    }

    public boolean remove(String deviceId, String sensorType) {
        boolean removed = thresholds.remove(Threshold.key(deviceId, sensorType)) != null;
        if (removed) snapshots.markDirty(COLLECTION);
        return removed;
    }

    public Optional<Threshold> find(String deviceId, String sensorType) {
        return Optional.ofNullable(thresholds.get(Threshold.key(deviceId, sensorType)));
    }

    public List<Threshold> forDevice(String deviceId) {
        return thresholds.values().stream().filter(t -> t.getDeviceId().equals(deviceId)).toList();
    }

    public List<Threshold> all() {
        List<Threshold> list = new ArrayList<>(thresholds.values());
        list.sort(Comparator.comparing(Threshold::key));
        return list;
    }

    static void validate(Threshold t) {
        if (t == null) throw new ConfigurationException("Threshold must not be null");
        if (t.getDeviceId() == null || t.getDeviceId().isBlank()) throw new ConfigurationException("Threshold deviceId is required");
        if (t.getSensorType() == null || t.getSensorType().isBlank()) throw new ConfigurationException("Threshold sensorType is required");
        if (t.getMin() == null && t.getMax() == null && t.getCriticalMin() == null && t.getCriticalMax() == null) {
            throw new ConfigurationException("Threshold " + t.key() + " defines no bound");
        }
        if (t.getMin() != null && t.getMax() != null && t.getMin() > t.getMax()) {
            throw new ConfigurationException("Threshold " + t.key() + " has min above max");
        }
        if (t.getCriticalMin() != null && t.getCriticalMax() != null && t.getCriticalMin() > t.getCriticalMax()) {
            throw new ConfigurationException("Threshold " + t.key() + " has criticalMin above criticalMax");
        }
    }
}
