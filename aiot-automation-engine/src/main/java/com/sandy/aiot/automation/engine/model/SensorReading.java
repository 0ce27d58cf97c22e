package com.sandy.aiot.automation.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One telemetry sample as delivered by the device transport.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SensorReading {
    private String deviceId;
    private String sensorType;
    private Double value;
    private String unit;
    /** Sample time, filled with the intake time when the transport omits it. */
    private Instant timestamp;
}
