package com.sandy.aiot.automation.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Limits for one sensor of one device. Any bound may be left null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Threshold {
    private String deviceId;
    private String sensorType;
    private Double min;
    private Double max;
    private Double criticalMin;
    private Double criticalMax;

    public String key() {
        return key(deviceId, sensorType);
    }

    public static String key(String deviceId, String sensorType) {
        return deviceId + ":" + sensorType;
    }
}
