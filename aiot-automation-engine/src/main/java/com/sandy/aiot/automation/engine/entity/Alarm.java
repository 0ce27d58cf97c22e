package com.sandy.aiot.automation.engine.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Threshold breach (or offline detection) for one device sensor.
 * Kept until the retention sweep removes it; operators only acknowledge.
 */
@Entity
@Table(name = "alarms", indexes = {
        @Index(name = "idx_alarm_signature", columnList = "deviceId,alarmType,createdAt"),
        @Index(name = "idx_alarm_created", columnList = "createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Alarm {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 120, nullable = false)
    private String deviceId;

    @Column(length = 64)
    private String sensorType;

    /** critical_high, critical_low, warning_high, warning_low, device_offline */
    @Column(length = 32, nullable = false)
    private String alarmType;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private AlarmSeverity severity;

    @Column(length = 500, nullable = false)
    private String message;

    /** Reading that breached the limit. */
    private Double actualValue;
    /** The limit that was breached. */
    private Double limitValue;

    private Instant createdAt;

    private boolean acknowledged;
    private Instant acknowledgedAt;
}
