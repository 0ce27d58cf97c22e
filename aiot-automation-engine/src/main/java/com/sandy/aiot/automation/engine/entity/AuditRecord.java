package com.sandy.aiot.automation.engine.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Append-only record of an automation event (rule fired, task run, escalation raised, operator change).
 */
@Entity
@Table(name = "audit_records", indexes = {
        @Index(name = "idx_audit_subject", columnList = "subjectId,createdAt"),
        @Index(name = "idx_audit_created", columnList = "createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 64, nullable = false)
    private String eventType;

    @Column(length = 120)
    private String subjectId;

    /** JSON encoded event details. */
    @Column(length = 4000)
    private String details;

    private Instant createdAt;
}
