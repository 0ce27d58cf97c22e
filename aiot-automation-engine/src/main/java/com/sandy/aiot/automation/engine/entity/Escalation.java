package com.sandy.aiot.automation.engine.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Unresolved device issue whose notification tier rises every escalation interval, up to level 3.
 */
@Entity
@Table(name = "escalations", indexes = {
        @Index(name = "idx_escalation_issue", columnList = "deviceId,issueType,resolved")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Escalation {
    public static final int MAX_LEVEL = 3;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 120, nullable = false)
    private String deviceId;

    @Column(length = 64, nullable = false)
    private String issueType;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private AlarmSeverity severity;

    private int level;

    /** Every contact notified so far, comma separated, in notification order. */
    @Column(length = 1000)
    private String notifiedContacts;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "escalation_notices", joinColumns = @JoinColumn(name = "escalation_id"))
    @OrderColumn(name = "seq")
    @Builder.Default
    private List<EscalationNotice> notifications = new ArrayList<>();

    private boolean resolved;
    private Instant resolvedAt;
    private Instant createdAt;
    /** Time the current level was reached; the next escalation counts from here. */
    private Instant lastEscalatedAt;

    public boolean isTerminal() {
        return level >= MAX_LEVEL;
    }
}
