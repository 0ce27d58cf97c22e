package com.sandy.aiot.automation.engine.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One notification round sent for an escalation.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationNotice {
    private int level;
    @Column(length = 500)
    private String contacts;
    private Instant sentAt;
    /** False when at least one recipient could not be reached. */
    private boolean delivered;
}
