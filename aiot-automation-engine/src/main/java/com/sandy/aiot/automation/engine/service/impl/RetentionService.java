package com.sandy.aiot.automation.engine.service.impl;

import com.sandy.aiot.automation.engine.entity.Escalation;
import com.sandy.aiot.automation.engine.repository.AlarmRepository;
import com.sandy.aiot.automation.engine.repository.AuditRecordRepository;
import com.sandy.aiot.automation.engine.repository.EscalationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deletes aged alarms, resolved escalations and audit records.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RetentionService {

    private final AlarmRepository alarmRepository;
    private final EscalationRepository escalationRepository;
    private final AuditRecordRepository auditRecordRepository;
    private final Clock clock;

    @Value("${retention.enabled:true}")
    private boolean enabled;
    @Value("${retention.alarm-days:30}")
    private int alarmDays;
    @Value("${retention.escalation-days:7}")
    private int escalationDays;
    @Value("${retention.audit-days:30}")
    private int auditDays;

    @Scheduled(fixedDelayString = "${retention.sweep-interval-ms:3600000}", initialDelayString = "${retention.initial-delay-ms:60000}")
    public void scheduledSweep() {
        if (!enabled) return;
        try { sweepOnce(); } catch (Exception e) { log.error("Scheduled retention sweep failed: {}", e.getMessage(), e); }
    }

    /**
     * @return number of removed rows per kind
     */
    public Map<String, Integer> sweepOnce() {
        Instant now = clock.instant();
        int alarms = alarmRepository.deleteCreatedBefore(now.minus(alarmDays, ChronoUnit.DAYS));
        List<Escalation> resolved = escalationRepository.findByResolvedTrueAndCreatedAtBefore(now.minus(escalationDays, ChronoUnit.DAYS));
        escalationRepository.deleteAll(resolved);
        int audits = auditRecordRepository.deleteCreatedBefore(now.minus(auditDays, ChronoUnit.DAYS));
        Map<String, Integer> removed = new LinkedHashMap<>();
        removed.put("alarms", alarms);
        removed.put("escalations", resolved.size());
        removed.put("auditRecords", audits);
        if (alarms + resolved.size() + audits > 0) {
            log.info("Retention sweep removed {}", removed);
        }
        return removed;
    }
}
