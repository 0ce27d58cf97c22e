package com.sandy.aiot.automation.engine.service.impl;

import com.sandy.aiot.automation.engine.entity.Alarm;
import com.sandy.aiot.automation.engine.entity.AlarmSeverity;
import com.sandy.aiot.automation.engine.entity.Escalation;
import com.sandy.aiot.automation.engine.entity.EscalationNotice;
import com.sandy.aiot.automation.engine.event.AlarmRaisedEvent;
import com.sandy.aiot.automation.engine.repository.EscalationRepository;
import com.sandy.aiot.automation.engine.service.AuditLogService;
import com.sandy.aiot.automation.engine.service.NotificationSender;
import com.sandy.aiot.automation.engine.worker.AutomationWorker;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Tracks unresolved device issues and widens the notified audience while they stay open.
 * <p>
 * Level 1 notifies the frontline, level 2 frontline, supervisor and manager, level 3 director and executive.
 * A sweep raises an issue by one level once the escalation interval has passed since its last escalation;
 * level 3 is final until an operator resolves the issue.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EscalationService implements AutomationWorker {

    private final EscalationRepository escalationRepository;
    private final NotificationSender notificationSender;
    private final AuditLogService auditLogService;
    private final Clock clock;

    @Value("${escalation.interval-minutes:30}")
    private long intervalMinutes;
    @Value("${escalation.sweep-interval-ms:30000}")
    private long sweepIntervalMs;
    @Value("${escalation.channel:email}")
    private String channel;
    @Value("${escalation.open-severities:CRITICAL}")
    private Set<AlarmSeverity> openSeverities;
    @Value("${escalation.contacts.frontline:technician}")
    private String[] frontline;
    @Value("${escalation.contacts.supervisor:supervisor}")
    private String[] supervisor;
    @Value("${escalation.contacts.manager:manager}")
    private String[] manager;
    @Value("${escalation.contacts.director:director}")
    private String[] director;
    @Value("${escalation.contacts.executive:ceo}")
    private String[] executive;

    @PostConstruct
    public void init() {
        log.info("Escalation manager initialized: intervalMinutes={} openSeverities={} channel={}", intervalMinutes, openSeverities, channel);
    }

    @EventListener
    public void onAlarmRaised(AlarmRaisedEvent event) {
        Alarm alarm = event.alarm();
        if (!openSeverities.contains(alarm.getSeverity())) return;
        try {
            open(alarm.getDeviceId(), alarm.getAlarmType(), alarm.getSeverity());
        } catch (RuntimeException e) {
            log.error("Failed to open escalation for alarm id={} error={}", alarm.getId(), e.getMessage(), e);
        }
    }

    /**
     * Opens an issue at level 1 and notifies the frontline. Returns the open issue when one already exists.
     */
    public synchronized Escalation open(String deviceId, String issueType, AlarmSeverity severity) {
        Optional<Escalation> existing = escalationRepository.findFirstByDeviceIdAndIssueTypeAndResolvedFalse(deviceId, issueType);
        if (existing.isPresent()) {
            log.debug("Escalation already open id={} deviceId={} issueType={}", existing.get().getId(), deviceId, issueType);
            return existing.get();
        }
        Instant now = clock.instant();
        Escalation escalation = Escalation.builder()
                .deviceId(deviceId)
                .issueType(issueType)
                .severity(severity)
                .level(1)
                .createdAt(now)
                .lastEscalatedAt(now)
                .resolved(false)
                .build();
        notifyLevel(escalation, now);
        Escalation saved = escalationRepository.save(escalation);
        auditLogService.record("escalation_opened", String.valueOf(saved.getId()),
                Map.of("deviceId", deviceId, "issueType", issueType, "severity", String.valueOf(severity)));
        log.warn("Escalation opened id={} deviceId={} issueType={} severity={}", saved.getId(), deviceId, issueType, severity);
        return saved;
    }

    @Override
    public String workerName() {
        return "escalation";
    }

    @Override
    public Duration tickInterval() {
        return Duration.ofMillis(sweepIntervalMs);
    }

    @Override
    public void tick() {
        sweep();
    }

    /**
     * Raises every due issue by exactly one level.
     *
     * @return number of issues escalated
     */
    public synchronized int sweep() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(Duration.ofMinutes(intervalMinutes));
        List<Escalation> due = escalationRepository.findByResolvedFalseAndLevelLessThanAndLastEscalatedAtLessThanEqual(Escalation.MAX_LEVEL, cutoff);
        int escalated = 0;
        for (Escalation e : due) {
            try {
                e.setLevel(e.getLevel() + 1);
                e.setLastEscalatedAt(now);
                notifyLevel(e, now);
                escalationRepository.save(e);
                escalated++;
                auditLogService.record("escalation_raised", String.valueOf(e.getId()), Map.of("level", e.getLevel()));
                log.warn("Escalated id={} deviceId={} issueType={} level={}", e.getId(), e.getDeviceId(), e.getIssueType(), e.getLevel());
            } catch (RuntimeException ex) {
                log.error("Escalation failed id={} error={}", e.getId(), ex.getMessage(), ex);
            }
        }
        if (escalated > 0) log.info("Escalation sweep done escalated={}", escalated);
        return escalated;
    }

    public synchronized Optional<Escalation> resolve(Long id) {
        return escalationRepository.findById(id).map(e -> {
            if (e.isResolved()) return e;
            e.setResolved(true);
            e.setResolvedAt(clock.instant());
            Escalation saved = escalationRepository.save(e);
            auditLogService.record("escalation_resolved", String.valueOf(id), Map.of("level", e.getLevel()));
            log.info("Escalation resolved id={} deviceId={} level={}", id, e.getDeviceId(), e.getLevel());
            return saved;
        });
    }

    /** Sends the current level's notification again without changing the level. */
    public synchronized Optional<Escalation> renotify(Long id) {
        return escalationRepository.findById(id).filter(e -> !e.isResolved()).map(e -> {
            notifyLevel(e, clock.instant());
            Escalation saved = escalationRepository.save(e);
            auditLogService.record("escalation_renotified", String.valueOf(id), Map.of("level", e.getLevel()));
            return saved;
        });
    }

    public Optional<Escalation> get(Long id) {
        return escalationRepository.findById(id);
    }

    public List<Escalation> open() {
        return escalationRepository.findByResolvedFalseOrderByCreatedAtDesc();
    }

    public List<Escalation> recent() {
        return escalationRepository.findTop50ByOrderByCreatedAtDesc();
    }

    public List<String> contactsForLevel(int level) {
        List<String> contacts = new ArrayList<>();
        switch (level) {
            case 1 -> contacts.addAll(List.of(frontline));
            case 2 -> {
                contacts.addAll(List.of(frontline));
                contacts.addAll(List.of(supervisor));
                contacts.addAll(List.of(manager));
            }
            default -> {
                contacts.addAll(List.of(director));
                contacts.addAll(List.of(executive));
            }
        }
        return contacts.stream().map(String::trim).filter(s -> !s.isEmpty()).distinct().toList();
    }

    private void notifyLevel(Escalation e, Instant now) {
        List<String> contacts = contactsForLevel(e.getLevel());
        String title = "ESCALATION LEVEL " + e.getLevel() + ": " + e.getDeviceId();
        String message = String.format("Device %s has an unresolved %s issue (%s) open since %s",
                e.getDeviceId(), e.getIssueType(), e.getSeverity(), e.getCreatedAt());
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("deviceId", e.getDeviceId());
        metadata.put("issueType", e.getIssueType());
        metadata.put("level", e.getLevel());
        boolean delivered;
        try {
            delivered = notificationSender.send(channel, contacts, title, message, metadata);
        } catch (RuntimeException ex) {
            log.error("Escalation notification failed deviceId={} level={} error={}", e.getDeviceId(), e.getLevel(), ex.getMessage());
            delivered = false;
        }
        e.getNotifications().add(EscalationNotice.builder()
                .level(e.getLevel())
                .contacts(String.join(",", contacts))
                .sentAt(now)
                .delivered(delivered)
                .build());
        LinkedHashSet<String> notified = new LinkedHashSet<>();
        if (e.getNotifiedContacts() != null && !e.getNotifiedContacts().isBlank()) {
            notified.addAll(Arrays.asList(e.getNotifiedContacts().split(",")));
        }
        notified.addAll(contacts);
        e.setNotifiedContacts(String.join(",", notified));
    }
}
