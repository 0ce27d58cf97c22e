package com.sandy.aiot.automation.engine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.aiot.automation.engine.entity.AuditRecord;
import com.sandy.aiot.automation.engine.repository.AuditRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only audit trail. A failed write is logged and never propagated to the automation that caused it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AuditLogService {

    private static final int MAX_DETAILS = 4000;

    private final AuditRecordRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void record(String eventType, String subjectId, Map<String, ?> details) {
        try {
            repository.save(AuditRecord.builder()
                    .eventType(eventType)
                    .subjectId(subjectId)
                    .details(encode(details))
                    .createdAt(clock.instant())
                    .build());
        } catch (RuntimeException e) {
            log.error("Audit write failed type={} subject={} error={}", eventType, subjectId, e.getMessage());
        }
    }

    public List<AuditRecord> recent() {
        return repository.findTop100ByOrderByCreatedAtDesc();
    }

    public List<AuditRecord> recent(String subjectId) {
        return repository.findTop100BySubjectIdOrderByCreatedAtDesc(subjectId);
    }

    private String encode(Map<String, ?> details) {
        if (details == null || details.isEmpty()) return null;
        String json;
        try {
            json = objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            json = String.valueOf(details);
        }
        return json.length() > MAX_DETAILS ? truncated(json) : json;
    }

    /** Oversized details are stored as a valid JSON marker carrying a prefix of the original text. */
    private String truncated(String json) {
        String preview = json.substring(0, MAX_DETAILS / 2);
        while (true) {
            Map<String, Object> marker = new LinkedHashMap<>();
            marker.put("truncated", true);
            marker.put("length", json.length());
            marker.put("preview", preview);
            try {
                String encoded = objectMapper.writeValueAsString(marker);
                if (encoded.length() <= MAX_DETAILS || preview.isEmpty()) return encoded;
            } catch (JsonProcessingException e) {
                log.warn("Audit details marker could not be encoded error={}", e.getMessage());
                return "{\"truncated\":true}";
            }
            preview = preview.substring(0, preview.length() / 2);
        }
    }
}
