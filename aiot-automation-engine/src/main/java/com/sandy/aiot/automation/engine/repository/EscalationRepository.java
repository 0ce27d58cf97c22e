package com.sandy.aiot.automation.engine.repository;

import com.sandy.aiot.automation.engine.entity.Escalation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface EscalationRepository extends JpaRepository<Escalation, Long> {
    Optional<Escalation> findFirstByDeviceIdAndIssueTypeAndResolvedFalse(String deviceId, String issueType);
    List<Escalation> findByResolvedFalseAndLevelLessThanAndLastEscalatedAtLessThanEqual(int level, Instant cutoff);
    List<Escalation> findByResolvedFalseOrderByCreatedAtDesc();
    List<Escalation> findTop50ByOrderByCreatedAtDesc();
    List<Escalation> findByResolvedTrueAndCreatedAtBefore(Instant cutoff);
}
