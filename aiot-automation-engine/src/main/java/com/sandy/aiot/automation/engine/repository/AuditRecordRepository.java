package com.sandy.aiot.automation.engine.repository;

import com.sandy.aiot.automation.engine.entity.AuditRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Repository
public interface AuditRecordRepository extends JpaRepository<AuditRecord, Long> {
    List<AuditRecord> findTop100BySubjectIdOrderByCreatedAtDesc(String subjectId);
    List<AuditRecord> findTop100ByOrderByCreatedAtDesc();

    @Modifying
    @Transactional
    @Query("delete from AuditRecord r where r.createdAt < :cutoff")
    int deleteCreatedBefore(@Param("cutoff") Instant cutoff);
}
