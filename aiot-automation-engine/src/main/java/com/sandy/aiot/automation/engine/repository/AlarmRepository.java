package com.sandy.aiot.automation.engine.repository;

import com.sandy.aiot.automation.engine.entity.Alarm;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Repository
public interface AlarmRepository extends JpaRepository<Alarm, Long> {
    boolean existsByDeviceIdAndAlarmTypeAndMessageAndCreatedAtAfter(String deviceId, String alarmType, String message, Instant after);
    List<Alarm> findByAcknowledgedFalseOrderByCreatedAtDesc();
    List<Alarm> findTop50ByOrderByCreatedAtDesc();
    List<Alarm> findByCreatedAtAfterOrderByCreatedAtAsc(Instant after);
    List<Alarm> findByDeviceIdOrderByCreatedAtDesc(String deviceId);

    @Modifying
    @Transactional
    @Query("delete from Alarm a where a.createdAt < :cutoff")
    int deleteCreatedBefore(@Param("cutoff") Instant cutoff);
}
