package com.plantwatch.repository;

import com.plantwatch.entity.AlertTrigger;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface AlertTriggerRepository extends JpaRepository<AlertTrigger, UUID> {

    boolean existsByRule_IdAndTriggeredAtAfter(UUID ruleId, Instant since);

    List<AlertTrigger> findByRule_IdOrderByTriggeredAtDesc(UUID ruleId);

    long countByRule_Id(UUID ruleId);

    @Modifying
    @Query("delete from AlertTrigger t where t.rule.id in "
            + "(select r.id from AlertRule r where r.device.id = :deviceId)")
    int deleteByDeviceId(@Param("deviceId") UUID deviceId);
}
