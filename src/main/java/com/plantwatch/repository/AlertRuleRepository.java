package com.plantwatch.repository;

import com.plantwatch.entity.AlertRule;
import com.plantwatch.entity.MeasurementKind;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AlertRuleRepository extends JpaRepository<AlertRule, UUID> {

    List<AlertRule> findByDevice_IdAndKindAndActiveTrue(UUID deviceId, MeasurementKind kind);

    List<AlertRule> findByDevice_IdOrderByCreatedAtDesc(UUID deviceId);

    List<AlertRule> findByDevice_IdAndActiveOrderByCreatedAtDesc(UUID deviceId, boolean active);

    List<AlertRule> findByActiveOrderByCreatedAtDesc(boolean active);

    List<AlertRule> findAllByOrderByCreatedAtDesc();

    /**
     * Row lock on the rule; concurrent trigger attempts for the same rule queue
     * here until the holder commits.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from AlertRule r where r.id = :id")
    Optional<AlertRule> findByIdForUpdate(@Param("id") UUID id);

    @Modifying
    @Query("delete from AlertRule r where r.device.id = :deviceId")
    int deleteByDeviceId(@Param("deviceId") UUID deviceId);
}
