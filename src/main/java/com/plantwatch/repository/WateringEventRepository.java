package com.plantwatch.repository;

import com.plantwatch.entity.WateringEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface WateringEventRepository extends JpaRepository<WateringEvent, UUID> {
    List<WateringEvent> findBySubject_IdOrderByDetectedAtDesc(UUID subjectId);

    List<WateringEvent> findBySubject_Id(UUID subjectId);

    @Modifying
    @Query("update WateringEvent e set e.device = null where e.device.id = :deviceId")
    int detachDevice(@Param("deviceId") UUID deviceId);
}
