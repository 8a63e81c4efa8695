package com.plantwatch.repository;

import com.plantwatch.entity.WateringSchedule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface WateringScheduleRepository extends JpaRepository<WateringSchedule, UUID> {
    Optional<WateringSchedule> findBySubject_Id(UUID subjectId);
}
