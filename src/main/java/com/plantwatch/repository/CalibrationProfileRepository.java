package com.plantwatch.repository;

import com.plantwatch.entity.CalibrationProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface CalibrationProfileRepository extends JpaRepository<CalibrationProfile, UUID> {
    boolean existsByName(String name);

    boolean existsByNameAndIdNot(String name, UUID id);
}
