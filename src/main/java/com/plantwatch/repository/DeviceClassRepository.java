package com.plantwatch.repository;

import com.plantwatch.entity.DeviceClass;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface DeviceClassRepository extends JpaRepository<DeviceClass, UUID> {
    Optional<DeviceClass> findBySlug(String slug);

    boolean existsBySlug(String slug);
}
