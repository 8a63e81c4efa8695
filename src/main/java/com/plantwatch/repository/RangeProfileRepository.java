package com.plantwatch.repository;

import com.plantwatch.entity.RangeProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface RangeProfileRepository extends JpaRepository<RangeProfile, UUID> {
    boolean existsByName(String name);
}
