package com.plantwatch.repository;

import com.plantwatch.entity.MeasurementKind;
import com.plantwatch.entity.Reading;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ReadingRepository extends JpaRepository<Reading, UUID>, ReadingSearchRepository {

    Optional<Reading> findFirstByDevice_IdAndKindAndRecordedAtBeforeOrderByRecordedAtDesc(
            UUID deviceId, MeasurementKind kind, Instant before);

    Optional<Reading> findFirstByDevice_IdAndKindOrderByRecordedAtDesc(UUID deviceId, MeasurementKind kind);

    // Half-open window [from, to)
    @Query("select r from Reading r where r.device.id = :deviceId and r.kind = :kind "
            + "and r.recordedAt >= :from and r.recordedAt < :to order by r.recordedAt asc")
    List<Reading> findWindow(@Param("deviceId") UUID deviceId,
                             @Param("kind") MeasurementKind kind,
                             @Param("from") Instant from,
                             @Param("to") Instant to);

    @Query("select distinct r.kind from Reading r where r.device.id = :deviceId")
    List<MeasurementKind> findDistinctKindsByDeviceId(@Param("deviceId") UUID deviceId);

    @Modifying
    @Query("delete from Reading r where r.device.id = :deviceId")
    int deleteByDeviceId(@Param("deviceId") UUID deviceId);
}
