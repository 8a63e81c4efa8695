package com.plantwatch.repository;

import com.plantwatch.entity.Device;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DeviceRepository extends JpaRepository<Device, UUID> {

    @EntityGraph(attributePaths = {"deviceClass", "calibrationProfile", "rangeProfile"})
    Optional<Device> findByMacAddress(String macAddress);

    // Loads everything calibration and classification need outside a transaction
    @EntityGraph(attributePaths = {"deviceClass", "calibrationProfile", "rangeProfile"})
    @Query("select d from Device d where d.id = :id")
    Optional<Device> findWithProfilesById(@Param("id") UUID id);

    @EntityGraph(attributePaths = {"deviceClass", "calibrationProfile", "rangeProfile"})
    List<Device> findAllByOrderByCreatedAtAsc();

    List<Device> findByCalibrationProfile_Id(UUID calibrationProfileId);

    List<Device> findByRangeProfile_Id(UUID rangeProfileId);

    List<Device> findByDeviceClass_Id(UUID deviceClassId);
}
