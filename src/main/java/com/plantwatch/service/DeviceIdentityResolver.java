package com.plantwatch.service;

import com.plantwatch.entity.Device;
import com.plantwatch.entity.DeviceClass;
import com.plantwatch.entity.Resolution;
import com.plantwatch.exception.NotFoundException;
import com.plantwatch.exception.TransientStoreException;
import com.plantwatch.exception.ValidationException;
import com.plantwatch.repository.DeviceClassRepository;
import com.plantwatch.repository.DeviceRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps a hardware address to its device row, creating the row on first
 * contact. The unique constraint on the address decides which of several
 * concurrent first contacts wins; the losers read the winner's row.
 */
@Service
@Slf4j
public class DeviceIdentityResolver {

    private static final Pattern CANONICAL = Pattern.compile("^[0-9A-F]{12}$");
    private static final Pattern SEPARATORS = Pattern.compile("[:\\-.\\s]");

    private final DeviceRepository deviceRepository;
    private final DeviceClassRepository deviceClassRepository;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate insertTemplate;
    private final Clock clock;

    public DeviceIdentityResolver(DeviceRepository deviceRepository,
                                  DeviceClassRepository deviceClassRepository,
                                  PlatformTransactionManager transactionManager,
                                  Clock clock) {
        this.deviceRepository = deviceRepository;
        this.deviceClassRepository = deviceClassRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.insertTemplate = new TransactionTemplate(transactionManager);
        this.insertTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    /**
     * Strips separators and upper-cases; empty when the result is not twelve
     * hex digits.
     */
    public static Optional<String> canonicalize(String address) {
        if (address == null) {
            return Optional.empty();
        }
        String mac = SEPARATORS.matcher(address).replaceAll("").toUpperCase();
        return CANONICAL.matcher(mac).matches() ? Optional.of(mac) : Optional.empty();
    }

    public Device resolveOrCreate(String address, String deviceClassSlug, Integer resolutionBits) {
        String mac = canonicalize(address).orElseThrow(() -> new ValidationException(
                List.of("body", "deviceAddress"),
                "deviceAddress must be 12 hex digits, optionally separated by ':', '-' or '.'",
                "value_error.address"));
        if (resolutionBits != null && Resolution.fromBits(resolutionBits).isEmpty()) {
            throw new ValidationException(List.of("body", "resolutionBits"),
                    "resolutionBits must be 10 or 12", "value_error.resolution");
        }

        try {
            Device device = deviceRepository.findByMacAddress(mac).orElseGet(() -> createOrFetch(mac));
            return touch(device, deviceClassSlug, resolutionBits);
        } catch (DataAccessException | TransactionException e) {
            log.error("Resolving device {} failed", mac, e);
            throw new TransientStoreException("Device " + mac + " could not be resolved, retry the batch", e);
        }
    }

    private Device createOrFetch(String mac) {
        try {
            Device created = insertTemplate.execute(status -> deviceRepository.saveAndFlush(
                    Device.builder().macAddress(mac).lastSeenAt(clock.instant()).build()));
            log.info("Provisioned new device {}", mac);
            return created;
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            log.debug("Device {} was created concurrently, using existing row", mac);
            return deviceRepository.findByMacAddress(mac)
                    .orElseThrow(() -> new TransientStoreException("Device " + mac + " could not be created", e));
        }
    }

    private Device touch(Device device, String deviceClassSlug, Integer resolutionBits) {
        return transactionTemplate.execute(status -> {
            Device managed = deviceRepository.findWithProfilesById(device.getId())
                    .orElseThrow(() -> NotFoundException.of("Device", device.getMacAddress()));
            managed.setLastSeenAt(clock.instant());

            if (deviceClassSlug != null && !deviceClassSlug.isBlank()) {
                Optional<DeviceClass> deviceClass = deviceClassRepository.findBySlug(deviceClassSlug.trim());
                if (deviceClass.isPresent()) {
                    managed.setDeviceClass(deviceClass.get());
                    if (resolutionBits == null) {
                        managed.setResolutionBits(deviceClass.get().getResolutionBits());
                    }
                } else {
                    log.info("Device {} reported unknown class '{}', ignoring", managed.getMacAddress(), deviceClassSlug);
                }
            }
            if (resolutionBits != null) {
                managed.setResolutionBits(resolutionBits);
            }
            return deviceRepository.save(managed);
        });
    }
}
