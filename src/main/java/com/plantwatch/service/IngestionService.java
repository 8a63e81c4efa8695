package com.plantwatch.service;

import com.plantwatch.dto.IngestRequest;
import com.plantwatch.dto.IngestResult;
import com.plantwatch.entity.Device;
import com.plantwatch.entity.MeasurementKind;
import com.plantwatch.entity.Reading;
import com.plantwatch.exception.TransientStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One device wake cycle: validate, resolve the device, store the batch, then
 * run the after-commit work. Not transactional itself: only a failed batch
 * write fails the request.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionService {

    private final IngestionValidator validator;
    private final DeviceIdentityResolver identityResolver;
    private final ReadingBatchWriter batchWriter;
    private final WateringEventDetector wateringEventDetector;
    private final AlertEvaluationEngine alertEvaluationEngine;
    private final TelemetryBroadcaster broadcaster;

    public IngestResult ingest(IngestRequest request) {
        ValidatedBatch batch = validator.validate(request);
        Device device = identityResolver.resolveOrCreate(batch.getMacAddress(), batch.getDeviceClass(),
                batch.getResolutionBits());

        List<Reading> saved;
        try {
            saved = batchWriter.writeAll(device, batch);
        } catch (DataAccessException | TransactionException e) {
            log.error("Storing {} readings from {} failed", batch.getEntries().size(), device.getMacAddress(), e);
            throw new TransientStoreException("Readings could not be stored, retry the batch", e);
        }
        log.debug("Stored {} readings from {}", saved.size(), device.getMacAddress());

        // Last value per kind, in batch order
        Map<MeasurementKind, Reading> latestByKind = new LinkedHashMap<>();
        for (Reading reading : saved) {
            latestByKind.put(reading.getKind(), reading);
        }

        Reading moisture = latestByKind.get(MeasurementKind.SOIL_MOISTURE);
        if (moisture != null) {
            try {
                wateringEventDetector.onMoistureReading(device, moisture);
            } catch (RuntimeException e) {
                log.warn("Watering detection for {} failed", device.getMacAddress(), e);
            }
        }

        int fired = 0;
        for (Map.Entry<MeasurementKind, Reading> entry : latestByKind.entrySet()) {
            try {
                fired += alertEvaluationEngine.evaluate(device, entry.getKey(), entry.getValue().getValue());
            } catch (RuntimeException e) {
                log.warn("Alert evaluation of {} for {} failed", entry.getKey().getCode(), device.getMacAddress(), e);
            }
        }

        broadcaster.publishReadings(device, saved);
        return new IngestResult(saved.size(), fired);
    }
}
