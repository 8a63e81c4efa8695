package com.plantwatch.service;

import com.plantwatch.entity.Device;
import com.plantwatch.entity.Reading;
import com.plantwatch.repository.ReadingRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class ReadingBatchWriter {

    private final ReadingRepository readingRepository;

    /**
     * All entries of one wake cycle in one transaction; a failure on any row
     * rolls back the rest.
     */
    @Transactional
    public List<Reading> writeAll(Device device, ValidatedBatch batch) {
        List<Reading> readings = batch.getEntries().stream()
                .map(entry -> Reading.builder()
                        .device(device)
                        .kind(entry.getKind())
                        .value(entry.getValue())
                        .recordedAt(batch.getRecordedAt())
                        .build())
                .collect(Collectors.toList());
        List<Reading> saved = readingRepository.saveAll(readings);
        readingRepository.flush();
        return saved;
    }
}
