package com.plantwatch.repository;

import com.plantwatch.entity.MeasurementKind;
import com.plantwatch.entity.Reading;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Offset-based history query. Spring Data's {@code Pageable} works on page
 * numbers, so arbitrary offsets go through the entity manager directly.
 */
public interface ReadingSearchRepository {

    List<Reading> search(UUID deviceId, MeasurementKind kind, Instant from, Instant toInclusive,
                         int limit, int offset);
}
