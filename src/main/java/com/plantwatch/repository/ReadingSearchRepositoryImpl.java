package com.plantwatch.repository;

import com.plantwatch.entity.MeasurementKind;
import com.plantwatch.entity.Reading;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public class ReadingSearchRepositoryImpl implements ReadingSearchRepository {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<Reading> search(UUID deviceId, MeasurementKind kind, Instant from, Instant toInclusive,
                                int limit, int offset) {
        StringBuilder jpql = new StringBuilder("select r from Reading r where r.device.id = :deviceId");
        if (kind != null) {
            jpql.append(" and r.kind = :kind");
        }
        if (from != null) {
            jpql.append(" and r.recordedAt >= :from");
        }
        if (toInclusive != null) {
            jpql.append(" and r.recordedAt <= :to");
        }
        jpql.append(" order by r.recordedAt desc");

        TypedQuery<Reading> query = entityManager.createQuery(jpql.toString(), Reading.class)
                .setParameter("deviceId", deviceId);
        if (kind != null) {
            query.setParameter("kind", kind);
        }
        if (from != null) {
            query.setParameter("from", from);
        }
        if (toInclusive != null) {
            query.setParameter("to", toInclusive);
        }
        return query.setFirstResult(offset)
                .setMaxResults(limit)
                .getResultList();
    }
}
