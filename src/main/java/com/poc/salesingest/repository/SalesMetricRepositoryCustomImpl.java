package com.poc.salesingest.repository;

import com.poc.salesingest.entity.SalesMetric;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;

import java.util.List;

public class SalesMetricRepositoryCustomImpl implements SalesMetricRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<SalesMetric> findRecentByUser(String userId, int limit, int offset) {
        return entityManager.createQuery(
                        "select m from SalesMetric m where m.userId = :userId order by m.createdAt desc, m.id desc",
                        SalesMetric.class)
                .setParameter("userId", userId)
                .setFirstResult(offset)
                .setMaxResults(limit)
                .getResultList();
    }
}
