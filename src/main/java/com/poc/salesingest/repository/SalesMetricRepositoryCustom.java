package com.poc.salesingest.repository;

import com.poc.salesingest.entity.SalesMetric;

import java.util.List;

public interface SalesMetricRepositoryCustom {
    /**
     * Newest first. The offset is a row offset, not a page number.
     */
    List<SalesMetric> findRecentByUser(String userId, int limit, int offset);
}
