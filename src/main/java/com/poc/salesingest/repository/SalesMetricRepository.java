package com.poc.salesingest.repository;

import com.poc.salesingest.entity.SalesMetric;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface SalesMetricRepository extends JpaRepository<SalesMetric, Long>, SalesMetricRepositoryCustom {

    Optional<SalesMetric> findByIdAndUserId(Long id, String userId);

    Optional<SalesMetric> findFirstByUserIdOrderByCreatedAtDescIdDesc(String userId);
}
