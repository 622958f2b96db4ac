package com.poc.salesingest.repository;

import com.poc.salesingest.entity.ColumnMappingEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.Optional;

public interface ColumnMappingRepository extends JpaRepository<ColumnMappingEntry, Long> {
    Optional<ColumnMappingEntry> findByUserIdAndSignature(String userId, String signature);
}
