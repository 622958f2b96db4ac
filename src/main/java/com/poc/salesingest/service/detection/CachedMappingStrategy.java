package com.poc.salesingest.service.detection;

import com.poc.salesingest.dto.ColumnMapping;
import com.poc.salesingest.service.MappingCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reuses the mapping stored the last time this user uploaded a file with the same preview.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CachedMappingStrategy implements DetectionStrategy {

    public static final String NAME = "cache";

    private final MappingCache mappingCache;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public DetectionOutcome detect(DetectionRequest request) {
        if (request.getSignature() == null || request.getSignature().isEmpty()) {
            return DetectionOutcome.failure("no signature");
        }
        try {
            Optional<ColumnMapping> cached = mappingCache.get(request.getUserId(), request.getSignature());
            return cached
                    .map(mapping -> DetectionOutcome.success(mapping, false, NAME))
                    .orElseGet(() -> DetectionOutcome.failure("cache miss"));
        } catch (DataAccessException e) {
            log.warn("Mapping cache lookup failed for user {}: {}", request.getUserId(), e.getMessage());
            return DetectionOutcome.failure("cache lookup error");
        }
    }
}
