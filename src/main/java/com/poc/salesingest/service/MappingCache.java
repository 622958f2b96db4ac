package com.poc.salesingest.service;

import com.poc.salesingest.dto.ColumnMapping;

import java.util.Optional;

/**
 * Per-user store of confirmed column mappings, keyed by preview signature.
 */
public interface MappingCache {

    Optional<ColumnMapping> get(String userId, String signature);

    /**
     * Inserts or overwrites the mapping for this user and signature. Last writer wins.
     */
    void upsert(String userId, String signature, ColumnMapping mapping);
}
