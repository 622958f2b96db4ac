package com.poc.salesingest.service;

import com.poc.salesingest.dto.ColumnMapping;
import com.poc.salesingest.entity.ColumnMappingEntry;
import com.poc.salesingest.repository.ColumnMappingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaMappingCache implements MappingCache {

    private final ColumnMappingRepository columnMappingRepository;

    @Override
    public Optional<ColumnMapping> get(String userId, String signature) {
        return columnMappingRepository.findByUserIdAndSignature(userId, signature)
                .map(entry -> new ColumnMapping(entry.getHeaderRow(), entry.getSalesColumn(), entry.getBillColumn()));
    }

    @Override
    public void upsert(String userId, String signature, ColumnMapping mapping) {
        try {
            save(userId, signature, mapping);
        } catch (DataIntegrityViolationException e) {
            // Another request inserted the same key between our read and write
            log.debug("Concurrent insert for signature {}, retrying as update", signature);
            save(userId, signature, mapping);
        }
    }

    private void save(String userId, String signature, ColumnMapping mapping) {
        Optional<ColumnMappingEntry> existing = columnMappingRepository.findByUserIdAndSignature(userId, signature);
        ColumnMappingEntry entry = existing.orElse(new ColumnMappingEntry());
        entry.setUserId(userId);
        entry.setSignature(signature);
        entry.setHeaderRow(mapping.getHeaderRowIndex());
        entry.setSalesColumn(mapping.getSalesColumn());
        entry.setBillColumn(mapping.getBillColumn());
        columnMappingRepository.saveAndFlush(entry);
    }
}
