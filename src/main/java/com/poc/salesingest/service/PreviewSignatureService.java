package com.poc.salesingest.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Fingerprints the first rows of an upload so a layout seen before can reuse its column mapping.
 * The signature is a cache key only.
 */
@Service
public class PreviewSignatureService {

    private final ObjectMapper objectMapper = new ObjectMapper();

    public String signatureFor(List<List<String>> preview) {
        try {
            return DigestUtils.sha256Hex(objectMapper.writeValueAsString(preview));
        } catch (JsonProcessingException e) {
            // A list of strings always serialises
            throw new IllegalStateException("Preview serialisation failed", e);
        }
    }
}
