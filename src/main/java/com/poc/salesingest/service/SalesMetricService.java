package com.poc.salesingest.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.poc.salesingest.dto.Metrics;
import com.poc.salesingest.dto.MetricsPage;
import com.poc.salesingest.dto.SalesMetricView;
import com.poc.salesingest.entity.SalesMetric;
import com.poc.salesingest.repository.SalesMetricRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Stores the metrics of each ingestion and serves them back per user.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SalesMetricService {

    static final int DEFAULT_LIMIT = 20;
    static final int MAX_LIMIT = 100;

    private final SalesMetricRepository salesMetricRepository;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Transactional
    public SalesMetric recordFileMetrics(String userId, String fileName, List<String> headers, Metrics metrics) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("file_name", fileName);
        payload.put("headers", headers);
        return save(userId, SalesMetric.SOURCE_FILE, payload, metrics);
    }

    @Transactional
    public SalesMetric recordTextMetrics(String userId, String rawText, Metrics metrics) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("source", "text");
        payload.put("raw_text", rawText);
        return save(userId, SalesMetric.SOURCE_TEXT, payload, metrics);
    }

    @Transactional(readOnly = true)
    public MetricsPage list(String userId, Integer limit, Integer offset) {
        int l = limit == null || limit <= 0 || limit > MAX_LIMIT ? DEFAULT_LIMIT : limit;
        int o = offset == null || offset < 0 ? 0 : offset;
        List<SalesMetricView> items = salesMetricRepository.findRecentByUser(userId, l, o).stream()
                .map(SalesMetricService::toView)
                .collect(Collectors.toList());
        return new MetricsPage(items, l, o);
    }

    @Transactional(readOnly = true)
    public Optional<SalesMetricView> get(String userId, Long id) {
        return salesMetricRepository.findByIdAndUserId(id, userId).map(SalesMetricService::toView);
    }

    @Transactional(readOnly = true)
    public Optional<SalesMetricView> latest(String userId) {
        return salesMetricRepository.findFirstByUserIdOrderByCreatedAtDescIdDesc(userId).map(SalesMetricService::toView);
    }

    private SalesMetric save(String userId, String sourceType, Map<String, Object> payload, Metrics metrics) {
        SalesMetric metric = new SalesMetric();
        metric.setUserId(userId);
        metric.setSourceType(sourceType);
        metric.setPayload(toJson(payload));
        metric.setTotalSales(metrics.getTotalSales());
        metric.setBillRowCount(metrics.getBillRowCount());
        metric.setUniqueBillCount(metrics.getUniqueBillCount());
        SalesMetric saved = salesMetricRepository.save(metric);
        log.info("Stored {} sales metrics #{} for user {}", sourceType, saved.getId(), userId);
        return saved;
    }

    private String toJson(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Payload serialisation failed", e);
        }
    }

    private static SalesMetricView toView(SalesMetric m) {
        return new SalesMetricView(m.getId(), m.getSourceType(), m.getPayload(), m.getTotalSales(),
                m.getBillRowCount(), m.getUniqueBillCount(), m.getCreatedAt());
    }
}
