package com.poc.salesingest.controller;

import com.poc.salesingest.dto.AnalysisResult;
import com.poc.salesingest.dto.ApiResponse;
import com.poc.salesingest.dto.IngestionResult;
import com.poc.salesingest.dto.Metrics;
import com.poc.salesingest.dto.MetricsPage;
import com.poc.salesingest.dto.SalesClassification;
import com.poc.salesingest.dto.SalesMetricView;
import com.poc.salesingest.dto.SalesTextRequest;
import com.poc.salesingest.exception.AnalysisException;
import com.poc.salesingest.service.SalesAnalysisService;
import com.poc.salesingest.service.SalesIngestionService;
import com.poc.salesingest.service.SalesMetricService;
import com.poc.salesingest.service.SalesTextService;
import com.poc.salesingest.service.TabularGrid;
import com.poc.salesingest.service.TabularReader;
import com.poc.salesingest.service.ai.SalesPreviewClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.Map;
import java.util.Optional;

@Slf4j
@RestController
@RequestMapping("/api/sales")
@RequiredArgsConstructor
public class SalesController {

    static final String USER_HEADER = "X-User-Id";

    private final SalesAnalysisService salesAnalysisService;
    private final SalesIngestionService salesIngestionService;
    private final SalesTextService salesTextService;
    private final SalesMetricService salesMetricService;
    private final TabularReader tabularReader;
    private final SalesPreviewClassifier classifier;

    /**
     * Multipart upload, field name "file" (.csv, .xlsx or .xls).
     */
    @PostMapping("/upload")
    public ResponseEntity<ApiResponse<?>> uploadAnalyze(@RequestHeader(USER_HEADER) String userId,
                                                        @RequestParam("file") MultipartFile file) {
        try {
            AnalysisResult result = salesAnalysisService.analyzeUpload(userId, file.getOriginalFilename(), file.getBytes());
            return ResponseEntity.ok(ApiResponse.success("File Processed Successfully", result));
        } catch (AnalysisException e) {
            log.warn("Upload '{}' rejected: {}", file.getOriginalFilename(), e.getMessage());
            return ResponseEntity.badRequest().body(rejection(e));
        } catch (Exception e) {
            log.error("Upload failed", e);
            return ResponseEntity.internalServerError().body(ApiResponse.error(e.getMessage(), "UPLOAD_FAIL"));
        }
    }

    /**
     * Like /upload, but the file need not be sales data; non-sales files are reported, not rejected.
     */
    @PostMapping("/ingest")
    public ResponseEntity<ApiResponse<?>> ingest(@RequestHeader(USER_HEADER) String userId,
                                                 @RequestParam("file") MultipartFile file) {
        try {
            IngestionResult result = salesIngestionService.ingest(userId, file.getOriginalFilename(), file.getBytes());
            return ResponseEntity.ok(ApiResponse.success("File Ingested", result));
        } catch (AnalysisException e) {
            log.warn("Ingestion of '{}' rejected: {}", file.getOriginalFilename(), e.getMessage());
            return ResponseEntity.badRequest().body(rejection(e));
        } catch (Exception e) {
            log.error("Ingestion failed", e);
            return ResponseEntity.internalServerError().body(ApiResponse.error(e.getMessage(), "INGEST_FAIL"));
        }
    }

    @PostMapping("/text")
    public ResponseEntity<ApiResponse<?>> ingestText(@RequestHeader(USER_HEADER) String userId,
                                                     @RequestBody SalesTextRequest request) {
        try {
            Metrics metrics = salesTextService.ingest(userId, request);
            return ResponseEntity.ok(ApiResponse.success("ok", Map.of("metrics", metrics)));
        } catch (Exception e) {
            log.error("Text ingestion failed", e);
            return ResponseEntity.internalServerError().body(ApiResponse.error(e.getMessage(), "TEXT_FAIL"));
        }
    }

    @PostMapping("/classify")
    public ResponseEntity<ApiResponse<?>> classify(@RequestParam("file") MultipartFile file) {
        try {
            TabularGrid grid = tabularReader.read(file.getBytes(), file.getOriginalFilename());
            Optional<SalesClassification> classification = classifier.classify(grid.preview());
            if (classification.isEmpty()) {
                return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                        .body(ApiResponse.error("classification unavailable", "CLASSIFY_FAIL"));
            }
            return ResponseEntity.ok(ApiResponse.success("ok", classification.get()));
        } catch (AnalysisException e) {
            return ResponseEntity.badRequest().body(rejection(e));
        } catch (Exception e) {
            log.error("Classification failed", e);
            return ResponseEntity.internalServerError().body(ApiResponse.error(e.getMessage(), "CLASSIFY_FAIL"));
        }
    }

    @GetMapping("/metrics")
    public ResponseEntity<ApiResponse<MetricsPage>> listMetrics(@RequestHeader(USER_HEADER) String userId,
                                                                @RequestParam(value = "limit", required = false) Integer limit,
                                                                @RequestParam(value = "offset", required = false) Integer offset) {
        return ResponseEntity.ok(ApiResponse.success("ok", salesMetricService.list(userId, limit, offset)));
    }

    @GetMapping("/metrics/latest")
    public ResponseEntity<ApiResponse<SalesMetricView>> latestMetric(@RequestHeader(USER_HEADER) String userId) {
        return salesMetricService.latest(userId)
                .map(view -> ResponseEntity.ok(ApiResponse.success("ok", view)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.error("no sales metrics", "NOT_FOUND")));
    }

    @GetMapping("/metrics/{id}")
    public ResponseEntity<ApiResponse<SalesMetricView>> getMetric(@RequestHeader(USER_HEADER) String userId,
                                                                  @PathVariable("id") Long id) {
        return salesMetricService.get(userId, id)
                .map(view -> ResponseEntity.ok(ApiResponse.success("ok", view)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.error("not found", "NOT_FOUND")));
    }

    private static ApiResponse<?> rejection(AnalysisException e) {
        if (e.getDetails().isEmpty()) {
            return ApiResponse.error(e.getMessage(), e.getErrorCode());
        }
        return ApiResponse.error(e.getMessage(), e.getErrorCode(), e.getDetails());
    }
}
