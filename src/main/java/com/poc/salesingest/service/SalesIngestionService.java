package com.poc.salesingest.service;

import com.poc.salesingest.dto.AnalysisResult;
import com.poc.salesingest.dto.IngestionResult;
import com.poc.salesingest.dto.SalesClassification;
import com.poc.salesingest.exception.AnalysisException;
import com.poc.salesingest.service.ai.SalesPreviewClassifier;
import com.poc.salesingest.service.detection.DetectionRequest;
import com.poc.salesingest.service.detection.DetectionResult;
import com.poc.salesingest.service.detection.DetectionStrategy;
import com.poc.salesingest.service.detection.HeaderColumnDetector;
import com.poc.salesingest.service.detection.HeuristicStrategy;
import com.poc.salesingest.service.detection.ModelAssistedStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Ingests a file whose content type is unknown: tries it as sales data with the heuristic first,
 * asks the model whether it is sales data when that fails, and reports anything else as
 * non-sales.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SalesIngestionService {

    private static final String STATUS_OK = "ok";
    private static final String STATUS_SKIPPED = "skipped";

    private final TabularReader tabularReader;
    private final HeaderColumnDetector headerColumnDetector;
    private final HeuristicStrategy heuristicStrategy;
    private final ModelAssistedStrategy modelAssistedStrategy;
    private final SalesPreviewClassifier classifier;
    private final SalesAnalysisService salesAnalysisService;
    private final SalesMetricService salesMetricService;

    public IngestionResult ingest(String userId, String fileName, byte[] content) {
        TabularGrid grid = tabularReader.read(content, fileName);
        DetectionRequest request = salesAnalysisService.newRequest(userId, grid);

        Optional<AnalysisResult> heuristic = tryPipeline(request, grid, fileName, heuristicStrategy);
        if (heuristic.isPresent()) {
            return stored(userId, fileName, heuristic.get(), "detected as sales via heuristics");
        }

        Optional<SalesClassification> classification = classifier.classify(request.getPreview());
        if (classification.isPresent() && classification.get().isSales()) {
            Optional<AnalysisResult> assisted = tryPipeline(request, grid, fileName, modelAssistedStrategy);
            if (assisted.isPresent()) {
                return stored(userId, fileName, assisted.get(), "detected as sales via model");
            }
            return new IngestionResult(IngestionResult.TYPE_KNOWLEDGE, fileName, STATUS_SKIPPED, null,
                    "classified as sales but columns could not be resolved");
        }
        return new IngestionResult(IngestionResult.TYPE_KNOWLEDGE, fileName, STATUS_SKIPPED, null,
                "not recognised as sales data");
    }

    /**
     * Runs detection with a single strategy and the rest of the pipeline. Empty when detection or
     * matching fails or no billable rows remain.
     */
    private Optional<AnalysisResult> tryPipeline(DetectionRequest request, TabularGrid grid, String fileName,
                                                 DetectionStrategy strategy) {
        try {
            DetectionResult detection = headerColumnDetector.detectUsing(List.of(strategy), request);
            AnalysisResult result = salesAnalysisService.analyze(request, grid, detection, fileName);
            if (result.getMetrics().getBillRowCount() == 0) {
                log.info("'{}' via {}: no billable rows", fileName, strategy.name());
                return Optional.empty();
            }
            return Optional.of(result);
        } catch (AnalysisException e) {
            log.info("'{}' via {}: {}", fileName, strategy.name(), e.getMessage());
            return Optional.empty();
        }
    }

    private IngestionResult stored(String userId, String fileName, AnalysisResult result, String notes) {
        salesMetricService.recordFileMetrics(userId, fileName, result.getHeaders(), result.getMetrics());
        return new IngestionResult(IngestionResult.TYPE_SALES, fileName, STATUS_OK, result.getMetrics(), notes);
    }
}
