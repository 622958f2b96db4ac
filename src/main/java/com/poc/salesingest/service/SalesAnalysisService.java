package com.poc.salesingest.service;

import com.poc.salesingest.dto.AnalysisResult;
import com.poc.salesingest.dto.ColumnMapping;
import com.poc.salesingest.dto.DetectionMeta;
import com.poc.salesingest.dto.Metrics;
import com.poc.salesingest.dto.RowData;
import com.poc.salesingest.exception.AnalysisException;
import com.poc.salesingest.service.cleaning.CleaningResult;
import com.poc.salesingest.service.cleaning.RowCleaningPipeline;
import com.poc.salesingest.service.detection.DetectionRequest;
import com.poc.salesingest.service.detection.DetectionResult;
import com.poc.salesingest.service.detection.HeaderColumnDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Upload analysis end to end: read, detect the header and target columns, clean the rows,
 * aggregate, summarise and store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SalesAnalysisService {

    private final TabularReader tabularReader;
    private final PreviewSignatureService signatureService;
    private final HeaderColumnDetector headerColumnDetector;
    private final ColumnMatcher columnMatcher;
    private final MappingCache mappingCache;
    private final RowCleaningPipeline cleaningPipeline;
    private final MetricsAggregator metricsAggregator;
    private final SummaryService summaryService;
    private final SalesMetricService salesMetricService;

    public AnalysisResult analyzeUpload(String userId, String fileName, byte[] content) {
        // 1. Read the grid
        TabularGrid grid = tabularReader.read(content, fileName);

        // 2. Detect header + columns on the preview: cache -> model -> heuristic
        DetectionRequest request = newRequest(userId, grid);
        DetectionResult detection = headerColumnDetector.detect(request);

        // 3. Match, clean, aggregate
        AnalysisResult result = analyze(request, grid, detection, fileName);

        // 4. Summary + persistence
        result.setSummary(summaryService.summarize(result.getMetrics()));
        salesMetricService.recordFileMetrics(userId, fileName, result.getHeaders(), result.getMetrics());

        log.info("Upload '{}' analysed: total {}, {} bill rows, {} unique bills",
                fileName, result.getMetrics().getTotalSales(), result.getMetrics().getBillRowCount(),
                result.getMetrics().getUniqueBillCount());
        return result;
    }

    public DetectionRequest newRequest(String userId, TabularGrid grid) {
        List<List<String>> preview = grid.preview();
        return new DetectionRequest(userId, signatureService.signatureFor(preview), preview);
    }

    /**
     * Everything after detection. Throws {@link AnalysisException} when the header row is empty or
     * the detected names do not resolve to real headers; otherwise caches the mapping.
     */
    public AnalysisResult analyze(DetectionRequest request, TabularGrid grid, DetectionResult detection, String fileName) {
        int headerIdx = detection.getHeaderRowIndex();
        List<String> headers = grid.headersAt(headerIdx);
        if (headers.isEmpty()) {
            throw AnalysisException.emptyHeader(headerIdx);
        }

        String salesText = detection.getMapping().getSalesColumn();
        String billText = detection.getMapping().getBillColumn();
        String salesCol = columnMatcher.findColumn(headers, salesText);
        String billCol = columnMatcher.findColumn(headers, billText);
        if (salesCol.isEmpty() || billCol.isEmpty()) {
            log.warn("Detected columns did not match headers {}: sales '{}', bill '{}'", headers, salesText, billText);
            throw AnalysisException.matchingFailure(headers, salesText, billText);
        }

        rememberMapping(request, new ColumnMapping(headerIdx, salesCol, billCol));

        List<RowData> records = RowCleaningPipeline.buildRecords(grid, headerIdx, headers);
        CleaningResult cleaning = cleaningPipeline.clean(records, headers, salesCol, billCol);
        Metrics metrics = metricsAggregator.aggregate(cleaning.getFinalRows(), salesCol, billCol);

        DetectionMeta meta = new DetectionMeta(fileName, headerIdx, salesCol, billCol,
                detection.isUsedExternalAssist(), detection.getDiagnosticMessage(), detection.getAttempts());
        return new AnalysisResult(null, metrics, meta, cleaning.toReport(), headers);
    }

    private void rememberMapping(DetectionRequest request, ColumnMapping mapping) {
        try {
            mappingCache.upsert(request.getUserId(), request.getSignature(), mapping);
        } catch (DataAccessException e) {
            log.warn("Could not cache column mapping for user {}: {}", request.getUserId(), e.getMessage());
        }
    }
}
