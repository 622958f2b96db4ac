package com.poc.salesingest.service.detection;

/**
 * One way of locating the header row and the sales / bill columns in a preview.
 */
public interface DetectionStrategy {

    /**
     * Short name used in diagnostics ("cache", "model", "heuristic").
     */
    String name();

    /**
     * Never throws; failures come back as {@link DetectionOutcome#failure(String)}.
     */
    DetectionOutcome detect(DetectionRequest request);
}
