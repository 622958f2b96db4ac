package com.poc.salesingest.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResult {
    /**
     * One-sentence summary of the metrics, model written when available.
     */
    private String summary;

    private Metrics metrics;

    /**
     * How the header row and the two target columns were resolved.
     */
    private DetectionMeta meta;

    /**
     * How many rows each cleaning stage removed.
     */
    private CleaningReport cleaning;

    /**
     * The resolved headers, kept for the stored payload only.
     */
    @JsonIgnore
    private List<String> headers;
}
