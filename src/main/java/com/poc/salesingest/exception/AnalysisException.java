package com.poc.salesingest.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A fatal, user-facing failure of the upload analysis. The error code tells the caller which
 * stage gave up; the details hold whatever the user needs to correct the upload.
 */
@Getter
public class AnalysisException extends RuntimeException {

    public static final String FORMAT_ERROR = "FORMAT_ERROR";
    public static final String DETECTION_FAIL = "DETECTION_FAIL";
    public static final String EMPTY_HEADER = "EMPTY_HEADER";
    public static final String COLUMN_MATCH_FAIL = "COLUMN_MATCH_FAIL";

    private final String errorCode;
    private final Map<String, Object> details;

    public AnalysisException(String message, String errorCode, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details == null ? Collections.emptyMap() : Collections.unmodifiableMap(details);
    }

    public AnalysisException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = Collections.emptyMap();
    }

    public static AnalysisException formatError(String message) {
        return new AnalysisException(message, FORMAT_ERROR, (Map<String, Object>) null);
    }

    public static AnalysisException formatError(String message, Throwable cause) {
        return new AnalysisException(message, FORMAT_ERROR, cause);
    }

    public static AnalysisException detectionFailure(int attemptedHeaderRow, List<?> attempts) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("header_row", attemptedHeaderRow);
        details.put("attempts", attempts);
        return new AnalysisException("could not detect header row", DETECTION_FAIL, details);
    }

    public static AnalysisException emptyHeader(int headerRow) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("header_row", headerRow);
        return new AnalysisException("empty header row", EMPTY_HEADER, details);
    }

    public static AnalysisException matchingFailure(List<String> headers, String salesDetected, String billDetected) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("headers", headers);
        details.put("sales_detected", salesDetected);
        details.put("bill_detected", billDetected);
        return new AnalysisException("could not match detected columns", COLUMN_MATCH_FAIL, details);
    }
}
