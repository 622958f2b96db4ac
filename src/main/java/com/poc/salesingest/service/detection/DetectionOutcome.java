package com.poc.salesingest.service.detection;

import com.poc.salesingest.dto.ColumnMapping;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * What one detection strategy concluded. Strategies return this instead of throwing, so the
 * orchestrator can move on and still report why each step failed.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class DetectionOutcome {

    private final boolean success;
    private final ColumnMapping mapping;
    private final boolean usedExternalAssist;
    private final String message;

    public static DetectionOutcome success(ColumnMapping mapping, boolean usedExternalAssist, String message) {
        return new DetectionOutcome(true, mapping, usedExternalAssist, message);
    }

    public static DetectionOutcome failure(String message) {
        return new DetectionOutcome(false, null, false, message);
    }
}
