package com.poc.salesingest.service.detection;

import com.poc.salesingest.dto.ColumnMapping;
import com.poc.salesingest.dto.StrategyAttempt;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@ToString
@AllArgsConstructor
public class DetectionResult {
    private final ColumnMapping mapping;
    private final boolean usedExternalAssist;
    private final String diagnosticMessage;
    private final List<StrategyAttempt> attempts;

    public int getHeaderRowIndex() {
        return mapping.getHeaderRowIndex();
    }
}
