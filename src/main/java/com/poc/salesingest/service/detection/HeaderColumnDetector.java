package com.poc.salesingest.service.detection;

import com.poc.salesingest.dto.StrategyAttempt;
import com.poc.salesingest.exception.AnalysisException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs detection strategies in order (cache, model, heuristic) and keeps the first success.
 * Only when every strategy fails does detection fail.
 */
@Slf4j
@Service
public class HeaderColumnDetector {

    private final List<DetectionStrategy> defaultChain;

    public HeaderColumnDetector(CachedMappingStrategy cachedMappingStrategy,
                                ModelAssistedStrategy modelAssistedStrategy,
                                HeuristicStrategy heuristicStrategy) {
        this.defaultChain = List.of(cachedMappingStrategy, modelAssistedStrategy, heuristicStrategy);
    }

    public DetectionResult detect(DetectionRequest request) {
        return detectUsing(defaultChain, request);
    }

    public DetectionResult detectUsing(List<? extends DetectionStrategy> strategies, DetectionRequest request) {
        List<StrategyAttempt> attempts = new ArrayList<>();
        for (DetectionStrategy strategy : strategies) {
            DetectionOutcome outcome = strategy.detect(request);
            attempts.add(new StrategyAttempt(strategy.name(), outcome.isSuccess(), outcome.getMessage()));
            if (outcome.isSuccess()) {
                log.info("Header detection resolved by '{}': row {}, sales '{}', bill '{}'",
                        strategy.name(), outcome.getMapping().getHeaderRowIndex(),
                        outcome.getMapping().getSalesColumn(), outcome.getMapping().getBillColumn());
                return new DetectionResult(outcome.getMapping(), outcome.isUsedExternalAssist(), outcome.getMessage(), attempts);
            }
            log.warn("Header detection strategy '{}' failed: {}", strategy.name(), outcome.getMessage());
        }
        throw AnalysisException.detectionFailure(-1, attempts);
    }
}
