package com.poc.salesingest.service.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.poc.salesingest.dto.SalesClassification;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Asks the model whether a table preview looks like sales data (an amount column plus a
 * bill/invoice column). Empty when the model is unavailable or answers unusably.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SalesPreviewClassifier {

    private final GenerativeModelClient modelClient;
    private final ObjectMapper mapper = new ObjectMapper();

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ClassificationAnswer {
        @JsonProperty("is_sales")
        private boolean sales;
        private double confidence;
    }

    public Optional<SalesClassification> classify(List<List<String>> preview) {
        if (!modelClient.isConfigured()) {
            return Optional.empty();
        }
        String prompt = "Classify if the table is sales data.\n"
                + "Return strict JSON {\"is_sales\":true|false,\"confidence\":0..1}.\n"
                + "Sales data typically has a money/amount column and a bill/invoice/ref column.\n"
                + "Preview (orient='split'):\n" + ModelPayloads.previewAsSplitJson(preview);
        try {
            String text = modelClient.generate(prompt);
            if (text == null || text.isBlank()) {
                log.warn("Sales classification returned empty");
                return Optional.empty();
            }
            ClassificationAnswer answer = mapper.readValue(ModelPayloads.stripFences(text), ClassificationAnswer.class);
            if (answer == null) {
                return Optional.empty();
            }
            return Optional.of(new SalesClassification(answer.isSales(), answer.getConfidence()));
        } catch (ModelClientException e) {
            log.warn("Sales classification failed: {}", e.getMessage());
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("Sales classification JSON parse error: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
