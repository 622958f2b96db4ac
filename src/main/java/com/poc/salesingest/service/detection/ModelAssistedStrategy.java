package com.poc.salesingest.service.detection;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.poc.salesingest.dto.ColumnMapping;
import com.poc.salesingest.service.ai.GenerativeModelClient;
import com.poc.salesingest.service.ai.ModelClientException;
import com.poc.salesingest.service.ai.ModelPayloads;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Lets the language model pick the header row and the two target columns from the preview.
 * The answer must be a bare JSON object; anything else is a failure and the caller falls back.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelAssistedStrategy implements DetectionStrategy {

    public static final String NAME = "model";

    static final String NOT_CONFIGURED = "model assist not configured";
    static final String REQUEST_FAILED = "model request failed";
    static final String EMPTY = "model returned empty";
    static final String PARSE_ERROR = "model JSON parse error";
    static final String INCOMPLETE = "model response incomplete";

    private final GenerativeModelClient modelClient;
    private final ObjectMapper mapper = new ObjectMapper();

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class HeaderAnswer {
        @JsonProperty("header_row_index")
        private Integer headerRowIndex;

        @JsonProperty("sales_column")
        private String salesColumn;

        @JsonProperty("bill_column")
        private String billColumn;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public DetectionOutcome detect(DetectionRequest request) {
        if (!modelClient.isConfigured()) {
            return DetectionOutcome.failure(NOT_CONFIGURED);
        }

        String text;
        try {
            text = modelClient.generate(buildPrompt(request));
        } catch (ModelClientException e) {
            log.warn("Header detection request failed: {}", e.getMessage());
            return DetectionOutcome.failure(REQUEST_FAILED);
        }
        if (text == null || text.isBlank()) {
            return DetectionOutcome.failure(EMPTY);
        }

        HeaderAnswer answer;
        try {
            answer = mapper.readValue(ModelPayloads.stripFences(text), HeaderAnswer.class);
        } catch (JsonProcessingException e) {
            log.warn("Header detection answer is not JSON: {}", e.getOriginalMessage());
            return DetectionOutcome.failure(PARSE_ERROR);
        }

        if (answer == null) {
            return DetectionOutcome.failure(PARSE_ERROR);
        }
        Integer index = answer.getHeaderRowIndex();
        String sales = answer.getSalesColumn() == null ? "" : answer.getSalesColumn().trim();
        String bill = answer.getBillColumn() == null ? "" : answer.getBillColumn().trim();
        if (index == null || index < 0 || index >= request.getPreview().size() || sales.isEmpty() || bill.isEmpty()) {
            return DetectionOutcome.failure(INCOMPLETE);
        }
        return DetectionOutcome.success(new ColumnMapping(index, sales, bill), true, "ok");
    }

    private String buildPrompt(DetectionRequest request) {
        return "You are a data understanding AI.\n\n"
                + "Given the first 5 rows of a tabular file, identify:\n"
                + "1) Which row (0-based index) is most likely the header (column names).\n"
                + "2) The exact column name that represents \"Sales\" or \"Amount\".\n"
                + "3) The exact column name that represents \"Bill\" or \"Invoice\".\n\n"
                + "Important:\n"
                + "- Return STRICT JSON only, no commentary, no markdown fences.\n"
                + "- Use keys exactly: header_row_index, sales_column, bill_column.\n\n"
                + "Example format:\n"
                + "{\"header_row_index\": 0, \"sales_column\": \"Item Net Amt\", \"bill_column\": \"Bill No\"}\n\n"
                + "Here are the first 5 rows (Pandas JSON with orient='split'):\n"
                + ModelPayloads.previewAsSplitJson(request.getPreview());
    }
}
