package com.poc.salesingest.service;

import com.poc.salesingest.dto.Metrics;
import com.poc.salesingest.service.ai.GenerativeModelClient;
import com.poc.salesingest.service.ai.ModelClientException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class SummaryService {

    private final GenerativeModelClient modelClient;

    /**
     * A short model-written sentence when the model is available, otherwise the plain
     * "Total sales = ..., bill rows = ..., unique bill IDs = ..." line.
     */
    public String summarize(Metrics metrics) {
        if (modelClient.isConfigured()) {
            String prompt = "Create a short, friendly one-sentence summary for a user.\n"
                    + "Facts:\n"
                    + "- Total sales = " + metrics.getTotalSales().toPlainString() + "\n"
                    + "- Bill row count = " + metrics.getBillRowCount() + "\n"
                    + "- Unique bill IDs = " + metrics.getUniqueBillCount() + "\n"
                    + "Keep it concise and neutral (no emojis).";
            try {
                String summary = modelClient.generate(prompt);
                if (!summary.isBlank()) {
                    return summary.trim();
                }
            } catch (ModelClientException e) {
                log.warn("Summary generation failed, using plain summary: {}", e.getMessage());
            }
        }
        return simpleSummary(metrics);
    }

    public static String simpleSummary(Metrics metrics) {
        return "Total sales = " + metrics.getTotalSales().toPlainString()
                + ", bill rows = " + metrics.getBillRowCount()
                + ", unique bill IDs = " + metrics.getUniqueBillCount() + ".";
    }
}
