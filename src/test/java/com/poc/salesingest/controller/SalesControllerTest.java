package com.poc.salesingest.controller;

import com.poc.salesingest.dto.AnalysisResult;
import com.poc.salesingest.dto.CleaningReport;
import com.poc.salesingest.dto.DetectionMeta;
import com.poc.salesingest.dto.IngestionResult;
import com.poc.salesingest.dto.Metrics;
import com.poc.salesingest.dto.MetricsPage;
import com.poc.salesingest.dto.SalesMetricView;
import com.poc.salesingest.dto.SalesTextRequest;
import com.poc.salesingest.dto.StrategyAttempt;
import com.poc.salesingest.exception.AnalysisException;
import com.poc.salesingest.service.SalesAnalysisService;
import com.poc.salesingest.service.SalesIngestionService;
import com.poc.salesingest.service.SalesMetricService;
import com.poc.salesingest.service.SalesTextService;
import com.poc.salesingest.service.TabularGrid;
import com.poc.salesingest.service.TabularReader;
import com.poc.salesingest.service.ai.SalesPreviewClassifier;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SalesController.class)
class SalesControllerTest {

    private static final byte[] CSV = "Bill No,Amount\nB1,10\n".getBytes(StandardCharsets.UTF_8);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SalesAnalysisService salesAnalysisService;

    @MockBean
    private SalesIngestionService salesIngestionService;

    @MockBean
    private SalesTextService salesTextService;

    @MockBean
    private SalesMetricService salesMetricService;

    @MockBean
    private TabularReader tabularReader;

    @MockBean
    private SalesPreviewClassifier classifier;

    private static MockMultipartFile file() {
        return new MockMultipartFile("file", "march.csv", "text/csv", CSV);
    }

    @Test
    void uploadReturnsMetricsMetaAndCleaningReport() throws Exception {
        Metrics metrics = new Metrics(new BigDecimal("300.00"), 2, 2);
        DetectionMeta meta = new DetectionMeta("march.csv", 0, "Amount", "Bill No", false, "heuristic",
                List.of(new StrategyAttempt("cache", false, "cache miss"), new StrategyAttempt("heuristic", true, "heuristic")));
        AnalysisResult result = new AnalysisResult("Total sales = 300.00, bill rows = 2, unique bill IDs = 2.",
                metrics, meta, new CleaningReport(0, 1, 0, 0, 2), List.of("Date", "Bill No", "Amount"));
        when(salesAnalysisService.analyzeUpload(eq("u1"), eq("march.csv"), any())).thenReturn(result);

        mockMvc.perform(multipart("/api/sales/upload").file(file()).header("X-User-Id", "u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.metrics.bill_row_count").value(2))
                .andExpect(jsonPath("$.data.metrics.unique_bill_count").value(2))
                .andExpect(jsonPath("$.data.meta.sales_column").value("Amount"))
                .andExpect(jsonPath("$.data.meta.ai_used").value(false))
                .andExpect(jsonPath("$.data.meta.attempts[1].strategy").value("heuristic"))
                .andExpect(jsonPath("$.data.cleaning.dropped_totalish_second_col").value(1))
                .andExpect(jsonPath("$.data.cleaning.final_rows_used").value(2))
                .andExpect(jsonPath("$.data.headers").doesNotExist());
    }

    @Test
    void unmatchedColumnsAreABadRequestWithTheHeaders() throws Exception {
        when(salesAnalysisService.analyzeUpload(eq("u1"), eq("march.csv"), any()))
                .thenThrow(AnalysisException.matchingFailure(List.of("Date", "Customer"), "", ""));

        mockMvc.perform(multipart("/api/sales/upload").file(file()).header("X-User-Id", "u1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errorCode").value("COLUMN_MATCH_FAIL"))
                .andExpect(jsonPath("$.message").value("could not match detected columns"))
                .andExpect(jsonPath("$.data.headers[1]").value("Customer"));
    }

    @Test
    void formatErrorsCarryNoData() throws Exception {
        when(salesAnalysisService.analyzeUpload(eq("u1"), eq("march.csv"), any()))
                .thenThrow(AnalysisException.formatError("empty file"));

        mockMvc.perform(multipart("/api/sales/upload").file(file()).header("X-User-Id", "u1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("FORMAT_ERROR"))
                .andExpect(jsonPath("$.data").doesNotExist());
    }

    @Test
    void unexpectedFailureIsAServerError() throws Exception {
        when(salesAnalysisService.analyzeUpload(eq("u1"), eq("march.csv"), any()))
                .thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(multipart("/api/sales/upload").file(file()).header("X-User-Id", "u1"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.errorCode").value("UPLOAD_FAIL"));
    }

    @Test
    void userHeaderIsRequired() throws Exception {
        mockMvc.perform(multipart("/api/sales/upload").file(file()))
                .andExpect(status().isBadRequest());
    }

    @Test
    void ingestReportsNonSalesFiles() throws Exception {
        when(salesIngestionService.ingest(eq("u1"), eq("march.csv"), any())).thenReturn(
                new IngestionResult(IngestionResult.TYPE_KNOWLEDGE, "march.csv", "skipped", null, "not recognised as sales data"));

        mockMvc.perform(multipart("/api/sales/ingest").file(file()).header("X-User-Id", "u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.type").value("knowledge"))
                .andExpect(jsonPath("$.data.file_name").value("march.csv"))
                .andExpect(jsonPath("$.data.metrics").doesNotExist());
    }

    @Test
    void textMetricsAreWrapped() throws Exception {
        when(salesTextService.ingest(eq("u1"), any(SalesTextRequest.class)))
                .thenReturn(new Metrics(new BigDecimal("450.00"), 3, 0));

        mockMvc.perform(post("/api/sales/text")
                        .header("X-User-Id", "u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"450 from 3 bills\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.metrics.bill_row_count").value(3));
    }

    @Test
    void classificationUnavailableIs503() throws Exception {
        when(tabularReader.read(any(), eq("march.csv"))).thenReturn(TabularGrid.of(List.of(List.of("Bill No", "Amount"))));
        when(classifier.classify(anyList())).thenReturn(Optional.empty());

        mockMvc.perform(multipart("/api/sales/classify").file(file()))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.errorCode").value("CLASSIFY_FAIL"));
    }

    @Test
    void listPassesPagingThrough() throws Exception {
        when(salesMetricService.list("u1", 5, 10)).thenReturn(new MetricsPage(List.of(), 5, 10));

        mockMvc.perform(get("/api/sales/metrics").header("X-User-Id", "u1").param("limit", "5").param("offset", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.limit").value(5))
                .andExpect(jsonPath("$.data.offset").value(10));
        verify(salesMetricService).list("u1", 5, 10);
    }

    @Test
    void storedPayloadIsEmbeddedAsJson() throws Exception {
        SalesMetricView view = new SalesMetricView(7L, "file", "{\"file_name\":\"march.csv\"}",
                new BigDecimal("300.00"), 2, 2, LocalDateTime.of(2024, 3, 1, 10, 0));
        when(salesMetricService.get("u1", 7L)).thenReturn(Optional.of(view));

        mockMvc.perform(get("/api/sales/metrics/7").header("X-User-Id", "u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.id").value(7))
                .andExpect(jsonPath("$.data.payload.file_name").value("march.csv"));
    }

    @Test
    void missingMetricsAre404() throws Exception {
        when(salesMetricService.latest("u1")).thenReturn(Optional.empty());
        when(salesMetricService.get("u1", 99L)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/sales/metrics/latest").header("X-User-Id", "u1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("no sales metrics"));
        mockMvc.perform(get("/api/sales/metrics/99").header("X-User-Id", "u1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("not found"));
    }
}
