package com.poc.salesingest.service.detection;

import com.poc.salesingest.dto.ColumnMapping;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HeuristicStrategyTest {

    private final HeuristicStrategy strategy = new HeuristicStrategy();

    private static DetectionRequest request(List<List<String>> preview) {
        return new DetectionRequest("u1", "sig", preview);
    }

    @Test
    void findsHeaderBelowTitleAndNumericRows() {
        List<List<String>> preview = List.of(
                List.of("", "", ""),
                List.of("2024", "01", "15"),
                List.of("Date", "Bill No", "Amount"),
                List.of("1/1", "B1", "100"));

        DetectionOutcome outcome = strategy.detect(request(preview));

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.isUsedExternalAssist()).isFalse();
        assertThat(outcome.getMessage()).isEqualTo("heuristic");
        assertThat(outcome.getMapping()).isEqualTo(new ColumnMapping(2, "Amount", "Bill No"));
    }

    @Test
    void earlierRowKeepsTieOnAlphaRatio() {
        List<List<String>> preview = List.of(
                List.of("Store Report", "Jan"),
                List.of("Bill", "Sales"));

        assertThat(HeuristicStrategy.findHeaderRow(preview)).isZero();
    }

    @Test
    void laterRowWithHigherRatioWins() {
        List<List<String>> preview = List.of(
                List.of("Report", "2024"),
                List.of("Invoice No", "Net Amount"));

        assertThat(HeuristicStrategy.findHeaderRow(preview)).isEqualTo(1);
    }

    @Test
    void defaultsToRowZeroWhenNothingLooksLikeAHeader() {
        List<List<String>> preview = List.of(
                List.of("1", "2"),
                List.of("3", "4"));

        assertThat(HeuristicStrategy.findHeaderRow(preview)).isZero();
    }

    @Test
    void onlyTheFirstFiveRowsAreScanned() {
        List<List<String>> rows = List.of(
                List.of("1", "2"),
                List.of("3", "4"),
                List.of("5", "6"),
                List.of("7", "8"),
                List.of("9", "10"),
                List.of("Bill", "Amount"));

        assertThat(HeuristicStrategy.findHeaderRow(rows)).isZero();
    }

    @Test
    void lettersOutsideAsciiCount() {
        List<List<String>> preview = List.of(
                List.of("1", "2"),
                List.of("Número", "Importe"));

        assertThat(HeuristicStrategy.findHeaderRow(preview)).isEqualTo(1);
    }

    @Test
    void exactKeywordBeatsSubstring() {
        List<String> headers = List.of("Total Amount", "Amt");

        assertThat(HeuristicStrategy.pickColumn(headers, HeuristicStrategy.SALES_KEYWORDS)).isEqualTo("Amt");
    }

    @Test
    void exactMatchIgnoresCase() {
        List<String> headers = List.of("Date", "BILL NO", "AMT");

        assertThat(HeuristicStrategy.pickColumn(headers, HeuristicStrategy.BILL_KEYWORDS)).isEqualTo("BILL NO");
        assertThat(HeuristicStrategy.pickColumn(headers, HeuristicStrategy.SALES_KEYWORDS)).isEqualTo("AMT");
    }

    @Test
    void substringMatchFollowsKeywordOrder() {
        List<String> headers = List.of("Voucher Ref", "Invoice Id", "Item Net Amt");

        assertThat(HeuristicStrategy.pickColumn(headers, HeuristicStrategy.BILL_KEYWORDS)).isEqualTo("Invoice Id");
        assertThat(HeuristicStrategy.pickColumn(headers, HeuristicStrategy.SALES_KEYWORDS)).isEqualTo("Item Net Amt");
    }

    @Test
    void unmatchedColumnsComeBackEmpty() {
        DetectionOutcome outcome = strategy.detect(request(List.of(List.of("Date", "Customer"))));

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getMapping().getSalesColumn()).isEmpty();
        assertThat(outcome.getMapping().getBillColumn()).isEmpty();
    }

    @Test
    void emptyPreviewFails() {
        DetectionOutcome outcome = strategy.detect(request(Collections.emptyList()));

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getMessage()).isEqualTo("no rows to inspect");
    }
}
