package com.poc.salesingest.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ColumnMatcherTest {

    private final ColumnMatcher matcher = new ColumnMatcher();
    private final List<String> headers = List.of("Date", "Bill No", "Item Net Amt", "Net Amount");

    @Test
    void exactMatchIgnoresCaseAndSurroundingSpace() {
        assertThat(matcher.findColumn(headers, "  bill no ")).isEqualTo("Bill No");
    }

    @Test
    void exactMatchBeatsAnEarlierSubstringMatch() {
        assertThat(matcher.findColumn(headers, "net amount")).isEqualTo("Net Amount");
    }

    @Test
    void fallsBackToFirstHeaderContainingTheName() {
        assertThat(matcher.findColumn(headers, "amt")).isEqualTo("Item Net Amt");
        assertThat(matcher.findColumn(headers, "Bill")).isEqualTo("Bill No");
    }

    @Test
    void unknownOrBlankNamesDoNotMatch() {
        assertThat(matcher.findColumn(headers, "Invoice")).isEmpty();
        assertThat(matcher.findColumn(headers, "")).isEmpty();
        assertThat(matcher.findColumn(headers, null)).isEmpty();
    }
}
