package com.poc.salesingest.service;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class NumericParserTest {

    @Test
    void stripsCurrencySymbolsAndThousandsSeparators() {
        assertThat(NumericParser.parse("₹1,234.50")).contains(new BigDecimal("1234.50"));
        assertThat(NumericParser.parse(" $ 99 ")).contains(new BigDecimal("99"));
    }

    @Test
    void keepsLeadingMinus() {
        assertThat(NumericParser.parse("-42.5")).contains(new BigDecimal("-42.5"));
    }

    @Test
    void dashLikeAndEmptyCellsAreNotNumbers() {
        assertThat(NumericParser.parse("—")).isEmpty();
        assertThat(NumericParser.parse("")).isEmpty();
        assertThat(NumericParser.parse("   ")).isEmpty();
        assertThat(NumericParser.parse(null)).isEmpty();
        assertThat(NumericParser.parse("-")).isEmpty();
        assertThat(NumericParser.parse("n/a")).isEmpty();
    }

    @Test
    void malformedRemaindersAreNotNumbers() {
        assertThat(NumericParser.parse("1.2.3")).isEmpty();
        assertThat(NumericParser.parse("2024-01-05")).isEmpty();
    }
}
