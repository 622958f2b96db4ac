package com.poc.salesingest.service;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Lenient amount parsing for exported sales cells such as "₹1,234.50" or "(USD) 99".
 */
public final class NumericParser {

    private NumericParser() {
    }

    /**
     * Keeps ASCII digits, '.' and '-' and parses what is left. Empty when nothing numeric remains
     * or the remainder is not a valid number (e.g. "1.2.3", "5-3").
     */
    public static Optional<BigDecimal> parse(String text) {
        if (text == null) return Optional.empty();
        String t = text.trim();
        if (t.isEmpty()) {
            return Optional.empty();
        }
        StringBuilder cleaned = new StringBuilder(t.length());
        for (int i = 0; i < t.length(); i++) {
            char ch = t.charAt(i);
            if ((ch >= '0' && ch <= '9') || ch == '.' || ch == '-') {
                cleaned.append(ch);
            }
        }
        if (cleaned.length() == 0) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(cleaned.toString()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public static boolean isNumeric(String text) {
        return parse(text).isPresent();
    }
}
