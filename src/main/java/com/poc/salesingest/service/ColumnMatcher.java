package com.poc.salesingest.service;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Resolves a proposed column name (from the cache, the model or the heuristic) to a real header.
 */
@Component
public class ColumnMatcher {

    /**
     * Exact case-insensitive match on trimmed text first, then the first header containing the
     * proposed name. Returns "" when nothing matches or the proposal is blank.
     */
    public String findColumn(List<String> headers, String proposed) {
        String target = proposed == null ? "" : proposed.trim().toLowerCase(Locale.ROOT);
        if (target.isEmpty()) {
            return "";
        }
        for (String header : headers) {
            if (header.trim().toLowerCase(Locale.ROOT).equals(target)) {
                return header;
            }
        }
        for (String header : headers) {
            if (header.toLowerCase(Locale.ROOT).contains(target)) {
                return header;
            }
        }
        return "";
    }
}
