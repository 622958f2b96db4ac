package com.poc.salesingest.service.detection;

import com.poc.salesingest.dto.ColumnMapping;
import com.poc.salesingest.service.TabularGrid;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Picks the header as the first preview row that is mostly text, then looks for well-known
 * sales and bill column names in it.
 */
@Component
public class HeuristicStrategy implements DetectionStrategy {

    public static final String NAME = "heuristic";

    static final double MIN_ALPHA_RATIO = 0.5;

    /** Earlier entries win. */
    static final List<String> SALES_KEYWORDS = List.of(
            "sales", "amount", "amt", "net amt", "net amount", "total", "grand total",
            "invoice amount", "subtotal", "item net amt");

    /** Earlier entries win. */
    static final List<String> BILL_KEYWORDS = List.of(
            "bill", "bill no", "bill number", "invoice", "invoice no", "invoice number",
            "inv", "ref no", "reference", "voucher", "receipt");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public DetectionOutcome detect(DetectionRequest request) {
        List<List<String>> preview = request.getPreview();
        if (preview == null || preview.isEmpty()) {
            return DetectionOutcome.failure("no rows to inspect");
        }

        int headerIdx = findHeaderRow(preview);
        List<String> headers = TabularGrid.of(preview).headersAt(headerIdx);
        String sales = pickColumn(headers, SALES_KEYWORDS);
        String bill = pickColumn(headers, BILL_KEYWORDS);
        return DetectionOutcome.success(new ColumnMapping(headerIdx, sales, bill), false, NAME);
    }

    /**
     * First row (of at most {@value TabularGrid#PREVIEW_ROWS}) whose share of cells containing a letter is
     * at least one half and strictly above every earlier candidate; row 0 if none qualifies.
     */
    static int findHeaderRow(List<List<String>> rows) {
        int headerIdx = -1;
        double bestScore = -1.0;
        int limit = Math.min(rows.size(), TabularGrid.PREVIEW_ROWS);
        for (int i = 0; i < limit; i++) {
            int nonEmpty = 0;
            int alpha = 0;
            for (String value : rows.get(i)) {
                String t = value == null ? "" : value.trim();
                if (t.isEmpty()) {
                    continue;
                }
                nonEmpty++;
                if (hasLetter(t)) {
                    alpha++;
                }
            }
            if (nonEmpty == 0) {
                continue;
            }
            double score = (double) alpha / nonEmpty;
            if (score >= MIN_ALPHA_RATIO && score > bestScore) {
                bestScore = score;
                headerIdx = i;
            }
        }
        return headerIdx == -1 ? 0 : headerIdx;
    }

    /**
     * Exact case-insensitive name match over the whole keyword list first, then substring match.
     * Returns "" when nothing matches.
     */
    static String pickColumn(List<String> headers, List<String> keywords) {
        for (String keyword : keywords) {
            for (String header : headers) {
                if (header.equalsIgnoreCase(keyword)) {
                    return header;
                }
            }
        }
        for (String keyword : keywords) {
            String lk = keyword.toLowerCase(Locale.ROOT);
            for (String header : headers) {
                if (header.toLowerCase(Locale.ROOT).contains(lk)) {
                    return header;
                }
            }
        }
        return "";
    }

    private static boolean hasLetter(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isLetter(s.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}
