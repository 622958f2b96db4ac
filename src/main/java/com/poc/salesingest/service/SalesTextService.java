package com.poc.salesingest.service;

import com.poc.salesingest.dto.Metrics;
import com.poc.salesingest.dto.SalesTextRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Metrics typed in by the user instead of uploaded. Explicit numbers win; otherwise they are
 * pulled out of the free text.
 */
@Service
@RequiredArgsConstructor
public class SalesTextService {

    private static final Pattern FLOAT_PATTERN = Pattern.compile("([0-9]+(?:\\.[0-9]+)?)");
    private static final Pattern INT_PATTERN = Pattern.compile("(?<![0-9.])([0-9]{1,9})(?![0-9]|\\.[0-9])");

    private final SalesMetricService salesMetricService;

    public Metrics ingest(String userId, SalesTextRequest request) {
        Metrics metrics = detectMetrics(request);
        salesMetricService.recordTextMetrics(userId, request.getText(), metrics);
        return metrics;
    }

    /**
     * Total = first number in the text; bill rows and unique bills = the first two standalone
     * integers after it. 0 for whatever is missing.
     */
    public static Metrics detectMetrics(SalesTextRequest request) {
        if (request.getTotalSales() != null && request.getBillRowCount() != null && request.getUniqueBillCount() != null) {
            return new Metrics(MetricsAggregator.round2(BigDecimal.valueOf(request.getTotalSales())),
                    request.getBillRowCount(), request.getUniqueBillCount());
        }
        String t = request.getText() == null ? "" : request.getText().toLowerCase(Locale.ROOT);

        BigDecimal amount = BigDecimal.ZERO;
        int countsFrom = 0;
        Matcher floatMatcher = FLOAT_PATTERN.matcher(t);
        if (floatMatcher.find()) {
            amount = new BigDecimal(floatMatcher.group(1));
            countsFrom = floatMatcher.end();
        }

        List<Integer> counts = new ArrayList<>();
        Matcher intMatcher = INT_PATTERN.matcher(t);
        intMatcher.region(countsFrom, t.length());
        while (intMatcher.find()) {
            counts.add(Integer.parseInt(intMatcher.group(1)));
        }
        int billRows = counts.size() > 0 ? counts.get(0) : 0;
        int unique = counts.size() > 1 ? counts.get(1) : 0;
        return new Metrics(MetricsAggregator.round2(amount), billRows, unique);
    }
}
