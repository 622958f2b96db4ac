package com.poc.salesingest.service;

import com.poc.salesingest.dto.Metrics;
import com.poc.salesingest.dto.RowData;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Component
public class MetricsAggregator {

    /**
     * Sums the parseable sales cells (unparseable ones are skipped, not counted as zero), counts the
     * rows, and counts distinct non-empty bill numbers (case-sensitive).
     */
    public Metrics aggregate(List<RowData> rows, String salesCol, String billCol) {
        BigDecimal total = BigDecimal.ZERO;
        Set<String> bills = new HashSet<>();
        for (RowData row : rows) {
            Optional<BigDecimal> amount = NumericParser.parse(row.get(salesCol));
            if (amount.isPresent()) {
                total = total.add(amount.get());
            }
            String bill = row.get(billCol).trim();
            if (!bill.isEmpty()) {
                bills.add(bill);
            }
        }
        return new Metrics(round2(total), rows.size(), bills.size());
    }

    public static BigDecimal round2(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}
