package com.poc.salesingest.service.cleaning;

import java.util.Locale;
import java.util.Set;

public final class BillIdentifiers {

    /** Placeholder values that exports use for "no bill number". */
    private static final Set<String> EMPTY_TOKENS = Set.of("", "-", "na", "n/a", "none", "null", "nil", "nan", "0");

    private BillIdentifiers() {
    }

    public static boolean isEffectivelyEmpty(String value) {
        String t = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return EMPTY_TOKENS.contains(t);
    }
}
