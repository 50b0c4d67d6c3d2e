package com.isobolt.generator.codegen.util;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Locale independent number rendering for catalog and table files.
 */
public class NumberFormatUtil {

    private NumberFormatUtil() {
        // Utility class
    }

    /**
     * Shortest plain decimal form without trailing zeros, e.g. {@code 10}, {@code 1.25}.
     */
    public static String format(double value) {
        if (value == 0) {
            return "0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /**
     * Two decimals, e.g. {@code 1.52}.
     */
    public static String fixed2(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
