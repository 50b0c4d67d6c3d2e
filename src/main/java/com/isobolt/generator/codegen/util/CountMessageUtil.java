package com.isobolt.generator.codegen.util;

/**
 * Builds human readable count messages such as "Found no thread materials" or
 * "Created 1 file".
 */
public class CountMessageUtil {

    private CountMessageUtil() {
        // Utility class
    }

    /**
     * Fills {@code {0}} with the count (or "no" for zero) and {@code {1}} with the suffix
     * matching the count.
     */
    public static String format(int count, String pattern, String pluralSuffix, String singularSuffix) {
        String countText = count != 0 ? Integer.toString(count) : "no";
        String suffix = count != 1 ? pluralSuffix : singularSuffix;
        return pattern.replace("{0}", countText).replace("{1}", suffix);
    }

    public static String format(int count, String pattern) {
        return format(count, pattern, "s", "");
    }

    /**
     * Like {@link #format(int, String)} with an "ok" or "NOT OK" verdict appended.
     */
    public static String formatVerdict(int count, boolean ok, String pattern, String pluralSuffix,
                                       String singularSuffix) {
        return format(count, pattern, pluralSuffix, singularSuffix) + (ok ? " --> ok" : " --> NOT OK");
    }
}
