package com.example.ordersummary.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Text-only quantity decoding, used when no column geometry is available.
 */
public final class QuantityParser {

    private QuantityParser() {
    }

    /**
     * "2 1" for two orders, "4 5 6" for three. Padded with zeros or truncated to {@code expectedCount}.
     */
    public static List<Integer> parseSpaceSeparated(String quantities, int expectedCount) {
        List<Integer> out = new ArrayList<>();
        if (quantities != null && !quantities.isBlank()) {
            for (String token : quantities.trim().split("\\s+")) {
                Integer qty = parseOrNull(token);
                if (qty != null) out.add(qty);
            }
        }
        return fit(out, expectedCount);
    }

    /**
     * Legacy concatenated layout: "436" is 4, 3, 6 for three orders and 436 for one.
     */
    public static List<Integer> parseConcatenated(String digits, int expectedCount) {
        if (digits == null || digits.isEmpty()) return zeros(expectedCount);

        List<Integer> out = new ArrayList<>();
        if (expectedCount == 1 && digits.length() != 1) {
            Integer whole = parseOrNull(digits);
            if (whole != null) out.add(whole);
        } else {
            // one digit per order; length == expected is the exact case
            for (int i = 0; i < digits.length() && out.size() < expectedCount; i++) {
                char c = digits.charAt(i);
                if (c >= '0' && c <= '9') out.add(c - '0');
            }
        }
        return fit(out, expectedCount);
    }

    public static List<Integer> zeros(int count) {
        return new ArrayList<>(Collections.nCopies(Math.max(count, 0), 0));
    }

    private static List<Integer> fit(List<Integer> values, int expectedCount) {
        List<Integer> out = new ArrayList<>(values.subList(0, Math.min(values.size(), Math.max(expectedCount, 0))));
        while (out.size() < expectedCount) out.add(0);
        return out;
    }

    private static Integer parseOrNull(String s) {
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
