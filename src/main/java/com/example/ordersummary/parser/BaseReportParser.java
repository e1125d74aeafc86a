package com.example.ordersummary.parser;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text helpers shared by the report parsers.
 */
public abstract class BaseReportParser {

    // -------------------- shared patterns --------------------
    /** 68101-0E120-00 */
    protected static final String PART_NUMBER = "\\d{5}-[A-Z0-9]{5}-\\d{2}";
    protected static final Pattern P_PART_NUMBER = Pattern.compile(PART_NUMBER);

    // -------------------- extract() --------------------
    /** First group of the first match, or null. */
    protected String extract(String src, Pattern p) {
        return extract(src, p, 1);
    }

    /** Trimmed group of the first match; falls back to group 1, then the whole match. */
    protected String extract(String src, Pattern p, int groupIndex) {
        if (src == null || p == null) return null;
        Matcher m = p.matcher(src);
        if (!m.find()) return null;

        int groupCount = m.groupCount();
        if (groupIndex > 0 && groupIndex <= groupCount) {
            return Optional.ofNullable(m.group(groupIndex)).orElse("").trim();
        } else if (groupCount >= 1) {
            return Optional.ofNullable(m.group(1)).orElse("").trim();
        }
        return m.group().trim();
    }

    // -------------------- helpers --------------------
    /** Digits of {@code s} as an int, or null. */
    protected Integer toInt(String s) {
        if (s == null) return null;
        String clean = s.replaceAll("[^0-9]", "");
        if (clean.isEmpty()) return null;
        try {
            return Integer.parseInt(clean);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    protected boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    protected String head(String text, int length) {
        if (text == null) return "";
        return text.length() > length ? text.substring(0, length) : text;
    }

    /** Shortened text for log lines. */
    protected static String abbreviate(String s, int max) {
        if (s == null) return "";
        return s.length() > max ? s.substring(0, max) + "..." : s;
    }
}
