package com.example.ordersummary.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the per-page order sequence numbers (001, 002, ...). The returned list is distinct and
 * sorted ascending; its order is the index order of every quantity vector on the page.
 */
public class OrderNumberExtractor extends BaseReportParser {

    private static final Logger log = LoggerFactory.getLogger(OrderNumberExtractor.class);

    /** "Order Number 001 002 003", kept to a single line */
    private static final Pattern P_LABELED_RUN = Pattern.compile(
            "Order\\s+Number[ \\t]*:?[ \\t]*((?:\\d{3}(?![\\d-])[ \\t]*)+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern P_THREE_DIGITS = Pattern.compile("\\d{3}");
    private static final Pattern P_THREE_DIGIT_TOKEN = Pattern.compile("\\b(\\d{3})\\b");
    /** Lots Ord'd ... 001 68101-0E120-00 */
    private static final Pattern P_BEFORE_PART_AFTER_LOTS = Pattern.compile(
            "Lots\\s+Ord['\\u2019]d.*?(\\d{3})\\s?(?=" + PART_NUMBER + ")", Pattern.CASE_INSENSITIVE);
    private static final Pattern P_SERIES = Pattern.compile("(202\\d{5})");
    private static final Pattern P_TRAILING_THREE = Pattern.compile("(\\d{3})\\s*$");

    private final String defaultOrderNumber;
    private final PatternCascade<List<String>> cascade;

    public OrderNumberExtractor(String defaultOrderNumber) {
        this.defaultOrderNumber = defaultOrderNumber;
        this.cascade = PatternCascade.<List<String>>of("order numbers")
                .step("labeled run", this::labeledRun)
                .step("label line", this::labelLine)
                .step("before part", this::beforePartAfterLots)
                .step("series to part", this::betweenSeriesAndPart)
                .step("before first part", this::beforeFirstPart)
                .build();
    }

    public List<String> extract(String text) {
        List<String> found = cascade.resolve(text == null ? "" : text);
        if (found == null) {
            log.warn("No order numbers found, defaulting to '{}'", defaultOrderNumber);
            found = List.of(defaultOrderNumber);
        }

        List<String> result = new ArrayList<>(new TreeSet<>(found));
        log.info("Extracted {} order numbers: {}", result.size(), String.join(", ", result));
        return List.copyOf(result);
    }

    // -------------------- cascade steps --------------------
    List<String> labeledRun(String text) {
        String run = extract(text, P_LABELED_RUN);
        List<String> out = new ArrayList<>();
        if (run == null) return out;

        Matcher m = P_THREE_DIGITS.matcher(run);
        while (m.find()) addOrderNumber(out, m.group());
        return out;
    }

    List<String> labelLine(String text) {
        List<String> out = new ArrayList<>();
        for (String line : text.split("\n")) {
            if (!line.toLowerCase(Locale.ROOT).contains("order number")) continue;

            Matcher m = P_THREE_DIGIT_TOKEN.matcher(line);
            while (m.find()) addOrderNumber(out, m.group(1));
            break;
        }
        return out;
    }

    List<String> beforePartAfterLots(String text) {
        List<String> out = new ArrayList<>();
        addOrderNumber(out, extract(text, P_BEFORE_PART_AFTER_LOTS));
        return out;
    }

    /** FL11/17 14:5120251117 ... 001 68101-0E120-00 */
    List<String> betweenSeriesAndPart(String text) {
        List<String> out = new ArrayList<>();
        Matcher series = P_SERIES.matcher(text);
        if (!series.find()) return out;

        Matcher part = P_PART_NUMBER.matcher(text);
        if (!part.find(series.end())) return out;

        String section = text.substring(series.end(), part.start());
        log.debug("Searching for order numbers in section: {}", abbreviate(section, 100));
        addOrderNumber(out, extract(section, P_TRAILING_THREE));
        return out;
    }

    List<String> beforeFirstPart(String text) {
        List<String> out = new ArrayList<>();
        Matcher part = P_PART_NUMBER.matcher(text);
        if (!part.find() || part.start() < 3) return out;

        String before = text.substring(part.start() - 3, part.start());
        log.debug("Text before first part number: '{}'", before);
        if (before.chars().allMatch(Character::isDigit)) addOrderNumber(out, before);
        return out;
    }

    private void addOrderNumber(List<String> out, String candidate) {
        if (candidate == null || !candidate.matches("\\d{3}")) return;
        int n = Integer.parseInt(candidate);
        if (n >= 1 && n <= 999 && !out.contains(candidate)) out.add(candidate);
    }
}
