package com.example.ordersummary.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.example.ordersummary.model.ColumnMap;
import com.example.ordersummary.model.LineItemRecord;
import com.example.ordersummary.model.Word;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decomposes table rows into part number, description, lot quantity, kanban and per-order quantities.
 * <p>
 * Clean layouts are read line by line. When that yields nothing the page is treated as the
 * legacy concatenated layout and scanned part number by part number.
 */
public class LineItemExtractor extends BaseReportParser {

    private static final Logger log = LoggerFactory.getLogger(LineItemExtractor.class);

    // -------------------- clean layout --------------------
    private static final Pattern P_PART_LINE = Pattern.compile("^(" + PART_NUMBER + ")\\s+(.+)$");

    /** GLASS SUB-ASSY BA 00012 TF63 2 1 */
    private static final Pattern P_ROW_WITH_QTY = Pattern.compile(
            "^([A-Z][A-Z\\s\\-/,]+?)\\s+(\\d{5})\\s+([A-Z0-9]{2,6})\\s+([\\d\\s]+)\\s*$", Pattern.CASE_INSENSITIVE);
    /** GLASS SUB-ASSY BA 00012 TF63 (every quantity cell blank) */
    private static final Pattern P_ROW_NO_QTY = Pattern.compile(
            "^([A-Z][A-Z\\s\\-/,]+?)\\s+(\\d{5})\\s+([A-Z0-9]{2,6})\\s*$", Pattern.CASE_INSENSITIVE);
    /** GLASS SUB-ASSY FR DOOR 00045 MH98 1 1 1 */
    private static final Pattern P_ROW_GREEDY = Pattern.compile(
            "^([A-Z][A-Z\\s\\-/,]+)\\s+(\\d{5})\\s+([A-Z0-9]{2,6})\\s+([\\d\\s]+)\\s*$", Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> ROW_PATTERNS = List.of(P_ROW_WITH_QTY, P_ROW_NO_QTY, P_ROW_GREEDY);

    // -------------------- concatenated layout --------------------
    private static final Pattern P_PART_ANYWHERE = Pattern.compile("(" + PART_NUMBER + ")");
    /** 68101-0E120-00 GLASS SUB-ASSY FR00045FA994 */
    private static final Pattern P_CONCATENATED = Pattern.compile(
            "^(" + PART_NUMBER + ")\\s+([A-Z][A-Z\\s\\-/,]*?)(\\d{5})([A-Z0-9]{2,6})(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern P_DESC_BEFORE_LOT = Pattern.compile(
            "^\\s+([A-Z][A-Z\\s\\-/,]*?)(?=\\d{5})", Pattern.CASE_INSENSITIVE);
    private static final Pattern P_LOT_BEFORE_KANBAN = Pattern.compile("(\\d{5})(?=[A-Z])");
    private static final Pattern P_KANBAN = Pattern.compile("^([A-Z0-9]{2,6})");
    private static final Pattern P_LEADING_DIGITS = Pattern.compile("^(\\d+)");

    private final int fallbackContextLength;
    private final QuantityColumnResolver resolver;

    public LineItemExtractor(int fallbackContextLength, QuantityColumnResolver resolver) {
        this.fallbackContextLength = fallbackContextLength;
        this.resolver = resolver;
    }

    public List<LineItemRecord> extract(String text, List<String> orderNumbers, List<Word> words, ColumnMap columns) {
        List<LineItemRecord> items = extractRows(text, orderNumbers, words, columns);

        if (items.isEmpty()) {
            log.warn("No items found in clean layout, trying concatenated layout");
            items = extractConcatenated(text, orderNumbers.size());
        }

        log.info("Extracted {} line items", items.size());
        return items;
    }

    // -------------------- clean layout --------------------
    List<LineItemRecord> extractRows(String text, List<String> orderNumbers, List<Word> words, ColumnMap columns) {
        List<LineItemRecord> items = new ArrayList<>();
        int orderCount = orderNumbers.size();
        int skipped = 0;
        int lineNumber = 0;

        for (String line : text.split("\n")) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty()) continue;

            Matcher lineMatch = P_PART_LINE.matcher(trimmed);
            if (!lineMatch.matches()) continue;

            String partNumber = lineMatch.group(1);
            String rest = lineMatch.group(2).trim();

            Matcher row = matchRow(rest);
            if (row == null) {
                skipped++;
                log.warn("Line {}: no row pattern matched for part {}: [{}]", lineNumber, partNumber, abbreviate(rest, 100));
                continue;
            }

            String description = row.group(1).trim();
            Integer lotQty = toInt(row.group(2));
            String kanban = row.group(3);
            String quantityText = row.groupCount() >= 4 ? row.group(4) : "";

            List<Integer> quantities = quantities(partNumber, quantityText, orderNumbers, words, columns);
            LineItemRecord item = new LineItemRecord(partNumber, description, lotQty, kanban, quantities, orderCount);
            items.add(item);

            log.debug("Line {}: part={}, desc={}, lot={}, kanban={}, quantities={}",
                    lineNumber, partNumber, description, lotQty, kanban, item.getQuantities());
        }

        if (skipped > 0) log.warn("Skipped {} part rows that matched no row pattern", skipped);
        log.info("Clean layout extraction found {} items", items.size());
        return items;
    }

    private Matcher matchRow(String rest) {
        for (Pattern p : ROW_PATTERNS) {
            Matcher m = p.matcher(rest);
            if (m.matches()) return m;
        }
        return null;
    }

    private List<Integer> quantities(String partNumber, String quantityText, List<String> orderNumbers,
                                     List<Word> words, ColumnMap columns) {
        if (columns.isEmpty()) {
            log.debug("No order column positions, parsing quantities from text");
            return QuantityParser.parseSpaceSeparated(quantityText, orderNumbers.size());
        }

        Word partWord = words.stream()
                .filter(w -> w.trimmedText().equals(partNumber))
                .findFirst()
                .orElse(null);
        if (partWord == null) {
            log.warn("Could not find part word '{}' in words, parsing quantities from text", partNumber);
            return QuantityParser.parseSpaceSeparated(quantityText, orderNumbers.size());
        }

        return resolver.resolve(resolver.rowOf(partWord, words), columns, orderNumbers);
    }

    // -------------------- concatenated layout --------------------
    List<LineItemRecord> extractConcatenated(String text, int orderCount) {
        List<LineItemRecord> items = new ArrayList<>();
        Matcher part = P_PART_ANYWHERE.matcher(text);
        // one digit per order closing the alphanumeric run, e.g. FA99 + 436 for three orders, HN7X + 4 for one
        Pattern perOrderDigits = Pattern.compile("^(" + PART_NUMBER + ")\\s+([A-Z][A-Z\\s\\-/,]*?)(\\d{5})([A-Z0-9]{2,6}?)(\\d{"
                + Math.max(orderCount, 1) + "})(?![A-Z0-9])", Pattern.CASE_INSENSITIVE);

        while (part.find()) {
            String partNumber = part.group(1);
            int end = Math.min(text.length(), part.start() + fallbackContextLength);
            String context = text.substring(part.start(), end);
            log.debug("Part {} at position {}: [{}]", partNumber, part.start(), abbreviate(context, 150));

            Matcher m = firstMatch(context, perOrderDigits, P_CONCATENATED);
            LineItemRecord item = m != null
                    ? new LineItemRecord(partNumber, m.group(2).trim(), toInt(m.group(3)), m.group(4),
                            QuantityParser.parseConcatenated(m.group(5), orderCount), orderCount)
                    : piecewise(partNumber, context.substring(partNumber.length()), orderCount);

            items.add(item);
            log.debug("Concatenated item: part={}, desc={}, lot={}, kanban={}, quantities={}",
                    item.getPartNumber(), item.getDescription(), item.getLotQty(), item.getKanbanCode(),
                    item.getQuantities());
        }

        log.info("Concatenated layout extraction found {} items", items.size());
        return items;
    }

    private static Matcher firstMatch(String context, Pattern... patterns) {
        for (Pattern p : patterns) {
            Matcher m = p.matcher(context);
            if (m.find()) return m;
        }
        return null;
    }

    /**
     * Isolates whatever pieces it can; the rest stay null and quantities fall back to zeros.
     */
    LineItemRecord piecewise(String partNumber, String rest, int orderCount) {
        log.warn("Concatenated pattern failed for part {}, extracting piece by piece", partNumber);

        String description = extract(rest, P_DESC_BEFORE_LOT);
        Integer lotQty = null;
        String kanban = null;
        List<Integer> quantities = null;

        Matcher lot = P_LOT_BEFORE_KANBAN.matcher(rest);
        if (lot.find()) {
            lotQty = toInt(lot.group(1));
            String afterLot = rest.substring(lot.end());

            kanban = extract(afterLot, P_KANBAN);
            if (kanban != null) {
                String digits = extract(afterLot.substring(kanban.length()), P_LEADING_DIGITS);
                if (digits != null) quantities = QuantityParser.parseConcatenated(digits, orderCount);
            }
        }

        if (quantities == null) {
            log.debug("Defaulting to zero quantities for part {}", partNumber);
            quantities = QuantityParser.zeros(orderCount);
        }
        return new LineItemRecord(partNumber, isBlank(description) ? null : description, lotQty, kanban,
                quantities, orderCount);
    }
}
