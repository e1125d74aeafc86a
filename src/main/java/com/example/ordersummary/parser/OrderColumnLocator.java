package com.example.ordersummary.parser;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.example.ordersummary.model.ColumnMap;
import com.example.ordersummary.model.Word;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locates the horizontal center of each order number in the "Order Number" header row.
 * These centers are the column positions quantities are aligned against.
 */
public class OrderColumnLocator {

    private static final Logger log = LoggerFactory.getLogger(OrderColumnLocator.class);

    private final double headerRowTolerance;

    public OrderColumnLocator(double headerRowTolerance) {
        this.headerRowTolerance = headerRowTolerance;
    }

    public ColumnMap locate(List<Word> words, List<String> orderNumbers) {
        if (words == null || words.isEmpty() || orderNumbers == null || orderNumbers.isEmpty()) {
            log.warn("Cannot extract order positions: words or order numbers are empty");
            return ColumnMap.empty();
        }

        List<Word> headerWords = new ArrayList<>();
        for (Word w : words) {
            String lower = w.trimmedText().toLowerCase(Locale.ROOT);
            if (lower.contains("order") || lower.contains("number")) headerWords.add(w);
        }
        if (headerWords.isEmpty()) {
            log.warn("Could not find 'Order Number' header words");
            return ColumnMap.empty();
        }

        double headerY = headerWords.stream().mapToDouble(Word::getBottom).average().orElse(0);
        log.debug("Order Number header row Y position: {}", headerY);

        List<Word> headerRow = new ArrayList<>();
        for (Word w : words) {
            if (Math.abs(w.getBottom() - headerY) < headerRowTolerance) headerRow.add(w);
        }
        headerRow.sort(Comparator.comparingDouble(Word::getLeft));
        log.debug("Found {} words in Order Number header row", headerRow.size());

        Map<String, Double> centers = new LinkedHashMap<>();
        for (String orderNumber : orderNumbers) {
            Word match = headerRow.stream()
                    .filter(w -> w.trimmedText().equals(orderNumber))
                    .findFirst()
                    .orElse(null);

            if (match != null) {
                centers.put(orderNumber, match.getCenterX());
                log.debug("Order {} column position: X={} (left={}, right={})",
                        orderNumber, match.getCenterX(), match.getLeft(), match.getRight());
            } else {
                log.warn("Could not find word for order number {} in header row", orderNumber);
            }
        }

        log.info("Extracted {} of {} order column positions", centers.size(), orderNumbers.size());
        return new ColumnMap(centers);
    }
}
