package com.example.ordersummary.parser;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalDouble;

import com.example.ordersummary.model.ColumnMap;
import com.example.ordersummary.model.Word;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns the numeric tokens of one table row to order columns by horizontal distance.
 * <p>
 * A column with no token close enough is a blank cell and resolves to 0. Matching by position
 * instead of token order keeps a blank cell from shifting later quantities into the wrong order.
 */
public class QuantityColumnResolver {

    private static final Logger log = LoggerFactory.getLogger(QuantityColumnResolver.class);

    private final double partRowTolerance;
    private final double columnTolerance;

    public QuantityColumnResolver(double partRowTolerance, double columnTolerance) {
        this.partRowTolerance = partRowTolerance;
        this.columnTolerance = columnTolerance;
    }

    /** Words sharing the row of {@code anchor}. */
    public List<Word> rowOf(Word anchor, List<Word> words) {
        List<Word> row = new ArrayList<>();
        for (Word w : words) {
            if (Math.abs(w.getBottom() - anchor.getBottom()) < partRowTolerance) row.add(w);
        }
        log.debug("Found {} words in part row at Y={}", row.size(), anchor.getBottom());
        return row;
    }

    /**
     * One quantity per order number, in the given order.
     */
    public List<Integer> resolve(List<Word> rowWords, ColumnMap columns, List<String> orderNumbers) {
        List<Word> numeric = new ArrayList<>();
        for (Word w : rowWords) {
            if (isNumeric(w.trimmedText())) numeric.add(w);
        }

        List<Integer> quantities = new ArrayList<>(orderNumbers.size());
        for (String orderNumber : orderNumbers) {
            OptionalDouble column = columns.centerOf(orderNumber);
            if (column.isEmpty()) {
                log.warn("Order {}: column position not found, defaulting to 0", orderNumber);
                quantities.add(0);
                continue;
            }

            double columnX = column.getAsDouble();
            Word closest = numeric.stream()
                    .filter(w -> Math.abs(w.getCenterX() - columnX) <= columnTolerance)
                    .min(Comparator.comparingDouble(w -> Math.abs(w.getCenterX() - columnX)))
                    .orElse(null);

            int qty = 0;
            if (closest != null) {
                qty = parse(closest.trimmedText());
                log.debug("Order {} (X={}): quantity {} at X={}", orderNumber, columnX, qty, closest.getCenterX());
            } else {
                log.debug("Order {} (X={}): blank cell", orderNumber, columnX);
            }
            quantities.add(qty);
        }
        return quantities;
    }

    private static boolean isNumeric(String s) {
        return !s.isEmpty() && s.length() <= 9 && s.chars().allMatch(c -> c >= '0' && c <= '9');
    }

    private static int parse(String s) {
        return Integer.parseInt(s);
    }
}
