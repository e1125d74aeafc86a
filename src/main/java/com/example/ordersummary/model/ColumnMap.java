package com.example.ordersummary.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Order number to horizontal center of its column header. Built once per page.
 */
@ToString
@EqualsAndHashCode
public final class ColumnMap {

    private static final ColumnMap EMPTY = new ColumnMap(Map.of());

    private final Map<String, Double> centers;

    public ColumnMap(Map<String, Double> centers) {
        this.centers = Collections.unmodifiableMap(new LinkedHashMap<>(centers));
    }

    public static ColumnMap empty() {
        return EMPTY;
    }

    public OptionalDouble centerOf(String orderNumber) {
        Double x = centers.get(orderNumber);
        return x == null ? OptionalDouble.empty() : OptionalDouble.of(x);
    }

    public boolean isEmpty() {
        return centers.isEmpty();
    }

    public int size() {
        return centers.size();
    }

    public Map<String, Double> asMap() {
        return centers;
    }
}
