package com.example.ordersummary.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Value;

/**
 * One table row of the report: a part and its quantity for every order number on the page.
 * <p>
 * {@code quantities} always holds exactly one entry per order number; shorter input is
 * zero-padded and longer input truncated.
 */
@Value
public class LineItemRecord {

    String partNumber;
    String description;
    Integer lotQty;
    String kanbanCode;
    List<Integer> quantities;

    public LineItemRecord(String partNumber, String description, Integer lotQty, String kanbanCode,
                          List<Integer> quantities, int orderCount) {
        this.partNumber = partNumber;
        this.description = description;
        this.lotQty = lotQty;
        this.kanbanCode = kanbanCode;
        this.quantities = fit(quantities, orderCount);
    }

    public int quantityAt(int orderIndex) {
        return orderIndex < quantities.size() ? quantities.get(orderIndex) : 0;
    }

    private static List<Integer> fit(List<Integer> raw, int size) {
        List<Integer> out = new ArrayList<>(Math.max(size, 0));
        for (int i = 0; i < size; i++) {
            Integer v = (raw != null && i < raw.size()) ? raw.get(i) : null;
            out.add(v == null ? 0 : v);
        }
        return List.copyOf(out);
    }
}
