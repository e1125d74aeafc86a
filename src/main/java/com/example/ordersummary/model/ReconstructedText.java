package com.example.ordersummary.model;

import java.util.List;

import lombok.Value;

/**
 * Page text rebuilt from word geometry, one entry per visual row, top to bottom.
 */
@Value
public class ReconstructedText {

    private static final ReconstructedText EMPTY = new ReconstructedText(List.of());

    List<String> lines;

    public ReconstructedText(List<String> lines) {
        this.lines = List.copyOf(lines);
    }

    public static ReconstructedText empty() {
        return EMPTY;
    }

    public String fullText() {
        return String.join("\n", lines);
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }
}
