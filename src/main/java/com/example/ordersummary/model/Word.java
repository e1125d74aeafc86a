package com.example.ordersummary.model;

import lombok.Value;

/**
 * A single token on a page with its bounding box.
 * <p>
 * Coordinates are top-down: a larger {@code bottom} sits lower on the page.
 */
@Value
public class Word {

    String text;
    double left;
    double right;
    double top;
    double bottom;

    public double getWidth() {
        return right - left;
    }

    public double getCenterX() {
        return left + getWidth() / 2;
    }

    /** Trimmed text, never null. */
    public String trimmedText() {
        return text == null ? "" : text.trim();
    }
}
