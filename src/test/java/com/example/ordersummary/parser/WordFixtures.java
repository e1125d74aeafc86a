package com.example.ordersummary.parser;

import java.util.ArrayList;
import java.util.List;

import com.example.ordersummary.model.Word;

/**
 * Word boxes for hand-built pages: 6 units per character, 10 units tall.
 */
public final class WordFixtures {

    public static final double CHAR_WIDTH = 6;

    private WordFixtures() {
    }

    public static Word word(String text, double left, double bottom) {
        return new Word(text, left, left + text.length() * CHAR_WIDTH, bottom - 10, bottom);
    }

    /** Word whose horizontal center sits exactly on {@code centerX}. */
    public static Word centered(String text, double centerX, double bottom) {
        double half = text.length() * CHAR_WIDTH / 2;
        return new Word(text, centerX - half, centerX + half, bottom - 10, bottom);
    }

    /** Space separated tokens laid out left to right starting at {@code left}. */
    public static List<Word> row(String line, double left, double bottom) {
        List<Word> out = new ArrayList<>();
        double x = left;
        for (String token : line.trim().split("\\s+")) {
            out.add(word(token, x, bottom));
            x += (token.length() + 1) * CHAR_WIDTH;
        }
        return out;
    }
}
