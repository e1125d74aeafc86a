package com.example.ordersummary.parser;

import com.example.ordersummary.model.ColumnMap;
import com.example.ordersummary.model.Word;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.example.ordersummary.parser.WordFixtures.centered;
import static com.example.ordersummary.parser.WordFixtures.row;
import static com.example.ordersummary.parser.WordFixtures.word;
import static org.junit.jupiter.api.Assertions.*;

class OrderColumnLocatorTest {

    private final OrderColumnLocator locator = new OrderColumnLocator(10);

    @Test
    void locatesCenterOfEachOrderNumberInHeaderRow() {
        List<Word> words = new ArrayList<>(row("Order Number", 20, 100));
        words.add(centered("001", 409, 100));
        words.add(centered("002", 469, 100));
        words.addAll(row("68101-0E120-00 GLASS 001", 20, 130));

        ColumnMap columns = locator.locate(words, List.of("001", "002"));

        assertEquals(2, columns.size());
        assertEquals(409.0, columns.centerOf("001").getAsDouble(), 1e-9);
        assertEquals(469.0, columns.centerOf("002").getAsDouble(), 1e-9);
    }

    @Test
    void orderNumberOutsideHeaderRow_isLeftOut() {
        List<Word> words = new ArrayList<>(row("Order Number", 20, 100));
        words.add(centered("001", 409, 104));
        words.add(centered("002", 469, 140));

        ColumnMap columns = locator.locate(words, List.of("001", "002"));

        assertTrue(columns.centerOf("001").isPresent());
        assertFalse(columns.centerOf("002").isPresent());
    }

    @Test
    void noHeaderWords_givesEmptyMap() {
        List<Word> words = List.of(word("001", 400, 100), word("002", 460, 100));

        assertTrue(locator.locate(words, List.of("001", "002")).isEmpty());
    }

    @Test
    void emptyInput_givesEmptyMap() {
        assertTrue(locator.locate(List.of(), List.of("001")).isEmpty());
        assertTrue(locator.locate(row("Order Number 001", 20, 100), List.of()).isEmpty());
    }
}
