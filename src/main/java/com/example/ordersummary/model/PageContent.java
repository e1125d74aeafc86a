package com.example.ordersummary.model;

import java.util.List;

import lombok.Value;

/**
 * One page as handed over by the page layer: flattened text plus positioned words.
 */
@Value
public class PageContent {

    int pageNumber;
    String text;
    List<Word> words;

    public PageContent(int pageNumber, String text, List<Word> words) {
        this.pageNumber = pageNumber;
        this.text = text == null ? "" : text;
        this.words = words == null ? List.of() : List.copyOf(words);
    }
}
