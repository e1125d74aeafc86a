package com.example.ordersummary.parser;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.example.ordersummary.model.ReconstructedText;
import com.example.ordersummary.model.Word;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds row text from word boxes. Raw extraction tends to drop the whitespace between
 * columns; clustering by the bottom edge and re-joining left to right restores it.
 */
public class RowReconstructor {

    private static final Logger log = LoggerFactory.getLogger(RowReconstructor.class);

    private final double bucketSize;

    public RowReconstructor(double bucketSize) {
        if (bucketSize <= 0) throw new IllegalArgumentException("bucketSize must be positive: " + bucketSize);
        this.bucketSize = bucketSize;
    }

    public ReconstructedText reconstruct(List<Word> words, int pageNumber) {
        if (words == null || words.isEmpty()) {
            log.warn("No words found on page {}", pageNumber);
            return ReconstructedText.empty();
        }

        // bucket key = round(bottom / size); rows sorted top to bottom
        Map<Long, List<Word>> rows = new TreeMap<>();
        for (Word w : words) {
            long key = Math.round(w.getBottom() / bucketSize);
            rows.computeIfAbsent(key, k -> new ArrayList<>()).add(w);
        }

        List<String> lines = new ArrayList<>(rows.size());
        for (Map.Entry<Long, List<Word>> row : rows.entrySet()) {
            List<Word> inRow = row.getValue();
            inRow.sort(Comparator.comparingDouble(Word::getLeft));

            List<String> texts = new ArrayList<>(inRow.size());
            for (Word w : inRow) texts.add(w.trimmedText());
            String line = String.join(" ", texts);
            lines.add(line);

            log.debug("Row at Y={}: {}", row.getKey() * bucketSize, BaseReportParser.abbreviate(line, 100));
        }

        log.info("Reconstructed {} lines from {} words on page {}", lines.size(), words.size(), pageNumber);
        return new ReconstructedText(lines);
    }
}
