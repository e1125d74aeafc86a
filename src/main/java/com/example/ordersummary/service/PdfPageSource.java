package com.example.ordersummary.service;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.example.ordersummary.model.PageContent;
import com.example.ordersummary.model.Word;

/**
 * Opens a PDF and exposes each page as flattened text plus positioned words.
 */
@Service
public class PdfPageSource {

    private static final Logger log = LoggerFactory.getLogger(PdfPageSource.class);

    public List<PageContent> load(InputStream in) throws IOException {
        return load(in.readAllBytes());
    }

    public List<PageContent> load(Path path) throws IOException {
        File file = path.toFile();
        PDDocument document;
        try {
            document = Loader.loadPDF(file);
        } catch (IOException e) {
            throw new DocumentOpenException("Failed to open PDF file " + file.getName(), e);
        }
        return readPages(document);
    }

    public List<PageContent> load(byte[] pdf) throws IOException {
        PDDocument document;
        try {
            document = Loader.loadPDF(pdf);
        } catch (IOException e) {
            throw new DocumentOpenException("Failed to open PDF document", e);
        }
        return readPages(document);
    }

    private List<PageContent> readPages(PDDocument document) throws IOException {
        try (document) {
            int pageCount = document.getNumberOfPages();
            log.info("PDF opened successfully. Total pages: {}", pageCount);

            List<PageContent> pages = new ArrayList<>(pageCount);
            for (int pageNumber = 1; pageNumber <= pageCount; pageNumber++) {
                pages.add(readPage(document, pageNumber));
            }
            return pages;
        }
    }

    /**
     * A page whose content cannot be read comes back empty, so it yields no orders and the
     * remaining pages still parse.
     */
    private PageContent readPage(PDDocument document, int pageNumber) {
        try {
            WordStripper stripper = newStripper();
            stripper.setStartPage(pageNumber);
            stripper.setEndPage(pageNumber);
            String text = stripper.getText(document);

            log.debug("Page {}: {} words", pageNumber, stripper.words.size());
            return new PageContent(pageNumber, text, stripper.words);
        } catch (IOException e) {
            log.error("Error reading page {}", pageNumber, e);
            return new PageContent(pageNumber, "", List.of());
        }
    }

    WordStripper newStripper() throws IOException {
        return new WordStripper();
    }

    /**
     * Collects a bounding box per whitespace-delimited token. Boxes use direction-adjusted
     * coordinates: y grows downward and the bottom edge is the baseline.
     */
    static class WordStripper extends PDFTextStripper {

        final List<Word> words = new ArrayList<>();

        WordStripper() throws IOException {
            super();
            setSortByPosition(true);
        }

        @Override
        protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
            List<TextPosition> token = new ArrayList<>();
            for (TextPosition tp : textPositions) {
                String unicode = tp.getUnicode();
                if (unicode == null || unicode.isBlank()) {
                    flush(token);
                } else {
                    token.add(tp);
                }
            }
            flush(token);

            super.writeString(text, textPositions);
        }

        private void flush(List<TextPosition> token) {
            if (token.isEmpty()) return;

            StringBuilder sb = new StringBuilder();
            float left = Float.MAX_VALUE, right = -Float.MAX_VALUE;
            float top = Float.MAX_VALUE, bottom = -Float.MAX_VALUE;
            for (TextPosition tp : token) {
                sb.append(tp.getUnicode());
                left = Math.min(left, tp.getXDirAdj());
                right = Math.max(right, tp.getXDirAdj() + tp.getWidthDirAdj());
                top = Math.min(top, tp.getYDirAdj() - tp.getHeightDir());
                bottom = Math.max(bottom, tp.getYDirAdj());
            }
            words.add(new Word(sb.toString(), left, right, top, bottom));
            token.clear();
        }
    }
}
