package com.example.ordersummary.service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.example.ordersummary.model.ExtractedOrder;
import com.example.ordersummary.model.PageContent;
import com.example.ordersummary.parser.OrderSummaryPageParser;

/**
 * Parses a whole order summary report, page by page.
 * <p>
 * Pages are independent: a page that fails contributes no orders and the rest still parse.
 * Only a document that cannot be opened fails the call. Merging the result with earlier uploads
 * (by order number and dock code) is left to the caller.
 */
@Service
public class OrderSummaryParseService {

    private static final Logger log = LoggerFactory.getLogger(OrderSummaryParseService.class);

    private final OrderSummaryPageParser pageParser;
    private final PdfPageSource pageSource;

    public OrderSummaryParseService(OrderSummaryPageParser pageParser, PdfPageSource pageSource) {
        this.pageParser = pageParser;
        this.pageSource = pageSource;
    }

    public List<ExtractedOrder> parse(InputStream pdf) throws IOException {
        return parse(pageSource.load(pdf));
    }

    public List<ExtractedOrder> parse(Path pdf) throws IOException {
        return parse(pageSource.load(pdf));
    }

    public List<ExtractedOrder> parse(List<PageContent> pages) {
        List<ExtractedOrder> orders = new ArrayList<>();

        for (PageContent page : pages) {
            log.info("Processing page {}", page.getPageNumber());
            List<ExtractedOrder> pageOrders = pageParser.parse(page);
            orders.addAll(pageOrders);
            log.info("Extracted {} orders from page {}", pageOrders.size(), page.getPageNumber());
        }

        log.info("Order summary parsing completed. Total orders extracted: {}", orders.size());
        return orders;
    }
}
