package com.example.ordersummary.parser;

import java.time.Clock;
import java.util.List;

import com.example.ordersummary.config.ExtractionProperties;
import com.example.ordersummary.model.ColumnMap;
import com.example.ordersummary.model.ExtractedOrder;
import com.example.ordersummary.model.LineItemRecord;
import com.example.ordersummary.model.OrderHeader;
import com.example.ordersummary.model.PageContent;
import com.example.ordersummary.model.ReconstructedText;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses one page of a daily one-way kanban order summary report into orders.
 * <p>
 * Every value is local to a single {@link #parse} call, so pages can be parsed independently.
 */
public class OrderSummaryPageParser {

    private static final Logger log = LoggerFactory.getLogger(OrderSummaryPageParser.class);

    private final RowReconstructor rowReconstructor;
    private final HeaderFieldExtractor headerExtractor;
    private final OrderNumberExtractor orderNumberExtractor;
    private final OrderColumnLocator columnLocator;
    private final LineItemExtractor lineItemExtractor;
    private final OrderAssembler assembler;

    public OrderSummaryPageParser(ExtractionProperties properties, Clock clock) {
        this.rowReconstructor = new RowReconstructor(properties.getRowBucketSize());
        this.headerExtractor = new HeaderFieldExtractor(properties, clock);
        this.orderNumberExtractor = new OrderNumberExtractor(properties.getDefaultOrderNumber());
        this.columnLocator = new OrderColumnLocator(properties.getHeaderRowTolerance());
        this.lineItemExtractor = new LineItemExtractor(properties.getFallbackContextLength(),
                new QuantityColumnResolver(properties.getPartRowTolerance(), properties.getColumnTolerance()));
        this.assembler = new OrderAssembler();
    }

    /**
     * Never throws for page content problems: a failing page is logged and yields no orders.
     */
    public List<ExtractedOrder> parse(PageContent page) {
        int pageNumber = page.getPageNumber();
        try {
            return parsePage(page);
        } catch (RuntimeException e) {
            log.error("Error parsing page {}", pageNumber, e);
            return List.of();
        }
    }

    List<ExtractedOrder> parsePage(PageContent page) {
        int pageNumber = page.getPageNumber();
        log.debug("=== PAGE {} RAW TEXT ===\n{}", pageNumber, page.getText());

        ReconstructedText reconstructed = rowReconstructor.reconstruct(page.getWords(), pageNumber);
        String text = reconstructed.isEmpty() ? page.getText() : reconstructed.fullText();
        log.debug("=== PAGE {} TEXT TO PARSE ===\n{}", pageNumber, text);

        OrderHeader header = headerExtractor.parseHeader(text);
        List<String> orderNumbers = orderNumberExtractor.extract(text);
        ColumnMap columns = columnLocator.locate(page.getWords(), orderNumbers);

        log.info("Page {} - supplier: {}, code: {}, dock: {}, series: {}, orders: {}",
                pageNumber, header.getSupplierName(), header.getSupplierCode(), header.getDockCode(),
                header.getOrderSeries(), orderNumbers.size());

        List<LineItemRecord> lineItems = lineItemExtractor.extract(text, orderNumbers, page.getWords(), columns);
        return assembler.assemble(pageNumber, header, orderNumbers, lineItems);
    }
}
