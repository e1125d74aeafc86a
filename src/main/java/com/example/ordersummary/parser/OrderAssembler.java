package com.example.ordersummary.parser;

import java.util.ArrayList;
import java.util.List;

import com.example.ordersummary.model.ExtractedOrder;
import com.example.ordersummary.model.ExtractedOrderItem;
import com.example.ordersummary.model.LineItemRecord;
import com.example.ordersummary.model.OrderHeader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a page into one order per order number. A page listing 001, 002 and 003 yields three
 * orders, each holding only the parts with a positive quantity for that number.
 */
public class OrderAssembler {

    private static final Logger log = LoggerFactory.getLogger(OrderAssembler.class);

    public List<ExtractedOrder> assemble(int pageNumber, OrderHeader header, List<String> orderNumbers,
                                         List<LineItemRecord> lineItems) {
        List<ExtractedOrder> orders = new ArrayList<>();

        for (int index = 0; index < orderNumbers.size(); index++) {
            String orderNumber = orderNumbers.get(index);

            ExtractedOrder.ExtractedOrderBuilder order = ExtractedOrder.builder()
                    .pageNumber(pageNumber)
                    .owkNumber(String.join("-", nullToEmpty(header.getSupplierCode()),
                            nullToEmpty(header.getDockCode()), nullToEmpty(header.getOrderSeries()), orderNumber))
                    .realOrderNumber(nullToEmpty(header.getOrderSeries()) + orderNumber)
                    .orderNumber(orderNumber)
                    .customerName(header.getSupplierName())
                    .supplierCode(header.getSupplierCode())
                    .dockCode(header.getDockCode())
                    .orderSeries(header.getOrderSeries())
                    .orderDate(header.getTransmitDate())
                    .arriveDateTime(header.getArriveDateTime())
                    .departDateTime(header.getDepartDateTime())
                    .unloadDateTime(header.getUnloadDateTime());

            int itemCount = 0;
            for (LineItemRecord line : lineItems) {
                int qty = line.quantityAt(index);
                if (qty <= 0) continue;

                order.item(ExtractedOrderItem.builder()
                        .partNumber(line.getPartNumber())
                        .description(line.getDescription())
                        .lotQty(line.getLotQty())
                        .kanbanCode(line.getKanbanCode())
                        .plannedQty(qty)
                        .rawKanbanValue(line.getKanbanCode())
                        .manifestNo(0L)
                        .build());
                itemCount++;
            }

            if (itemCount == 0) {
                log.debug("Order {} on page {} has no items, skipped", orderNumber, pageNumber);
                continue;
            }

            ExtractedOrder built = order.build();
            orders.add(built);
            log.info("Created order {} (series: {}, number: {}) with {} items",
                    built.getRealOrderNumber(), header.getOrderSeries(), orderNumber, itemCount);
        }
        return orders;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
