package com.example.ordersummary.parser;

import com.example.ordersummary.model.ExtractedOrder;
import com.example.ordersummary.model.ExtractedOrderItem;
import com.example.ordersummary.model.LineItemRecord;
import com.example.ordersummary.model.OrderHeader;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OrderAssemblerTest {

    private static final OrderHeader HEADER = OrderHeader.builder()
            .supplierName("AGC Automotive")
            .supplierCode("02806")
            .dockCode("FL")
            .orderSeries("20251117")
            .transmitDate(LocalDateTime.of(2025, 11, 12, 0, 0))
            .arriveDateTime(LocalDateTime.of(2025, 11, 14, 13, 1))
            .build();

    private final OrderAssembler assembler = new OrderAssembler();

    private static LineItemRecord line(String part, String kanban, List<Integer> quantities, int orderCount) {
        return new LineItemRecord(part, "GLASS SUB-ASSY", 12, kanban, quantities, orderCount);
    }

    @Test
    void oneOrderPerOrderNumber_withPositiveQuantitiesOnly() {
        List<LineItemRecord> lines = List.of(
                line("68101-0E120-00", "TF63", List.of(2, 1), 2),
                line("68105-0E131-00", "TF64", List.of(0, 3), 2));

        List<ExtractedOrder> orders = assembler.assemble(1, HEADER, List.of("001", "002"), lines);

        assertEquals(2, orders.size());

        ExtractedOrder first = orders.get(0);
        assertEquals("001", first.getOrderNumber());
        assertEquals(1, first.getItemCount());
        assertEquals("68101-0E120-00", first.getItems().get(0).getPartNumber());
        assertEquals(2, first.getItems().get(0).getPlannedQty());

        ExtractedOrder second = orders.get(1);
        assertEquals("002", second.getOrderNumber());
        assertEquals(List.of(1, 3), second.getItems().stream().map(ExtractedOrderItem::getPlannedQty).toList());
    }

    @Test
    void headerFieldsAndIdentifiers() {
        List<ExtractedOrder> orders = assembler.assemble(3, HEADER, List.of("002"),
                List.of(line("68101-0E120-00", "TF63", List.of(4), 1)));

        ExtractedOrder order = orders.get(0);
        assertEquals(3, order.getPageNumber());
        assertEquals("02806-FL-20251117-002", order.getOwkNumber());
        assertEquals("20251117002", order.getRealOrderNumber());
        assertEquals("AGC Automotive", order.getCustomerName());
        assertEquals("02806", order.getSupplierCode());
        assertEquals("FL", order.getDockCode());
        assertEquals("20251117", order.getOrderSeries());
        assertEquals(LocalDateTime.of(2025, 11, 12, 0, 0), order.getOrderDate());
        assertEquals(LocalDateTime.of(2025, 11, 14, 13, 1), order.getArriveDateTime());
        assertNull(order.getDepartDateTime());

        ExtractedOrderItem item = order.getItems().get(0);
        assertEquals("TF63", item.getKanbanCode());
        assertEquals("TF63", item.getRawKanbanValue());
        assertEquals(12, item.getLotQty());
        assertEquals(0L, item.getManifestNo());
    }

    @Test
    void orderWithoutItems_isOmitted() {
        List<LineItemRecord> lines = List.of(line("68101-0E120-00", "TF63", List.of(1, 0, 2), 3));

        List<ExtractedOrder> orders = assembler.assemble(1, HEADER, List.of("001", "002", "003"), lines);

        assertEquals(List.of("001", "003"), orders.stream().map(ExtractedOrder::getOrderNumber).toList());
    }

    @Test
    void missingHeaderValues_leaveIdentifierSegmentsEmpty() {
        OrderHeader empty = OrderHeader.builder().build();

        ExtractedOrder order = assembler.assemble(1, empty, List.of("001"),
                List.of(line("68101-0E120-00", "TF63", List.of(1), 1))).get(0);

        assertEquals("---001", order.getOwkNumber());
        assertEquals("001", order.getRealOrderNumber());
    }

    @Test
    void noLineItems_noOrders() {
        assertTrue(assembler.assemble(1, HEADER, List.of("001"), List.of()).isEmpty());
    }
}
