package com.example.ordersummary.parser;

import com.example.ordersummary.model.ColumnMap;
import com.example.ordersummary.model.LineItemRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LineItemExtractorTest {

    private static final List<String> TWO_ORDERS = List.of("001", "002");
    private static final List<String> THREE_ORDERS = List.of("001", "002", "003");

    private final LineItemExtractor extractor = new LineItemExtractor(200, new QuantityColumnResolver(5, 30));

    private List<LineItemRecord> extract(String text, List<String> orderNumbers) {
        return extractor.extract(text, orderNumbers, List.of(), ColumnMap.empty());
    }

    @Test
    void cleanRows_decomposeIntoFields() {
        String text = String.join("\n",
                "Order Number 001 002",
                "68101-0E120-00 GLASS SUB-ASSY BA 00012 TF63 2 1",
                "68105-0E131-00 GLASS SUB-ASSY FR 00013 TF64 0 3");

        List<LineItemRecord> items = extract(text, TWO_ORDERS);

        assertEquals(2, items.size());
        LineItemRecord first = items.get(0);
        assertEquals("68101-0E120-00", first.getPartNumber());
        assertEquals("GLASS SUB-ASSY BA", first.getDescription());
        assertEquals(12, first.getLotQty());
        assertEquals("TF63", first.getKanbanCode());
        assertEquals(List.of(2, 1), first.getQuantities());
        assertEquals(List.of(0, 3), items.get(1).getQuantities());
    }

    @Test
    void longDescription_isKeptWhole() {
        List<LineItemRecord> items = extract("68101-0E120-00 GLASS SUB-ASSY FR DOOR 00045 MH98 1 1 1", THREE_ORDERS);

        assertEquals(1, items.size());
        assertEquals("GLASS SUB-ASSY FR DOOR", items.get(0).getDescription());
        assertEquals("MH98", items.get(0).getKanbanCode());
        assertEquals(List.of(1, 1, 1), items.get(0).getQuantities());
    }

    @Test
    void rowWithoutQuantities_isAllZeros() {
        List<LineItemRecord> items = extract("68105-0E131-00 GLASS SUB-ASSY BA 00012 TF63", TWO_ORDERS);

        assertEquals(1, items.size());
        assertEquals("TF63", items.get(0).getKanbanCode());
        assertEquals(List.of(0, 0), items.get(0).getQuantities());
    }

    @Test
    void quantityVector_alwaysMatchesOrderCount() {
        String text = String.join("\n",
                "68101-0E120-00 GLASS SUB-ASSY BA 00012 TF63 5 6 7",
                "68105-0E131-00 GLASS SUB-ASSY FR 00013 TF64 4");

        List<LineItemRecord> items = extract(text, TWO_ORDERS);

        assertEquals(List.of(5, 6), items.get(0).getQuantities());
        assertEquals(List.of(4, 0), items.get(1).getQuantities());
    }

    @Test
    void unparseableRow_isSkippedOthersKept() {
        String text = String.join("\n",
                "68101-0E120-00 ??? 12",
                "68105-0E131-00 GLASS SUB-ASSY FR 00013 TF64 1 2");

        List<LineItemRecord> items = extract(text, TWO_ORDERS);

        assertEquals(1, items.size());
        assertEquals("68105-0E131-00", items.get(0).getPartNumber());
    }

    @Test
    void concatenatedLayout_splitsOneDigitPerOrder() {
        String text = String.join("\n",
                "Order Number 001 002 003",
                "Lots Ord'd 68101-0E120-00 GLASS SUB-ASSY FR00045FA99436",
                "68105-0E131-00 GLASS SUB-ASSY BA00012TF63102",
                "");

        List<LineItemRecord> items = extract(text, THREE_ORDERS);

        assertEquals(2, items.size());
        LineItemRecord first = items.get(0);
        assertEquals("68101-0E120-00", first.getPartNumber());
        assertEquals("GLASS SUB-ASSY FR", first.getDescription());
        assertEquals(45, first.getLotQty());
        assertEquals("FA99", first.getKanbanCode());
        assertEquals(List.of(4, 3, 6), first.getQuantities());

        LineItemRecord second = items.get(1);
        assertEquals("TF63", second.getKanbanCode());
        assertEquals(List.of(1, 0, 2), second.getQuantities());
    }

    @Test
    void concatenatedLayout_singleOrder() {
        List<LineItemRecord> items = extract("Lots Ord'd 00168101-0E120-00 GLASS SUB-ASSY FR00045FA994\n", List.of("001"));

        assertEquals(1, items.size());
        assertEquals("FA99", items.get(0).getKanbanCode());
        assertEquals(45, items.get(0).getLotQty());
        assertEquals(List.of(4), items.get(0).getQuantities());
    }

    @Test
    void concatenatedLayout_kanbanWithInnerDigitStaysWhole() {
        List<LineItemRecord> single = extract("Lots Ord'd 00168101-0E120-00 GLASS SUB-ASSY FR00045HN7X4\n", List.of("001"));

        assertEquals(1, single.size());
        assertEquals("HN7X", single.get(0).getKanbanCode());
        assertEquals(List.of(4), single.get(0).getQuantities());

        List<LineItemRecord> two = extract(
                "Order Number 001 002\nLots Ord'd 68101-0E120-00 GLASS SUB-ASSY FR00045HN7X12\n", TWO_ORDERS);

        assertEquals(1, two.size());
        assertEquals("HN7X", two.get(0).getKanbanCode());
        assertEquals(List.of(1, 2), two.get(0).getQuantities());
    }

    @Test
    void concatenatedLayout_fallsBackToPieces() {
        List<LineItemRecord> items = extract("68101-0E120-00 12 GLASS 00045FA99", TWO_ORDERS);

        assertEquals(1, items.size());
        LineItemRecord item = items.get(0);
        assertNull(item.getDescription());
        assertEquals(45, item.getLotQty());
        assertEquals("FA99", item.getKanbanCode());
        assertEquals(List.of(0, 0), item.getQuantities());
    }

    @Test
    void piecewise_withNothingRecognisable() {
        LineItemRecord item = extractor.piecewise("68101-0E120-00", " ???", 3);

        assertNull(item.getDescription());
        assertNull(item.getLotQty());
        assertNull(item.getKanbanCode());
        assertEquals(List.of(0, 0, 0), item.getQuantities());
    }

    @Test
    void noPartNumbers_noItems() {
        assertTrue(extract("Daily One-Way Kanban Order Summary Report", TWO_ORDERS).isEmpty());
    }
}
