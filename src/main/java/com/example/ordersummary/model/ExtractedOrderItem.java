package com.example.ordersummary.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ExtractedOrderItem {

    /** e.g. 68101-0E120-00 */
    String partNumber;
    String description;
    /** Total committed quantity for the part across all orders on the page. */
    Integer lotQty;
    String kanbanCode;
    /** Quantity for this specific order number. */
    int plannedQty;
    String rawKanbanValue;
    /** The report carries no manifest numbers, so this stays 0. */
    long manifestNo;
}
