package com.example.ordersummary.model;

import java.time.LocalDateTime;
import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * One logical order: a single order number of a single page, with its positive-quantity items.
 */
@Value
public class ExtractedOrder {

    int pageNumber;

    /** supplierCode-dockCode-orderSeries-orderNumber */
    String owkNumber;
    /** orderSeries + orderNumber, e.g. 2025111701 */
    String realOrderNumber;
    String orderNumber;

    String customerName;
    String supplierCode;
    String dockCode;
    String orderSeries;

    LocalDateTime orderDate;
    LocalDateTime arriveDateTime;
    LocalDateTime departDateTime;
    LocalDateTime unloadDateTime;

    List<ExtractedOrderItem> items;
    /** Always items.size(). */
    int itemCount;

    @Builder
    private ExtractedOrder(int pageNumber, String owkNumber, String realOrderNumber, String orderNumber,
                           String customerName, String supplierCode, String dockCode, String orderSeries,
                           LocalDateTime orderDate, LocalDateTime arriveDateTime, LocalDateTime departDateTime,
                           LocalDateTime unloadDateTime, @Singular List<ExtractedOrderItem> items) {
        this.pageNumber = pageNumber;
        this.owkNumber = owkNumber;
        this.realOrderNumber = realOrderNumber;
        this.orderNumber = orderNumber;
        this.customerName = customerName;
        this.supplierCode = supplierCode;
        this.dockCode = dockCode;
        this.orderSeries = orderSeries;
        this.orderDate = orderDate;
        this.arriveDateTime = arriveDateTime;
        this.departDateTime = departDateTime;
        this.unloadDateTime = unloadDateTime;
        this.items = items;
        this.itemCount = items.size();
    }
}
