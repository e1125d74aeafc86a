package com.example.ordersummary.model;

import java.time.LocalDateTime;

import lombok.Builder;
import lombok.Value;

/**
 * Page-level header attributes. Any field may be null when the report does not show it.
 */
@Value
@Builder
public class OrderHeader {

    String supplierName;
    String supplierCode;
    String dockCode;
    String orderSeries;
    LocalDateTime transmitDate;
    LocalDateTime arriveDateTime;
    LocalDateTime departDateTime;
    LocalDateTime unloadDateTime;
}
