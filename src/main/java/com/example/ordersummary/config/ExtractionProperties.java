package com.example.ordersummary.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Tunable constants of the order summary extraction.
 * <p>
 * The geometric tolerances are in page units and were tuned against the font metrics of the
 * daily one-way kanban order summary report.
 */
@Data
@ConfigurationProperties(prefix = "order-summary.extraction")
public class ExtractionProperties {

    /** Bucket size used to cluster words into rows by their bottom edge. */
    private double rowBucketSize = 5.0;

    /** Max vertical distance from the averaged "Order Number" header y. */
    private double headerRowTolerance = 10.0;

    /** Max vertical distance from the part number word when collecting a row. */
    private double partRowTolerance = 5.0;

    /** Max horizontal distance between a quantity token and its column center. */
    private double columnTolerance = 30.0;

    /** Characters after a part number scanned by the concatenated-layout fallback. */
    private int fallbackContextLength = 200;

    /** Leading characters treated as the page header for loose header scans. */
    private int headerScanLength = 500;

    private String defaultOrderNumber = "001";

    private List<String> knownSuppliers = new ArrayList<>(
            Arrays.asList("AGC Automotive", "Toyota", "Denso", "Aisin", "Bridgestone"));

    /** Where month/day-only header dates take their year from. */
    private YearSource yearSource = YearSource.CLOCK;

    public enum YearSource {
        /** Current year of the wall clock. */
        CLOCK,
        /** Year prefix of the order series, the clock when no series was found. */
        ORDER_SERIES
    }
}
