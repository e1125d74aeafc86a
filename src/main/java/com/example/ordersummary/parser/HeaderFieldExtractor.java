package com.example.ordersummary.parser;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.example.ordersummary.config.ExtractionProperties;
import com.example.ordersummary.config.ExtractionProperties.YearSource;
import com.example.ordersummary.model.OrderHeader;
import com.example.ordersummary.utils.DateUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pulls the scalar header attributes (supplier, dock, order series, dates) out of page text.
 */
public class HeaderFieldExtractor extends BaseReportParser {

    private static final Logger log = LoggerFactory.getLogger(HeaderFieldExtractor.class);

    // -------------------- labels --------------------
    private static final Pattern P_SUPPLIER_NAME_LABEL = Pattern.compile(
            "Supplier\\s+Name\\s*:?\\s*([A-Za-z0-9\\s&\\-.]+?)(?=Supplier\\s+Code|\\d{5})", Pattern.CASE_INSENSITIVE);
    private static final Pattern P_SUPPLIER_CODE_LABEL = Pattern.compile(
            "Supplier\\s+Code\\s*:?\\s*(\\d{5})", Pattern.CASE_INSENSITIVE);
    private static final Pattern P_DOCK_CODE_LABEL = Pattern.compile(
            "NAMC\\s+Dock\\s+Code\\s*:?\\s*([A-Z][A-Z0-9])\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern P_ORDER_SERIES_LABEL = Pattern.compile(
            "Order\\s+Series\\s*:?\\s*(\\d{8})", Pattern.CASE_INSENSITIVE);
    private static final Pattern P_TRANSMIT_DATE_LABEL = Pattern.compile(
            "Transmit\\s+Date\\s*:?\\s*(\\d{4}[/\\-]\\d{2}[/\\-]\\d{2})", Pattern.CASE_INSENSITIVE);

    // -------------------- unlabeled fallbacks --------------------
    /** 02806FL: supplier code run straight into the dock code */
    private static final Pattern P_CODE_DOCK_CONCAT = Pattern.compile("(\\d{5})([A-Z][A-Z0-9])");
    private static final Pattern P_STANDALONE_DOCK = Pattern.compile("\\b([A-Z][A-Z0-9])\\b");
    private static final Pattern P_SERIES_TOKEN = Pattern.compile("\\b(202\\d{5})\\b");
    private static final Pattern P_SERIES_RUN = Pattern.compile("(?<![\\d/-])(202\\d{5})(?![/-])");
    private static final Pattern P_SERIES_AFTER_DOCK = Pattern.compile("([A-Z][A-Z0-9])(\\d{8})");
    private static final Pattern P_BARE_DATE = Pattern.compile("\\b(\\d{4}[/\\-]\\d{1,2}[/\\-]\\d{1,2})\\b");

    private final ExtractionProperties properties;
    private final Clock clock;

    private final PatternCascade<String> supplierName;
    private final PatternCascade<String> supplierCode;
    private final PatternCascade<String> dockCode;
    private final PatternCascade<String> orderSeries;
    private final PatternCascade<LocalDateTime> transmitDate;

    public HeaderFieldExtractor(ExtractionProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;

        List<String> known = properties.getKnownSuppliers();
        Pattern nameThenCode = Pattern.compile("(" + known.stream().map(Pattern::quote)
                .collect(Collectors.joining("|")) + ")\\s*(\\d{5})");

        this.supplierName = PatternCascade.<String>of("supplier name")
                .step("known supplier", text -> knownSupplier(text, known))
                .step("labeled", text -> extract(text, P_SUPPLIER_NAME_LABEL))
                .build();

        this.supplierCode = PatternCascade.<String>of("supplier code")
                .step("labeled", text -> extract(text, P_SUPPLIER_CODE_LABEL))
                .step("concatenated", text -> extract(text, P_CODE_DOCK_CONCAT, 1))
                .step("after name", text -> known.isEmpty() ? null : extract(text, nameThenCode, 2))
                .build();

        this.dockCode = PatternCascade.<String>of("dock code")
                .step("labeled", text -> upper(extract(text, P_DOCK_CODE_LABEL)))
                .step("concatenated", text -> extract(text, P_CODE_DOCK_CONCAT, 2))
                .step("header", text -> extract(head(text, properties.getHeaderScanLength()), P_STANDALONE_DOCK))
                .build();

        this.orderSeries = PatternCascade.<String>of("order series")
                .step("labeled", text -> extract(text, P_ORDER_SERIES_LABEL))
                .step("line scan", this::seriesOutsideDate)
                .step("8-digit run", text -> extract(text, P_SERIES_RUN))
                .step("after dock", text -> extract(text, P_SERIES_AFTER_DOCK, 2))
                .build();

        this.transmitDate = PatternCascade.<LocalDateTime>of("transmit date")
                .step("labeled", text -> startOfDay(extract(text, P_TRANSMIT_DATE_LABEL)))
                .step("header date", text -> startOfDay(extract(head(text, properties.getHeaderScanLength()), P_BARE_DATE)))
                .build();
    }

    public OrderHeader parseHeader(String text) {
        String series = orderSeries(text);
        return OrderHeader.builder()
                .supplierName(supplierName(text))
                .supplierCode(supplierCode(text))
                .dockCode(dockCode(text))
                .orderSeries(series)
                .transmitDate(transmitDate(text))
                .arriveDateTime(scheduled(text, "Arrive", series))
                .departDateTime(scheduled(text, "Depart", series))
                .unloadDateTime(scheduled(text, "Unload", series))
                .build();
    }

    public String supplierName(String text) {
        return supplierName.resolve(text);
    }

    public String supplierCode(String text) {
        return supplierCode.resolve(text);
    }

    public String dockCode(String text) {
        return dockCode.resolve(text);
    }

    public String orderSeries(String text) {
        return orderSeries.resolve(text);
    }

    public LocalDateTime transmitDate(String text) {
        return transmitDate.resolve(text);
    }

    /**
     * "Arrive Date 11/14" + "Arrive Time 13:01". The report prints no year.
     */
    public LocalDateTime scheduled(String text, String label, String series) {
        Matcher date = Pattern.compile(label + "\\s+Date\\s*:?\\s*(\\d{1,2})/(\\d{1,2})", Pattern.CASE_INSENSITIVE)
                .matcher(text);
        if (!date.find()) {
            log.info("Could not extract {} date from text", label.toLowerCase(Locale.ROOT));
            return null;
        }
        Matcher time = Pattern.compile(label + "\\s+Time\\s*:?\\s*(\\d{1,2}):(\\d{2})", Pattern.CASE_INSENSITIVE)
                .matcher(text);
        if (!time.find()) {
            log.info("Could not extract {} time from text", label.toLowerCase(Locale.ROOT));
            return null;
        }

        int month = Integer.parseInt(date.group(1));
        int day = Integer.parseInt(date.group(2));
        int hour = Integer.parseInt(time.group(1));
        int minute = Integer.parseInt(time.group(2));
        try {
            LocalDateTime value = DateUtils.monthDayTime(yearFor(series), month, day, hour, minute);
            log.debug("Extracted {} date/time: {}", label.toLowerCase(Locale.ROOT), value);
            return value;
        } catch (DateTimeException e) {
            log.warn("Invalid {} date/time {}/{} {}:{}", label.toLowerCase(Locale.ROOT), month, day, hour, minute);
            return null;
        }
    }

    int yearFor(String series) {
        if (properties.getYearSource() == YearSource.ORDER_SERIES) {
            Integer fromSeries = DateUtils.yearOfSeries(series);
            if (fromSeries != null) return fromSeries;
        }
        return LocalDate.now(clock).getYear();
    }

    // -------------------- cascade steps --------------------
    private String knownSupplier(String text, List<String> known) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String supplier : known) {
            if (lower.contains(supplier.toLowerCase(Locale.ROOT))) return supplier;
        }
        return null;
    }

    /** 8-digit 202nnnnn token on a line, unless it sits inside a slash date. */
    private String seriesOutsideDate(String text) {
        for (String line : text.split("\n")) {
            Matcher m = P_SERIES_TOKEN.matcher(line);
            if (m.find() && (line.indexOf('/') < 0 || m.start() > line.lastIndexOf('/'))) {
                return m.group(1);
            }
        }
        return null;
    }

    private LocalDateTime startOfDay(String dateText) {
        if (dateText == null) return null;
        try {
            return DateUtils.parseFlexibleDate(dateText).atStartOfDay();
        } catch (DateTimeParseException e) {
            log.warn("Invalid date extracted: {}", dateText);
            return null;
        }
    }

    private static String upper(String s) {
        return s == null ? null : s.toUpperCase(Locale.ROOT);
    }
}
