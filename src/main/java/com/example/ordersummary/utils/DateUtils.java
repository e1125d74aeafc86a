package com.example.ordersummary.utils;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;

public class DateUtils {

    // Date layouts seen in report headers
    private static final List<DateTimeFormatter> DATE_FORMATTERS = List.of(
            DateTimeFormatter.ofPattern("uuuu/MM/dd").withResolverStyle(ResolverStyle.STRICT), // 2025/11/12
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT), // 2025-11-12
            DateTimeFormatter.ofPattern("uuuu/M/d").withResolverStyle(ResolverStyle.STRICT),   // 2025/1/5
            DateTimeFormatter.ofPattern("uuuu-M-d").withResolverStyle(ResolverStyle.STRICT)    // 2025-1-5
    );

    private DateUtils() {
    }

    public static LocalDate parseFlexibleDate(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Date text is empty");
        }

        String value = text.trim();

        DateTimeParseException last = null;
        for (DateTimeFormatter formatter : DATE_FORMATTERS) {
            try {
                return LocalDate.parse(value, formatter);
            } catch (DateTimeParseException e) {
                last = e;
            }
        }

        throw new DateTimeParseException("Unsupported date format: " + value, value, 0, last);
    }

    /**
     * Builds a timestamp from a month/day pair and a time of day.
     *
     * @throws java.time.DateTimeException when the values do not form a valid date or time
     */
    public static LocalDateTime monthDayTime(int year, int month, int day, int hour, int minute) {
        return LocalDateTime.of(year, month, day, hour, minute);
    }

    /**
     * Year of an 8-digit yyyyMMdd order series, or null when the series does not carry one.
     */
    public static Integer yearOfSeries(String orderSeries) {
        if (orderSeries == null || !orderSeries.matches("\\d{8}")) return null;
        return Integer.parseInt(orderSeries.substring(0, 4));
    }
}
