package com.smurthy.ai.insights.filter;

import com.smurthy.ai.insights.extract.SemanticRow;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Client-side date filtering for procedures that return their whole history regardless of the requested range.
 */
@Component
public class DateRangeFilter {

    private static final DateTimeFormatter COMPACT = DateTimeFormatter.BASIC_ISO_DATE;

    /**
     * Keeps rows dated within {@code [start, end]}, both inclusive, in their original order.
     */
    public List<DatedRow> filter(List<DatedRow> rows, LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Both start and end dates are required");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Start date " + start + " is after end date " + end);
        }
        return rows.stream()
                .filter(r -> !r.date().isBefore(start) && !r.date().isAfter(end))
                .toList();
    }

    /**
     * @param start inclusive, {@code yyyy-MM-dd}
     * @param end   inclusive, {@code yyyy-MM-dd}
     */
    public List<DatedRow> filter(List<DatedRow> rows, String start, String end) {
        return filter(rows, parseDate(start), parseDate(end));
    }

    /**
     * Attaches the date held in {@code dateDimension} to each row. Rows without a parseable date are counted, not kept.
     */
    public DatedRows toDated(List<SemanticRow> rows, String dateDimension) {
        List<DatedRow> dated = new ArrayList<>(rows.size());
        int skipped = 0;
        for (SemanticRow row : rows) {
            Optional<LocalDate> date = tryParse(row.dimension(dateDimension));
            if (date.isPresent()) {
                dated.add(new DatedRow(date.get(), row));
            } else {
                skipped++;
            }
        }
        return new DatedRows(dated, skipped);
    }

    public static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Date is required (YYYY-MM-DD)");
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date '" + value + "', expected YYYY-MM-DD", e);
        }
    }

    static Optional<LocalDate> tryParse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        try {
            return Optional.of(trimmed.length() == 8 ? LocalDate.parse(trimmed, COMPACT) : LocalDate.parse(trimmed));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public record DatedRows(List<DatedRow> rows, int skippedRows) {
    }
}
