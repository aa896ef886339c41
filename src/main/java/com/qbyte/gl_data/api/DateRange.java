package com.qbyte.gl_data.api;

import com.qbyte.gl_data.exception.InvalidRangeException;
import lombok.Value;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A validated {@code start_date}/{@code end_date} pair from query parameters.
 *
 * Rules:
 * - both or neither must be supplied
 * - values are trimmed and parsed as YYYY-MM-DD
 * - start must not be after end
 */
@Value
public class DateRange {
    LocalDate start;
    LocalDate end;

    /**
     * Parses an optional range. Empty when neither parameter is supplied.
     *
     * @throws InvalidRangeException echoing the offending parameters
     */
    public static Optional<DateRange> parse(String startDate, String endDate) {
        if (startDate == null && endDate == null) {
            return Optional.empty();
        }

        if (startDate == null || endDate == null) {
            throw new InvalidRangeException(
                "Both start_date and end_date must be provided together", echo(startDate, endDate));
        }

        LocalDate start = parseDate("start_date", startDate);
        LocalDate end = parseDate("end_date", endDate);

        if (start.isAfter(end)) {
            throw new InvalidRangeException(
                "start_date must be before or equal to end_date", echo(start.toString(), end.toString()));
        }

        return Optional.of(new DateRange(start, end));
    }

    private static LocalDate parseDate(String field, String value) {
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw InvalidRangeException.forField(
                "Invalid date format for " + field + ". Use YYYY-MM-DD format.", field, value);
        }
    }

    private static Map<String, String> echo(String startDate, String endDate) {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("start_date", startDate != null ? startDate : "null");
        details.put("end_date", endDate != null ? endDate : "null");
        return details;
    }
}
