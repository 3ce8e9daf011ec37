package com.deepansh.historyagent.tool;

import com.deepansh.historyagent.history.DateRange;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed accessors over a validated argument map, plus the schema fragments
 * shared by the date-filtered tools.
 * Accessors throw {@link IllegalArgumentException} for values the schema let through
 * but the query cannot use.
 */
public final class ToolArguments {

    public static final String START_DATE = "start_date";
    public static final String END_DATE = "end_date";

    private ToolArguments() {
    }

    public static Map<String, Object> dateProperty(String description) {
        return Map.of("type", "string", "format", "date", "description", description);
    }

    /** Properties map pre-filled with optional start_date / end_date */
    public static Map<String, Object> withDateRange(Map<String, Object> properties) {
        Map<String, Object> all = new LinkedHashMap<>(properties);
        all.put(START_DATE, dateProperty("Inclusive start date (YYYY-MM-DD). Omit for no lower bound."));
        all.put(END_DATE, dateProperty("Inclusive end date (YYYY-MM-DD). Omit for no upper bound."));
        return all;
    }

    public static Map<String, Object> objectSchema(Map<String, Object> properties, List<String> required) {
        return Map.of(
                "type", "object",
                "properties", properties,
                "required", required,
                "additionalProperties", false);
    }

    public static DateRange dateRange(Map<String, Object> arguments) {
        return new DateRange(date(arguments, START_DATE), date(arguments, END_DATE));
    }

    public static LocalDate date(Map<String, Object> arguments, String key) {
        Object value = arguments.get(key);
        if (value == null) return null;
        try {
            return LocalDate.parse(value.toString());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("'" + key + "' is not a YYYY-MM-DD date: " + value, e);
        }
    }

    public static String string(Map<String, Object> arguments, String key) {
        Object value = arguments.get(key);
        return value == null || value.toString().isBlank() ? null : value.toString().trim();
    }

    public static int integer(Map<String, Object> arguments, String key, int defaultValue) {
        Object value = arguments.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number number) return number.intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + key + "' is not an integer: " + value, e);
        }
    }
}
