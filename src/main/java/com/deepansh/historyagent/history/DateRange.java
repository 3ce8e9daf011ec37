package com.deepansh.historyagent.history;

import java.time.LocalDate;

/**
 * Inclusive date range. A null bound means unbounded on that side.
 */
public record DateRange(LocalDate start, LocalDate end) {

    public static final DateRange ALL = new DateRange(null, null);

    public DateRange {
        if (start != null && end != null && start.isAfter(end)) {
            throw new IllegalArgumentException("start " + start + " is after end " + end);
        }
    }

    public boolean contains(LocalDate date) {
        return (start == null || !date.isBefore(start)) && (end == null || !date.isAfter(end));
    }

    public boolean isUnbounded() {
        return start == null && end == null;
    }
}
