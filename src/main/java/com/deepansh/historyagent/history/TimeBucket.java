package com.deepansh.historyagent.history;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public enum TimeBucket {
    HOUR, WEEKDAY, MONTH, YEAR;

    /** Calendar buckets run forward in time; they are listed newest first so truncation keeps recent periods */
    public boolean isChronological() {
        return this == MONTH || this == YEAR;
    }

    public String wireName() {
        return name().toLowerCase();
    }

    public static Optional<TimeBucket> fromWireName(String value) {
        return Arrays.stream(values()).filter(b -> b.wireName().equalsIgnoreCase(value)).findFirst();
    }

    public static List<String> wireNames() {
        return Arrays.stream(values()).map(TimeBucket::wireName).toList();
    }
}
