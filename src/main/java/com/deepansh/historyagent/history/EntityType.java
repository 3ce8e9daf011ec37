package com.deepansh.historyagent.history;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public enum EntityType {
    ARTIST, TRACK, ALBUM;

    public String wireName() {
        return name().toLowerCase();
    }

    public static Optional<EntityType> fromWireName(String value) {
        return Arrays.stream(values()).filter(t -> t.wireName().equalsIgnoreCase(value)).findFirst();
    }

    public static List<String> wireNames() {
        return Arrays.stream(values()).map(EntityType::wireName).toList();
    }
}
