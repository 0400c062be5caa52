package com.questrail.designer.api;

import java.util.Locale;
import java.util.Optional;

/**
 * Data direction of a field-device mapping, seen from the control runtime.
 */
public enum Direction
{
    READ("read"),
    WRITE("write"),
    READ_WRITE("read_write");

    private final String wireName;

    Direction(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<Direction> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String lower = name.trim().toLowerCase(Locale.ROOT);
        for (Direction d : values()) {
            if (d.wireName.equals(lower)) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
