package com.questrail.designer.api;

import java.util.Locale;
import java.util.Optional;

/**
 * Value type carried by a signal.
 */
public enum SignalType
{
    BOOL("bool"),
    INT("int"),
    FLOAT("float");

    private final String wireName;

    SignalType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<SignalType> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String lower = name.trim().toLowerCase(Locale.ROOT);
        for (SignalType type : values()) {
            if (type.wireName.equals(lower)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
