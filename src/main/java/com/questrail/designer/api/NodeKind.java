package com.questrail.designer.api;

import java.util.Locale;
import java.util.Optional;

/**
 * NodeKind
 * -----------------------------------------------------------------------------
 * Closed set of node kinds a control-logic diagram may contain.
 *
 * <h2>Core kinds</h2>
 * <ul>
 *   <li>{@link #SIGNAL}: a typed, named value acting as a wire endpoint</li>
 *   <li>{@link #BLOCK}: a logic/math/timer/control unit with named ports</li>
 *   <li>{@link #MQTT}, {@link #S7}, {@link #TWILIO}: protocol adapters that the
 *       runtime configuration can express</li>
 * </ul>
 *
 * {@link #MODBUS} is an extension kind: it can be placed, edited and validated,
 * but the runtime configuration format has no section for it.
 *
 * The {@link #wireName()} is the lower-case identifier used by the diagram
 * editor and in diagnostics; it never changes for a given kind.
 */
public enum NodeKind
{
    SIGNAL("signal"),
    BLOCK("block"),
    MQTT("mqtt"),
    S7("s7"),
    TWILIO("twilio"),
    MODBUS("modbus");

    private final String wireName;

    NodeKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a kind from its wire name, ignoring case.
     *
     * @param name wire name such as {@code "signal"} or {@code "s7"}
     * @return the matching kind, or {@link Optional#empty()} if none matches
     */
    public static Optional<NodeKind> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for (NodeKind kind : values()) {
            if (kind.wireName.equals(lower)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
