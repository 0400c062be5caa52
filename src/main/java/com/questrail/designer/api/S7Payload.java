package com.questrail.designer.api;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * S7Payload
 * -----------------------------------------------------------------------------
 * Payload of a {@link NodeKind#S7} node: one Siemens S7 memory mapping together
 * with the PLC connection it is read from or written to.
 *
 * <h2>Addressing</h2>
 * <ul>
 *   <li>{@code area} selects the memory area (data block, inputs, outputs, markers)</li>
 *   <li>{@code dbNumber} is only meaningful for {@link Area#DB}</li>
 *   <li>{@code bit} is only meaningful for {@link DataType#BOOL} and may be {@code null}</li>
 * </ul>
 *
 * {@code signal} names the diagram signal the mapping feeds or is fed by.
 */
public record S7Payload(String label,
                        boolean configured,
                        String ip,
                        int rack,
                        int slot,
                        Area area,
                        int dbNumber,
                        int address,
                        DataType dataType,
                        Integer bit,
                        Direction direction,
                        String signal) implements NodePayload
{
    public enum Area {
        DB, I, Q, M;

        public String wireName() {
            return name();
        }

        public static Optional<Area> fromWireName(String name) {
            if (name == null) {
                return Optional.empty();
            }
            String upper = name.trim().toUpperCase(Locale.ROOT);
            for (Area a : values()) {
                if (a.name().equals(upper)) {
                    return Optional.of(a);
                }
            }
            return Optional.empty();
        }
    }

    public enum DataType {
        BOOL, BYTE, WORD, INT, DINT, REAL;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Optional<DataType> fromWireName(String name) {
            if (name == null) {
                return Optional.empty();
            }
            String lower = name.trim().toLowerCase(Locale.ROOT);
            for (DataType t : values()) {
                if (t.wireName().equals(lower)) {
                    return Optional.of(t);
                }
            }
            return Optional.empty();
        }
    }

    public S7Payload {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(ip, "ip");
        Objects.requireNonNull(area, "area");
        Objects.requireNonNull(dataType, "dataType");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(signal, "signal");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.S7;
    }

    public Optional<Integer> bitOffset() {
        return Optional.ofNullable(bit);
    }

    @Override
    public S7Payload withLabel(String label) {
        return new S7Payload(label, configured, ip, rack, slot, area, dbNumber, address, dataType, bit, direction, signal);
    }

    public S7Payload withConfigured(boolean configured) {
        return new S7Payload(label, configured, ip, rack, slot, area, dbNumber, address, dataType, bit, direction, signal);
    }

    public S7Payload withConnection(String ip, int rack, int slot) {
        return new S7Payload(label, configured, ip, rack, slot, area, dbNumber, address, dataType, bit, direction, signal);
    }

    public S7Payload withArea(Area area, int dbNumber) {
        return new S7Payload(label, configured, ip, rack, slot, area, dbNumber, address, dataType, bit, direction, signal);
    }

    public S7Payload withAddress(int address, Integer bit) {
        return new S7Payload(label, configured, ip, rack, slot, area, dbNumber, address, dataType, bit, direction, signal);
    }

    public S7Payload withDataType(DataType dataType) {
        return new S7Payload(label, configured, ip, rack, slot, area, dbNumber, address, dataType, bit, direction, signal);
    }

    public S7Payload withDirection(Direction direction) {
        return new S7Payload(label, configured, ip, rack, slot, area, dbNumber, address, dataType, bit, direction, signal);
    }

    public S7Payload withSignal(String signal) {
        return new S7Payload(label, configured, ip, rack, slot, area, dbNumber, address, dataType, bit, direction, signal);
    }
}
