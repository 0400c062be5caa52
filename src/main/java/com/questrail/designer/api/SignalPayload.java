package com.questrail.designer.api;

import java.util.Locale;
import java.util.Objects;

/**
 * Payload of a {@link NodeKind#SIGNAL} node.
 *
 * @param label      user-facing label; the canonical signal name is derived from it
 * @param signalType declared value type
 * @param initial    initial value, converted to {@code signalType} on generation
 * @param mode       whether the editor treats the signal as read or written
 */
public record SignalPayload(String label,
                            SignalType signalType,
                            SignalValue initial,
                            Mode mode) implements NodePayload
{
    /**
     * Access mode of a signal in the editor.
     */
    public enum Mode {
        READ,
        WRITE;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public SignalPayload {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(signalType, "signalType");
        Objects.requireNonNull(initial, "initial");
        Objects.requireNonNull(mode, "mode");
    }

    public static SignalPayload of(String label, SignalType type, SignalValue initial) {
        return new SignalPayload(label, type, initial, Mode.WRITE);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SIGNAL;
    }

    @Override
    public SignalPayload withLabel(String label) {
        return new SignalPayload(label, signalType, initial, mode);
    }

    public SignalPayload withSignalType(SignalType signalType) {
        return new SignalPayload(label, signalType, initial, mode);
    }

    public SignalPayload withInitial(SignalValue initial) {
        return new SignalPayload(label, signalType, initial, mode);
    }

    public SignalPayload withMode(Mode mode) {
        return new SignalPayload(label, signalType, initial, mode);
    }
}
