package com.questrail.designer.api;

/**
 * NodePayload
 * -----------------------------------------------------------------------------
 * Kind-specific configuration of a diagram {@link Node}.
 *
 * <h2>Tagged variant</h2>
 * Every node kind has exactly one payload type, and every payload type reports
 * the kind it belongs to:
 * <ul>
 *   <li>{@link SignalPayload}: {@link NodeKind#SIGNAL}</li>
 *   <li>{@link BlockPayload}: {@link NodeKind#BLOCK}</li>
 *   <li>{@link MqttPayload}: {@link NodeKind#MQTT}</li>
 *   <li>{@link S7Payload}: {@link NodeKind#S7}</li>
 *   <li>{@link TwilioPayload}: {@link NodeKind#TWILIO}</li>
 *   <li>{@link ModbusPayload}: {@link NodeKind#MODBUS}</li>
 * </ul>
 *
 * Code that reads kind-specific fields matches on the concrete payload type
 * rather than probing fields by name. The hierarchy is sealed so that the set
 * of variants is visible to the compiler and to readers.
 *
 * <h2>Immutability</h2>
 * Payloads are immutable records. Field-level edits produce a new payload via
 * the {@code withXxx} methods on each variant.
 */
public sealed interface NodePayload
        permits SignalPayload, BlockPayload, MqttPayload, S7Payload, TwilioPayload, ModbusPayload
{
    /**
     * Returns the node kind this payload belongs to.
     */
    NodeKind kind();

    /**
     * Returns the user-facing label. May be blank; never {@code null}.
     */
    String label();

    /**
     * Returns a copy of this payload with the label replaced.
     */
    NodePayload withLabel(String label);

    /**
     * Returns whether a protocol adapter payload has been marked as configured by
     * the operator. Signals and blocks are always considered configured.
     */
    default boolean configured() {
        return true;
    }
}
