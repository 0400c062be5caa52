package com.questrail.designer.api;

import java.util.Locale;
import java.util.Objects;

/**
 * Payload of a {@link NodeKind#MODBUS} node (extension kind).
 *
 * Modbus mappings can be edited and validated, but are not part of the runtime
 * configuration text and are ignored by the generator.
 */
public record ModbusPayload(String label,
                            boolean configured,
                            String host,
                            int port,
                            int unitId,
                            int address,
                            RegisterType dataType,
                            Direction direction,
                            String signal) implements NodePayload
{
    public enum RegisterType {
        COIL,
        DISCRETE_INPUT,
        INPUT_REGISTER,
        HOLDING_REGISTER;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public ModbusPayload {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(dataType, "dataType");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(signal, "signal");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MODBUS;
    }

    @Override
    public ModbusPayload withLabel(String label) {
        return new ModbusPayload(label, configured, host, port, unitId, address, dataType, direction, signal);
    }

    public ModbusPayload withConfigured(boolean configured) {
        return new ModbusPayload(label, configured, host, port, unitId, address, dataType, direction, signal);
    }

    public ModbusPayload withEndpoint(String host, int port) {
        return new ModbusPayload(label, configured, host, port, unitId, address, dataType, direction, signal);
    }

    public ModbusPayload withUnitId(int unitId) {
        return new ModbusPayload(label, configured, host, port, unitId, address, dataType, direction, signal);
    }

    public ModbusPayload withAddress(int address) {
        return new ModbusPayload(label, configured, host, port, unitId, address, dataType, direction, signal);
    }

    public ModbusPayload withSignal(String signal) {
        return new ModbusPayload(label, configured, host, port, unitId, address, dataType, direction, signal);
    }
}
