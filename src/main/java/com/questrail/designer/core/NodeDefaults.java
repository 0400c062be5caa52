package com.questrail.designer.core;

import com.questrail.designer.api.BlockPayload;
import com.questrail.designer.api.Direction;
import com.questrail.designer.api.ModbusPayload;
import com.questrail.designer.api.MqttPayload;
import com.questrail.designer.api.NodeKind;
import com.questrail.designer.api.NodePayload;
import com.questrail.designer.api.S7Payload;
import com.questrail.designer.api.SignalPayload;
import com.questrail.designer.api.SignalType;
import com.questrail.designer.api.SignalValue;
import com.questrail.designer.api.TwilioPayload;

import java.util.Locale;

/**
 * Payloads given to newly created nodes. Protocol nodes start unconfigured, so
 * they are left out of generated text until the operator marks them configured.
 */
public final class NodeDefaults
{
    private NodeDefaults() {}

    public static NodePayload payloadFor(NodeKind kind) {
        switch (kind) {
            case SIGNAL:
                return SignalPayload.of("New Signal", SignalType.FLOAT, SignalValue.of(0.0));
            case BLOCK:
                return block(BlockCatalog.DEFAULT_BLOCK_TYPE);
            case MQTT:
                return new MqttPayload("New MQTT", false, "localhost", 1883, "petra_client", "petra",
                        null, null, MqttPayload.Mode.READ_WRITE, true);
            case S7:
                return new S7Payload("New S7", false, "192.168.1.100", 0, 1, S7Payload.Area.DB, 1, 0,
                        S7Payload.DataType.REAL, null, Direction.READ, "plc_data");
            case TWILIO:
                return new TwilioPayload("New Twilio", false, TwilioPayload.ActionType.SMS,
                        "+1234567890", "Alert from PETRA");
            case MODBUS:
                return new ModbusPayload("New Modbus", false, "localhost", 502, 1, 0,
                        ModbusPayload.RegisterType.HOLDING_REGISTER, Direction.READ, "modbus_data");
            default:
                throw new IllegalArgumentException("Unsupported node kind: " + kind);
        }
    }

    public static BlockPayload block(String blockType) {
        BlockCatalog.Template t = BlockCatalog.templateFor(blockType);
        return new BlockPayload("New " + blockType.trim().toUpperCase(Locale.ROOT), t.blockType(),
                t.inputs(), t.outputs(), t.params());
    }
}
