package com.questrail.designer.validation;

import com.questrail.designer.api.BlockPayload;
import com.questrail.designer.api.ModbusPayload;
import com.questrail.designer.api.MqttPayload;
import com.questrail.designer.api.Node;
import com.questrail.designer.api.NodePayload;
import com.questrail.designer.api.S7Payload;
import com.questrail.designer.api.SignalPayload;
import com.questrail.designer.api.TwilioPayload;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * FieldValidator
 * -----------------------------------------------------------------------------
 * Per-kind configuration rules for node payloads.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Dispatches on the payload variant; every variant has a rule set</li>
 *   <li>Stops at the first failing field and returns a single message naming it</li>
 *   <li>Never throws; failures are {@link ValidationResult.ErrorKind#FIELD} results</li>
 * </ul>
 *
 * Enumerated fields (signal type, S7 area, data types, directions) are already
 * closed by the type system and need no runtime check here.
 */
public final class FieldValidator
{
    public static final long MAX_TIMER_PRESET_MS = 3_600_000L;
    public static final double MAX_GENERATOR_FREQUENCY = 100.0;
    public static final int MAX_SMS_LENGTH = 1600;

    private static final Pattern E164 = Pattern.compile("^\\+[1-9]\\d{1,14}$");
    private static final Pattern OCTET = Pattern.compile("\\d{1,3}");

    private static final Set<String> TIMER_TYPES = Set.of("ON_DELAY", "OFF_DELAY", "TON", "TOF", "PULSE");
    private static final String DATA_GENERATOR = "DATA_GENERATOR";

    public ValidationResult validateFields(Node node) {
        Objects.requireNonNull(node, "node");
        return validatePayload(node.payload());
    }

    public ValidationResult validatePayload(NodePayload payload) {
        Objects.requireNonNull(payload, "payload");

        if (payload instanceof SignalPayload p) {
            return validateSignal(p);
        }
        if (payload instanceof BlockPayload p) {
            return validateBlock(p);
        }
        if (payload instanceof TwilioPayload p) {
            return validateTwilio(p);
        }
        if (payload instanceof MqttPayload p) {
            return validateMqtt(p);
        }
        if (payload instanceof S7Payload p) {
            return validateS7(p);
        }
        if (payload instanceof ModbusPayload p) {
            return validateModbus(p);
        }
        return ValidationResult.field("Unsupported node kind: " + payload.kind());
    }

    // ---------------------------------------------------------------------
    // Per-kind rules
    // ---------------------------------------------------------------------

    private ValidationResult validateSignal(SignalPayload p) {
        if (p.label().isBlank()) {
            return ValidationResult.field("Signal label is required");
        }
        return ValidationResult.ok();
    }

    private ValidationResult validateBlock(BlockPayload p) {
        if (p.label().isBlank()) {
            return ValidationResult.field("Block label is required");
        }
        if (p.blockType().isBlank()) {
            return ValidationResult.field("Block type is required");
        }

        String type = p.blockType().trim().toUpperCase(Locale.ROOT);
        if (TIMER_TYPES.contains(type)) {
            Optional<Double> preset = p.param("preset_ms");
            if (preset.isEmpty()) {
                return ValidationResult.field("Timer preset (preset_ms) is required");
            }
            double ms = preset.get();
            if (Double.isNaN(ms) || ms < 0 || ms > MAX_TIMER_PRESET_MS) {
                return ValidationResult.field(
                        "Timer preset (preset_ms) must be between 0 and " + MAX_TIMER_PRESET_MS + " ms");
            }
        }
        if (DATA_GENERATOR.equals(type)) {
            double frequency = p.param("frequency").orElse(1.0);
            if (Double.isNaN(frequency) || frequency < 0 || frequency > MAX_GENERATOR_FREQUENCY) {
                return ValidationResult.field("Frequency must be between 0 and 100 Hz");
            }
            double amplitude = p.param("amplitude").orElse(1.0);
            if (Double.isNaN(amplitude) || amplitude <= 0) {
                return ValidationResult.field("Amplitude must be greater than 0");
            }
        }
        return ValidationResult.ok();
    }

    private ValidationResult validateTwilio(TwilioPayload p) {
        if (!E164.matcher(p.toNumber()).matches()) {
            return ValidationResult.field("To number must be in E.164 format (e.g. +15551234567)");
        }
        if (p.content().isBlank()) {
            return ValidationResult.field("Message content is required");
        }
        if (p.content().length() > MAX_SMS_LENGTH) {
            return ValidationResult.field("Message content must be at most " + MAX_SMS_LENGTH + " characters");
        }
        return ValidationResult.ok();
    }

    private ValidationResult validateMqtt(MqttPayload p) {
        if (p.brokerHost().isBlank()) {
            return ValidationResult.field("Broker host is required");
        }
        if (p.brokerPort() < 1 || p.brokerPort() > 65535) {
            return ValidationResult.field("Broker port must be between 1 and 65535");
        }
        if (p.clientId().isBlank()) {
            return ValidationResult.field("Client ID is required");
        }
        if (p.topicPrefix().isBlank()) {
            return ValidationResult.field("Topic prefix is required");
        }
        if (p.topicPrefix().contains("#") || p.topicPrefix().contains("+")) {
            return ValidationResult.field("Topic prefix must not contain MQTT wildcards (# or +)");
        }
        return ValidationResult.ok();
    }

    private ValidationResult validateS7(S7Payload p) {
        if (p.signal().isBlank()) {
            return ValidationResult.field("Signal name is required");
        }
        if (!isIpv4(p.ip())) {
            return ValidationResult.field("IP address must be a valid IPv4 address");
        }
        if (p.rack() < 0 || p.rack() > 7) {
            return ValidationResult.field("Rack must be between 0 and 7");
        }
        if (p.slot() < 0 || p.slot() > 31) {
            return ValidationResult.field("Slot must be between 0 and 31");
        }
        if (p.area() == S7Payload.Area.DB && p.dbNumber() < 1) {
            return ValidationResult.field("DB number must be at least 1 for the DB area");
        }
        if (p.address() < 0) {
            return ValidationResult.field("Address must not be negative");
        }
        if (p.dataType() == S7Payload.DataType.BOOL) {
            Integer bit = p.bit();
            if (bit == null || bit < 0 || bit > 7) {
                return ValidationResult.field("Bit must be between 0 and 7 for bool data");
            }
        }
        return ValidationResult.ok();
    }

    private ValidationResult validateModbus(ModbusPayload p) {
        if (p.host().isBlank()) {
            return ValidationResult.field("Host is required");
        }
        if (p.port() < 1 || p.port() > 65535) {
            return ValidationResult.field("Port must be between 1 and 65535");
        }
        if (p.unitId() < 0 || p.unitId() > 247) {
            return ValidationResult.field("Unit ID must be between 0 and 247");
        }
        if (p.address() < 0 || p.address() > 65535) {
            return ValidationResult.field("Address must be between 0 and 65535");
        }
        if (p.signal().isBlank()) {
            return ValidationResult.field("Signal name is required");
        }
        return ValidationResult.ok();
    }

    static boolean isIpv4(String ip) {
        if (ip == null) {
            return false;
        }
        String[] octets = ip.split("\\.", -1);
        if (octets.length != 4) {
            return false;
        }
        for (String octet : octets) {
            if (!OCTET.matcher(octet).matches() || Integer.parseInt(octet) > 255) {
                return false;
            }
        }
        return true;
    }
}
