package com.questrail.designer.codec.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * RuntimeConfig
 * -----------------------------------------------------------------------------
 * Top-level shape of the configuration text consumed by the control runtime.
 *
 * <pre>
 * signals:      [ SignalEntry ]
 * blocks:       [ BlockEntry ]
 * scan_time_ms: integer
 * twilio:       TwilioSection   (optional)
 * mqtt:         MqttSection     (optional)
 * s7:           S7Section       (optional)
 * </pre>
 *
 * Property order is fixed; downstream tooling and version control diff the
 * emitted text, so it must not depend on map iteration or reflection order.
 */
@JsonPropertyOrder({"signals", "blocks", "scan_time_ms", "twilio", "mqtt", "s7"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RuntimeConfig(
        @JsonProperty("signals") List<SignalEntry> signals,
        @JsonProperty("blocks") List<BlockEntry> blocks,
        @JsonProperty("scan_time_ms") int scanTimeMs,
        @JsonProperty("twilio") TwilioSection twilio,
        @JsonProperty("mqtt") MqttSection mqtt,
        @JsonProperty("s7") S7Section s7
) {
    public RuntimeConfig {
        signals = List.copyOf(Objects.requireNonNull(signals, "signals"));
        blocks = List.copyOf(Objects.requireNonNull(blocks, "blocks"));
    }
}
