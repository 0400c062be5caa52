package com.questrail.designer.config;

import java.util.Objects;

/**
 * GeneratorSettings
 * -----------------------------------------------------------------------------
 * Fixed values the configuration generator writes where the diagram has no
 * field of its own, and placeholders for blank protocol fields.
 *
 * <h2>Defaults</h2>
 * <ul>
 *   <li><b>scanTimeMs</b>: 100</li>
 *   <li><b>s7PollIntervalMs</b>: 100</li>
 *   <li><b>twilioFromNumber</b>: {@code +1234567890} (placeholder, edited by the operator
 *       in the emitted text)</li>
 *   <li><b>twilioCooldownSeconds</b>: 300</li>
 *   <li><b>unknownTriggerName</b>: {@code unknown_trigger}, used for an unwired alert</li>
 *   <li>MQTT placeholders: {@code mqtt.lithos.systems:1883}, client {@code petra-01},
 *       prefix {@code petra/plc}</li>
 *   <li>Twilio placeholders: recipient {@code +1234567890}, content {@code Alert from Petra}</li>
 * </ul>
 */
public record GeneratorSettings(
        int scanTimeMs,
        int s7PollIntervalMs,
        String twilioFromNumber,
        int twilioCooldownSeconds,
        String unknownTriggerName,
        String defaultBrokerHost,
        int defaultBrokerPort,
        String defaultClientId,
        String defaultTopicPrefix,
        String defaultTwilioToNumber,
        String defaultTwilioContent
) {
    public GeneratorSettings {
        Objects.requireNonNull(twilioFromNumber, "twilioFromNumber");
        Objects.requireNonNull(unknownTriggerName, "unknownTriggerName");
        Objects.requireNonNull(defaultBrokerHost, "defaultBrokerHost");
        Objects.requireNonNull(defaultClientId, "defaultClientId");
        Objects.requireNonNull(defaultTopicPrefix, "defaultTopicPrefix");
        Objects.requireNonNull(defaultTwilioToNumber, "defaultTwilioToNumber");
        Objects.requireNonNull(defaultTwilioContent, "defaultTwilioContent");

        if (scanTimeMs <= 0) {
            throw new IllegalArgumentException("scanTimeMs must be positive");
        }
        if (s7PollIntervalMs <= 0) {
            throw new IllegalArgumentException("s7PollIntervalMs must be positive");
        }
        if (twilioCooldownSeconds < 0) {
            throw new IllegalArgumentException("twilioCooldownSeconds must be non-negative");
        }
    }

    public static GeneratorSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int scanTimeMs = 100;
        private int s7PollIntervalMs = 100;
        private String twilioFromNumber = "+1234567890";
        private int twilioCooldownSeconds = 300;
        private String unknownTriggerName = "unknown_trigger";
        private String defaultBrokerHost = "mqtt.lithos.systems";
        private int defaultBrokerPort = 1883;
        private String defaultClientId = "petra-01";
        private String defaultTopicPrefix = "petra/plc";
        private String defaultTwilioToNumber = "+1234567890";
        private String defaultTwilioContent = "Alert from Petra";

        public Builder withScanTimeMs(int scanTimeMs) {
            this.scanTimeMs = scanTimeMs;
            return this;
        }

        public Builder withS7PollIntervalMs(int s7PollIntervalMs) {
            this.s7PollIntervalMs = s7PollIntervalMs;
            return this;
        }

        public Builder withTwilioFromNumber(String twilioFromNumber) {
            this.twilioFromNumber = twilioFromNumber;
            return this;
        }

        public Builder withTwilioCooldownSeconds(int twilioCooldownSeconds) {
            this.twilioCooldownSeconds = twilioCooldownSeconds;
            return this;
        }

        public Builder withUnknownTriggerName(String unknownTriggerName) {
            this.unknownTriggerName = unknownTriggerName;
            return this;
        }

        public Builder withMqttPlaceholders(String host, int port, String clientId, String topicPrefix) {
            this.defaultBrokerHost = host;
            this.defaultBrokerPort = port;
            this.defaultClientId = clientId;
            this.defaultTopicPrefix = topicPrefix;
            return this;
        }

        public Builder withTwilioPlaceholders(String toNumber, String content) {
            this.defaultTwilioToNumber = toNumber;
            this.defaultTwilioContent = content;
            return this;
        }

        public GeneratorSettings build() {
            return new GeneratorSettings(scanTimeMs, s7PollIntervalMs, twilioFromNumber,
                    twilioCooldownSeconds, unknownTriggerName, defaultBrokerHost, defaultBrokerPort,
                    defaultClientId, defaultTopicPrefix, defaultTwilioToNumber, defaultTwilioContent);
        }
    }
}
