package com.questrail.designer.api;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Payload of a {@link NodeKind#MQTT} node: one broker connection.
 *
 * {@code username} and {@code password} are optional and may be {@code null};
 * use {@link #credentials()} to read them.
 */
public record MqttPayload(String label,
                          boolean configured,
                          String brokerHost,
                          int brokerPort,
                          String clientId,
                          String topicPrefix,
                          String username,
                          String password,
                          Mode mode,
                          boolean publishOnChange) implements NodePayload
{
    public enum Mode {
        READ,
        WRITE,
        READ_WRITE;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Broker credentials, present only when a username is set.
     */
    public record Credentials(String username, String password) {}

    public MqttPayload {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(brokerHost, "brokerHost");
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(topicPrefix, "topicPrefix");
        Objects.requireNonNull(mode, "mode");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MQTT;
    }

    public Optional<Credentials> credentials() {
        if (username == null || username.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new Credentials(username, password == null ? "" : password));
    }

    @Override
    public MqttPayload withLabel(String label) {
        return new MqttPayload(label, configured, brokerHost, brokerPort, clientId, topicPrefix,
                username, password, mode, publishOnChange);
    }

    public MqttPayload withConfigured(boolean configured) {
        return new MqttPayload(label, configured, brokerHost, brokerPort, clientId, topicPrefix,
                username, password, mode, publishOnChange);
    }

    public MqttPayload withBroker(String brokerHost, int brokerPort) {
        return new MqttPayload(label, configured, brokerHost, brokerPort, clientId, topicPrefix,
                username, password, mode, publishOnChange);
    }

    public MqttPayload withClientId(String clientId) {
        return new MqttPayload(label, configured, brokerHost, brokerPort, clientId, topicPrefix,
                username, password, mode, publishOnChange);
    }

    public MqttPayload withTopicPrefix(String topicPrefix) {
        return new MqttPayload(label, configured, brokerHost, brokerPort, clientId, topicPrefix,
                username, password, mode, publishOnChange);
    }

    public MqttPayload withCredentials(String username, String password) {
        return new MqttPayload(label, configured, brokerHost, brokerPort, clientId, topicPrefix,
                username, password, mode, publishOnChange);
    }

    public MqttPayload withMode(Mode mode) {
        return new MqttPayload(label, configured, brokerHost, brokerPort, clientId, topicPrefix,
                username, password, mode, publishOnChange);
    }

    public MqttPayload withPublishOnChange(boolean publishOnChange) {
        return new MqttPayload(label, configured, brokerHost, brokerPort, clientId, topicPrefix,
                username, password, mode, publishOnChange);
    }
}
