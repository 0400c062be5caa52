package com.questrail.designer.codec.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * The {@code mqtt} section. Only one broker connection is representable.
 * Credentials are omitted when not set.
 */
@JsonPropertyOrder({"broker_host", "broker_port", "client_id", "topic_prefix", "publish_on_change",
        "username", "password"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MqttSection(
        @JsonProperty("broker_host") String brokerHost,
        @JsonProperty("broker_port") int brokerPort,
        @JsonProperty("client_id") String clientId,
        @JsonProperty("topic_prefix") String topicPrefix,
        @JsonProperty("publish_on_change") boolean publishOnChange,
        @JsonProperty("username") String username,
        @JsonProperty("password") String password
) {}
