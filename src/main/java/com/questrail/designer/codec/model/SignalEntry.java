package com.questrail.designer.codec.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One {@code signals} entry. {@code initial} is a {@link Boolean}, {@link Long}
 * or {@link Double} matching {@code type}.
 */
@JsonPropertyOrder({"name", "type", "initial"})
public record SignalEntry(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("initial") Object initial
) {}
