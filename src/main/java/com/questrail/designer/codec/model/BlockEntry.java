package com.questrail.designer.codec.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One {@code blocks} entry. The {@code inputs}/{@code outputs} maps go from port
 * name to wire (signal) name and keep the block's declared port order.
 * {@code params} is {@code null} when the block has none, so that the key is
 * omitted from the text.
 */
@JsonPropertyOrder({"name", "type", "inputs", "outputs", "params"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BlockEntry(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("inputs") Map<String, String> inputs,
        @JsonProperty("outputs") Map<String, String> outputs,
        @JsonProperty("params") Map<String, Object> params
) {
    public BlockEntry {
        inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        if (params != null) {
            params = params.isEmpty() ? null : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        }
    }
}
