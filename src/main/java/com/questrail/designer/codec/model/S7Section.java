package com.questrail.designer.codec.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * The {@code s7} section: one PLC connection shared by all {@code mappings}.
 */
@JsonPropertyOrder({"ip", "rack", "slot", "poll_interval_ms", "mappings"})
public record S7Section(
        @JsonProperty("ip") String ip,
        @JsonProperty("rack") int rack,
        @JsonProperty("slot") int slot,
        @JsonProperty("poll_interval_ms") int pollIntervalMs,
        @JsonProperty("mappings") List<Mapping> mappings
) {
    public S7Section {
        mappings = List.copyOf(mappings);
    }

    /**
     * One memory mapping. {@code bit} is present only for bool data.
     */
    @JsonPropertyOrder({"signal", "area", "db_number", "address", "data_type", "direction", "bit"})
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Mapping(
            @JsonProperty("signal") String signal,
            @JsonProperty("area") String area,
            @JsonProperty("db_number") int dbNumber,
            @JsonProperty("address") int address,
            @JsonProperty("data_type") String dataType,
            @JsonProperty("direction") String direction,
            @JsonProperty("bit") Integer bit
    ) {}
}
