package com.questrail.designer.codec.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * The {@code twilio} section: one sender number shared by every alert action.
 */
@JsonPropertyOrder({"from_number", "actions"})
public record TwilioSection(
        @JsonProperty("from_number") String fromNumber,
        @JsonProperty("actions") List<Action> actions
) {
    public TwilioSection {
        actions = List.copyOf(actions);
    }

    @JsonPropertyOrder({"name", "trigger_signal", "action_type", "to_number", "content", "cooldown_seconds"})
    public record Action(
            @JsonProperty("name") String name,
            @JsonProperty("trigger_signal") String triggerSignal,
            @JsonProperty("action_type") String actionType,
            @JsonProperty("to_number") String toNumber,
            @JsonProperty("content") String content,
            @JsonProperty("cooldown_seconds") int cooldownSeconds
    ) {}
}
