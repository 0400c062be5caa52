package com.questrail.designer.api;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Payload of a {@link NodeKind#TWILIO} node: an SMS or voice alert fired when
 * its triggering bool signal becomes true.
 */
public record TwilioPayload(String label,
                            boolean configured,
                            ActionType actionType,
                            String toNumber,
                            String content) implements NodePayload
{
    public enum ActionType {
        SMS,
        CALL;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Optional<ActionType> fromWireName(String name) {
            if (name == null) {
                return Optional.empty();
            }
            String lower = name.trim().toLowerCase(Locale.ROOT);
            for (ActionType t : values()) {
                if (t.wireName().equals(lower)) {
                    return Optional.of(t);
                }
            }
            return Optional.empty();
        }
    }

    public TwilioPayload {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(actionType, "actionType");
        Objects.requireNonNull(toNumber, "toNumber");
        Objects.requireNonNull(content, "content");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TWILIO;
    }

    @Override
    public TwilioPayload withLabel(String label) {
        return new TwilioPayload(label, configured, actionType, toNumber, content);
    }

    public TwilioPayload withConfigured(boolean configured) {
        return new TwilioPayload(label, configured, actionType, toNumber, content);
    }

    public TwilioPayload withActionType(ActionType actionType) {
        return new TwilioPayload(label, configured, actionType, toNumber, content);
    }

    public TwilioPayload withToNumber(String toNumber) {
        return new TwilioPayload(label, configured, actionType, toNumber, content);
    }

    public TwilioPayload withContent(String content) {
        return new TwilioPayload(label, configured, actionType, toNumber, content);
    }
}
