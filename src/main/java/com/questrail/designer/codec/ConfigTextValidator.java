package com.questrail.designer.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.questrail.designer.api.SignalType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks configuration text against the runtime schema without building a
 * diagram. Used before an import to show the operator everything that is wrong
 * at once.
 *
 * Stricter than {@link ConfigParser}: {@code signals} and {@code blocks} must be
 * present, and every signal and block needs a name and a type.
 */
public final class ConfigTextValidator
{
    /**
     * @param valid  true when {@code errors} is empty
     * @param errors every problem found, in text order
     */
    public record Report(boolean valid, List<String> errors)
    {
        public Report {
            errors = List.copyOf(errors);
        }
    }

    private final YAMLMapper mapper = YamlMappers.create();

    public Report validate(String text) {
        List<String> errors = new ArrayList<>();

        JsonNode root;
        try {
            root = mapper.readTree(text == null ? "" : text);
        } catch (JsonProcessingException e) {
            errors.add("YAML syntax error: " + e.getOriginalMessage());
            return new Report(false, errors);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            errors.add("Configuration is empty");
            return new Report(false, errors);
        }
        if (!root.isObject()) {
            errors.add("Configuration root must be a mapping");
            return new Report(false, errors);
        }

        checkSignals(root.get("signals"), errors);
        checkBlocks(root.get("blocks"), errors);

        JsonNode scan = root.get("scan_time_ms");
        if (scan != null && (!scan.canConvertToInt() || !scan.isIntegralNumber() || scan.asInt() <= 0)) {
            errors.add("scan_time_ms must be a positive integer");
        }
        for (String section : List.of("twilio", "mqtt", "s7")) {
            JsonNode node = root.get(section);
            if (node != null && !node.isNull() && !node.isObject()) {
                errors.add("'" + section + "' must be a mapping");
            }
        }

        return new Report(errors.isEmpty(), errors);
    }

    private static void checkSignals(JsonNode signals, List<String> errors) {
        if (signals == null || !signals.isArray()) {
            errors.add("Missing 'signals' list");
            return;
        }
        Set<String> names = new HashSet<>();
        for (int i = 0; i < signals.size(); i++) {
            JsonNode s = signals.get(i);
            String where = "signals[" + i + "]";
            if (!s.isObject()) {
                errors.add(where + " must be a mapping");
                continue;
            }
            String name = s.path("name").asText("");
            if (name.isBlank()) {
                errors.add(where + ": name is required");
            } else if (!names.add(name)) {
                errors.add(where + ": duplicate signal name '" + name + "'");
            }
            String type = s.path("type").asText("");
            if (SignalType.fromWireName(type).isEmpty()) {
                errors.add(where + ": type must be one of bool, int, float");
            }
        }
    }

    private static void checkBlocks(JsonNode blocks, List<String> errors) {
        if (blocks == null || !blocks.isArray()) {
            errors.add("Missing 'blocks' list");
            return;
        }
        for (int i = 0; i < blocks.size(); i++) {
            JsonNode b = blocks.get(i);
            String where = "blocks[" + i + "]";
            if (!b.isObject()) {
                errors.add(where + " must be a mapping");
                continue;
            }
            if (b.path("name").asText("").isBlank()) {
                errors.add(where + ": name is required");
            }
            if (b.path("type").asText("").isBlank()) {
                errors.add(where + ": type is required");
            }
            for (String ports : List.of("inputs", "outputs", "params")) {
                JsonNode node = b.get(ports);
                if (node != null && !node.isNull() && !node.isObject()) {
                    errors.add(where + ": '" + ports + "' must be a mapping");
                }
            }
        }
    }
}
