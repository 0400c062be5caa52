package com.questrail.designer.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.questrail.designer.api.BlockPayload;
import com.questrail.designer.api.Direction;
import com.questrail.designer.api.Document;
import com.questrail.designer.api.Edge;
import com.questrail.designer.api.MqttPayload;
import com.questrail.designer.api.Node;
import com.questrail.designer.api.Port;
import com.questrail.designer.api.Position;
import com.questrail.designer.api.S7Payload;
import com.questrail.designer.api.SignalPayload;
import com.questrail.designer.api.SignalType;
import com.questrail.designer.api.SignalValue;
import com.questrail.designer.api.TwilioPayload;
import com.questrail.designer.config.GeneratorSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * ConfigParser
 * -----------------------------------------------------------------------------
 * Reconstructs a diagram from runtime configuration text.
 *
 * <h2>Tolerance</h2>
 * <ul>
 *   <li>Missing or non-list {@code signals}/{@code blocks} are treated as empty.</li>
 *   <li>Empty text yields an empty diagram.</li>
 *   <li>Missing signal types default to {@code float}; missing initial values
 *       default to the type's zero value.</li>
 * </ul>
 *
 * Malformed YAML, a root that is not a mapping, blank port names, and values
 * outside a closed vocabulary raise {@link ConfigParseException}. So does any
 * other value the graph model refuses.
 *
 * <h2>Wiring</h2>
 * Block ports are rebuilt from the keys of {@code inputs}/{@code outputs} and
 * are untyped. Each port value is looked up among the parsed signals; a value
 * that names no signal (for example the upstream block of a direct
 * block-to-block wire) produces no edge. Every such drop is logged and reported
 * in {@link ParsedDiagram#diagnostics()}.
 *
 * <h2>Layout</h2>
 * Signals are stacked in a column at {@code x = 0}, blocks at {@code x = 300}
 * and protocol nodes at {@code x = 600}.
 */
public final class ConfigParser
{
    private static final Logger log = LoggerFactory.getLogger(ConfigParser.class);

    static final double SIGNAL_COLUMN_X = 0;
    static final double SIGNAL_ROW_HEIGHT = 80;
    static final double BLOCK_COLUMN_X = 300;
    static final double BLOCK_ROW_HEIGHT = 120;
    static final double PROTOCOL_COLUMN_X = 600;
    static final double PROTOCOL_ROW_HEIGHT = 120;

    private final YAMLMapper mapper;
    private final String unknownTriggerName;

    public ConfigParser() {
        this(GeneratorSettings.defaults());
    }

    /**
     * @param settings supplies the placeholder trigger name the generator writes
     *                 for unwired alerts; it is not reported as unresolved
     */
    public ConfigParser(GeneratorSettings settings) {
        this.unknownTriggerName = Objects.requireNonNull(settings, "settings").unknownTriggerName();
        this.mapper = YamlMappers.create();
    }

    /**
     * Parses {@code text} into nodes and edges.
     *
     * @throws ConfigParseException if the text is not a usable configuration
     */
    public ParsedDiagram parse(String text) {
        if (text == null || text.isBlank()) {
            return new ParsedDiagram(Document.EMPTY, List.of());
        }

        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ConfigParseException("Malformed configuration text: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return new ParsedDiagram(Document.EMPTY, List.of());
        }
        if (!root.isObject()) {
            throw new ConfigParseException("Configuration root must be a mapping");
        }

        try {
            return new Pass(root).run();
        } catch (IllegalArgumentException e) {
            throw new ConfigParseException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    /**
     * State of a single parse. Not shared between calls.
     */
    private final class Pass
    {
        private final JsonNode root;
        private final List<Node> nodes = new ArrayList<>();
        private final List<Edge> edges = new ArrayList<>();
        private final List<String> diagnostics = new ArrayList<>();
        private final Map<String, String> signalIds = new HashMap<>();
        private int protocolRow = 0;

        Pass(JsonNode root) {
            this.root = root;
        }

        ParsedDiagram run() {
            parseSignals(root.path("signals"));
            parseBlocks(root.path("blocks"));
            parseMqtt(root.path("mqtt"));
            parseS7(root.path("s7"));
            parseTwilio(root.path("twilio"));
            return new ParsedDiagram(new Document(nodes, edges), diagnostics);
        }

        // -----------------------------------------------------------------
        // signals / blocks
        // -----------------------------------------------------------------

        private void parseSignals(JsonNode list) {
            if (!list.isArray()) {
                return;
            }
            for (int i = 0; i < list.size(); i++) {
                JsonNode entry = requireMapping(list.get(i), "signals[" + i + "]");
                String id = "signal_" + i;
                String name = text(entry, "name", id);

                String typeName = text(entry, "type", SignalType.FLOAT.wireName());
                int index = i;
                SignalType type = SignalType.fromWireName(typeName).orElseThrow(() ->
                        new ConfigParseException("signals[" + index + "]: unknown signal type '" + typeName + "'"));

                SignalValue initial = initialValue(entry.path("initial"), type, "signals[" + i + "]");
                SignalPayload.Mode mode = "read".equalsIgnoreCase(text(entry, "mode", ""))
                        ? SignalPayload.Mode.READ
                        : SignalPayload.Mode.WRITE;

                nodes.add(new Node(id, Position.of(SIGNAL_COLUMN_X, i * SIGNAL_ROW_HEIGHT),
                        new SignalPayload(name, type, initial, mode)));
                signalIds.put(name, id);
            }
        }

        private void parseBlocks(JsonNode list) {
            if (!list.isArray()) {
                return;
            }
            for (int i = 0; i < list.size(); i++) {
                JsonNode entry = requireMapping(list.get(i), "blocks[" + i + "]");
                String id = "block_" + i;
                String name = text(entry, "name", id);
                String type = text(entry, "type", "");

                List<Port> inputs = new ArrayList<>();
                Iterator<Map.Entry<String, JsonNode>> in = entry.path("inputs").fields();
                while (in.hasNext()) {
                    Map.Entry<String, JsonNode> port = in.next();
                    inputs.add(portNamed(port.getKey(), "blocks[" + i + "].inputs"));
                    String wire = port.getValue().asText();
                    String signalId = signalIds.get(wire);
                    if (signalId != null) {
                        edges.add(new Edge(signalId + "-" + id + "-" + port.getKey(),
                                signalId, null, id, port.getKey()));
                    } else {
                        dropped("Block '" + name + "' input '" + port.getKey()
                                + "' references unknown signal '" + wire + "'; wire dropped");
                    }
                }

                List<Port> outputs = new ArrayList<>();
                Iterator<Map.Entry<String, JsonNode>> out = entry.path("outputs").fields();
                while (out.hasNext()) {
                    Map.Entry<String, JsonNode> port = out.next();
                    outputs.add(portNamed(port.getKey(), "blocks[" + i + "].outputs"));
                    String wire = port.getValue().asText();
                    String signalId = signalIds.get(wire);
                    if (signalId != null) {
                        edges.add(new Edge(id + "-" + signalId + "-" + port.getKey(),
                                id, port.getKey(), signalId, null));
                    } else {
                        dropped("Block '" + name + "' output '" + port.getKey()
                                + "' references unknown signal '" + wire + "'; wire dropped");
                    }
                }

                Map<String, Double> params = new LinkedHashMap<>();
                Iterator<Map.Entry<String, JsonNode>> ps = entry.path("params").fields();
                while (ps.hasNext()) {
                    Map.Entry<String, JsonNode> param = ps.next();
                    if (param.getValue().isNumber()) {
                        params.put(param.getKey(), param.getValue().asDouble());
                    } else {
                        dropped("Block '" + name + "' param '" + param.getKey() + "' is not numeric; ignored");
                    }
                }

                nodes.add(new Node(id, Position.of(BLOCK_COLUMN_X, i * BLOCK_ROW_HEIGHT),
                        new BlockPayload(name, type, inputs, outputs, params)));
            }
        }

        // -----------------------------------------------------------------
        // protocol sections
        // -----------------------------------------------------------------

        private void parseMqtt(JsonNode section) {
            if (!section.isObject()) {
                return;
            }
            MqttPayload payload = new MqttPayload(
                    "MQTT",
                    true,
                    text(section, "broker_host", ""),
                    section.path("broker_port").asInt(1883),
                    text(section, "client_id", ""),
                    text(section, "topic_prefix", ""),
                    nullableText(section, "username"),
                    nullableText(section, "password"),
                    MqttPayload.Mode.READ_WRITE,
                    section.path("publish_on_change").asBoolean(true));
            nodes.add(new Node("mqtt_0", nextProtocolPosition(), payload));
        }

        private void parseS7(JsonNode section) {
            if (!section.isObject()) {
                return;
            }
            String ip = text(section, "ip", "");
            int rack = section.path("rack").asInt(0);
            int slot = section.path("slot").asInt(1);

            JsonNode mappings = section.path("mappings");
            if (!mappings.isArray()) {
                return;
            }
            for (int i = 0; i < mappings.size(); i++) {
                String where = "s7.mappings[" + i + "]";
                JsonNode m = requireMapping(mappings.get(i), where);
                String signal = text(m, "signal", "");

                String areaName = text(m, "area", S7Payload.Area.DB.wireName());
                S7Payload.Area area = S7Payload.Area.fromWireName(areaName).orElseThrow(() ->
                        new ConfigParseException(where + ": unknown area '" + areaName + "'"));
                String dataTypeName = text(m, "data_type", S7Payload.DataType.REAL.wireName());
                S7Payload.DataType dataType = S7Payload.DataType.fromWireName(dataTypeName).orElseThrow(() ->
                        new ConfigParseException(where + ": unknown data type '" + dataTypeName + "'"));
                String directionName = text(m, "direction", Direction.READ.wireName());
                Direction direction = Direction.fromWireName(directionName).orElseThrow(() ->
                        new ConfigParseException(where + ": unknown direction '" + directionName + "'"));

                Integer bit = null;
                if (m.hasNonNull("bit")) {
                    bit = m.get("bit").asInt();
                } else if (dataType == S7Payload.DataType.BOOL) {
                    bit = 0;
                }

                S7Payload payload = new S7Payload(
                        signal.isBlank() ? "s7_" + i : signal,
                        true,
                        ip, rack, slot,
                        area,
                        m.path("db_number").asInt(1),
                        m.path("address").asInt(0),
                        dataType,
                        bit,
                        direction,
                        signal);
                nodes.add(new Node("s7_" + i, nextProtocolPosition(), payload));
            }
        }

        private void parseTwilio(JsonNode section) {
            if (!section.isObject()) {
                return;
            }
            JsonNode actions = section.path("actions");
            if (!actions.isArray()) {
                return;
            }
            for (int i = 0; i < actions.size(); i++) {
                String where = "twilio.actions[" + i + "]";
                JsonNode a = requireMapping(actions.get(i), where);
                String id = "twilio_" + i;

                String actionName = text(a, "action_type", TwilioPayload.ActionType.SMS.wireName());
                TwilioPayload.ActionType actionType = TwilioPayload.ActionType.fromWireName(actionName)
                        .orElseThrow(() -> new ConfigParseException(where + ": unknown action type '" + actionName + "'"));

                TwilioPayload payload = new TwilioPayload(
                        text(a, "name", id),
                        true,
                        actionType,
                        text(a, "to_number", ""),
                        text(a, "content", ""));
                nodes.add(new Node(id, nextProtocolPosition(), payload));

                String trigger = text(a, "trigger_signal", "");
                String signalId = signalIds.get(trigger);
                if (signalId != null) {
                    edges.add(new Edge(signalId + "-" + id, signalId, null, id, null));
                } else if (!trigger.isEmpty() && !trigger.equals(unknownTriggerName)) {
                    dropped("Alert '" + payload.label() + "' references unknown trigger signal '"
                            + trigger + "'; wire dropped");
                }
            }
        }

        // -----------------------------------------------------------------
        // helpers
        // -----------------------------------------------------------------

        private Position nextProtocolPosition() {
            return Position.of(PROTOCOL_COLUMN_X, (protocolRow++) * PROTOCOL_ROW_HEIGHT);
        }

        private void dropped(String message) {
            log.warn(message);
            diagnostics.add(message);
        }
    }

    private static Port portNamed(String name, String where) {
        if (name.isBlank()) {
            throw new ConfigParseException(where + ": port name must not be blank");
        }
        return Port.untyped(name);
    }

    private static JsonNode requireMapping(JsonNode node, String where) {
        if (node == null || !node.isObject()) {
            throw new ConfigParseException(where + " must be a mapping");
        }
        return node;
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return fallback;
        }
        return value.asText();
    }

    private static String nullableText(JsonNode node, String field) {
        return text(node, field, null);
    }

    private static SignalValue initialValue(JsonNode value, SignalType type, String where) {
        if (value.isMissingNode() || value.isNull()) {
            return SignalValue.defaultFor(type);
        }
        if (value.isBoolean()) {
            return SignalValue.of(value.booleanValue());
        }
        if (value.isNumber()) {
            return SignalValue.of(value.doubleValue());
        }
        String raw = value.asText().trim();
        if ("true".equalsIgnoreCase(raw) || "false".equalsIgnoreCase(raw)) {
            return SignalValue.of(Boolean.parseBoolean(raw));
        }
        try {
            return SignalValue.of(Double.parseDouble(raw));
        } catch (IllegalArgumentException e) {
            throw new ConfigParseException(where + ": initial value '" + raw + "' is not a bool or number", e);
        }
    }
}
