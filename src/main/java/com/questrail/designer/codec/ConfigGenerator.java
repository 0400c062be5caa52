package com.questrail.designer.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.questrail.designer.api.BlockPayload;
import com.questrail.designer.api.Document;
import com.questrail.designer.api.Edge;
import com.questrail.designer.api.MqttPayload;
import com.questrail.designer.api.Node;
import com.questrail.designer.api.NodeKind;
import com.questrail.designer.api.Port;
import com.questrail.designer.api.S7Payload;
import com.questrail.designer.api.SignalPayload;
import com.questrail.designer.api.TwilioPayload;
import com.questrail.designer.codec.model.BlockEntry;
import com.questrail.designer.codec.model.MqttSection;
import com.questrail.designer.codec.model.RuntimeConfig;
import com.questrail.designer.codec.model.S7Section;
import com.questrail.designer.codec.model.SignalEntry;
import com.questrail.designer.codec.model.TwilioSection;
import com.questrail.designer.config.GeneratorSettings;
import com.questrail.designer.naming.CanonicalNames;
import com.questrail.designer.naming.IdentifierNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * ConfigGenerator
 * -----------------------------------------------------------------------------
 * Deterministic translation of a {@link Document} into runtime configuration
 * text.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>Every signal node becomes a {@code signals} entry named by its
 *       canonical name. Duplicate canonical names are rejected with
 *       {@link ConfigGenerationException}.</li>
 *   <li>Every block node becomes a {@code blocks} entry. For each declared
 *       port, in declaration order, the edge at that exact port names the wire
 *       after the node at its other end: the source for an input, the target
 *       for an output. When several edges meet one port the last one wins. A
 *       direct block-to-block edge is therefore written as the upstream block's
 *       name on the downstream input and the downstream block's name on the
 *       upstream output.</li>
 *   <li>Configured Twilio nodes become {@code twilio.actions}, triggered by the
 *       source of their first incoming edge.</li>
 *   <li>The first configured MQTT node becomes the {@code mqtt} section.</li>
 *   <li>Configured S7 nodes become {@code s7.mappings}, sharing the connection
 *       of the first one.</li>
 *   <li>{@code scan_time_ms} is always emitted.</li>
 * </ol>
 *
 * Modbus nodes are not part of the runtime format and are skipped. Unwired
 * ports are omitted from the port maps.
 *
 * Instances are immutable and thread-safe.
 */
public final class ConfigGenerator
{
    private static final Logger log = LoggerFactory.getLogger(ConfigGenerator.class);

    private final GeneratorSettings settings;
    private final YAMLMapper mapper;

    public ConfigGenerator() {
        this(GeneratorSettings.defaults());
    }

    public ConfigGenerator(GeneratorSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.mapper = YamlMappers.create();
    }

    public GeneratorSettings settings() {
        return settings;
    }

    /**
     * Generates configuration text for {@code document}.
     *
     * @throws ConfigGenerationException if the document cannot be represented
     */
    public String generate(Document document) {
        RuntimeConfig config = toRuntimeConfig(document);
        try {
            return mapper.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new ConfigGenerationException("Failed to write configuration text", e);
        }
    }

    /**
     * Builds the configuration model for {@code document} without rendering it.
     */
    public RuntimeConfig toRuntimeConfig(Document document) {
        Objects.requireNonNull(document, "document");

        Map<String, String> signalNames = CanonicalNames.of(document.nodes(), NodeKind.SIGNAL);
        Set<String> duplicates = CanonicalNames.duplicates(signalNames.values());
        if (!duplicates.isEmpty()) {
            throw new ConfigGenerationException("Duplicate signal name: " + duplicates.iterator().next());
        }

        Map<String, String> names = new HashMap<>();
        for (NodeKind kind : NodeKind.values()) {
            names.putAll(CanonicalNames.of(document.nodes(), kind));
        }

        List<SignalEntry> signals = signals(document, signalNames);
        List<BlockEntry> blocks = blocks(document, names);
        TwilioSection twilio = twilio(document, names);
        MqttSection mqtt = mqtt(document);
        S7Section s7 = s7(document);

        log.debug("Generated configuration: {} signals, {} blocks, twilio={}, mqtt={}, s7={}",
                signals.size(), blocks.size(), twilio != null, mqtt != null, s7 != null);

        return new RuntimeConfig(signals, blocks, settings.scanTimeMs(), twilio, mqtt, s7);
    }

    // ---------------------------------------------------------------------
    // Sections
    // ---------------------------------------------------------------------

    private static List<SignalEntry> signals(Document document, Map<String, String> signalNames) {
        List<SignalEntry> entries = new ArrayList<>();
        for (Node n : document.nodes()) {
            if (n.payload() instanceof SignalPayload p) {
                entries.add(new SignalEntry(signalNames.get(n.id()), p.signalType().wireName(), initialValue(p)));
            }
        }
        return entries;
    }

    private static Object initialValue(SignalPayload p) {
        switch (p.signalType()) {
            case BOOL:
                return p.initial().asBoolean();
            case INT:
                return (long) p.initial().asDouble();
            default:
                return number(p.initial().asDouble());
        }
    }

    private static List<BlockEntry> blocks(Document document, Map<String, String> names) {
        List<BlockEntry> entries = new ArrayList<>();
        for (Node n : document.nodes()) {
            if (!(n.payload() instanceof BlockPayload p)) {
                continue;
            }
            Map<String, String> inputs = new LinkedHashMap<>();
            for (Port port : p.inputs()) {
                lastEdge(document, e -> e.entersAt(n.id(), port.name()))
                        .map(e -> wireName(names, e.sourceNodeId()))
                        .ifPresent(wire -> inputs.put(port.name(), wire));
            }
            Map<String, String> outputs = new LinkedHashMap<>();
            for (Port port : p.outputs()) {
                lastEdge(document, e -> e.leavesAt(n.id(), port.name()))
                        .map(e -> wireName(names, e.targetNodeId()))
                        .ifPresent(wire -> outputs.put(port.name(), wire));
            }
            Map<String, Object> params = new LinkedHashMap<>();
            p.params().forEach((k, v) -> params.put(k, number(v)));

            entries.add(new BlockEntry(names.get(n.id()), p.blockType(), inputs, outputs, params));
        }
        return entries;
    }

    private TwilioSection twilio(Document document, Map<String, String> names) {
        List<TwilioSection.Action> actions = new ArrayList<>();
        int index = 0;
        for (Node n : document.nodes()) {
            if (!(n.payload() instanceof TwilioPayload p) || !p.configured()) {
                continue;
            }
            String trigger = firstEdge(document, e -> e.targetNodeId().equals(n.id()))
                    .map(e -> names.get(e.sourceNodeId()))
                    .filter(Objects::nonNull)
                    .orElse(settings.unknownTriggerName());
            actions.add(new TwilioSection.Action(
                    IdentifierNormalizer.normalize(p.label(), "twilio_" + index),
                    trigger,
                    p.actionType().wireName(),
                    orDefault(p.toNumber(), settings.defaultTwilioToNumber()),
                    orDefault(p.content(), settings.defaultTwilioContent()),
                    settings.twilioCooldownSeconds()));
            index++;
        }
        if (actions.isEmpty()) {
            return null;
        }
        return new TwilioSection(settings.twilioFromNumber(), actions);
    }

    private MqttSection mqtt(Document document) {
        for (Node n : document.nodes()) {
            if (n.payload() instanceof MqttPayload p && p.configured()) {
                Optional<MqttPayload.Credentials> credentials = p.credentials();
                return new MqttSection(
                        orDefault(p.brokerHost(), settings.defaultBrokerHost()),
                        p.brokerPort() > 0 ? p.brokerPort() : settings.defaultBrokerPort(),
                        orDefault(p.clientId(), settings.defaultClientId()),
                        orDefault(p.topicPrefix(), settings.defaultTopicPrefix()),
                        p.publishOnChange(),
                        credentials.map(MqttPayload.Credentials::username).orElse(null),
                        credentials.map(MqttPayload.Credentials::password).orElse(null));
            }
        }
        return null;
    }

    private S7Section s7(Document document) {
        List<S7Payload> configured = new ArrayList<>();
        for (Node n : document.nodes()) {
            if (n.payload() instanceof S7Payload p && p.configured()) {
                configured.add(p);
            }
        }
        if (configured.isEmpty()) {
            return null;
        }

        List<S7Section.Mapping> mappings = new ArrayList<>();
        for (S7Payload p : configured) {
            Integer bit = p.dataType() == S7Payload.DataType.BOOL ? p.bitOffset().orElse(0) : null;
            mappings.add(new S7Section.Mapping(
                    p.signal(),
                    p.area().wireName(),
                    p.dbNumber(),
                    p.address(),
                    p.dataType().wireName(),
                    p.direction().wireName(),
                    bit));
        }
        S7Payload connection = configured.get(0);
        return new S7Section(connection.ip(), connection.rack(), connection.slot(),
                settings.s7PollIntervalMs(), mappings);
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    /**
     * Names a block port's wire after the node at the other end of its edge.
     */
    private static String wireName(Map<String, String> names, String otherNodeId) {
        return names.getOrDefault(otherNodeId, IdentifierNormalizer.normalize(null, otherNodeId));
    }

    private static Optional<Edge> firstEdge(Document document, Predicate<Edge> test) {
        for (Edge e : document.edges()) {
            if (test.test(e)) {
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }

    /**
     * Several edges may enter one port; the last one in document order names it.
     */
    private static Optional<Edge> lastEdge(Document document, Predicate<Edge> test) {
        Edge found = null;
        for (Edge e : document.edges()) {
            if (test.test(e)) {
                found = e;
            }
        }
        return Optional.ofNullable(found);
    }

    /**
     * Whole numbers are written without a fractional part.
     */
    private static Object number(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return (long) value;
        }
        return value;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
