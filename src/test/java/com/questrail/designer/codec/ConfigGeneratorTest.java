package com.questrail.designer.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.questrail.designer.api.DiagramFixtures;
import com.questrail.designer.api.Direction;
import com.questrail.designer.api.Document;
import com.questrail.designer.api.ModbusPayload;
import com.questrail.designer.api.MqttPayload;
import com.questrail.designer.api.Node;
import com.questrail.designer.api.Position;
import com.questrail.designer.api.S7Payload;
import com.questrail.designer.api.SignalType;
import com.questrail.designer.api.SignalValue;
import com.questrail.designer.api.TwilioPayload;
import com.questrail.designer.codec.model.BlockEntry;
import com.questrail.designer.codec.model.RuntimeConfig;
import com.questrail.designer.config.GeneratorSettings;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.questrail.designer.api.DiagramFixtures.edge;
import static org.junit.jupiter.api.Assertions.*;

class ConfigGeneratorTest
{
    private final ConfigGenerator generator = new ConfigGenerator();
    private final YAMLMapper yaml = new YAMLMapper();

    private JsonNode generateTree(Document doc) throws Exception {
        return yaml.readTree(generator.generate(doc));
    }

    // ---------------------------------------------------------------------
    // Signals and blocks
    // ---------------------------------------------------------------------

    @Test
    void signalWiredIntoAddBlock() throws Exception {
        Node tank = DiagramFixtures.signal("s1", "Tank Level", SignalType.FLOAT, SignalValue.of(0.0));
        Node add = DiagramFixtures.addBlock("b1", "Add");
        Document doc = DiagramFixtures.document(List.of(tank, add), List.of(edge("e1", "s1", null, "b1", "a")));

        JsonNode root = generateTree(doc);

        JsonNode signal = root.get("signals").get(0);
        assertEquals("tank_level", signal.get("name").asText());
        assertEquals("float", signal.get("type").asText());
        assertEquals(0.0, signal.get("initial").asDouble());

        JsonNode block = root.get("blocks").get(0);
        assertEquals("add", block.get("name").asText());
        assertEquals("ADD", block.get("type").asText());
        assertEquals("tank_level", block.get("inputs").get("a").asText());
        assertFalse(block.get("inputs").has("b"));
        assertFalse(block.has("params"));
    }

    @Test
    void initialValuesFollowSignalType() {
        Document doc = DiagramFixtures.document(List.of(
                DiagramFixtures.signal("s1", "Run", SignalType.BOOL, SignalValue.of(1.0)),
                DiagramFixtures.signal("s2", "Count", SignalType.INT, SignalValue.of(7.9)),
                DiagramFixtures.signal("s3", "Gain", SignalType.FLOAT, SignalValue.of(0.25))), List.of());

        RuntimeConfig config = generator.toRuntimeConfig(doc);

        assertEquals(Boolean.TRUE, config.signals().get(0).initial());
        assertEquals(7L, config.signals().get(1).initial());
        assertEquals(0.25, config.signals().get(2).initial());
    }

    @Test
    void topLevelKeysAppearInFixedOrder() {
        Document doc = DiagramFixtures.document(List.of(
                DiagramFixtures.boolSignal("s1", "Alarm"),
                DiagramFixtures.twilio("t1", "Notify", true),
                DiagramFixtures.mqtt("m1", true),
                DiagramFixtures.s7("p1", "alarm", true)), List.of());

        String text = generator.generate(doc);

        int signals = text.indexOf("signals:");
        int blocks = text.indexOf("blocks:");
        int scan = text.indexOf("scan_time_ms: 100");
        int twilio = text.indexOf("twilio:");
        int mqtt = text.indexOf("mqtt:");
        int s7 = text.indexOf("s7:");
        assertTrue(signals == 0, text);
        assertTrue(signals < blocks && blocks < scan && scan < twilio && twilio < mqtt && mqtt < s7, text);
        assertFalse(text.startsWith("---"));
    }

    @Test
    void outputIsDeterministic() {
        Document doc = DiagramFixtures.document(List.of(
                DiagramFixtures.floatSignal("s1", "A"),
                DiagramFixtures.floatSignal("s2", "B"),
                DiagramFixtures.addBlock("b1", "Sum")), List.of(
                edge("e1", "s1", null, "b1", "a"),
                edge("e2", "s2", null, "b1", "b")));
        assertEquals(generator.generate(doc), generator.generate(doc));
    }

    @Test
    void portsFollowDeclarationOrderNotEdgeOrder() {
        Document doc = DiagramFixtures.document(List.of(
                DiagramFixtures.floatSignal("s1", "A"),
                DiagramFixtures.floatSignal("s2", "B"),
                DiagramFixtures.addBlock("b1", "Sum")), List.of(
                edge("e2", "s2", null, "b1", "b"),
                edge("e1", "s1", null, "b1", "a")));

        BlockEntry block = generator.toRuntimeConfig(doc).blocks().get(0);
        assertEquals(List.of("a", "b"), List.copyOf(block.inputs().keySet()));
    }

    @Test
    void wholeNumberParamsAreWrittenAsIntegers() {
        Node timer = DiagramFixtures.block("b1", "Delay", "ON_DELAY", List.of("in"), List.of("out"),
                Map.of("preset_ms", 1500.0));
        Node pid = DiagramFixtures.block("b2", "Loop", "PID", List.of("setpoint"), List.of("output"),
                Map.of("ki", 0.1));

        RuntimeConfig config = generator.toRuntimeConfig(DiagramFixtures.document(List.of(timer, pid), List.of()));

        assertEquals(1500L, config.blocks().get(0).params().get("preset_ms"));
        assertEquals(0.1, config.blocks().get(1).params().get("ki"));
    }

    @Test
    void blockPortsAreNamedAfterTheOtherEnd() {
        Node upstream = DiagramFixtures.block("b1", "Upstream", "NOT", List.of("in"), List.of("out"));
        Node downstream = DiagramFixtures.block("b2", "Downstream", "NOT", List.of("in"), List.of("out"));
        Node alert = DiagramFixtures.twilio("t1", "Notify", true);
        Document doc = DiagramFixtures.document(List.of(upstream, downstream, alert), List.of(
                edge("e1", "b1", "out", "b2", "in"),
                edge("e2", "b2", "out", "t1", null)));

        RuntimeConfig config = generator.toRuntimeConfig(doc);

        assertEquals("downstream", config.blocks().get(0).outputs().get("out"));
        assertEquals("upstream", config.blocks().get(1).inputs().get("in"));
        assertEquals("notify", config.blocks().get(1).outputs().get("out"));
    }

    @Test
    void lastEdgeIntoAPortNamesIt() {
        Document doc = DiagramFixtures.document(List.of(
                DiagramFixtures.floatSignal("s1", "First"),
                DiagramFixtures.floatSignal("s2", "Second"),
                DiagramFixtures.addBlock("b1", "Sum")), List.of(
                edge("e1", "s1", null, "b1", "a"),
                edge("e2", "s2", null, "b1", "a")));

        BlockEntry block = generator.toRuntimeConfig(doc).blocks().get(0);

        assertEquals(Map.of("a", "second"), block.inputs());
    }

    @Test
    void duplicateCanonicalSignalNamesAreRejected() {
        Document doc = DiagramFixtures.document(List.of(
                DiagramFixtures.floatSignal("s1", "Tank Level"),
                DiagramFixtures.floatSignal("s2", "tank level")), List.of());

        ConfigGenerationException e = assertThrows(ConfigGenerationException.class, () -> generator.generate(doc));
        assertEquals("Duplicate signal name: tank_level", e.getMessage());
    }

    @Test
    void unlabeledNodesGetIndexedNames() {
        Document doc = DiagramFixtures.document(List.of(
                DiagramFixtures.floatSignal("s1", ""),
                DiagramFixtures.addBlock("b1", "")), List.of());
        RuntimeConfig config = generator.toRuntimeConfig(doc);
        assertEquals("signal_0", config.signals().get(0).name());
        assertEquals("block_0", config.blocks().get(0).name());
    }

    // ---------------------------------------------------------------------
    // Protocol sections
    // ---------------------------------------------------------------------

    @Test
    void emptyDocumentHasOnlyRequiredSections() throws Exception {
        JsonNode root = generateTree(Document.EMPTY);
        assertEquals(0, root.get("signals").size());
        assertEquals(0, root.get("blocks").size());
        assertEquals(100, root.get("scan_time_ms").asInt());
        assertFalse(root.has("twilio"));
        assertFalse(root.has("mqtt"));
        assertFalse(root.has("s7"));
    }

    @Test
    void twilioActionsResolveTriggerOrUsePlaceholder() throws Exception {
        Node alarm = DiagramFixtures.boolSignal("s1", "High Level");
        Node wired = DiagramFixtures.twilio("t1", "Notify Ops", true);
        Node unwired = new Node("t2", wired.position(),
                new TwilioPayload("", true, TwilioPayload.ActionType.CALL, "", ""));
        Node draft = DiagramFixtures.twilio("t3", "Draft", false);
        Document doc = DiagramFixtures.document(List.of(alarm, wired, unwired, draft),
                List.of(edge("e1", "s1", null, "t1", null)));

        JsonNode twilio = generateTree(doc).get("twilio");

        assertEquals("+1234567890", twilio.get("from_number").asText());
        assertTrue(twilio.get("from_number").isTextual());
        JsonNode actions = twilio.get("actions");
        assertEquals(2, actions.size());

        JsonNode first = actions.get(0);
        assertEquals("notify_ops", first.get("name").asText());
        assertEquals("high_level", first.get("trigger_signal").asText());
        assertEquals("sms", first.get("action_type").asText());
        assertEquals("+15551234567", first.get("to_number").asText());
        assertEquals(300, first.get("cooldown_seconds").asInt());

        JsonNode second = actions.get(1);
        assertEquals("twilio_1", second.get("name").asText());
        assertEquals("unknown_trigger", second.get("trigger_signal").asText());
        assertEquals("call", second.get("action_type").asText());
        assertEquals("+1234567890", second.get("to_number").asText());
        assertEquals("Alert from Petra", second.get("content").asText());
    }

    @Test
    void onlyFirstConfiguredMqttNodeIsEmitted() throws Exception {
        Node draft = DiagramFixtures.mqtt("m0", false);
        Node first = new Node("m1", draft.position(), ((MqttPayload) draft.payload())
                .withConfigured(true).withBroker("first.local", 8883).withCredentials("svc", "secret"));
        Node second = new Node("m2", draft.position(), ((MqttPayload) draft.payload())
                .withConfigured(true).withBroker("second.local", 1883));

        JsonNode mqtt = generateTree(DiagramFixtures.document(List.of(draft, first, second), List.of())).get("mqtt");

        assertEquals("first.local", mqtt.get("broker_host").asText());
        assertEquals(8883, mqtt.get("broker_port").asInt());
        assertEquals("plant-1", mqtt.get("client_id").asText());
        assertEquals("plant/line1", mqtt.get("topic_prefix").asText());
        assertTrue(mqtt.get("publish_on_change").asBoolean());
        assertEquals("svc", mqtt.get("username").asText());
        assertEquals("secret", mqtt.get("password").asText());
    }

    @Test
    void mqttWithoutCredentialsOmitsThem() throws Exception {
        JsonNode mqtt = generateTree(DiagramFixtures.document(
                List.of(DiagramFixtures.mqtt("m1", true)), List.of())).get("mqtt");
        assertFalse(mqtt.has("username"));
        assertFalse(mqtt.has("password"));
    }

    @Test
    void s7MappingsShareFirstConnection() throws Exception {
        Node level = DiagramFixtures.s7("p1", "tank_level", true);
        Node pump = new Node("p2", level.position(), ((S7Payload) level.payload())
                .withSignal("pump_on")
                .withConnection("10.0.0.99", 3, 4)
                .withArea(S7Payload.Area.Q, 0)
                .withDataType(S7Payload.DataType.BOOL)
                .withAddress(2, 5));
        Node unconfigured = DiagramFixtures.s7("p3", "ignored", false);

        JsonNode s7 = generateTree(DiagramFixtures.document(List.of(level, pump, unconfigured), List.of())).get("s7");

        assertEquals("10.0.0.5", s7.get("ip").asText());
        assertEquals(0, s7.get("rack").asInt());
        assertEquals(2, s7.get("slot").asInt());
        assertEquals(100, s7.get("poll_interval_ms").asInt());

        JsonNode mappings = s7.get("mappings");
        assertEquals(2, mappings.size());
        assertEquals("tank_level", mappings.get(0).get("signal").asText());
        assertEquals("DB", mappings.get(0).get("area").asText());
        assertEquals(10, mappings.get(0).get("db_number").asInt());
        assertEquals("real", mappings.get(0).get("data_type").asText());
        assertEquals("read", mappings.get(0).get("direction").asText());
        assertFalse(mappings.get(0).has("bit"));

        assertEquals("Q", mappings.get(1).get("area").asText());
        assertEquals("bool", mappings.get(1).get("data_type").asText());
        assertEquals(5, mappings.get(1).get("bit").asInt());
    }

    @Test
    void settingsOverrideFixedValues() throws Exception {
        ConfigGenerator custom = new ConfigGenerator(GeneratorSettings.builder()
                .withScanTimeMs(250)
                .withTwilioFromNumber("+15550000000")
                .withTwilioCooldownSeconds(60)
                .build());
        Document doc = DiagramFixtures.document(List.of(DiagramFixtures.twilio("t1", "Notify", true)), List.of());

        JsonNode root = yaml.readTree(custom.generate(doc));

        assertEquals(250, root.get("scan_time_ms").asInt());
        assertEquals("+15550000000", root.get("twilio").get("from_number").asText());
        assertEquals(60, root.get("twilio").get("actions").get(0).get("cooldown_seconds").asInt());
    }

    @Test
    void modbusNodesAreNotGenerated() throws Exception {
        Node modbus = new Node("mb1", Position.ORIGIN, new ModbusPayload("Meter", true, "h", 502, 1, 0,
                ModbusPayload.RegisterType.COIL, Direction.READ, "flow"));
        JsonNode root = generateTree(DiagramFixtures.document(List.of(modbus), List.of()));
        assertFalse(root.has("modbus"));
        assertEquals(0, root.get("signals").size());
    }
}
