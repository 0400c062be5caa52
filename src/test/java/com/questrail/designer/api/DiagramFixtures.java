package com.questrail.designer.api;

import java.util.List;
import java.util.Map;

/**
 * Builders for the nodes and edges the tests wire together.
 */
public final class DiagramFixtures
{
    private DiagramFixtures() {}

    public static Node signal(String id, String label, SignalType type) {
        return new Node(id, Position.ORIGIN, SignalPayload.of(label, type, SignalValue.defaultFor(type)));
    }

    public static Node signal(String id, String label, SignalType type, SignalValue initial) {
        return new Node(id, Position.ORIGIN, SignalPayload.of(label, type, initial));
    }

    public static Node boolSignal(String id, String label) {
        return signal(id, label, SignalType.BOOL);
    }

    public static Node floatSignal(String id, String label) {
        return signal(id, label, SignalType.FLOAT);
    }

    /**
     * A block with untyped ports named as given.
     */
    public static Node block(String id, String label, String blockType, List<String> inputs, List<String> outputs) {
        return block(id, label, blockType, inputs, outputs, Map.of());
    }

    public static Node block(String id, String label, String blockType,
                             List<String> inputs, List<String> outputs, Map<String, Double> params) {
        return new Node(id, Position.ORIGIN, new BlockPayload(label, blockType,
                inputs.stream().map(Port::untyped).toList(),
                outputs.stream().map(Port::untyped).toList(),
                params));
    }

    /**
     * An ADD block with inputs {@code a, b} and output {@code out}.
     */
    public static Node addBlock(String id, String label) {
        return block(id, label, "ADD", List.of("a", "b"), List.of("out"));
    }

    public static Node twilio(String id, String label, boolean configured) {
        return new Node(id, Position.ORIGIN, new TwilioPayload(label, configured,
                TwilioPayload.ActionType.SMS, "+15551234567", "Tank high"));
    }

    public static Node mqtt(String id, boolean configured) {
        return new Node(id, Position.ORIGIN, new MqttPayload("Broker", configured, "broker.local", 1883,
                "plant-1", "plant/line1", null, null, MqttPayload.Mode.READ_WRITE, true));
    }

    public static Node s7(String id, String signal, boolean configured) {
        return new Node(id, Position.ORIGIN, new S7Payload(signal, configured, "10.0.0.5", 0, 2,
                S7Payload.Area.DB, 10, 4, S7Payload.DataType.REAL, null, Direction.READ, signal));
    }

    public static Edge edge(String id, String source, String sourceHandle, String target, String targetHandle) {
        return new Edge(id, source, sourceHandle, target, targetHandle);
    }

    public static Document document(List<Node> nodes, List<Edge> edges) {
        return new Document(nodes, edges);
    }
}
