package com.questrail.designer.api;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * BlockPayload
 * -----------------------------------------------------------------------------
 * Payload of a {@link NodeKind#BLOCK} node.
 *
 * <h2>Ports</h2>
 * The ordered {@code inputs} and {@code outputs} lists are the only valid
 * handle names for edges touching the block. Port names are unique within each
 * list (an input and an output may share a name).
 *
 * <h2>Block type</h2>
 * {@code blockType} is an open string enumeration ({@code AND}, {@code GT},
 * {@code ON_DELAY}, {@code PID}, ...). The runtime decides which types it
 * understands; this model only carries the name.
 *
 * <h2>Params</h2>
 * Numeric parameters keyed by name. Iteration order is insertion order so that
 * generated text is stable.
 */
public record BlockPayload(String label,
                           String blockType,
                           List<Port> inputs,
                           List<Port> outputs,
                           Map<String, Double> params) implements NodePayload
{
    public BlockPayload {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(blockType, "blockType");
        inputs = List.copyOf(Objects.requireNonNull(inputs, "inputs"));
        outputs = List.copyOf(Objects.requireNonNull(outputs, "outputs"));
        requireUniqueNames(inputs, "input");
        requireUniqueNames(outputs, "output");

        Objects.requireNonNull(params, "params");
        Map<String, Double> copy = new LinkedHashMap<>();
        params.forEach((k, v) -> copy.put(
                Objects.requireNonNull(k, "param name"),
                Objects.requireNonNull(v, "param " + k)));
        params = Collections.unmodifiableMap(copy);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BLOCK;
    }

    public boolean hasInput(String name) {
        return inputs.stream().anyMatch(p -> p.name().equals(name));
    }

    public boolean hasOutput(String name) {
        return outputs.stream().anyMatch(p -> p.name().equals(name));
    }

    public Optional<Double> param(String key) {
        return Optional.ofNullable(params.get(key));
    }

    @Override
    public BlockPayload withLabel(String label) {
        return new BlockPayload(label, blockType, inputs, outputs, params);
    }

    /**
     * Replaces the block type only. Ports and params are kept; use
     * {@code BlockCatalog} to re-template a block for a new type.
     */
    public BlockPayload withBlockType(String blockType) {
        return new BlockPayload(label, blockType, inputs, outputs, params);
    }

    public BlockPayload withPorts(List<Port> inputs, List<Port> outputs) {
        return new BlockPayload(label, blockType, inputs, outputs, params);
    }

    public BlockPayload withParams(Map<String, Double> params) {
        return new BlockPayload(label, blockType, inputs, outputs, params);
    }

    public BlockPayload withParam(String key, double value) {
        Map<String, Double> updated = new LinkedHashMap<>(params);
        updated.put(key, value);
        return new BlockPayload(label, blockType, inputs, outputs, updated);
    }

    private static void requireUniqueNames(List<Port> ports, String side) {
        Set<String> seen = new HashSet<>();
        for (Port p : ports) {
            if (!seen.add(p.name())) {
                throw new IllegalArgumentException("Duplicate " + side + " port: " + p.name());
            }
        }
    }
}
