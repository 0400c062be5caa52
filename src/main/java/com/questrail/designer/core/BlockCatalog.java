package com.questrail.designer.core;

import com.questrail.designer.api.Port;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * BlockCatalog
 * -----------------------------------------------------------------------------
 * Port and parameter templates for the block types the runtime knows.
 *
 * <h2>Templates</h2>
 * <ul>
 *   <li>{@code AND, OR, XOR}: {@code a, b -> out}, all bool</li>
 *   <li>{@code NOT}: {@code in -> out}, bool</li>
 *   <li>{@code GT, LT, GTE, LTE, EQ, NEQ}: float {@code a, b -> out} bool</li>
 *   <li>{@code ADD, SUB, MUL, DIV}: {@code a, b -> out}, all float</li>
 *   <li>{@code ON_DELAY, OFF_DELAY, PULSE} (and {@code TON}, {@code TOF}):
 *       bool {@code in -> out}, float {@code elapsed}; {@code preset_ms = 1000}</li>
 *   <li>{@code PID}: {@code setpoint, process_var, enable -> output} with gains and
 *       output limits</li>
 *   <li>{@code DATA_GENERATOR}: {@code enable -> out} with frequency and amplitude 1</li>
 *   <li>anything else: float {@code in -> out}, no params</li>
 * </ul>
 *
 * Type names are matched case-insensitively; the template keeps the caller's
 * spelling of the type.
 */
public final class BlockCatalog
{
    public static final String DEFAULT_BLOCK_TYPE = "AND";

    /**
     * A block shape ready to be applied to a block payload.
     */
    public record Template(String blockType, List<Port> inputs, List<Port> outputs, Map<String, Double> params)
    {
        public Template {
            Objects.requireNonNull(blockType, "blockType");
            inputs = List.copyOf(inputs);
            outputs = List.copyOf(outputs);
            params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
        }
    }

    private static final String BOOL = "bool";
    private static final String FLOAT = "float";

    private static final Set<String> LOGIC = Set.of("AND", "OR", "XOR");
    private static final Set<String> COMPARE = Set.of("GT", "LT", "GTE", "LTE", "EQ", "NEQ");
    private static final Set<String> MATH = Set.of("ADD", "SUB", "MUL", "DIV");
    private static final Set<String> TIMERS = Set.of("ON_DELAY", "OFF_DELAY", "PULSE", "TON", "TOF");

    private BlockCatalog() {}

    public static Template templateFor(String blockType) {
        Objects.requireNonNull(blockType, "blockType");
        String key = blockType.trim().toUpperCase(Locale.ROOT);

        if (LOGIC.contains(key)) {
            return new Template(blockType,
                    List.of(Port.of("a", BOOL), Port.of("b", BOOL)),
                    List.of(Port.of("out", BOOL)),
                    Map.of());
        }
        if ("NOT".equals(key)) {
            return new Template(blockType,
                    List.of(Port.of("in", BOOL)),
                    List.of(Port.of("out", BOOL)),
                    Map.of());
        }
        if (COMPARE.contains(key)) {
            return new Template(blockType,
                    List.of(Port.of("a", FLOAT), Port.of("b", FLOAT)),
                    List.of(Port.of("out", BOOL)),
                    Map.of());
        }
        if (MATH.contains(key)) {
            return new Template(blockType,
                    List.of(Port.of("a", FLOAT), Port.of("b", FLOAT)),
                    List.of(Port.of("out", FLOAT)),
                    Map.of());
        }
        if (TIMERS.contains(key)) {
            return new Template(blockType,
                    List.of(Port.of("in", BOOL)),
                    List.of(Port.of("out", BOOL), Port.of("elapsed", FLOAT)),
                    Map.of("preset_ms", 1000.0));
        }
        if ("PID".equals(key)) {
            Map<String, Double> params = new LinkedHashMap<>();
            params.put("kp", 1.0);
            params.put("ki", 0.1);
            params.put("kd", 0.01);
            params.put("output_min", 0.0);
            params.put("output_max", 100.0);
            return new Template(blockType,
                    List.of(Port.of("setpoint", FLOAT), Port.of("process_var", FLOAT), Port.of("enable", BOOL)),
                    List.of(Port.of("output", FLOAT)),
                    params);
        }
        if ("DATA_GENERATOR".equals(key)) {
            Map<String, Double> params = new LinkedHashMap<>();
            params.put("frequency", 1.0);
            params.put("amplitude", 1.0);
            return new Template(blockType,
                    List.of(Port.of("enable", BOOL)),
                    List.of(Port.of("out", FLOAT)),
                    params);
        }
        return new Template(blockType,
                List.of(Port.of("in", FLOAT)),
                List.of(Port.of("out", FLOAT)),
                Map.of());
    }
}
