package com.questrail.designer.codec;

/**
 * Indicates that configuration text could not be turned into a diagram.
 *
 * This typically reflects:
 * <ul>
 *   <li>Malformed YAML</li>
 *   <li>A root that is not a mapping</li>
 *   <li>A value outside a closed vocabulary (signal type, S7 area, data type)</li>
 * </ul>
 *
 * Unresolved wire references are not parse errors; they are reported as
 * diagnostics on {@link ParsedDiagram}.
 */
public final class ConfigParseException extends RuntimeException
{
    public ConfigParseException(String message) {
        super(message);
    }

    public ConfigParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
