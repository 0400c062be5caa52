package com.questrail.designer.api;

import java.util.Objects;

/**
 * A named connection point on a block.
 *
 * The {@code type} is descriptive ({@code "bool"}, {@code "float"}, ...). Ports
 * rebuilt from a configuration text carry {@link #ANY_TYPE}, because the format
 * does not record port types.
 */
public record Port(String name, String type)
{
    public static final String ANY_TYPE = "any";

    public Port {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Port name must not be blank");
        }
    }

    public static Port of(String name, String type) {
        return new Port(name, type);
    }

    public static Port untyped(String name) {
        return new Port(name, ANY_TYPE);
    }
}
