package com.questrail.designer.codec;

/**
 * Indicates that a diagram cannot be expressed as configuration text, e.g.
 * because two signals normalize to the same canonical name.
 */
public final class ConfigGenerationException extends RuntimeException
{
    public ConfigGenerationException(String message) {
        super(message);
    }

    public ConfigGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
