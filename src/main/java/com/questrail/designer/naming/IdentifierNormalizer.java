package com.questrail.designer.naming;

import java.util.Locale;

/**
 * IdentifierNormalizer
 * -----------------------------------------------------------------------------
 * Derives the canonical name of a diagram element from its user-facing label.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>the label is lower-cased ({@link Locale#ROOT})</li>
 *   <li>every character outside {@code [a-z0-9_]} becomes {@code _}</li>
 *   <li>if nothing remains, the (equally sanitized) fallback is returned</li>
 * </ul>
 *
 * <h2>Properties</h2>
 * <ul>
 *   <li>Total: never throws, {@code null} inputs are treated as empty</li>
 *   <li>Idempotent: {@code normalize(normalize(x, f), f).equals(normalize(x, f))}</li>
 * </ul>
 *
 * Uniqueness of canonical signal names is not checked here; the configuration
 * generator enforces it across a whole document.
 */
public final class IdentifierNormalizer
{
    private IdentifierNormalizer() {}

    /**
     * Returns the canonical name for {@code label}, or the sanitized
     * {@code fallback} when the label is empty.
     *
     * @param label    user-facing label, may be {@code null}
     * @param fallback name to use for an empty label, typically {@code "<kind>_<index>"}
     * @return a string over {@code [a-z0-9_]}, empty only if both inputs are empty
     */
    public static String normalize(String label, String fallback) {
        String name = sanitize(label);
        if (!name.isEmpty()) {
            return name;
        }
        return sanitize(fallback);
    }

    /**
     * Returns true if {@code name} is already in canonical form.
     */
    public static boolean isCanonical(String name) {
        return name != null && !name.isEmpty() && sanitize(name).equals(name);
    }

    private static String sanitize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String lower = raw.toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(lower.length());
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            boolean allowed = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_';
            sb.append(allowed ? c : '_');
        }
        return sb.toString();
    }
}
