package com.questrail.designer.observability;

import java.time.Instant;

/**
 * Record representing an error at the store's I/O or codec boundary.
 */
public record DiagramErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
