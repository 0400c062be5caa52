package com.questrail.designer.observability;

import com.questrail.designer.internal.events.DiagramAction;
import com.questrail.designer.validation.ValidationResult;

import java.time.Instant;

/**
 * Record representing a mutation that was refused. {@code action} is
 * {@code null} when the refusal happened before an action was formed, e.g. an
 * import whose text did not parse.
 */
public record DiagramRejectionEvent(
    Instant timestamp,
    DiagramAction action,
    ValidationResult result
) {
}
