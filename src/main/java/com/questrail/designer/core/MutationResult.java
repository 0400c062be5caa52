package com.questrail.designer.core;

import com.questrail.designer.internal.state.DiagramState;
import com.questrail.designer.validation.ValidationResult;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a store mutation.
 *
 * @param outcome   {@link ValidationResult#ok()} when the mutation committed
 * @param state     the store's state after the call (unchanged on rejection)
 * @param createdId   id of the node or edge the mutation created, or {@code null}
 * @param diagnostics non-fatal import findings, such as dropped wires
 */
public record MutationResult(ValidationResult outcome, DiagramState state, String createdId,
                             List<String> diagnostics)
{
    public MutationResult {
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(state, "state");
        diagnostics = List.copyOf(diagnostics);
    }

    public MutationResult(ValidationResult outcome, DiagramState state, String createdId) {
        this(outcome, state, createdId, List.of());
    }

    public boolean applied() {
        return outcome.valid();
    }

    public Optional<String> error() {
        return outcome.errorMessage();
    }

    public Optional<String> created() {
        return applied() ? Optional.ofNullable(createdId) : Optional.empty();
    }
}
