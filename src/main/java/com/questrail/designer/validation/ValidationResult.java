package com.questrail.designer.validation;

import java.util.Objects;
import java.util.Optional;

/**
 * ValidationResult
 * -----------------------------------------------------------------------------
 * Outcome of a validation check. Validators return this value rather than
 * throwing; the caller decides whether to surface the message and whether to
 * abort the mutation it was guarding.
 *
 * A valid result carries neither kind nor message. An invalid result always
 * carries both, and the message names the offending field or endpoint.
 */
public record ValidationResult(boolean valid, ErrorKind kind, String error)
{
    /**
     * Error taxonomy shared by all validators.
     */
    public enum ErrorKind {
        /** An edge references a missing node or an undeclared handle. */
        STRUCTURAL,
        /** An edge duplicates an existing endpoint tuple. */
        DUPLICATE,
        /** The endpoint kinds or types may not be wired together. */
        INCOMPATIBLE,
        /** A node field violates its per-kind rule. */
        FIELD,
        /** Configuration text could not be read. */
        PARSE
    }

    private static final ValidationResult OK = new ValidationResult(true, null, null);

    public ValidationResult {
        if (valid && (kind != null || error != null)) {
            throw new IllegalArgumentException("A valid result carries no error");
        }
        if (!valid) {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(error, "error");
        }
    }

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult failure(ErrorKind kind, String error) {
        return new ValidationResult(false, kind, error);
    }

    public static ValidationResult structural(String error) {
        return failure(ErrorKind.STRUCTURAL, error);
    }

    public static ValidationResult field(String error) {
        return failure(ErrorKind.FIELD, error);
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }

    public Optional<ErrorKind> errorKind() {
        return Optional.ofNullable(kind);
    }

    public boolean isInvalid() {
        return !valid;
    }

    @Override
    public String toString() {
        return valid ? "ValidationResult[valid]" : "ValidationResult[" + kind + ": " + error + "]";
    }
}
