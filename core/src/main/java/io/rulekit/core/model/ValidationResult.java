package io.rulekit.core.model;

import io.rulekit.core.error.PathSerializer;
import io.rulekit.core.error.ValidationError;
import io.rulekit.core.error.ValidationErrorCollection;
import io.rulekit.core.error.ValidationException;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a validation run. Exactly one of two states:
 *
 * <ul>
 * <li>{@link Type#VALID}: {@code value} holds the coerced output.
 * <li>{@link Type#INVALID}: {@code errors} holds every violation found.
 * </ul>
 *
 * @param <T> the output type
 */
public final class ValidationResult<T> {

    /** The type of validation outcome. */
    public enum Type {
        VALID,
        INVALID
    }

    private final Type type;
    private final T value;
    private final ValidationErrorCollection errors;
    private final PathSerializer pathSerializer;
    private final long durationMs;

    private ValidationResult(
            Type type, T value, ValidationErrorCollection errors, PathSerializer pathSerializer, long durationMs) {
        this.type = type;
        this.value = value;
        this.errors = errors;
        this.pathSerializer = pathSerializer;
        this.durationMs = durationMs;
    }

    /** Creates a VALID result holding the coerced value (which may be null for nil-allowing rule sets). */
    public static <T> ValidationResult<T> valid(T value, long durationMs) {
        return new ValidationResult<>(
                Type.VALID, value, ValidationErrorCollection.empty(), PathSerializer.DEFAULT, durationMs);
    }

    /** Creates an INVALID result; error paths are rendered with {@code pathSerializer}. */
    public static <T> ValidationResult<T> invalid(
            ValidationErrorCollection errors, PathSerializer pathSerializer, long durationMs) {
        Objects.requireNonNull(errors, "errors must not be null for INVALID");
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("INVALID result requires at least one error");
        }
        return new ValidationResult<>(
                Type.INVALID,
                null,
                errors,
                Objects.requireNonNull(pathSerializer, "pathSerializer must not be null"),
                durationMs);
    }

    public Type type() {
        return type;
    }

    /** The coerced output. Only meaningful when {@code type() == VALID}. */
    public T value() {
        return value;
    }

    /** The violations; empty when valid. */
    public ValidationErrorCollection errors() {
        return errors;
    }

    /** The error paths in the configured format, one per error. */
    public List<String> errorPaths() {
        return errors.stream().map(e -> e.pathAs(pathSerializer)).toList();
    }

    /** Wall-clock duration of the run in milliseconds. */
    public long durationMs() {
        return durationMs;
    }

    public boolean isValid() {
        return type == Type.VALID;
    }

    public boolean isInvalid() {
        return type == Type.INVALID;
    }

    /**
     * Returns the value, or throws when invalid.
     *
     * @throws ValidationException carrying the errors when {@code type() == INVALID}
     */
    public T orElseThrow() {
        if (type == Type.INVALID) {
            throw new ValidationException(errors);
        }
        return value;
    }

    @Override
    public String toString() {
        return switch (type) {
            case VALID -> "ValidationResult[VALID, " + durationMs + "ms]";
            case INVALID -> {
                ValidationError first = errors.first();
                yield "ValidationResult[INVALID, errors=" + errors.size() + ", first="
                        + first.code() + "@" + first.pathAs(pathSerializer) + "]";
            }
        };
    }
}
