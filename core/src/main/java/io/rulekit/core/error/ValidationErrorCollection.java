package io.rulekit.core.error;

import io.rulekit.core.model.RuleContext;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Immutable, ordered collection of {@link ValidationError}s.
 *
 * <p>
 * An empty collection means "valid". Collections produced by concurrent field
 * evaluation are concatenated; order across independent fields is not
 * guaranteed.
 */
public final class ValidationErrorCollection implements Iterable<ValidationError> {

    private static final ValidationErrorCollection EMPTY = new ValidationErrorCollection(List.of());

    private final List<ValidationError> errors;

    private ValidationErrorCollection(List<ValidationError> errors) {
        this.errors = errors;
    }

    /** Returns the empty collection (singleton). */
    public static ValidationErrorCollection empty() {
        return EMPTY;
    }

    public static ValidationErrorCollection of(ValidationError... errors) {
        return of(List.of(errors));
    }

    /**
     * Creates a collection from the given errors. A defensive copy is made.
     *
     * @param errors the errors, must not contain null
     * @return the collection, or {@link #empty()} when {@code errors} is empty
     */
    public static ValidationErrorCollection of(Collection<ValidationError> errors) {
        if (errors == null || errors.isEmpty()) {
            return EMPTY;
        }
        for (ValidationError error : errors) {
            Objects.requireNonNull(error, "errors must not contain null");
        }
        return new ValidationErrorCollection(Collections.unmodifiableList(new ArrayList<>(errors)));
    }

    /** Returns a new collection holding this collection's errors followed by {@code other}'s. */
    public ValidationErrorCollection concat(ValidationErrorCollection other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        List<ValidationError> merged = new ArrayList<>(errors.size() + other.errors.size());
        merged.addAll(errors);
        merged.addAll(other.errors);
        return new ValidationErrorCollection(Collections.unmodifiableList(merged));
    }

    public int size() {
        return errors.size();
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    /** The first error, or {@code null} when empty. */
    public ValidationError first() {
        return errors.isEmpty() ? null : errors.get(0);
    }

    /**
     * Errors whose default-format path equals {@code path}.
     *
     * @param path a path such as {@code "/B"}, or {@code ""} for the root
     * @return the matching errors, possibly empty
     */
    public ValidationErrorCollection forPath(String path) {
        List<ValidationError> filtered = new ArrayList<>();
        for (ValidationError error : errors) {
            if (error.path().equals(path)) {
                filtered.add(error);
            }
        }
        return of(filtered);
    }

    /**
     * Collapses termination errors for a finished evaluation. Every
     * {@code TIMEOUT} and {@code CANCELLED} error is dropped and, when
     * {@code ctx} is done, a single one is appended at the context path.
     * Applying this at each level of a nested evaluation leaves exactly one
     * termination error, at the outermost path.
     */
    public ValidationErrorCollection settle(RuleContext ctx) {
        List<ValidationError> kept = new ArrayList<>(errors.size() + 1);
        for (ValidationError error : errors) {
            if (!isTermination(error.code())) {
                kept.add(error);
            }
        }
        if (ctx.isDone()) {
            kept.add(ValidationError.of(ctx.isCancelled() ? ErrorCode.CANCELLED : ErrorCode.TIMEOUT, ctx));
        } else if (kept.size() == errors.size()) {
            return this;
        }
        return of(kept);
    }

    private static boolean isTermination(ErrorCode code) {
        return code == ErrorCode.TIMEOUT || code == ErrorCode.CANCELLED;
    }

    /** True if any error is {@link ErrorType#INTERNAL}. */
    public boolean isInternal() {
        return errors.stream().anyMatch(ValidationError::isInternal);
    }

    /** True if the collection is non-empty and every error is {@link ErrorType#VALIDATION}. */
    public boolean isValidation() {
        return !errors.isEmpty() && !isInternal();
    }

    /** Unmodifiable view of the errors. */
    public List<ValidationError> asList() {
        return errors;
    }

    public Stream<ValidationError> stream() {
        return errors.stream();
    }

    @Override
    public Iterator<ValidationError> iterator() {
        return errors.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationErrorCollection that)) return false;
        return errors.equals(that.errors);
    }

    @Override
    public int hashCode() {
        return errors.hashCode();
    }

    /** First message with its path, plus a count of the remaining errors. */
    @Override
    public String toString() {
        if (errors.isEmpty()) {
            return "ValidationErrorCollection[]";
        }
        ValidationError first = errors.get(0);
        String head = first.path().isEmpty() ? first.message() : first.path() + ": " + first.message();
        return errors.size() > 1 ? head + " (and " + (errors.size() - 1) + " more)" : head;
    }
}
