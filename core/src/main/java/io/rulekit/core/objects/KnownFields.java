package io.rulekit.core.objects;

import io.rulekit.core.error.ErrorCode;
import io.rulekit.core.error.ValidationError;
import io.rulekit.core.error.ValidationErrorCollection;
import io.rulekit.core.model.RuleContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records which input keys were claimed by some rule during one apply, so the
 * rest can be reported as unexpected or copied through.
 *
 * <p>
 * Tracking is skipped entirely when inactive; {@link #unknown} and
 * {@link #check} then return empty results. Thread-safe.
 */
final class KnownFields {

    private final boolean active;
    private final Set<String> keys;

    KnownFields(boolean active) {
        this.active = active;
        this.keys = active ? ConcurrentHashMap.newKeySet() : Set.of();
    }

    void add(String key) {
        if (active) {
            keys.add(key);
        }
    }

    /** Input keys that were never claimed, in input order. */
    List<String> unknown(InputAccessor input) {
        if (!active) {
            return List.of();
        }
        List<String> unknown = new ArrayList<>();
        for (String key : input.keys()) {
            if (!keys.contains(key)) {
                unknown.add(key);
            }
        }
        return unknown;
    }

    /** One {@code UNEXPECTED} error per unclaimed key, at the key's path under {@code ctx}. */
    ValidationErrorCollection check(RuleContext ctx, InputAccessor input) {
        List<ValidationError> errors = new ArrayList<>();
        for (String key : unknown(input)) {
            errors.add(ValidationError.of(ErrorCode.UNEXPECTED, ctx.withPath(key)));
        }
        return ValidationErrorCollection.of(errors);
    }
}
