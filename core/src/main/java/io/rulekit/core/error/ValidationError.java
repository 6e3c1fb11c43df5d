package io.rulekit.core.error;

import io.rulekit.core.model.PathSegment;
import io.rulekit.core.model.RuleContext;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single validation failure: a stable {@link ErrorCode}, the path of the
 * offending field and a human-readable message.
 *
 * <p>
 * Immutable and thread-safe. The path is captured from the {@link RuleContext}
 * in effect when the error is created, so rules never have to build paths
 * themselves.
 */
public final class ValidationError {

    private final ErrorCode code;
    private final PathSegment path;
    private final String message;
    private final List<Object> params;

    private ValidationError(ErrorCode code, PathSegment path, String message, List<Object> params) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.path = path;
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.params = params;
    }

    /**
     * Creates an error whose message is the code's pattern formatted with
     * {@code args}.
     *
     * @param code the error code
     * @param ctx  the context carrying the field path
     * @param args format arguments for {@link ErrorCode#pattern()}
     * @return the new error
     */
    public static ValidationError of(ErrorCode code, RuleContext ctx, Object... args) {
        return new ValidationError(code, pathOf(ctx), String.format(code.pattern(), args), paramsOf(args));
    }

    /**
     * Creates an error with an explicit message. The message is formatted with
     * {@code args} when any are given.
     */
    public static ValidationError withMessage(ErrorCode code, RuleContext ctx, String message, Object... args) {
        String formatted = args.length == 0 ? message : String.format(message, args);
        return new ValidationError(code, pathOf(ctx), formatted, paramsOf(args));
    }

    private static List<Object> paramsOf(Object[] args) {
        // args may contain nulls
        return Collections.unmodifiableList(Arrays.asList(args.clone()));
    }

    private static PathSegment pathOf(RuleContext ctx) {
        return ctx != null ? ctx.path() : null;
    }

    public ErrorCode code() {
        return code;
    }

    /** Path in the default {@code /a/b} format; empty string at the root. */
    public String path() {
        return pathAs(PathSerializer.DEFAULT);
    }

    /** Path rendered with the given serializer. */
    public String pathAs(PathSerializer serializer) {
        return serializer.serialize(PathSegment.segments(path));
    }

    /** The last path segment, or {@code null} at the root. */
    public PathSegment pathSegment() {
        return path;
    }

    /** Long, human-readable message. */
    public String message() {
        return message;
    }

    /** Brief constant description of the code. */
    public String shortMessage() {
        return code.shortMessage();
    }

    /** The format arguments used to build {@link #message()}. */
    public List<Object> params() {
        return params;
    }

    public boolean isInternal() {
        return code.type() == ErrorType.INTERNAL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationError that)) return false;
        return code == that.code && Objects.equals(path(), that.path()) && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, path(), message);
    }

    @Override
    public String toString() {
        return "ValidationError[" + code + ", path=" + path() + ", " + message + "]";
    }
}
