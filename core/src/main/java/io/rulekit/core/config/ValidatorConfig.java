package io.rulekit.core.config;

import io.rulekit.core.engine.EvaluationExecutors;
import io.rulekit.core.error.PathSerializer;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Settings for a {@link io.rulekit.core.engine.Validator}.
 *
 * <p>
 * Use {@link #builder()} or {@link ConfigLoader} to construct instances.
 * {@link #DEFAULT} has no timeout, renders paths as {@code /a/b} and logs
 * every result at debug level.
 *
 * @param timeout          deadline applied to each validation; zero means none
 * @param threadNamePrefix prefix for the validator's evaluation threads
 * @param pathFormat       how error paths are rendered in results
 * @param logResults       log successful validations at info instead of debug
 */
public record ValidatorConfig(Duration timeout, String threadNamePrefix, PathFormat pathFormat, boolean logResults) {

    public static final ValidatorConfig DEFAULT = builder().build();

    public ValidatorConfig {
        Objects.requireNonNull(timeout, "timeout must not be null");
        Objects.requireNonNull(threadNamePrefix, "threadNamePrefix must not be null");
        Objects.requireNonNull(pathFormat, "pathFormat must not be null");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative: " + timeout);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /** True if a non-zero timeout is configured. */
    public boolean hasTimeout() {
        return !timeout.isZero();
    }

    /** Error path rendering formats. */
    public enum PathFormat {
        /** {@code /a/0/b} */
        DEFAULT(PathSerializer.DEFAULT),
        /** RFC 6901, e.g. {@code /a~1b/0}. */
        JSON_POINTER(PathSerializer.JSON_POINTER),
        /** {@code a.b[0]} */
        DOT(PathSerializer.DOT),
        /** {@code $.a[0].b} */
        JSON_PATH(PathSerializer.JSON_PATH);

        private final PathSerializer serializer;

        PathFormat(PathSerializer serializer) {
            this.serializer = serializer;
        }

        public PathSerializer serializer() {
            return serializer;
        }

        /**
         * Parses a configuration value such as {@code json-pointer} or
         * {@code DOT}. Dashes and underscores are interchangeable.
         *
         * @throws IllegalArgumentException for unknown formats
         */
        public static PathFormat parse(String value) {
            String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
            for (PathFormat format : values()) {
                if (format.name().equals(normalized)) {
                    return format;
                }
            }
            throw new IllegalArgumentException("unknown path format: " + value);
        }
    }

    /** Builder for {@link ValidatorConfig}. Every field has a default. */
    public static final class Builder {
        private Duration timeout = Duration.ZERO;
        private String threadNamePrefix = EvaluationExecutors.DEFAULT_THREAD_NAME_PREFIX;
        private PathFormat pathFormat = PathFormat.DEFAULT;
        private boolean logResults;

        Builder() {}

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder timeoutMs(long timeoutMs) {
            this.timeout = Duration.ofMillis(timeoutMs);
            return this;
        }

        public Builder threadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
            return this;
        }

        public Builder pathFormat(PathFormat pathFormat) {
            this.pathFormat = pathFormat;
            return this;
        }

        public Builder logResults(boolean logResults) {
            this.logResults = logResults;
            return this;
        }

        public ValidatorConfig build() {
            return new ValidatorConfig(timeout, threadNamePrefix, pathFormat, logResults);
        }
    }
}
