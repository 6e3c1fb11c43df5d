package io.rulekit.core.error;

import io.rulekit.core.model.PathSegment;
import java.util.List;

/**
 * Renders a field path for display. Implementations must be stateless and
 * thread-safe.
 */
public sealed interface PathSerializer {

    /**
     * @param segments path segments in root-to-leaf order, never null
     * @return the rendered path, empty string for an empty path
     */
    String serialize(List<PathSegment> segments);

    /** Default format: {@code /a/b/0}. A path that starts with an index has no leading slash. */
    PathSerializer DEFAULT = new Slash();

    /** RFC 6901 JSON Pointer: {@code /a~1b/0}. */
    PathSerializer JSON_POINTER = new JsonPointer();

    /** Dotted property access with bracketed indices: {@code a.b[0]}. */
    PathSerializer DOT = new Dot();

    /**
     * JSONPath: {@code $.a.b[0]}, {@code $} for the root. Keys containing
     * {@code .}, {@code [} or {@code ]} use bracket notation, {@code $['a.b']}.
     */
    PathSerializer JSON_PATH = new JsonPath();

    // ── Implementations ──

    /** See {@link #DEFAULT}. */
    final class Slash implements PathSerializer {
        private Slash() {}

        @Override
        public String serialize(List<PathSegment> segments) {
            if (segments.isEmpty()) {
                return "";
            }
            StringBuilder sb = new StringBuilder();
            boolean leadingIndex = segments.get(0) instanceof PathSegment.Index;
            for (int i = 0; i < segments.size(); i++) {
                if (i > 0 || !leadingIndex) {
                    sb.append('/');
                }
                sb.append(segments.get(i).segment());
            }
            return sb.toString();
        }
    }

    /** See {@link #JSON_POINTER}. */
    final class JsonPointer implements PathSerializer {
        private JsonPointer() {}

        @Override
        public String serialize(List<PathSegment> segments) {
            if (segments.isEmpty()) {
                return "";
            }
            StringBuilder sb = new StringBuilder();
            for (PathSegment segment : segments) {
                sb.append('/');
                // "~" must be escaped before "/" so that "~1" is not double-escaped
                sb.append(segment.segment().replace("~", "~0").replace("/", "~1"));
            }
            return sb.toString();
        }
    }

    /** See {@link #DOT}. */
    final class Dot implements PathSerializer {
        private Dot() {}

        @Override
        public String serialize(List<PathSegment> segments) {
            StringBuilder sb = new StringBuilder();
            for (PathSegment segment : segments) {
                if (segment instanceof PathSegment.Index idx) {
                    sb.append('[').append(idx.index()).append(']');
                } else {
                    if (sb.length() > 0) {
                        sb.append('.');
                    }
                    sb.append(segment.segment());
                }
            }
            return sb.toString();
        }
    }

    /** See {@link #JSON_PATH}. */
    final class JsonPath implements PathSerializer {
        private JsonPath() {}

        @Override
        public String serialize(List<PathSegment> segments) {
            StringBuilder sb = new StringBuilder("$");
            for (PathSegment segment : segments) {
                if (segment instanceof PathSegment.Index idx) {
                    sb.append('[').append(idx.index()).append(']');
                } else if (needsBrackets(segment.segment())) {
                    sb.append("['").append(segment.segment().replace("'", "\\'")).append("']");
                } else {
                    sb.append('.').append(segment.segment());
                }
            }
            return sb.toString();
        }

        private static boolean needsBrackets(String key) {
            return key.indexOf('.') >= 0 || key.indexOf('[') >= 0 || key.indexOf(']') >= 0;
        }
    }
}
