package io.rulekit.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One segment of a field path, linked to its parent segment. The root segment
 * has a {@code null} parent.
 *
 * <p>
 * Segments are immutable and shared between every context derived from the
 * same parent, so extending a path is O(1).
 */
public sealed interface PathSegment {

    /** The enclosing segment, or {@code null} for the first segment. */
    PathSegment parent();

    /** The raw text of this segment (field name or decimal index). */
    String segment();

    // ── Implementations ──

    /** A named field of an object or map. */
    record Key(PathSegment parent, String name) implements PathSegment {
        public Key {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String segment() {
            return name;
        }
    }

    /** A position inside a list. */
    record Index(PathSegment parent, int index) implements PathSegment {
        public Index {
            if (index < 0) {
                throw new IllegalArgumentException("index must not be negative, got: " + index);
            }
        }

        @Override
        public String segment() {
            return Integer.toString(index);
        }
    }

    /**
     * Flattens the chain ending at {@code leaf} into root-to-leaf order.
     *
     * @param leaf the last segment, may be null
     * @return the segments, empty if {@code leaf} is null
     */
    static List<PathSegment> segments(PathSegment leaf) {
        if (leaf == null) {
            return List.of();
        }
        List<PathSegment> segments = new ArrayList<>();
        for (PathSegment current = leaf; current != null; current = current.parent()) {
            segments.add(current);
        }
        Collections.reverse(segments);
        return Collections.unmodifiableList(segments);
    }
}
