package io.rulekit.core.rules;

import java.util.List;
import java.util.Map;

/** Short, user-facing names for the runtime kind of an untyped value. */
public final class ValueKinds {

    private ValueKinds() {
        // utility class
    }

    /**
     * @param value any value, may be null
     * @return e.g. {@code "string"}, {@code "int"}, {@code "map"}, {@code "null"}
     */
    public static String of(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String) return "string";
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) return "int";
        if (value instanceof Long) return "long";
        if (value instanceof Double || value instanceof Float) return "float";
        if (value instanceof Number) return "number";
        if (value instanceof Boolean) return "bool";
        if (value instanceof Map) return "map";
        if (value instanceof List) return "list";
        if (value instanceof byte[]) return "bytes";
        return value.getClass().getSimpleName();
    }
}
