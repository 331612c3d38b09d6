package io.routeflow.core.sandbox;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The closed set of named values a script call can see. Nothing outside these bindings is reachable from inside the
 * sandbox.
 *
 * <p>Immutable; the values themselves may be mutable (e.g. a working copy of the channel map).
 */
public final class ScriptBindings {

    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final ScriptBindings EMPTY = new ScriptBindings(Map.of());

    private final Map<String, Object> values;

    private ScriptBindings(Map<String, Object> values) {
        this.values = values;
    }

    public static ScriptBindings empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Bound value, or {@code null} when the name is unbound or bound to null. */
    public Object get(String name) {
        return values.get(name);
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public Set<String> names() {
        return values.keySet();
    }

    /** Read-only view in binding order. */
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "ScriptBindings" + values.keySet();
    }

    /** Collects bindings in declaration order. */
    public static final class Builder {

        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {}

        /**
         * @throws IllegalArgumentException if {@code name} is not a plain identifier
         */
        public Builder bind(String name, Object value) {
            Objects.requireNonNull(name, "name must not be null");
            if (!NAME.matcher(name).matches()) {
                throw new IllegalArgumentException("Invalid binding name: '" + name + "'");
            }
            values.put(name, value);
            return this;
        }

        public ScriptBindings build() {
            if (values.isEmpty()) {
                return EMPTY;
            }
            return new ScriptBindings(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }
    }
}
