package org.logicsolver.solver.frontend.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The values assigned to variables by the assignment statements of a statement.
 * Instances are immutable; the parser fills a {@link Builder} and freezes it once parsing completes.
 */
public final class Bindings {

    private static final Bindings EMPTY = new Bindings(Map.of());

    private final Map<String, Boolean> values;

    private Bindings(Map<String, Boolean> values) {
        this.values = values;
    }

    /**
     * Gets a table without any bindings.
     * @return The empty table.
     */
    public static Bindings empty() {
        return EMPTY;
    }

    /**
     * Creates a table from a map, e.g. for evaluating a hand-built tree.
     * @param values The variable values.
     * @return A table holding a copy of the values.
     */
    public static Bindings of(Map<String, Boolean> values) {
        return new Bindings(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    /**
     * Creates an empty builder.
     * @return The builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up the value of a variable.
     * @param name The variable name.
     * @return The value, or empty if the variable was never assigned.
     */
    public Optional<Boolean> resolve(String name) {
        return Optional.ofNullable(values.get(name));
    }

    /**
     * Checks whether a variable was assigned.
     * @param name The variable name.
     * @return true if a value is bound.
     */
    public boolean isBound(String name) {
        return values.containsKey(name);
    }

    /**
     * Gets the assigned variable names in order of first assignment.
     * @return The names.
     */
    public Set<String> names() {
        return values.keySet();
    }

    /**
     * Gets the number of assigned variables.
     * @return The size.
     */
    public int size() {
        return values.size();
    }

    /**
     * Gets a read-only view of the bindings.
     * @return The map from name to value.
     */
    public Map<String, Boolean> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bindings other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }

    /**
     * Collects bindings while assignment statements are parsed. Later assignments overwrite earlier ones.
     */
    public static final class Builder {
        private final Map<String, Boolean> values = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Binds a value, replacing any previous value.
         * @param name The variable name.
         * @param value The value.
         * @return true if the variable already had a value.
         */
        public boolean bind(String name, boolean value) {
            return values.put(name, value) != null;
        }

        /**
         * Looks up a value bound so far.
         * @param name The variable name.
         * @return The value, or empty if not bound yet.
         */
        public Optional<Boolean> resolve(String name) {
            return Optional.ofNullable(values.get(name));
        }

        /**
         * Freezes the collected bindings.
         * @return The immutable table.
         */
        public Bindings build() {
            if (values.isEmpty()) {
                return EMPTY;
            }
            return new Bindings(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }
    }
}
