package org.hexscript.interpreter.frontend.evaluation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The run-scoped mapping from identifier to its last successfully assigned value.
 * <p>
 * Entries keep the order of their first assignment. Not thread-safe: a table belongs
 * to exactly one run and is mutated in statement order only.
 */
public class VariableTable {

    private final Map<String, Long> values = new LinkedHashMap<>();

    /**
     * Looks up a variable.
     * @param name The identifier.
     * @return The current value, or empty if the variable was never assigned.
     */
    public Optional<Long> lookup(String name) {
        return Optional.ofNullable(values.get(name));
    }

    /**
     * @param name The identifier.
     * @return true if the variable has been assigned in this run.
     */
    public boolean isDefined(String name) {
        return values.containsKey(name);
    }

    /**
     * Assigns a value, replacing any previous one.
     * @param name The identifier.
     * @param value The new value.
     */
    public void assign(String name, long value) {
        values.put(name, value);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * @return An unmodifiable copy of the current contents, in assignment order.
     */
    public Map<String, Long> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
