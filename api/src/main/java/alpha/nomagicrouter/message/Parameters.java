package alpha.nomagicrouter.message;

import alpha.nomagicrouter.util.Getters;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Named parameters; path parameters captured by a route, or query parameters
 * of the request-target.<p>
 * 
 * A parameter has either a single value, or a sequence of values. Path
 * parameters declared as repeatable ({@code :name*} or {@code :name+}) always
 * have a sequence, as do query parameters given more than once.<p>
 * 
 * Names are case-sensitive and iterated in insertion order. The
 * implementation is immutable.
 * 
 * @see Getters#URL_PARAMS
 * @see Getters#QUERY
 */
public final class Parameters
{
    private static final Parameters EMPTY = new Parameters(Map.of(), Set.of());
    
    /**
     * {@return parameters without any names}
     */
    public static Parameters empty() {
        return EMPTY;
    }
    
    /**
     * {@return a builder of parameters}
     */
    public static Builder builder() {
        return new Builder();
    }
    
    private final Map<String, List<String>> values;
    private final Set<String> repeated;
    
    private Parameters(Map<String, List<String>> values, Set<String> repeated) {
        this.values = values;
        this.repeated = repeated;
    }
    
    /**
     * Returns the value of a parameter.<p>
     * 
     * If the parameter is a sequence, the first value is returned.
     * 
     * @param name of parameter
     * @return the value, or {@code null} if the parameter is absent
     */
    public String get(String name) {
        var v = values.get(name);
        return v == null ? null : v.get(0);
    }
    
    /**
     * Returns all values of a parameter.
     * 
     * @param name of parameter
     * @return all values (never {@code null}, empty if the parameter is absent)
     */
    public List<String> getAll(String name) {
        return values.getOrDefault(name, List.of());
    }
    
    /**
     * {@return {@code true} if the parameter is present}
     * 
     * @param name of parameter
     */
    public boolean contains(String name) {
        return values.containsKey(name);
    }
    
    /**
     * {@return {@code true} if the parameter is present with a sequence of values}
     * 
     * @param name of parameter
     */
    public boolean isRepeated(String name) {
        return repeated.contains(name);
    }
    
    /**
     * {@return all parameter names, in insertion order}
     */
    public Set<String> names() {
        return values.keySet();
    }
    
    /**
     * {@return {@code true} if there are no parameters}
     */
    public boolean isEmpty() {
        return values.isEmpty();
    }
    
    /**
     * Returns an unmodifiable map view where a single value is a
     * {@code String} and a sequence is a {@code List<String>}.
     * 
     * @return a map view
     */
    public Map<String, Object> asMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        values.forEach((k, v) -> m.put(k, repeated.contains(k) ? v : v.get(0)));
        return Collections.unmodifiableMap(m);
    }
    
    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Parameters other)) {
            return false;
        }
        return values.equals(other.values) && repeated.equals(other.repeated);
    }
    
    @Override
    public int hashCode() {
        return values.hashCode();
    }
    
    @Override
    public String toString() {
        return asMap().toString();
    }
    
    /**
     * Builder of {@link Parameters}.<p>
     * 
     * The implementation is not thread-safe.
     */
    public static final class Builder
    {
        private final Map<String, List<String>> values = new LinkedHashMap<>();
        private final Set<String> repeated = new LinkedHashSet<>();
        
        private Builder() {
            // Empty
        }
        
        /**
         * Adds a value.<p>
         * 
         * If the parameter already has a value, the parameter becomes a
         * sequence.
         * 
         * @param name of parameter
         * @param value of parameter
         * @return this (for chaining/fluency)
         * @throws NullPointerException if any argument is {@code null}
         */
        public Builder add(String name, String value) {
            requireNonNull(value);
            var l = values.computeIfAbsent(requireNonNull(name), k -> new ArrayList<>(1));
            l.add(value);
            if (l.size() > 1) {
                repeated.add(name);
            }
            return this;
        }
        
        /**
         * Sets a sequence, replacing any previous value.
         * 
         * @param name of parameter
         * @param values of parameter
         * @return this (for chaining/fluency)
         * @throws NullPointerException if any argument or element is {@code null}
         * @throws IllegalArgumentException if {@code values} is empty
         */
        public Builder setAll(String name, List<String> values) {
            if (values.isEmpty()) {
                throw new IllegalArgumentException("No values for " + name);
            }
            values.forEach(v -> requireNonNull(v));
            this.values.put(requireNonNull(name), new ArrayList<>(values));
            repeated.add(name);
            return this;
        }
        
        /**
         * {@return the parameters}
         */
        public Parameters build() {
            if (values.isEmpty()) {
                return EMPTY;
            }
            Map<String, List<String>> copy = new LinkedHashMap<>();
            values.forEach((k, v) -> copy.put(k, List.copyOf(v)));
            return new Parameters(
                    Collections.unmodifiableMap(copy),
                    Collections.unmodifiableSet(new LinkedHashSet<>(repeated)));
        }
    }
}
