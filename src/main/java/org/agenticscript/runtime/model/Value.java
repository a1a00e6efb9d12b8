package org.agenticscript.runtime.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Small, typed value system of the interpreter. Values are immutable; collection values keep
 * their insertion order.
 */
public sealed interface Value permits Value.Str, Value.Num, Value.Bool, Value.Null, Value.AgentRef,
        Value.ListVal, Value.MapVal, Value.ToolSet {

    /** The null value. */
    Null NULL = new Null();
    Bool TRUE = new Bool(true);
    Bool FALSE = new Bool(false);

    /**
     * @return The name of the value's type as shown in error messages.
     */
    String typeName();

    /**
     * @return The text written by {@code print} and inserted into interpolated strings.
     */
    String display();

    /**
     * @return The representation used when the value is nested in a collection.
     */
    default String repr() {
        return display();
    }

    static Str of(String value) {
        return new Str(value);
    }

    static Num of(double value) {
        return new Num(value);
    }

    static Bool of(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * Represents a string value.
     * @param value The string value.
     */
    record Str(String value) implements Value {
        @Override public String typeName() { return "string"; }
        @Override public String display() { return value; }
        @Override public String repr() { return "\"" + value + "\""; }
    }

    /**
     * Represents a number. Integral numbers display without a fraction.
     * @param value The numeric value.
     */
    record Num(double value) implements Value {
        @Override public String typeName() { return "number"; }

        @Override
        public String display() {
            if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
                return Long.toString((long) value);
            }
            return Double.toString(value);
        }
    }

    /**
     * Represents a boolean value.
     * @param value The boolean value.
     */
    record Bool(boolean value) implements Value {
        @Override public String typeName() { return "boolean"; }
        @Override public String display() { return Boolean.toString(value); }
    }

    /**
     * Represents the absence of a value.
     */
    record Null() implements Value {
        @Override public String typeName() { return "null"; }
        @Override public String display() { return "null"; }
    }

    /**
     * A reference to a live agent.
     * @param agentId The id of the referenced agent.
     */
    record AgentRef(String agentId) implements Value {
        @Override public String typeName() { return "agent"; }
        @Override public String display() { return "<agent " + agentId + ">"; }
    }

    /**
     * Represents a list of values.
     * @param elements The elements in order.
     */
    record ListVal(List<Value> elements) implements Value {
        public ListVal {
            elements = List.copyOf(elements);
        }

        @Override public String typeName() { return "list"; }

        @Override
        public String display() {
            return elements.stream().map(Value::repr).collect(Collectors.joining(", ", "[", "]"));
        }
    }

    /**
     * Represents a map of string keys to values, in insertion order.
     * @param entries The entries.
     */
    record MapVal(Map<String, Value> entries) implements Value {
        public MapVal {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        @Override public String typeName() { return "map"; }

        @Override
        public String display() {
            return entries.entrySet().stream()
                    .map(e -> "\"" + e.getKey() + "\": " + e.getValue().repr())
                    .collect(Collectors.joining(", ", "{", "}"));
        }
    }

    /**
     * An ordered set of tool bindings, as assigned to an agent's {@code tools} property.
     * @param bindings The bindings; tool names are unique.
     */
    record ToolSet(List<ToolBinding> bindings) implements Value {
        public ToolSet {
            bindings = List.copyOf(bindings);
        }

        @Override public String typeName() { return "tools"; }

        public Set<String> toolNames() {
            return bindings.stream().map(ToolBinding::toolName).collect(Collectors.toCollection(LinkedHashSet::new));
        }

        /**
         * Unions two tool sets by tool name. A binding in {@code other} replaces the binding of
         * the same name in place; new names are appended.
         * @param other The bindings to add.
         * @return The merged set.
         */
        public ToolSet union(ToolSet other) {
            Map<String, ToolBinding> merged = new LinkedHashMap<>();
            bindings.forEach(b -> merged.put(b.toolName(), b));
            other.bindings.forEach(b -> merged.put(b.toolName(), b));
            return new ToolSet(List.copyOf(merged.values()));
        }

        @Override
        public String display() {
            return bindings.stream()
                    .map(b -> b.targetAgentIds().isEmpty()
                            ? b.toolName()
                            : b.toolName() + "{" + String.join(", ", b.targetAgentIds()) + "}")
                    .collect(Collectors.joining(", ", "{", "}"));
        }
    }
}
