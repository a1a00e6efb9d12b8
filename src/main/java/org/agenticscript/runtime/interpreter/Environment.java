package org.agenticscript.runtime.interpreter;

import org.agenticscript.runtime.api.DuplicateNameException;
import org.agenticscript.runtime.api.UndefinedVariableException;
import org.agenticscript.runtime.model.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One frame of variable bindings. Frames form a chain: lookups walk outward, inner frames
 * shadow outer ones. Environments are confined to the interpreter thread.
 */
public class Environment {

    private final Environment parent;
    private final Map<String, Value> values = new LinkedHashMap<>();

    /**
     * Creates the outermost frame.
     */
    public Environment() {
        this(null);
    }

    private Environment(Environment parent) {
        this.parent = parent;
    }

    /**
     * @return A new frame nested in this one.
     */
    public Environment child() {
        return new Environment(this);
    }

    public boolean isGlobal() {
        return parent == null;
    }

    /**
     * Looks a name up in this frame and then in the enclosing ones.
     */
    public Optional<Value> lookup(String name) {
        for (Environment frame = this; frame != null; frame = frame.parent) {
            Value value = frame.values.get(name);
            if (value != null) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /**
     * @throws UndefinedVariableException if the name is bound in no frame.
     */
    public Value get(String name) {
        return lookup(name).orElseThrow(() -> new UndefinedVariableException(name));
    }

    public boolean isVisible(String name) {
        return lookup(name).isPresent();
    }

    public boolean isDefinedLocally(String name) {
        return values.containsKey(name);
    }

    /**
     * Binds a new name in this frame.
     * @throws DuplicateNameException if this frame already binds the name.
     */
    public void declare(String name, Value value) {
        if (values.containsKey(name)) {
            throw new DuplicateNameException(name);
        }
        values.put(name, value);
    }

    /**
     * Plain assignment. The outermost frame defines or rebinds; an inner frame rebinds the
     * nearest existing binding.
     * @throws UndefinedVariableException if an inner frame assigns a name bound nowhere.
     */
    public void assign(String name, Value value) {
        for (Environment frame = this; frame != null; frame = frame.parent) {
            if (frame.values.containsKey(name)) {
                frame.values.put(name, value);
                return;
            }
        }
        if (!isGlobal()) {
            throw new UndefinedVariableException(name);
        }
        values.put(name, value);
    }

    /**
     * @return The bindings of this frame only, in definition order.
     */
    public Map<String, Value> localBindings() {
        return Collections.unmodifiableMap(values);
    }
}
