package com.raditha.bytelift.match;

import com.raditha.bytelift.model.ILVariable;
import com.raditha.bytelift.model.Instruction;
import com.raditha.bytelift.model.MethodReference;
import com.raditha.bytelift.model.TypeReference;

import java.util.HashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Named bindings collected while a {@link Pattern} walks a sub-tree.
 */
public final class Match {

    private final Map<String, Object> bindings = new HashMap<>();

    void bind(String name, Object value) {
        bindings.put(name, value);
    }

    /**
     * Binds {@code name}, or checks that an existing binding is the same value. Repeating a capture name
     * inside one pattern therefore expresses "these two positions hold the same thing".
     */
    boolean bindOrCompare(String name, Object value) {
        Object existing = bindings.get(name);
        if (existing == null) {
            bindings.put(name, value);
            return true;
        }
        if (existing instanceof Instruction a && value instanceof Instruction b) {
            return a.isStructurallyEqual(b);
        }
        return existing == value || existing.equals(value);
    }

    Map<String, Object> snapshot() {
        return new HashMap<>(bindings);
    }

    void restore(Map<String, Object> snapshot) {
        bindings.clear();
        bindings.putAll(snapshot);
    }

    public boolean has(String name) {
        return bindings.containsKey(name);
    }

    public Instruction instruction(String name) {
        return get(name, Instruction.class);
    }

    public ILVariable variable(String name) {
        return get(name, ILVariable.class);
    }

    public String string(String name) {
        return get(name, String.class);
    }

    public TypeReference type(String name) {
        return get(name, TypeReference.class);
    }

    public MethodReference method(String name) {
        return get(name, MethodReference.class);
    }

    public int integer(String name) {
        return get(name, Integer.class);
    }

    private <T> T get(String name, Class<T> type) {
        Object value = bindings.get(name);
        if (value == null) {
            throw new NoSuchElementException("No binding named '" + name + "'");
        }
        if (!type.isInstance(value)) {
            throw new ClassCastException("Binding '" + name + "' is a " + value.getClass().getSimpleName()
                    + ", not a " + type.getSimpleName());
        }
        return type.cast(value);
    }

    @Override
    public String toString() {
        return "Match" + bindings.keySet();
    }
}
