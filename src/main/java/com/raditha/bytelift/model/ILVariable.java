package com.raditha.bytelift.model;

/**
 * A logical local slot. Identity is object identity: two variables with the same name, kind and
 * type are still distinct slots, so {@code equals} is deliberately not overridden.
 */
public final class ILVariable {

    private final VariableKind kind;
    private final TypeReference type;
    private final String name;
    private final int index;

    /**
     * @param kind  role of the slot
     * @param type  declared type, or null when the loader could not determine it
     * @param name  display name (best effort, not guaranteed unique)
     * @param index slot index inside its kind
     */
    public ILVariable(VariableKind kind, TypeReference type, String name, int index) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
        this.kind = kind;
        this.type = type;
        this.name = name;
        this.index = index;
    }

    public VariableKind getKind() {
        return kind;
    }

    public TypeReference getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public String toString() {
        return name;
    }
}
