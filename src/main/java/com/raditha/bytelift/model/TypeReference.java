package com.raditha.bytelift.model;

/**
 * Externally resolved type identity. Two references are the same type exactly when their full names match.
 *
 * @param fullName namespace-qualified name, e.g. {@code System.Linq.Expressions.ParameterExpression}
 */
public record TypeReference(String fullName) {

    public static final TypeReference VOID = new TypeReference("void");

    public TypeReference {
        if (fullName == null || fullName.isBlank()) {
            throw new IllegalArgumentException("fullName cannot be blank");
        }
    }

    public static TypeReference of(String fullName) {
        return new TypeReference(fullName);
    }

    /**
     * The type name without its namespace.
     */
    public String simpleName() {
        int dot = fullName.lastIndexOf('.');
        return dot < 0 ? fullName : fullName.substring(dot + 1);
    }

    /**
     * The namespace, or an empty string for types in the global namespace.
     */
    public String namespace() {
        int dot = fullName.lastIndexOf('.');
        return dot < 0 ? "" : fullName.substring(0, dot);
    }

    @Override
    public String toString() {
        return fullName;
    }
}
