package com.raditha.bytelift.model;

import java.util.Objects;

/**
 * Immutable, externally resolved method identity: declaring type, member name and arity.
 * Matching logic compares these structurally instead of comparing names alone, so an unrelated
 * member that happens to share a name never matches.
 *
 * @param declaringType  the type declaring the method
 * @param name           the member name
 * @param parameterCount number of declared parameters, excluding the implicit receiver
 */
public record MethodReference(TypeReference declaringType, String name, int parameterCount) {

    public MethodReference {
        Objects.requireNonNull(declaringType, "declaringType");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
        if (parameterCount < 0) {
            throw new IllegalArgumentException("parameterCount must be >= 0");
        }
    }

    public static MethodReference of(String declaringType, String name, int parameterCount) {
        return new MethodReference(TypeReference.of(declaringType), name, parameterCount);
    }

    @Override
    public String toString() {
        return declaringType.fullName() + "::" + name + "/" + parameterCount;
    }
}
