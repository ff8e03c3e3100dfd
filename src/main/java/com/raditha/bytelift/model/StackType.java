package com.raditha.bytelift.model;

/**
 * Evaluation stack type of a comparison's operands.
 */
public enum StackType {
    I4("i4"),
    I8("i8"),
    F("f"),
    REF("ref");

    private final String token;

    StackType(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public boolean isFloatingPoint() {
        return this == F;
    }

    public static StackType fromToken(String token) {
        for (StackType type : values()) {
            if (type.token.equals(token)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown stack type: " + token);
    }
}
