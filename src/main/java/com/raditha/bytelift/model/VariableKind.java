package com.raditha.bytelift.model;

/**
 * The role a local slot plays in a function body.
 */
public enum VariableKind {
    LOCAL("local"),
    PARAMETER("param"),
    /** Compiler-generated evaluation stack temporary. */
    STACK_SLOT("stack"),
    PINNED_LOCAL("pinned"),
    EXCEPTION_SLOT("exception");

    private final String token;

    VariableKind(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public static VariableKind fromToken(String token) {
        for (VariableKind kind : values()) {
            if (kind.token.equals(token)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown variable kind: " + token);
    }
}
