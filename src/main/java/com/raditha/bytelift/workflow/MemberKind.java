package com.raditha.bytelift.workflow;

/**
 * The kinds of declaration a caller may ask to decompile. Only the method-like kinds have a body.
 */
public enum MemberKind {
    TYPE("type", false),
    METHOD("method", true),
    CONSTRUCTOR("ctor", true),
    STATIC_CONSTRUCTOR("cctor", true),
    GETTER("getter", true),
    SETTER("setter", true),
    ADDER("adder", true),
    REMOVER("remover", true),
    FIELD("field", false),
    PROPERTY("property", false),
    EVENT("event", false);

    private final String token;
    private final boolean hasBody;

    MemberKind(String token, boolean hasBody) {
        this.token = token;
        this.hasBody = hasBody;
    }

    public String token() {
        return token;
    }

    public boolean hasBody() {
        return hasBody;
    }

    public boolean isConstructor() {
        return this == CONSTRUCTOR || this == STATIC_CONSTRUCTOR;
    }

    public boolean isAccessor() {
        return this == GETTER || this == SETTER || this == ADDER || this == REMOVER;
    }

    public static MemberKind fromToken(String token) {
        for (MemberKind kind : values()) {
            if (kind.token.equals(token)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown member kind: " + token);
    }
}
