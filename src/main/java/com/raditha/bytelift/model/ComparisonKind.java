package com.raditha.bytelift.model;

/**
 * Comparison kinds carried by {@link Comp}.
 */
public enum ComparisonKind {
    EQ("eq", "=="),
    NE("ne", "!="),
    LT("lt", "<"),
    LE("le", "<="),
    GT("gt", ">"),
    GE("ge", ">=");

    private final String token;
    private final String symbol;

    ComparisonKind(String token, String symbol) {
        this.token = token;
        this.symbol = symbol;
    }

    public String token() {
        return token;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * The kind that yields the logical complement for totally ordered operands.
     * Not valid for floating point operands where NaN is unordered.
     */
    public ComparisonKind negate() {
        return switch (this) {
            case EQ -> NE;
            case NE -> EQ;
            case LT -> GE;
            case LE -> GT;
            case GT -> LE;
            case GE -> LT;
        };
    }

    public static ComparisonKind fromToken(String token) {
        for (ComparisonKind kind : values()) {
            if (kind.token.equals(token)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown comparison kind: " + token);
    }
}
