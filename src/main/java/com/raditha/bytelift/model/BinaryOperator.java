package com.raditha.bytelift.model;

/**
 * Arithmetic and bitwise operators used by {@link BinaryNumeric} and {@link CompoundAssignment}.
 */
public enum BinaryOperator {
    ADD("add", "+"),
    SUB("sub", "-"),
    MUL("mul", "*"),
    DIV("div", "/"),
    REM("rem", "%"),
    BIT_AND("and", "&"),
    BIT_OR("or", "|"),
    BIT_XOR("xor", "^"),
    SHIFT_LEFT("shl", "<<"),
    SHIFT_RIGHT("shr", ">>");

    private final String token;
    private final String symbol;

    BinaryOperator(String token, String symbol) {
        this.token = token;
        this.symbol = symbol;
    }

    /**
     * Name used in the IL text syntax, e.g. {@code binary.add}.
     */
    public String token() {
        return token;
    }

    /**
     * Source-level operator symbol.
     */
    public String symbol() {
        return symbol;
    }

    public static BinaryOperator fromToken(String token) {
        for (BinaryOperator op : values()) {
            if (op.token.equals(token)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown binary operator: " + token);
    }
}
