package com.raditha.bytelift.model;

import java.util.Objects;

/**
 * Loads a string literal.
 */
public final class LdStr extends Instruction {

    private final String value;

    public LdStr(String value) {
        super(OpCode.LD_STR);
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean isSideEffectFree() {
        return true;
    }

    @Override
    protected Instruction shallowClone() {
        return new LdStr(value);
    }

    @Override
    protected boolean operandsEqual(Instruction other) {
        return value.equals(((LdStr) other).value);
    }

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitLdStr(this);
    }
}
