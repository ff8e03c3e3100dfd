package com.raditha.bytelift.model;

/**
 * Loads a 32-bit integer constant.
 */
public final class LdcI4 extends Instruction {

    private final int value;

    public LdcI4(int value) {
        super(OpCode.LDC_I4);
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    @Override
    public boolean isSideEffectFree() {
        return true;
    }

    @Override
    protected Instruction shallowClone() {
        return new LdcI4(value);
    }

    @Override
    protected boolean operandsEqual(Instruction other) {
        return value == ((LdcI4) other).value;
    }

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitLdcI4(this);
    }
}
