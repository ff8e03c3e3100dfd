package com.raditha.bytelift.model;

public final class Nop extends Instruction {

    public Nop() {
        super(OpCode.NOP);
    }

    @Override
    public boolean isSideEffectFree() {
        return true;
    }

    @Override
    protected Instruction shallowClone() {
        return new Nop();
    }

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitNop(this);
    }
}
