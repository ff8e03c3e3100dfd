package com.raditha.bytelift.model;

public final class LdNull extends Instruction {

    public LdNull() {
        super(OpCode.LD_NULL);
    }

    @Override
    public boolean isSideEffectFree() {
        return true;
    }

    @Override
    protected Instruction shallowClone() {
        return new LdNull();
    }

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitLdNull(this);
    }
}
