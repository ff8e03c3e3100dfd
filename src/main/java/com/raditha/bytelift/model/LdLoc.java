package com.raditha.bytelift.model;

import java.util.Objects;

/**
 * Loads the value of a local slot.
 */
public final class LdLoc extends Instruction {

    private final ILVariable variable;

    public LdLoc(ILVariable variable) {
        super(OpCode.LD_LOC);
        this.variable = Objects.requireNonNull(variable, "variable");
    }

    public ILVariable getVariable() {
        return variable;
    }

    public boolean loads(ILVariable v) {
        return variable == v;
    }

    @Override
    public boolean isSideEffectFree() {
        return true;
    }

    @Override
    protected Instruction shallowClone() {
        return new LdLoc(variable);
    }

    @Override
    protected boolean operandsEqual(Instruction other) {
        return variable == ((LdLoc) other).variable;
    }

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitLdLoc(this);
    }
}
