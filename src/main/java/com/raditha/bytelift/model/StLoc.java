package com.raditha.bytelift.model;

import java.util.Objects;

/**
 * Stores its single child into a local slot.
 */
public final class StLoc extends Instruction {

    private final ILVariable variable;

    public StLoc(ILVariable variable, Instruction value) {
        this(variable);
        children.add(Objects.requireNonNull(value, "value"));
    }

    private StLoc(ILVariable variable) {
        super(OpCode.ST_LOC);
        this.variable = Objects.requireNonNull(variable, "variable");
    }

    public ILVariable getVariable() {
        return variable;
    }

    public Instruction getValue() {
        return children.get(0);
    }

    public void setValue(Instruction value) {
        children.set(0, value);
    }

    @Override
    protected Instruction shallowClone() {
        return new StLoc(variable);
    }

    @Override
    protected boolean operandsEqual(Instruction other) {
        return variable == ((StLoc) other).variable;
    }

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitStLoc(this);
    }
}
