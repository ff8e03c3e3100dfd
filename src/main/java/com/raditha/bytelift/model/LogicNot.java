package com.raditha.bytelift.model;

import java.util.Objects;

/**
 * Boolean negation.
 */
public final class LogicNot extends Instruction {

    public LogicNot(Instruction argument) {
        this();
        children.add(Objects.requireNonNull(argument, "argument"));
    }

    private LogicNot() {
        super(OpCode.LOGIC_NOT);
    }

    public Instruction getArgument() {
        return children.get(0);
    }

    @Override
    public boolean isSideEffectFree() {
        return getArgument().isSideEffectFree();
    }

    @Override
    protected Instruction shallowClone() {
        return new LogicNot();
    }

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitLogicNot(this);
    }
}
