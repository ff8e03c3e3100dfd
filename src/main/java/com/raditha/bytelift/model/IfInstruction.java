package com.raditha.bytelift.model;

import java.util.Objects;

/**
 * {@code if (condition) trueInst else falseInst}. A missing else branch is a {@link Nop}.
 */
public final class IfInstruction extends Instruction {

    public IfInstruction(Instruction condition, Instruction trueInst) {
        this(condition, trueInst, new Nop());
    }

    public IfInstruction(Instruction condition, Instruction trueInst, Instruction falseInst) {
        this();
        children.add(Objects.requireNonNull(condition, "condition"));
        children.add(Objects.requireNonNull(trueInst, "trueInst"));
        children.add(Objects.requireNonNull(falseInst, "falseInst"));
    }

    private IfInstruction() {
        super(OpCode.IF);
    }

    public Instruction getCondition() {
        return children.get(0);
    }

    public Instruction getTrueInst() {
        return children.get(1);
    }

    public Instruction getFalseInst() {
        return children.get(2);
    }

    public boolean hasElse() {
        return getFalseInst().getOpCode() != OpCode.NOP;
    }

    @Override
    protected Instruction shallowClone() {
        return new IfInstruction();
    }

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitIf(this);
    }
}
