package com.raditha.bytelift.model;

import java.util.List;

/**
 * Flattened string concatenation of two or more operands.
 */
public final class StringConcat extends Instruction {

    public StringConcat(List<? extends Instruction> operands) {
        super(OpCode.STRING_CONCAT);
        for (Instruction operand : operands) {
            children.add(operand);
        }
    }

    public InstructionCollection getOperands() {
        return children;
    }

    @Override
    protected Instruction shallowClone() {
        return new StringConcat(List.of());
    }

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitStringConcat(this);
    }
}
