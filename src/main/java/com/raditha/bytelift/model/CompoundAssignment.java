package com.raditha.bytelift.model;

import java.util.Objects;

/**
 * {@code v op= value}: reads and writes the same local slot.
 */
public final class CompoundAssignment extends Instruction {

    private final BinaryOperator operator;
    private final ILVariable variable;

    public CompoundAssignment(BinaryOperator operator, ILVariable variable, Instruction value) {
        this(operator, variable);
        children.add(Objects.requireNonNull(value, "value"));
    }

    private CompoundAssignment(BinaryOperator operator, ILVariable variable) {
        super(OpCode.COMPOUND_ASSIGNMENT);
        this.operator = Objects.requireNonNull(operator, "operator");
        this.variable = Objects.requireNonNull(variable, "variable");
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public ILVariable getVariable() {
        return variable;
    }

    public Instruction getValue() {
        return children.get(0);
    }

    @Override
    protected Instruction shallowClone() {
        return new CompoundAssignment(operator, variable);
    }

    @Override
    protected boolean operandsEqual(Instruction other) {
        CompoundAssignment that = (CompoundAssignment) other;
        return operator == that.operator && variable == that.variable;
    }

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitCompoundAssignment(this);
    }
}
