package com.raditha.bytelift.model;

import java.util.Objects;

/**
 * Arithmetic or bitwise operation on two operands.
 */
public final class BinaryNumeric extends Instruction {

    private final BinaryOperator operator;

    public BinaryNumeric(BinaryOperator operator, Instruction left, Instruction right) {
        this(operator);
        children.add(Objects.requireNonNull(left, "left"));
        children.add(Objects.requireNonNull(right, "right"));
    }

    private BinaryNumeric(BinaryOperator operator) {
        super(OpCode.BINARY_NUMERIC);
        this.operator = Objects.requireNonNull(operator, "operator");
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public Instruction getLeft() {
        return children.get(0);
    }

    public Instruction getRight() {
        return children.get(1);
    }

    /**
     * Division and remainder may throw, everything else is pure if the operands are.
     */
    @Override
    public boolean isSideEffectFree() {
        return operator != BinaryOperator.DIV && operator != BinaryOperator.REM
                && getLeft().isSideEffectFree() && getRight().isSideEffectFree();
    }

    @Override
    protected Instruction shallowClone() {
        return new BinaryNumeric(operator);
    }

    @Override
    protected boolean operandsEqual(Instruction other) {
        return operator == ((BinaryNumeric) other).operator;
    }

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitBinaryNumeric(this);
    }
}
