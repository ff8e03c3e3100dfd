package com.raditha.bytelift.model;

import java.util.Objects;

/**
 * Compares two operands of the given stack type and yields a boolean.
 */
public final class Comp extends Instruction {

    private final ComparisonKind kind;
    private final StackType inputType;

    public Comp(ComparisonKind kind, StackType inputType, Instruction left, Instruction right) {
        this(kind, inputType);
        children.add(Objects.requireNonNull(left, "left"));
        children.add(Objects.requireNonNull(right, "right"));
    }

    private Comp(ComparisonKind kind, StackType inputType) {
        super(OpCode.COMP);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.inputType = Objects.requireNonNull(inputType, "inputType");
    }

    public ComparisonKind getKind() {
        return kind;
    }

    public StackType getInputType() {
        return inputType;
    }

    public Instruction getLeft() {
        return children.get(0);
    }

    public Instruction getRight() {
        return children.get(1);
    }

    @Override
    public boolean isSideEffectFree() {
        return getLeft().isSideEffectFree() && getRight().isSideEffectFree();
    }

    @Override
    protected Instruction shallowClone() {
        return new Comp(kind, inputType);
    }

    @Override
    protected boolean operandsEqual(Instruction other) {
        Comp comp = (Comp) other;
        return kind == comp.kind && inputType == comp.inputType;
    }

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitComp(this);
    }
}
