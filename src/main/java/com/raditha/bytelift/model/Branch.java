package com.raditha.bytelift.model;

import java.util.Objects;

/**
 * Unconditional jump to another block of the same function. The target is a reference, not a child.
 */
public final class Branch extends Instruction {

    private Block target;

    public Branch(Block target) {
        super(OpCode.BRANCH);
        this.target = Objects.requireNonNull(target, "target");
    }

    public Block getTarget() {
        return target;
    }

    /**
     * Re-points the branch, used when a whole function is cloned and its blocks are remapped.
     */
    public void setTarget(Block target) {
        this.target = Objects.requireNonNull(target, "target");
    }

    @Override
    protected Instruction shallowClone() {
        return new Branch(target);
    }

    @Override
    protected boolean operandsEqual(Instruction other) {
        return target.getLabel().equals(((Branch) other).target.getLabel());
    }

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitBranch(this);
    }
}
