package com.raditha.bytelift.model;

/**
 * Ordered statement list inside a function body. The block owns its instructions exclusively.
 */
public final class Block extends Instruction {

    private final String label;

    public Block(String label) {
        super(OpCode.BLOCK);
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("label cannot be blank");
        }
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public InstructionCollection getInstructions() {
        return children;
    }

    @Override
    protected Instruction shallowClone() {
        return new Block(label);
    }

    @Override
    protected boolean operandsEqual(Instruction other) {
        return label.equals(((Block) other).label);
    }

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }
}
