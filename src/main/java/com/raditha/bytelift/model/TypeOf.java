package com.raditha.bytelift.model;

import java.util.Objects;

/**
 * High-level {@code typeof(T)} expression, produced from a type-handle lookup call.
 */
public final class TypeOf extends Instruction {

    private final TypeReference type;

    public TypeOf(TypeReference type) {
        super(OpCode.TYPE_OF);
        this.type = Objects.requireNonNull(type, "type");
    }

    public TypeReference getType() {
        return type;
    }

    @Override
    public boolean isSideEffectFree() {
        return true;
    }

    @Override
    protected Instruction shallowClone() {
        return new TypeOf(type);
    }

    @Override
    protected boolean operandsEqual(Instruction other) {
        return type.equals(((TypeOf) other).type);
    }

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitTypeOf(this);
    }
}
