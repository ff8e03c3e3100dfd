package com.raditha.bytelift.model;

import java.util.Objects;

/**
 * Loads the runtime handle of a type (the {@code ldtoken} opcode applied to a type).
 */
public final class LdTypeToken extends Instruction {

    private final TypeReference type;

    public LdTypeToken(TypeReference type) {
        super(OpCode.LD_TYPE_TOKEN);
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
        return new LdTypeToken(type);
    }

    @Override
    protected boolean operandsEqual(Instruction other) {
        return type.equals(((LdTypeToken) other).type);
    }

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitLdTypeToken(this);
    }
}
