package com.raditha.bytelift.model;

import java.util.Optional;

/**
 * Leaves the function, optionally with a value.
 */
public final class Return extends Instruction {

    public Return() {
        super(OpCode.RETURN);
    }

    public Return(Instruction value) {
        this();
        if (value != null) {
            children.add(value);
        }
    }

    public Optional<Instruction> getValue() {
        return children.isEmpty() ? Optional.empty() : Optional.of(children.get(0));
    }

    @Override
    protected Instruction shallowClone() {
        return new Return();
    }

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }
}
