package com.raditha.bytelift.model;

import java.util.List;

/**
 * Static or non-virtual method call.
 */
public final class Call extends CallInstruction {

    public Call(MethodReference method, Instruction... arguments) {
        this(method, List.of(arguments));
    }

    public Call(MethodReference method, List<? extends Instruction> arguments) {
        super(OpCode.CALL, method, arguments);
    }

    @Override
    protected Instruction shallowClone() {
        return new Call(getMethod(), List.of());
    }
}
