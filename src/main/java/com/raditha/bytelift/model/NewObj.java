package com.raditha.bytelift.model;

import java.util.List;

/**
 * Constructor call that allocates a new object.
 */
public final class NewObj extends CallInstruction {

    public NewObj(MethodReference method, Instruction... arguments) {
        this(method, List.of(arguments));
    }

    public NewObj(MethodReference method, List<? extends Instruction> arguments) {
        super(OpCode.NEW_OBJ, method, arguments);
    }

    @Override
    protected Instruction shallowClone() {
        return new NewObj(getMethod(), List.of());
    }
}
