package com.raditha.bytelift.model;

import java.util.List;

/**
 * Virtual dispatch call; argument 0 is the receiver.
 */
public final class CallVirt extends CallInstruction {

    public CallVirt(MethodReference method, Instruction... arguments) {
        this(method, List.of(arguments));
    }

    public CallVirt(MethodReference method, List<? extends Instruction> arguments) {
        super(OpCode.CALL_VIRT, method, arguments);
    }

    @Override
    protected Instruction shallowClone() {
        return new CallVirt(getMethod(), List.of());
    }
}
