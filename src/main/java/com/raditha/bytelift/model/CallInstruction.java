package com.raditha.bytelift.model;

import java.util.List;
import java.util.Objects;

/**
 * Common base of {@link Call}, {@link CallVirt} and {@link NewObj}: a resolved target method plus an
 * ordered argument list. For instance calls the receiver is argument 0.
 */
public abstract class CallInstruction extends Instruction {

    private final MethodReference method;

    protected CallInstruction(OpCode opCode, MethodReference method, List<? extends Instruction> arguments) {
        super(opCode);
        this.method = Objects.requireNonNull(method, "method");
        for (Instruction argument : arguments) {
            children.add(argument);
        }
    }

    public MethodReference getMethod() {
        return method;
    }

    public InstructionCollection getArguments() {
        return children;
    }

    @Override
    protected boolean operandsEqual(Instruction other) {
        return method.equals(((CallInstruction) other).method);
    }

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}
