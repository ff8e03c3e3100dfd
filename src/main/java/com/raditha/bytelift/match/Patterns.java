package com.raditha.bytelift.match;

import com.raditha.bytelift.model.BinaryNumeric;
import com.raditha.bytelift.model.BinaryOperator;
import com.raditha.bytelift.model.CallInstruction;
import com.raditha.bytelift.model.ILVariable;
import com.raditha.bytelift.model.Instruction;
import com.raditha.bytelift.model.LdLoc;
import com.raditha.bytelift.model.LdStr;
import com.raditha.bytelift.model.LdTypeToken;
import com.raditha.bytelift.model.LdcI4;
import com.raditha.bytelift.model.LogicNot;
import com.raditha.bytelift.model.OpCode;
import com.raditha.bytelift.model.StLoc;

import java.util.Optional;

/**
 * Factory of composable {@link Pattern}s. Each factory method checks the concrete node type and the
 * operand count before looking at anything else.
 */
public final class Patterns {

    private Patterns() {
        /* static factory only */
    }

    /**
     * Runs {@code pattern} against {@code node} with fresh bindings.
     */
    public static Optional<Match> match(Pattern pattern, Instruction node) {
        Match bindings = new Match();
        return pattern.matches(node, bindings) ? Optional.of(bindings) : Optional.empty();
    }

    public static Pattern any() {
        return (node, bindings) -> node != null;
    }

    /**
     * Matches {@code inner} and binds the node under {@code name}.
     */
    public static Pattern capture(String name, Pattern inner) {
        return (node, bindings) -> inner.matches(node, bindings) && bindings.bindOrCompare(name, node);
    }

    public static Pattern capture(String name) {
        return capture(name, any());
    }

    public static Pattern opCode(OpCode opCode) {
        return (node, bindings) -> node != null && node.getOpCode() == opCode;
    }

    /**
     * {@code ldloc v}, binding v under {@code variableName}.
     */
    public static Pattern ldLoc(String variableName) {
        return (node, bindings) -> node instanceof LdLoc ld
                && bindings.bindOrCompare(variableName, ld.getVariable());
    }

    /**
     * {@code ldloc v} for one specific variable identity.
     */
    public static Pattern ldLoc(ILVariable variable) {
        return (node, bindings) -> variable != null && node instanceof LdLoc ld && ld.getVariable() == variable;
    }

    /**
     * {@code stloc v(value)}, binding v under {@code variableName}.
     */
    public static Pattern stLoc(String variableName, Pattern value) {
        return (node, bindings) -> node instanceof StLoc st
                && st.getChildCount() == 1
                && bindings.bindOrCompare(variableName, st.getVariable())
                && value.matches(st.getValue(), bindings);
    }

    /**
     * A {@code call} or {@code callvirt} whose target satisfies {@code method} and whose arguments
     * match {@code arguments} one for one.
     */
    public static Pattern call(MemberPredicate method, Pattern... arguments) {
        return (node, bindings) -> {
            if (!(node instanceof CallInstruction call) || node.getOpCode() == OpCode.NEW_OBJ) {
                return false;
            }
            if (call.getMethod() == null || !method.test(call.getMethod())) {
                return false;
            }
            return argumentsMatch(call, arguments, bindings);
        };
    }

    public static Pattern newObj(MemberPredicate constructor, Pattern... arguments) {
        return (node, bindings) -> node instanceof CallInstruction call
                && node.getOpCode() == OpCode.NEW_OBJ
                && call.getMethod() != null
                && constructor.test(call.getMethod())
                && argumentsMatch(call, arguments, bindings);
    }

    private static boolean argumentsMatch(CallInstruction call, Pattern[] arguments, Match bindings) {
        if (call.getArguments().size() != arguments.length) {
            return false;
        }
        for (int i = 0; i < arguments.length; i++) {
            if (!arguments[i].matches(call.getArguments().get(i), bindings)) {
                return false;
            }
        }
        return true;
    }

    public static Pattern ldStr(String valueName) {
        return (node, bindings) -> node instanceof LdStr str && bindings.bindOrCompare(valueName, str.getValue());
    }

    public static Pattern ldStr() {
        return opCode(OpCode.LD_STR);
    }

    public static Pattern ldTypeToken(String typeName) {
        return (node, bindings) -> node instanceof LdTypeToken token
                && bindings.bindOrCompare(typeName, token.getType());
    }

    public static Pattern ldTypeToken() {
        return opCode(OpCode.LD_TYPE_TOKEN);
    }

    public static Pattern ldcI4(String valueName) {
        return (node, bindings) -> node instanceof LdcI4 c && bindings.bindOrCompare(valueName, c.getValue());
    }

    public static Pattern ldcI4(int value) {
        return (node, bindings) -> node instanceof LdcI4 c && c.getValue() == value;
    }

    public static Pattern ldNull() {
        return opCode(OpCode.LD_NULL);
    }

    public static Pattern logicNot(Pattern argument) {
        return (node, bindings) -> node instanceof LogicNot not
                && not.getChildCount() == 1
                && argument.matches(not.getArgument(), bindings);
    }

    public static Pattern binary(BinaryOperator operator, Pattern left, Pattern right) {
        return (node, bindings) -> node instanceof BinaryNumeric bin
                && bin.getChildCount() == 2
                && (operator == null || bin.getOperator() == operator)
                && left.matches(bin.getLeft(), bindings)
                && right.matches(bin.getRight(), bindings);
    }

    /**
     * A side-effect free constant: {@code ldc.i4}, {@code ldstr}, {@code ldnull} or {@code ldtoken}.
     */
    public static Pattern constant() {
        return (node, bindings) -> node != null && switch (node.getOpCode()) {
            case LDC_I4, LD_STR, LD_NULL, LD_TYPE_TOKEN -> true;
            default -> false;
        };
    }
}
