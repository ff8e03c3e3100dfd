package com.raditha.bytelift.match;

import com.raditha.bytelift.model.Instruction;

import java.util.Map;

/**
 * Declarative shape test over one instruction node.
 * <p>
 * Implementations fail closed: a null node, an unexpected opcode, a wrong operand count or a missing
 * reference all yield {@code false}. A pattern never throws on shapes it does not expect.
 */
@FunctionalInterface
public interface Pattern {

    /**
     * @param node     node to test, may be null
     * @param bindings receives captures; may hold partial captures when the result is false
     */
    boolean matches(Instruction node, Match bindings);

    /**
     * Both patterns must match the same node.
     */
    default Pattern and(Pattern other) {
        return (node, bindings) -> matches(node, bindings) && other.matches(node, bindings);
    }

    /**
     * Tries this pattern, then {@code other}. Captures from a failed first attempt are discarded.
     */
    default Pattern or(Pattern other) {
        return (node, bindings) -> {
            Map<String, Object> before = bindings.snapshot();
            if (matches(node, bindings)) {
                return true;
            }
            bindings.restore(before);
            return other.matches(node, bindings);
        };
    }
}
