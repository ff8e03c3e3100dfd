package com.raditha.bytelift.transforms;

import com.raditha.bytelift.model.Block;
import com.raditha.bytelift.model.Comp;
import com.raditha.bytelift.model.Instruction;
import com.raditha.bytelift.model.LogicNot;

import java.util.List;

/**
 * Removes double negation and pushes a negation into an integer or reference comparison:
 * {@code logic.not(logic.not(x))} becomes {@code x} and {@code logic.not(comp.lt(a, b))} becomes
 * {@code comp.ge(a, b)}. Floating point comparisons keep their negation because NaN is unordered.
 */
public class LogicNotSimplification implements StatementTransform {

    @Override
    public boolean run(Block block, int pos, TransformContext context) {
        List<LogicNot> negations = block.getInstructions().get(pos).descendants(LogicNot.class);
        boolean changed = false;
        for (int i = negations.size() - 1; i >= 0; i--) {
            LogicNot not = negations.get(i);
            if (not.isDescendantOf(block) && simplify(not)) {
                changed = true;
            }
        }
        return changed;
    }

    private static boolean simplify(LogicNot not) {
        if (not.getChildCount() != 1) {
            return false;
        }
        Instruction argument = not.getArgument();
        if (argument instanceof LogicNot inner && inner.getChildCount() == 1) {
            not.replaceWith(inner.getArgument());
            return true;
        }
        if (argument instanceof Comp comp && comp.getChildCount() == 2 && !comp.getInputType().isFloatingPoint()) {
            List<Instruction> operands = comp.takeChildren();
            Comp negated = new Comp(comp.getKind().negate(), comp.getInputType(), operands.get(0), operands.get(1));
            negated.setILOffset(not.getILOffset());
            not.replaceWith(negated);
            return true;
        }
        return false;
    }
}
