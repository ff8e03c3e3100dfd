package com.raditha.bytelift.transforms;

import com.raditha.bytelift.model.Block;
import com.raditha.bytelift.model.ILFunction;
import com.raditha.bytelift.model.ILVariable;
import com.raditha.bytelift.model.Instruction;
import com.raditha.bytelift.model.LdLoc;
import com.raditha.bytelift.model.StLoc;
import com.raditha.bytelift.model.VariableKind;

import java.util.List;

import static com.raditha.bytelift.match.Patterns.capture;
import static com.raditha.bytelift.match.Patterns.constant;
import static com.raditha.bytelift.match.Patterns.match;
import static com.raditha.bytelift.match.Patterns.stLoc;

/**
 * Folds a stack temporary that carries a constant into the very next statement:
 * {@code stloc t(ldc.i4 5); call f(ldloc t)} becomes {@code call f(ldc.i4 5)}.
 * The temporary must be written once and read once, and the read must be in the following statement.
 */
public class InlineConstantTemporaries implements StatementTransform {

    @Override
    public boolean run(Block block, int pos, TransformContext context) {
        if (pos + 1 >= block.getInstructions().size()) {
            return false;
        }
        return match(stLoc("t", capture("value", constant())), block.getInstructions().get(pos))
                .map(m -> inline(block, pos, m.variable("t"), m.instruction("value"), context.getFunction()))
                .orElse(false);
    }

    private boolean inline(Block block, int pos, ILVariable temp, Instruction value, ILFunction function) {
        if (temp.getKind() != VariableKind.STACK_SLOT || function.storesOf(temp).size() != 1) {
            return false;
        }
        List<LdLoc> loads = function.loadsOf(temp);
        if (loads.size() != 1) {
            return false;
        }
        LdLoc load = loads.get(0);
        Instruction next = block.getInstructions().get(pos + 1);
        if (load != next && !load.isDescendantOf(next)) {
            return false;
        }
        load.replaceWith(value.cloneSubtree());
        block.getInstructions().removeAt(pos);
        return true;
    }
}
