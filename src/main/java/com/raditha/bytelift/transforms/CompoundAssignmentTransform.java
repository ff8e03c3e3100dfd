package com.raditha.bytelift.transforms;

import com.raditha.bytelift.model.BinaryNumeric;
import com.raditha.bytelift.model.Block;
import com.raditha.bytelift.model.CompoundAssignment;
import com.raditha.bytelift.model.ILVariable;
import com.raditha.bytelift.model.Instruction;
import com.raditha.bytelift.model.LdLoc;
import com.raditha.bytelift.model.StLoc;

import static com.raditha.bytelift.match.Patterns.binary;
import static com.raditha.bytelift.match.Patterns.capture;
import static com.raditha.bytelift.match.Patterns.ldLoc;
import static com.raditha.bytelift.match.Patterns.match;
import static com.raditha.bytelift.match.Patterns.stLoc;

/**
 * {@code stloc v(binary.op(ldloc v, x))} becomes {@code compound.op v(x)} as long as x does not read v.
 */
public class CompoundAssignmentTransform implements StatementTransform {

    @Override
    public boolean run(Block block, int pos, TransformContext context) {
        Instruction statement = block.getInstructions().get(pos);
        return match(stLoc("v", capture("bin", binary(null, ldLoc("v"), capture("rhs")))), statement)
                .map(m -> rewrite((StLoc) statement, (BinaryNumeric) m.instruction("bin"), m.variable("v")))
                .orElse(false);
    }

    private static boolean rewrite(StLoc store, BinaryNumeric bin, ILVariable v) {
        Instruction rhs = bin.getRight();
        for (LdLoc load : rhs.descendants(LdLoc.class)) {
            if (load.getVariable() == v) {
                return false;
            }
        }
        CompoundAssignment compound = new CompoundAssignment(bin.getOperator(), v, bin.takeChildren().get(1));
        compound.setILOffset(store.getILOffset());
        store.replaceWith(compound);
        return true;
    }
}
