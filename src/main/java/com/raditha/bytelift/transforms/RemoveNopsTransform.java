package com.raditha.bytelift.transforms;

import com.raditha.bytelift.model.Block;
import com.raditha.bytelift.model.ILFunction;
import com.raditha.bytelift.model.InstructionCollection;
import com.raditha.bytelift.model.OpCode;

/**
 * Drops {@code nop} statements. Nops nested inside other instructions (an empty else branch) stay.
 */
public class RemoveNopsTransform implements FunctionTransform {

    @Override
    public boolean run(ILFunction function, TransformContext context) {
        boolean changed = false;
        for (Block block : function.getBlocks()) {
            InstructionCollection instructions = block.getInstructions();
            for (int i = instructions.size() - 1; i >= 0; i--) {
                if (instructions.get(i).getOpCode() == OpCode.NOP) {
                    instructions.removeAt(i);
                    changed = true;
                }
            }
        }
        return changed;
    }
}
