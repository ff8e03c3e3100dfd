package com.raditha.bytelift.transforms;

import com.raditha.bytelift.model.Block;
import com.raditha.bytelift.model.ILFunction;
import com.raditha.bytelift.model.ILVariable;
import com.raditha.bytelift.model.Instruction;
import com.raditha.bytelift.model.InstructionCollection;
import com.raditha.bytelift.model.LdLoc;
import com.raditha.bytelift.model.StLoc;
import com.raditha.bytelift.model.VariableKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Removes stores to stack temporaries that are never read. A pure value disappears together with the
 * store; a value with side effects is kept as a statement of its own.
 */
public class DeadTemporaryStoreElimination implements FunctionTransform {

    private static final Logger logger = LoggerFactory.getLogger(DeadTemporaryStoreElimination.class);

    @Override
    public boolean run(ILFunction function, TransformContext context) {
        Map<ILVariable, Integer> loadCounts = new IdentityHashMap<>();
        for (LdLoc load : function.descendants(LdLoc.class)) {
            loadCounts.merge(load.getVariable(), 1, Integer::sum);
        }

        boolean changed = false;
        for (Block block : function.getBlocks()) {
            InstructionCollection instructions = block.getInstructions();
            for (int i = instructions.size() - 1; i >= 0; i--) {
                if (instructions.get(i) instanceof StLoc store
                        && store.getVariable().getKind() == VariableKind.STACK_SLOT
                        && !loadCounts.containsKey(store.getVariable())
                        && function.storesOf(store.getVariable()).stream().allMatch(StLoc.class::isInstance)) {
                    Instruction value = store.getValue();
                    if (value.isSideEffectFree()) {
                        instructions.removeAt(i);
                    } else {
                        store.replaceWith(value);
                    }
                    logger.debug("Removed dead store to {} in {}", store.getVariable(), function.getName());
                    changed = true;
                }
            }
        }
        return changed;
    }
}
