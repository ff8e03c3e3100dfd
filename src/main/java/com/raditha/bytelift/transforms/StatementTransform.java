package com.raditha.bytelift.transforms;

import com.raditha.bytelift.model.Block;

/**
 * A transform applied to one statement position of one block at a time.
 */
public interface StatementTransform extends Transform {

    /**
     * Tries to rewrite the statement at {@code block[pos]} (and anything it may legitimately touch,
     * such as other uses of a variable it eliminates).
     *
     * @return true if the tree was changed
     */
    boolean run(Block block, int pos, TransformContext context);
}
