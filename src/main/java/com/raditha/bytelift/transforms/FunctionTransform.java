package com.raditha.bytelift.transforms;

import com.raditha.bytelift.model.ILFunction;

/**
 * A transform that looks at a whole function body in one go.
 */
public interface FunctionTransform extends Transform {

    /**
     * @return true if the tree was changed
     */
    boolean run(ILFunction function, TransformContext context);
}
