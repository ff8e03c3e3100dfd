package com.raditha.bytelift.transforms;

/**
 * One rewrite rule. Every transform is optional: skipping it leaves a correct, if less readable, tree.
 */
public interface Transform {

    /**
     * Name used to enable, disable or abort after this transform. Defaults to the simple class name.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
