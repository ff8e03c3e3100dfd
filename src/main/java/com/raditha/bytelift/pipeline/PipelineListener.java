package com.raditha.bytelift.pipeline;

import com.raditha.bytelift.model.ILFunction;
import com.raditha.bytelift.transforms.Transform;

/**
 * Observes the pipeline as it runs. Callbacks happen on the thread that runs the pipeline, so a
 * listener shared by concurrent decompilations must be thread safe.
 */
public interface PipelineListener {

    default void beforePass(Transform transform, ILFunction function) {
    }

    default void afterPass(Transform transform, ILFunction function, boolean changed) {
    }
}
