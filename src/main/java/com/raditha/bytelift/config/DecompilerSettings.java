package com.raditha.bytelift.config;

import com.raditha.bytelift.transforms.TransformRegistry;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Settings for one decompilation run.
 *
 * @param disabledTransforms names of transforms that must not run
 * @param showDocumentation  pass the loader's doc comments through to the printer
 * @param abortAfter         stop the pipeline after this transform completes in the first cycle (null = never)
 * @param maxPositionRetries how often a statement transform may report a change at the same position
 * @param maxPipelineCycles  how many full cycles may report a change before the pipeline gives up
 * @param parallelism        worker threads used when decompiling several declarations
 */
public record DecompilerSettings(
        Set<String> disabledTransforms,
        boolean showDocumentation,
        String abortAfter,
        int maxPositionRetries,
        int maxPipelineCycles,
        int parallelism) {

    public static final int DEFAULT_MAX_POSITION_RETRIES = 16;
    public static final int DEFAULT_MAX_PIPELINE_CYCLES = 8;

    /**
     * Validate settings.
     */
    public DecompilerSettings {
        disabledTransforms = disabledTransforms == null ? Set.of() : Set.copyOf(disabledTransforms);
        for (String name : disabledTransforms) {
            if (!TransformRegistry.isKnown(name)) {
                throw new IllegalArgumentException("Unknown transform: " + name);
            }
        }
        if (abortAfter != null) {
            if (!TransformRegistry.isKnown(abortAfter)) {
                throw new IllegalArgumentException("Unknown transform for abortAfter: " + abortAfter);
            }
            if (disabledTransforms.contains(abortAfter)) {
                throw new IllegalArgumentException("abortAfter names a disabled transform: " + abortAfter);
            }
        }
        if (maxPositionRetries < 1) {
            throw new IllegalArgumentException("maxPositionRetries must be >= 1");
        }
        if (maxPipelineCycles < 1) {
            throw new IllegalArgumentException("maxPipelineCycles must be >= 1");
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1");
        }
    }

    /**
     * Every transform enabled, no documentation, one worker per available processor.
     */
    public static DecompilerSettings defaults() {
        return new DecompilerSettings(
                Set.of(),
                false,
                null,
                DEFAULT_MAX_POSITION_RETRIES,
                DEFAULT_MAX_PIPELINE_CYCLES,
                Runtime.getRuntime().availableProcessors());
    }

    /**
     * Only the parameter declaration inlining runs. Useful for looking at trees close to the raw bytecode.
     */
    public static DecompilerSettings minimal() {
        Set<String> disabled = new LinkedHashSet<>(TransformRegistry.names());
        disabled.remove("InlineParameterDeclarations");
        return new DecompilerSettings(
                disabled,
                false,
                null,
                DEFAULT_MAX_POSITION_RETRIES,
                DEFAULT_MAX_PIPELINE_CYCLES,
                1);
    }

    public boolean isEnabled(String transformName) {
        return !disabledTransforms.contains(transformName);
    }

    public DecompilerSettings withDisabled(Collection<String> names) {
        Set<String> disabled = new LinkedHashSet<>(disabledTransforms);
        disabled.addAll(names);
        return new DecompilerSettings(disabled, showDocumentation, abortAfter, maxPositionRetries,
                maxPipelineCycles, parallelism);
    }

    public DecompilerSettings withShowDocumentation(boolean show) {
        return new DecompilerSettings(disabledTransforms, show, abortAfter, maxPositionRetries,
                maxPipelineCycles, parallelism);
    }

    public DecompilerSettings withAbortAfter(String transformName) {
        return new DecompilerSettings(disabledTransforms, showDocumentation, transformName, maxPositionRetries,
                maxPipelineCycles, parallelism);
    }

    public DecompilerSettings withParallelism(int threads) {
        return new DecompilerSettings(disabledTransforms, showDocumentation, abortAfter, maxPositionRetries,
                maxPipelineCycles, threads);
    }
}
