package com.raditha.bytelift.pipeline;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * What one pipeline run did to one function.
 *
 * @param outcome       whether the tree settled or the run stopped at the abort point
 * @param appliedPasses names of the transforms that were executed, in first-execution order
 * @param changeCounts  how often each transform reported a change
 * @param cycles        number of cycles started
 * @param duration      wall clock time of the run
 */
public record PipelineRun(
        Outcome outcome,
        List<String> appliedPasses,
        Map<String, Integer> changeCounts,
        int cycles,
        Duration duration) {

    public enum Outcome {
        SETTLED,
        ABORTED
    }

    public PipelineRun {
        appliedPasses = List.copyOf(appliedPasses);
        changeCounts = Map.copyOf(changeCounts);
    }

    public int totalChanges() {
        return changeCounts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int changesOf(String passName) {
        return changeCounts.getOrDefault(passName, 0);
    }
}
