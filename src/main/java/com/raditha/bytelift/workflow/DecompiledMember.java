package com.raditha.bytelift.workflow;

import com.raditha.bytelift.model.ILFunction;
import com.raditha.bytelift.model.SourceHint;
import com.raditha.bytelift.pipeline.PipelineRun;

import java.util.Map;
import java.util.Optional;

/**
 * One decompiled body together with what the printer needs to show alongside it.
 *
 * @param declaration   the member the body belongs to
 * @param function      the transformed tree, or the untouched one for a degraded result
 * @param documentation doc comment from the loader, null when absent or not requested
 * @param sourceHints   source locations keyed by IL offset, for instructions still in the tree
 * @param run           pipeline statistics, null when the pipeline did not finish
 */
public record DecompiledMember(
        DeclarationRef declaration,
        ILFunction function,
        String documentation,
        Map<Integer, SourceHint> sourceHints,
        PipelineRun run) {

    public DecompiledMember {
        sourceHints = sourceHints == null ? Map.of() : Map.copyOf(sourceHints);
    }

    public Optional<String> getDocumentation() {
        return Optional.ofNullable(documentation);
    }

    public Optional<SourceHint> hintFor(int ilOffset) {
        return Optional.ofNullable(sourceHints.get(ilOffset));
    }
}
