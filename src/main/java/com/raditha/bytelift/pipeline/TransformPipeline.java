package com.raditha.bytelift.pipeline;

import com.raditha.bytelift.CancellationToken;
import com.raditha.bytelift.DecompilationCancelledException;
import com.raditha.bytelift.config.DecompilerSettings;
import com.raditha.bytelift.model.Block;
import com.raditha.bytelift.model.ILFunction;
import com.raditha.bytelift.model.InstructionCollection;
import com.raditha.bytelift.transforms.FunctionTransform;
import com.raditha.bytelift.transforms.StatementTransform;
import com.raditha.bytelift.transforms.Transform;
import com.raditha.bytelift.transforms.TransformContext;
import com.raditha.bytelift.transforms.TransformRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs an ordered list of transforms over a function until none of them changes anything.
 * <p>
 * One cycle runs every statement transform over every block position, then every function transform
 * once. Cycles repeat while something changed. Both the per-position retries and the number of cycles
 * are bounded; hitting either bound is reported as a {@link PassFaultException} so that a pair of
 * transforms undoing each other cannot hang the decompiler.
 * <p>
 * The pipeline keeps no per-run state and may be shared between threads.
 */
public class TransformPipeline {

    private static final Logger logger = LoggerFactory.getLogger(TransformPipeline.class);

    private final List<Transform> transforms;
    private final int maxPositionRetries;
    private final int maxPipelineCycles;
    private final String abortAfter;
    private final List<PipelineListener> listeners = new CopyOnWriteArrayList<>();

    public TransformPipeline(List<? extends Transform> transforms, int maxPositionRetries, int maxPipelineCycles,
            String abortAfter) {
        if (maxPositionRetries < 1) {
            throw new IllegalArgumentException("maxPositionRetries must be >= 1");
        }
        if (maxPipelineCycles < 1) {
            throw new IllegalArgumentException("maxPipelineCycles must be >= 1");
        }
        for (Transform t : transforms) {
            if (!(t instanceof StatementTransform) && !(t instanceof FunctionTransform)) {
                throw new IllegalArgumentException(t.name() + " is neither a statement nor a function transform");
            }
        }
        this.transforms = List.copyOf(transforms);
        this.maxPositionRetries = maxPositionRetries;
        this.maxPipelineCycles = maxPipelineCycles;
        this.abortAfter = abortAfter;
    }

    /**
     * The registered transforms in default order, minus the ones the settings disable.
     */
    public static TransformPipeline createDefault(DecompilerSettings settings) {
        List<Transform> enabled = TransformRegistry.createAll().stream()
                .filter(t -> settings.isEnabled(t.name()))
                .toList();
        return new TransformPipeline(enabled, settings.maxPositionRetries(), settings.maxPipelineCycles(),
                settings.abortAfter());
    }

    public List<Transform> getTransforms() {
        return transforms;
    }

    public void addListener(PipelineListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(PipelineListener listener) {
        listeners.remove(listener);
    }

    /**
     * Transforms {@code function} in place.
     *
     * @throws PassFaultException              when a transform throws or the pipeline does not settle
     * @throws DecompilationCancelledException when the context's token is cancelled
     */
    public PipelineRun run(ILFunction function, TransformContext context) {
        long start = System.nanoTime();
        CancellationToken token = context.getCancellationToken();
        Map<String, Integer> changeCounts = new LinkedHashMap<>();
        Set<String> applied = new LinkedHashSet<>();

        for (int cycle = 1; cycle <= maxPipelineCycles; cycle++) {
            List<String> changedThisCycle = new ArrayList<>();
            for (Transform transform : orderedForCycle()) {
                token.throwIfCancellationRequested();
                applied.add(transform.name());

                boolean changed = runPass(transform, function, context);
                if (changed) {
                    changeCounts.merge(transform.name(), 1, Integer::sum);
                    changedThisCycle.add(transform.name());
                }

                if (cycle == 1 && transform.name().equals(abortAfter)) {
                    logger.debug("Stopping {} after {}", function.getName(), abortAfter);
                    return new PipelineRun(PipelineRun.Outcome.ABORTED, new ArrayList<>(applied), changeCounts,
                            cycle, Duration.ofNanos(System.nanoTime() - start));
                }
            }
            if (changedThisCycle.isEmpty()) {
                logger.debug("{} settled after {} cycle(s)", function.getName(), cycle);
                return new PipelineRun(PipelineRun.Outcome.SETTLED, new ArrayList<>(applied), changeCounts,
                        cycle, Duration.ofNanos(System.nanoTime() - start));
            }
            if (cycle == maxPipelineCycles) {
                throw new PassFaultException(changedThisCycle.get(changedThisCycle.size() - 1),
                        "pipeline did not converge after " + maxPipelineCycles + " cycles in " + function.getName()
                                + " (still changing: " + changedThisCycle + ")");
            }
        }
        throw new IllegalStateException("unreachable");
    }

    /**
     * Statement transforms first, then function transforms, each group in registration order.
     */
    private List<Transform> orderedForCycle() {
        List<Transform> ordered = new ArrayList<>(transforms.size());
        for (Transform t : transforms) {
            if (t instanceof StatementTransform) {
                ordered.add(t);
            }
        }
        for (Transform t : transforms) {
            if (!(t instanceof StatementTransform)) {
                ordered.add(t);
            }
        }
        return ordered;
    }

    private boolean runPass(Transform transform, ILFunction function, TransformContext context) {
        for (PipelineListener listener : listeners) {
            listener.beforePass(transform, function);
        }
        boolean changed;
        try {
            if (transform instanceof StatementTransform statementTransform) {
                changed = runStatementTransform(statementTransform, function, context);
            } else {
                changed = ((FunctionTransform) transform).run(function, context);
            }
        } catch (PassFaultException | DecompilationCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PassFaultException(transform.name(), "failed on " + function.getName() + ": " + e.getMessage(), e);
        }
        logger.debug("{} on {}: {}", transform.name(), function.getName(), changed ? "changed" : "no change");
        for (PipelineListener listener : listeners) {
            listener.afterPass(transform, function, changed);
        }
        return changed;
    }

    private boolean runStatementTransform(StatementTransform transform, ILFunction function,
            TransformContext context) {
        boolean changed = false;
        for (Block block : function.getBlocks()) {
            InstructionCollection instructions = block.getInstructions();
            int pos = 0;
            while (pos < instructions.size()) {
                context.getCancellationToken().throwIfCancellationRequested();
                int retries = 0;
                int sizeAtReset = instructions.size();
                while (pos < instructions.size() && transform.run(block, pos, context)) {
                    changed = true;
                    if (instructions.size() < sizeAtReset) {
                        // the block shrank, so this position holds a different statement now
                        sizeAtReset = instructions.size();
                        retries = 0;
                    } else if (++retries > maxPositionRetries) {
                        throw new PassFaultException(transform.name(), "kept changing position " + pos
                                + " of block " + block.getLabel() + " in " + function.getName());
                    }
                }
                pos++;
            }
        }
        return changed;
    }
}
