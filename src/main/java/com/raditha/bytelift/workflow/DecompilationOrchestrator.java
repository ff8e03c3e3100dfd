package com.raditha.bytelift.workflow;

import com.raditha.bytelift.ByteliftException;
import com.raditha.bytelift.CancellationToken;
import com.raditha.bytelift.DecompilationCancelledException;
import com.raditha.bytelift.config.DecompilerSettings;
import com.raditha.bytelift.match.WellKnownMembers;
import com.raditha.bytelift.model.DebugInfoProvider;
import com.raditha.bytelift.model.ILFunction;
import com.raditha.bytelift.model.Instruction;
import com.raditha.bytelift.model.SourceHint;
import com.raditha.bytelift.model.TypeSystemResolver;
import com.raditha.bytelift.pipeline.PassFaultException;
import com.raditha.bytelift.pipeline.PipelineRun;
import com.raditha.bytelift.pipeline.TransformPipeline;
import com.raditha.bytelift.transforms.TransformContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Drives decompilation of whole declarations: picks the bodies, loads them, runs the pipeline on each
 * and packages the result for the printer.
 * <p>
 * A failing transform never loses a declaration. The untouched trees loaded before the pipeline ran
 * are returned instead and the result is marked {@link DecompilationResult.Status#DEGRADED}.
 */
public class DecompilationOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(DecompilationOrchestrator.class);

    private final Loader loader;
    private final TypeSystemResolver resolver;
    private final DebugInfoProvider debugInfo;
    private final DecompilerSettings settings;
    private final DeclarationSelector selector;
    private final WellKnownMembers wellKnownMembers;
    private final TransformPipeline pipeline;

    /**
     * Creates an orchestrator with the default pipeline for the given settings.
     *
     * @param loader    source of bodies and metadata
     * @param resolver  type system used by the transforms; may be null, in which case nothing matches
     * @param debugInfo source location provider; may be null
     * @param settings  run settings
     */
    public DecompilationOrchestrator(Loader loader, TypeSystemResolver resolver, DebugInfoProvider debugInfo,
            DecompilerSettings settings) {
        this(loader, resolver, debugInfo, settings, TransformPipeline.createDefault(settings));
    }

    public DecompilationOrchestrator(Loader loader, TypeSystemResolver resolver, DebugInfoProvider debugInfo,
            DecompilerSettings settings, TransformPipeline pipeline) {
        this.loader = loader;
        this.resolver = resolver;
        this.debugInfo = debugInfo;
        this.settings = settings;
        this.selector = new DeclarationSelector(loader);
        this.wellKnownMembers = new WellKnownMembers(resolver);
        this.pipeline = pipeline;
    }

    public TransformPipeline getPipeline() {
        return pipeline;
    }

    /**
     * Decompile one declaration.
     */
    public DecompilationResult decompile(DeclarationRef declaration, CancellationToken token) {
        CancellationToken cancellation = token == null ? CancellationToken.none() : token;
        long start = System.nanoTime();
        // pristine.get(i) is the untransformed copy of loaded.get(i)
        List<ILFunction> pristine = new ArrayList<>();
        List<DeclarationRef> loaded = new ArrayList<>();

        try {
            cancellation.throwIfCancellationRequested();
            List<DeclarationRef> bodies = selector.select(declaration);

            List<ILFunction> working = new ArrayList<>();
            for (DeclarationRef body : bodies) {
                Optional<ILFunction> function = loader.loadBody(body);
                if (function.isEmpty()) {
                    logger.debug("{} has no body", body);
                    continue;
                }
                working.add(function.get());
                pristine.add(function.get().cloneSubtree());
                loaded.add(body);
            }

            List<PipelineRun> runs = new ArrayList<>();
            boolean aborted = false;
            for (ILFunction function : working) {
                TransformContext context = new TransformContext(function, resolver, wellKnownMembers, cancellation);
                PipelineRun run = pipeline.run(function, context);
                function.checkInvariants();
                aborted |= run.outcome() == PipelineRun.Outcome.ABORTED;
                runs.add(run);
            }

            List<DecompiledMember> members = new ArrayList<>();
            for (int i = 0; i < working.size(); i++) {
                members.add(toMember(loaded.get(i), working.get(i), runs.get(i)));
            }
            DecompilationResult.Status status = aborted
                    ? DecompilationResult.Status.ABORTED
                    : DecompilationResult.Status.COMPLETE;
            return new DecompilationResult(declaration, status, members, documentationOf(declaration), null,
                    elapsed(start));
        } catch (DecompilationCancelledException e) {
            logger.debug("Decompilation of {} was cancelled", declaration);
            return DecompilationResult.cancelled(declaration, elapsed(start));
        } catch (PassFaultException e) {
            logger.warn("Transform {} failed on {}, falling back to untransformed code: {}",
                    e.getPassName(), declaration, e.getMessage());
            return degraded(declaration, loaded, pristine, e, start);
        } catch (RuntimeException e) {
            logger.warn("Decompilation of {} failed, falling back to untransformed code: {}",
                    declaration, e.getMessage());
            return degraded(declaration, loaded, pristine, e, start);
        }
    }

    /**
     * Decompile several independent declarations on a fixed pool of {@code settings.parallelism()}
     * threads. Results come back in input order. Declarations that had not started when the token was
     * cancelled are reported as cancelled.
     */
    public List<DecompilationResult> decompileAll(List<DeclarationRef> declarations, CancellationToken token) {
        CancellationToken cancellation = token == null ? CancellationToken.none() : token;
        if (declarations.isEmpty()) {
            return List.of();
        }
        int threads = Math.min(settings.parallelism(), declarations.size());
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        List<DecompilationResult> results = new ArrayList<>(declarations.size());
        try {
            List<Future<DecompilationResult>> futures = new ArrayList<>(declarations.size());
            for (DeclarationRef declaration : declarations) {
                futures.add(executor.submit(() -> cancellation.isCancellationRequested()
                        ? DecompilationResult.cancelled(declaration, Duration.ZERO)
                        : decompile(declaration, cancellation)));
            }
            for (Future<DecompilationResult> future : futures) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DecompilationCancelledException();
        } catch (ExecutionException e) {
            throw new ByteliftException("Decompilation worker failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }

        logSummary(results);
        return results;
    }

    private DecompilationResult degraded(DeclarationRef declaration, List<DeclarationRef> bodies,
            List<ILFunction> pristine, RuntimeException fault, long start) {
        List<DecompiledMember> members = new ArrayList<>();
        for (int i = 0; i < pristine.size() && i < bodies.size(); i++) {
            members.add(toMember(bodies.get(i), pristine.get(i), null));
        }
        return new DecompilationResult(declaration, DecompilationResult.Status.DEGRADED, members,
                documentationOf(declaration), fault, elapsed(start));
    }

    private DecompiledMember toMember(DeclarationRef body, ILFunction function, PipelineRun run) {
        return new DecompiledMember(body, function, documentationOf(body), sourceHints(function), run);
    }

    private String documentationOf(DeclarationRef declaration) {
        if (!settings.showDocumentation()) {
            return null;
        }
        return loader.documentation(declaration).orElse(null);
    }

    private Map<Integer, SourceHint> sourceHints(ILFunction function) {
        Map<Integer, SourceHint> hints = new TreeMap<>();
        if (debugInfo == null) {
            return hints;
        }
        for (Instruction node : function.descendants()) {
            if (node.hasILOffset() && !hints.containsKey(node.getILOffset())) {
                debugInfo.hintFor(node.getILOffset()).ifPresent(h -> hints.put(node.getILOffset(), h));
            }
        }
        return hints;
    }

    private static void logSummary(List<DecompilationResult> results) {
        Map<DecompilationResult.Status, Integer> counts = new EnumMap<>(DecompilationResult.Status.class);
        for (DecompilationResult result : results) {
            counts.merge(result.status(), 1, Integer::sum);
        }
        logger.info("Decompiled {} declaration(s): {}", results.size(), counts);
    }

    private static Duration elapsed(long start) {
        return Duration.ofNanos(System.nanoTime() - start);
    }
}
