package com.raditha.bytelift.diagnostics;

import com.raditha.bytelift.emit.ILTextWriter;
import com.raditha.bytelift.model.ILFunction;
import com.raditha.bytelift.pipeline.PipelineListener;
import com.raditha.bytelift.transforms.Transform;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records a unified diff of the IL text for every pass that changed a function.
 * Safe to share between pipelines running on different threads.
 */
public class PassTraceRecorder implements PipelineListener {

    /**
     * One changing pass application.
     *
     * @param function name of the transformed function
     * @param pass     name of the transform
     * @param diff     unified diff of the function's IL text
     */
    public record PassTrace(String function, String pass, String diff) {
    }

    private final DiffGenerator diffGenerator = new DiffGenerator();
    private final Map<ILFunction, String> snapshots = new ConcurrentHashMap<>();
    private final List<PassTrace> traces = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void beforePass(Transform transform, ILFunction function) {
        snapshots.put(function, ILTextWriter.toText(function));
    }

    @Override
    public void afterPass(Transform transform, ILFunction function, boolean changed) {
        String before = snapshots.remove(function);
        if (!changed || before == null) {
            return;
        }
        String diff = diffGenerator.generateUnifiedDiff(function.getName(), before, ILTextWriter.toText(function));
        traces.add(new PassTrace(function.getName(), transform.name(), diff));
    }

    public List<PassTrace> getTraces() {
        synchronized (traces) {
            return List.copyOf(traces);
        }
    }

    public List<PassTrace> tracesFor(String functionName) {
        return getTraces().stream().filter(t -> t.function().equals(functionName)).toList();
    }

    /**
     * All traces as text, each diff preceded by a header naming the pass.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (PassTrace trace : getTraces()) {
            sb.append("=== ").append(trace.pass()).append(" on ").append(trace.function()).append(" ===\n");
            sb.append(trace.diff()).append('\n');
        }
        return sb.toString();
    }

    public void clear() {
        traces.clear();
        snapshots.clear();
    }
}
