package com.raditha.bytelift.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.bytelift.pipeline.PipelineRun;
import com.raditha.bytelift.workflow.DecompilationResult;
import com.raditha.bytelift.workflow.DecompiledMember;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Exports decompilation run metrics to CSV and JSON formats for tracking transform effectiveness
 * across runs.
 */
public class MetricsExporter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .registerModule(new Jdk8Module())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * Run-level metrics aggregated from all declarations.
     */
    public record RunMetrics(
            String runName,
            LocalDateTime timestamp,
            int totalDeclarations,
            int complete,
            int aborted,
            int degraded,
            int cancelled,
            int totalChanges,
            long totalMillis,
            Map<String, Integer> passChanges,
            List<DeclarationMetrics> declarations) {
    }

    /**
     * Per-declaration metrics.
     */
    public record DeclarationMetrics(
            String declaration,
            String status,
            int bodies,
            int changes,
            int cycles,
            long durationMillis,
            String fault) {
    }

    /**
     * Build aggregated metrics from decompilation results.
     */
    public RunMetrics buildMetrics(List<DecompilationResult> results, String runName) {
        List<DeclarationMetrics> declarations = results.stream()
                .map(this::buildDeclarationMetrics)
                .toList();

        Map<String, Integer> passChanges = new TreeMap<>();
        results.stream()
                .flatMap(r -> r.members().stream())
                .map(DecompiledMember::run)
                .filter(Objects::nonNull)
                .forEach(run -> run.changeCounts().forEach((pass, n) -> passChanges.merge(pass, n, Integer::sum)));

        return new RunMetrics(
                runName,
                LocalDateTime.now(),
                results.size(),
                count(results, DecompilationResult.Status.COMPLETE),
                count(results, DecompilationResult.Status.ABORTED),
                count(results, DecompilationResult.Status.DEGRADED),
                count(results, DecompilationResult.Status.CANCELLED),
                declarations.stream().mapToInt(DeclarationMetrics::changes).sum(),
                declarations.stream().mapToLong(DeclarationMetrics::durationMillis).sum(),
                passChanges,
                declarations);
    }

    private DeclarationMetrics buildDeclarationMetrics(DecompilationResult result) {
        int changes = 0;
        int cycles = 0;
        for (DecompiledMember member : result.members()) {
            PipelineRun run = member.run();
            if (run != null) {
                changes += run.totalChanges();
                cycles = Math.max(cycles, run.cycles());
            }
        }
        return new DeclarationMetrics(
                result.declaration().toString(),
                result.status().name(),
                result.members().size(),
                changes,
                cycles,
                result.duration() == null ? 0 : result.duration().toMillis(),
                result.getFault().map(Throwable::getMessage).orElse(null));
    }

    private static int count(List<DecompilationResult> results, DecompilationResult.Status status) {
        return (int) results.stream().filter(r -> r.status() == status).count();
    }

    /**
     * Export metrics to CSV format.
     */
    public void exportToCsv(RunMetrics metrics, Path outputPath) throws IOException {
        StringBuilder csv = new StringBuilder();

        // Header - Summary
        csv.append("# Run Summary\n");
        csv.append("timestamp,run,total_declarations,complete,aborted,degraded,cancelled,total_changes,total_ms\n");
        csv.append(String.format("%s,%s,%d,%d,%d,%d,%d,%d,%d%n",
                metrics.timestamp().format(TIMESTAMP_FORMAT),
                csvField(metrics.runName()),
                metrics.totalDeclarations(),
                metrics.complete(),
                metrics.aborted(),
                metrics.degraded(),
                metrics.cancelled(),
                metrics.totalChanges(),
                metrics.totalMillis()));

        csv.append("\n");

        csv.append("# Per-Pass Changes\n");
        csv.append("pass,changes\n");
        metrics.passChanges().forEach((pass, n) -> csv.append(pass).append(',').append(n).append('\n'));

        csv.append("\n");

        // Header - Per-declaration metrics
        csv.append("# Per-Declaration Metrics\n");
        csv.append("declaration,status,bodies,changes,cycles,duration_ms,fault\n");

        for (DeclarationMetrics declaration : metrics.declarations()) {
            csv.append(String.format("%s,%s,%d,%d,%d,%d,%s%n",
                    csvField(declaration.declaration()),
                    declaration.status(),
                    declaration.bodies(),
                    declaration.changes(),
                    declaration.cycles(),
                    declaration.durationMillis(),
                    declaration.fault() == null ? "" : csvField(declaration.fault())));
        }

        Files.writeString(outputPath, csv.toString());
    }

    /**
     * Export metrics to JSON format.
     */
    public void exportToJson(RunMetrics metrics, Path outputPath) throws IOException {
        mapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), metrics);
    }

    /**
     * Quotes a CSV field when it contains a separator, quote or line break.
     */
    static String csvField(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
