package com.raditha.bytelift.cli;

import com.raditha.bytelift.CancellationToken;
import com.raditha.bytelift.config.ConfigurationException;
import com.raditha.bytelift.config.DecompilerSettings;
import com.raditha.bytelift.config.DecompilerSettingsLoader;
import com.raditha.bytelift.diagnostics.PassTraceRecorder;
import com.raditha.bytelift.emit.ILTextWriter;
import com.raditha.bytelift.emit.JavaSourceEmitter;
import com.raditha.bytelift.io.ILModule;
import com.raditha.bytelift.io.ILParseException;
import com.raditha.bytelift.io.ILReader;
import com.raditha.bytelift.metrics.MetricsExporter;
import com.raditha.bytelift.transforms.TransformRegistry;
import com.raditha.bytelift.workflow.DecompilationOrchestrator;
import com.raditha.bytelift.workflow.DecompilationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the decompiler.
 * <p>
 * Usage:
 * java -jar bytelift.jar [options] <file.il>...
 * <p>
 * Configuration priority: CLI arguments > decompiler.yml > defaults
 */
@Command(name = "bytelift", mixinStandardHelpOptions = true, version = "Bytelift v1.0.0",
        description = "Raises textual IL to readable source through the instruction-tree transform pipeline")
@SuppressWarnings("java:S106")
public class ByteliftCLI implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(ByteliftCLI.class);

    @Spec
    private CommandSpec spec;

    @Parameters(paramLabel = "<file>", arity = "0..*", description = "IL text files to decompile")
    private List<Path> files = new ArrayList<>();

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private Path configFile;

    @Option(names = "--preset", description = "Configuration preset: default or minimal", paramLabel = "<name>")
    private String preset;

    @Option(names = "--disable", description = "Disable a transform (repeatable)", paramLabel = "<transform>")
    private List<String> disabled = new ArrayList<>();

    @Option(names = "--abort-after", description = "Stop the pipeline after this transform", paramLabel = "<transform>")
    private String abortAfter;

    @Option(names = "--show-docs", description = "Emit documentation comments")
    private boolean showDocs = false;

    @Option(names = "--format", description = "Output format: ${COMPLETION-CANDIDATES} (default: java)",
            paramLabel = "<format>")
    private OutputFormat format = OutputFormat.JAVA;

    @Option(names = "--output", description = "Write one file per type into this directory", paramLabel = "<path>")
    private Path outputPath;

    @Option(names = "--threads", description = "Worker threads (default: available processors)", paramLabel = "<n>")
    private int threads = 0; // 0 = use YAML/default

    @Option(names = "--trace", description = "Print a unified diff for every transform that changed a body")
    private boolean trace = false;

    @Option(names = "--export", description = "Export metrics (csv, json, or both)", paramLabel = "<format>")
    private String exportFormat;

    @Option(names = "--list-transforms", description = "List the transforms in pipeline order and exit")
    private boolean listTransforms = false;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, non-zero for errors)
     */
    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();

        if (listTransforms) {
            TransformRegistry.names().forEach(out::println);
            out.flush();
            return 0;
        }

        validateConfiguration();

        DecompilerSettings settings = DecompilerSettingsLoader.loadConfig(
                configFile, preset, disabled, showDocs, abortAfter, threads);

        CancellationToken token = new CancellationToken();
        Thread cancelOnShutdown = new Thread(token::cancel, "bytelift-cancel");
        Runtime.getRuntime().addShutdownHook(cancelOnShutdown);
        try {
            List<DecompilationResult> allResults = new ArrayList<>();
            PassTraceRecorder recorder = trace ? new PassTraceRecorder() : null;
            for (Path file : files) {
                allResults.addAll(decompileFile(file, settings, token, recorder, out));
            }
            if (recorder != null) {
                out.print(recorder.render());
            }
            out.flush();

            if (exportFormat != null && !exportFormat.isEmpty()) {
                exportMetrics(allResults);
            }
        } finally {
            removeShutdownHook(cancelOnShutdown);
        }
        return 0;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * The command line with its exception handlers configured, ready to execute.
     */
    public static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new ByteliftCLI());
        cmd.setCaseInsensitiveEnumValuesAllowed(true);

        // Configure error handling
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            // Handle execution exceptions with appropriate exit codes
            if (ex instanceof IllegalArgumentException || ex instanceof ConfigurationException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else if (ex instanceof InterruptedException) {
                commandLine.getErr().println("Process interrupted: " + ex.getMessage());
                return 4;
            } else if (ex instanceof ILParseException) {
                commandLine.getErr().println("Parse error: " + ex.getMessage());
                return 5;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        // Configure parameter exception handler for better error messages
        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return 2; // Invalid command line arguments
        });
        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (files.isEmpty()) {
            throw new IllegalArgumentException("No input files given");
        }

        // Validate export format
        if (exportFormat != null && !exportFormat.isEmpty()) {
            String fmt = exportFormat.toLowerCase();
            if (!fmt.equals("csv") && !fmt.equals("json") && !fmt.equals("both")) {
                throw new IllegalArgumentException(
                        "Export format must be 'csv', 'json', or 'both', got: " + exportFormat);
            }
        }

        if (threads < 0) {
            throw new IllegalArgumentException("Threads must be positive, got: " + threads);
        }

        // Validate config file exists if specified
        if (configFile != null && !Files.exists(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }

        if (outputPath != null && Files.exists(outputPath) && !Files.isDirectory(outputPath)) {
            throw new IllegalArgumentException("Output path exists but is not a directory: " + outputPath);
        }
    }

    private List<DecompilationResult> decompileFile(Path file, DecompilerSettings settings, CancellationToken token,
            PassTraceRecorder recorder, PrintWriter out) throws IOException {
        ILModule module = ILReader.read(file);
        DecompilationOrchestrator orchestrator = new DecompilationOrchestrator(module, module.getTypeSystem(), null,
                settings);
        if (recorder != null) {
            orchestrator.getPipeline().addListener(recorder);
        }

        List<DecompilationResult> results = orchestrator.decompileAll(module.typeDeclarations(), token);
        JavaSourceEmitter emitter = new JavaSourceEmitter();
        for (DecompilationResult result : results) {
            String text = format == OutputFormat.JAVA ? emitter.emit(result) : ILTextWriter.writeResult(result);
            if (outputPath != null) {
                Files.createDirectories(outputPath);
                Path target = outputPath.resolve(result.declaration().typeName() + "." + format.extension());
                Files.writeString(target, text);
                logger.info("Wrote {}", target);
            } else {
                out.println(text);
            }
        }
        return results;
    }

    private void exportMetrics(List<DecompilationResult> results) throws IOException {
        MetricsExporter exporter = new MetricsExporter();
        MetricsExporter.RunMetrics metrics = exporter.buildMetrics(results, "bytelift");

        Path dir = outputPath != null ? outputPath : Path.of(".");
        Files.createDirectories(dir);
        String fmt = exportFormat.toLowerCase();

        if (fmt.equals("csv") || fmt.equals("both")) {
            Path csvPath = dir.resolve("bytelift-metrics.csv");
            exporter.exportToCsv(metrics, csvPath);
            spec.commandLine().getErr().println("Metrics exported to: " + csvPath);
        }
        if (fmt.equals("json") || fmt.equals("both")) {
            Path jsonPath = dir.resolve("bytelift-metrics.json");
            exporter.exportToJson(metrics, jsonPath);
            spec.commandLine().getErr().println("Metrics exported to: " + jsonPath);
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            logger.debug("JVM is already shutting down, cancellation hook stays registered");
        }
    }
}
