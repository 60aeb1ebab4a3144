package io.callmap;

import io.callmap.analysis.CallGraphBuilder;
import io.callmap.analysis.ProjectAnalyzer;
import io.callmap.ast.AstProvider;
import io.callmap.ast.ClangAstProvider;
import io.callmap.compdb.CompilationDatabase;
import io.callmap.compdb.CompilationDatabaseException;
import io.callmap.compdb.CompileCommand;
import io.callmap.compdb.CompileCommandGenerator;
import io.callmap.model.AnalysisResult;
import io.callmap.output.CallTreeRenderer;
import org.yaml.snakeyaml.error.YAMLException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI entry point for the callmap tool.
 */
@Command(
        name = "callmap",
        mixinStandardHelpOptions = true,
        version = "callmap 1.0.0",
        description = "Builds a static call graph of a C/C++ project and prints the call tree of every entry point.",
        footer = {
                "",
                "Examples:",
                "  callmap /path/to/project",
                "  callmap /path/to/project --generate-only",
                "  callmap /path/to/project --no-make --include=inc --flags=-DDEBUG,-Wall"
        }
)
public class CallMapCli implements Callable<Integer> {

    static final String PROJECT_CONFIG = "callmap.yaml";

    @Parameters(
            index = "0",
            description = "Project root (directory containing the Makefile or compile_commands.json)"
    )
    private Path projectRoot;

    @Option(
            names = {"--generate-only"},
            description = "Write compile_commands.json and exit"
    )
    private boolean generateOnly;

    @Option(
            names = {"--regenerate"},
            description = "Regenerate compile_commands.json even if it already exists"
    )
    private boolean regenerate;

    @Option(
            names = {"--no-make"},
            description = "Generate compile commands from discovered source files instead of make --dry-run"
    )
    private boolean noMake;

    @Option(
            names = {"--include"},
            description = "Include directories (-I) for generated compile commands",
            split = ","
    )
    private List<String> includes;

    @Option(
            names = {"--compiler"},
            description = "Compiler for generated compile commands (default from config: clang++)"
    )
    private String compiler;

    @Option(
            names = {"--flags"},
            description = "Extra compiler flags for generated compile commands, e.g. --flags=-DDEBUG,-g",
            split = ","
    )
    private List<String> flags;

    @Option(
            names = {"--clang"},
            description = "clang executable used to parse translation units"
    )
    private String clang;

    @Option(
            names = {"-c", "--config"},
            description = "Path to configuration YAML file (default: <project>/" + PROJECT_CONFIG + " if present)"
    )
    private Path configFile;

    @Option(
            names = {"--no-leaf-markers"},
            description = "Do not print '-> None' for functions without recorded calls"
    )
    private boolean noLeafMarkers;

    @Option(
            names = {"--no-color"},
            description = "Disable ANSI colors in console output"
    )
    private boolean noColor;

    @Option(
            names = {"-v", "--verbose"},
            description = "Enable verbose output"
    )
    private boolean verbose;

    private final AstProvider astProviderOverride;
    private final PrintStream out;
    private final PrintStream err;

    public CallMapCli() {
        this(null, System.out, System.err);
    }

    /**
     * @param astProvider Parser to use instead of clang, or null for clang
     */
    CallMapCli(AstProvider astProvider, PrintStream out, PrintStream err) {
        this.astProviderOverride = astProvider;
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        try {
            if (!Files.isDirectory(projectRoot)) {
                err.println("Error: Project path is not a directory: " + projectRoot);
                return 1;
            }

            CallMapConfig config;
            try {
                config = loadConfig();
            } catch (IOException | IllegalArgumentException | YAMLException e) {
                err.println("Error loading config: " + e.getMessage());
                return 1;
            }

            // Step 1: Compile commands
            Path databaseFile = projectRoot.resolve(CompilationDatabase.FILE_NAME);
            if (generateOnly || regenerate || !Files.exists(databaseFile)) {
                List<CompileCommand> generated = generateCommands(config);
                CompilationDatabase.write(generated, databaseFile);
                out.println("Generated " + databaseFile + " with " + generated.size() + " entries.");
                if (generateOnly) {
                    return 0;
                }
            }

            CompilationDatabase database;
            try {
                database = CompilationDatabase.fromDirectory(projectRoot);
            } catch (CompilationDatabaseException e) {
                err.println("Error: " + e.getMessage());
                return 1;
            }
            log("Loaded " + database.size() + " compile commands");
            if (database.isEmpty()) {
                err.println("Warning: " + databaseFile + " has no entries");
            }

            // Step 2: Parse and build
            AstProvider provider = astProviderOverride != null
                    ? astProviderOverride
                    : new ClangAstProvider(clang != null ? clang : config.getClang(), config.getParseTimeoutSeconds());
            log("Parsing with " + provider.name());

            ProjectAnalyzer analyzer = new ProjectAnalyzer(
                    provider,
                    new CallGraphBuilder(config.originFilter()),
                    verbose ? out : null,
                    err);
            AnalysisResult result = analyzer.analyze(database.uniqueUnits());

            log("Parsed " + result.unitsParsed() + " units, " + result.failures().size() + " failed");

            // Step 3: Output
            if (!result.hasFunctions()) {
                out.println("No functions found.");
                return 0;
            }
            if (!result.hasRoots()) {
                out.println("No root functions found.");
                return 0;
            }

            CallTreeRenderer renderer = new CallTreeRenderer(result.graph(), out, !noColor, !noLeafMarkers);
            if (verbose) {
                out.println();
                renderer.printSummary(result.roots());
            }
            renderer.printCallTrees(result.roots());
            return 0;

        } catch (Exception e) {
            err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace(err);
            }
            return 1;
        }
    }

    private CallMapConfig loadConfig() throws IOException {
        CallMapConfig defaultConfig = CallMapConfig.loadDefault();

        if (configFile != null) {
            if (!Files.exists(configFile)) {
                throw new IOException("Config file does not exist: " + configFile);
            }
            log("Loading configuration from: " + configFile);
            return defaultConfig.merge(CallMapConfig.loadFromFile(configFile));
        }

        Path projectConfig = projectRoot.resolve(PROJECT_CONFIG);
        if (Files.exists(projectConfig)) {
            log("Loading configuration from: " + projectConfig);
            return defaultConfig.merge(CallMapConfig.loadFromFile(projectConfig));
        }

        return defaultConfig;
    }

    private List<CompileCommand> generateCommands(CallMapConfig config) throws IOException {
        CompileCommandGenerator generator = new CompileCommandGenerator("make", err);
        if (!noMake) {
            log("Collecting compile commands from make --dry-run...");
            return generator.fromMake(projectRoot);
        }

        List<String> includeDirs = new ArrayList<>(config.getIncludes());
        if (includes != null) {
            includeDirs.addAll(includes);
        }
        List<String> extraFlags = new ArrayList<>(config.getFlags());
        if (flags != null) {
            extraFlags.addAll(flags);
        }
        String effectiveCompiler = compiler != null ? compiler : config.getCompiler();

        log("Generating compile commands for source files under " + projectRoot + "...");
        return generator.fromSources(projectRoot, effectiveCompiler, includeDirs, extraFlags);
    }

    private void log(String message) {
        if (verbose) {
            out.println(message);
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CallMapCli()).execute(args);
        System.exit(exitCode);
    }
}
