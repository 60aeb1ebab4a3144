package io.callmap.compdb;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Produces compile commands for projects that have no compilation database.
 * <p>
 * Two strategies are supported:
 * <ul>
 *   <li>harvesting compiler invocations from {@code make --dry-run}</li>
 *   <li>discovering source files and synthesizing one command per file</li>
 * </ul>
 */
public class CompileCommandGenerator {

    public static final List<String> SOURCE_EXTENSIONS = List.of(".c", ".cpp", ".cc", ".cxx");

    private static final List<String> COMPILER_PREFIXES = List.of("gcc", "g++", "clang", "clang++");
    private static final long MAKE_TIMEOUT_SECONDS = 300;

    private final String makeExecutable;
    private final long timeoutSeconds;
    private final PrintStream diagnostics;

    public CompileCommandGenerator(String makeExecutable, PrintStream diagnostics) {
        this(makeExecutable, MAKE_TIMEOUT_SECONDS, diagnostics);
    }

    public CompileCommandGenerator(String makeExecutable, long timeoutSeconds, PrintStream diagnostics) {
        this.makeExecutable = makeExecutable;
        this.timeoutSeconds = timeoutSeconds;
        this.diagnostics = diagnostics;
    }

    /**
     * Run {@code make --dry-run} in the project and collect the compiler invocations it prints.
     * A failing or hanging make is reported and yields no commands.
     * <p>
     * Output goes to a temporary file, so the timeout holds even when make never
     * closes its output.
     */
    public List<CompileCommand> fromMake(Path projectRoot) throws IOException {
        Path root = projectRoot.toAbsolutePath().normalize();
        Path outputFile = Files.createTempFile("callmap-make", ".log");
        try {
            ProcessBuilder pb = new ProcessBuilder(makeExecutable, "--dry-run", "-C", root.toString());
            pb.redirectErrorStream(true);
            pb.redirectOutput(outputFile.toFile());

            Process process = pb.start();
            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                diagnostics.println("Error running make: timed out after " + timeoutSeconds + " seconds");
                return List.of();
            }

            String output = new String(Files.readAllBytes(outputFile), StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                diagnostics.println("Error running make (exit code " + process.exitValue() + "):");
                diagnostics.println(output.trim());
                return List.of();
            }

            return parseDryRunOutput(output, root);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for make", e);
        } finally {
            try {
                Files.deleteIfExists(outputFile);
            } catch (IOException e) {
                diagnostics.println("Warning: Failed to delete temporary file " + outputFile + ": " + e.getMessage());
            }
        }
    }

    /**
     * Extract compile commands from {@code make --dry-run} output.
     * Lines starting with a known compiler that name a C/C++ source become commands;
     * the first source named on the line is the command's file.
     *
     * @param output     Output of make
     * @param projectDir Directory make ran in
     */
    public List<CompileCommand> parseDryRunOutput(String output, Path projectDir) {
        List<CompileCommand> commands = new ArrayList<>();

        for (String line : output.split("\\R")) {
            String trimmed = line.strip();
            if (!startsWithCompiler(trimmed)) {
                continue;
            }

            List<String> args;
            try {
                args = CommandLineSplitter.split(trimmed);
            } catch (IllegalArgumentException e) {
                diagnostics.println("Warning: Skipping unparsable make line: " + e.getMessage());
                continue;
            }

            String source = args.stream()
                    .skip(1)
                    .filter(CompileCommandGenerator::isSourceFile)
                    .findFirst()
                    .orElse(null);
            if (source == null) {
                continue;
            }

            Path file = projectDir.resolve(source).normalize();
            commands.add(new CompileCommand(projectDir, file, args));
        }

        return commands;
    }

    /**
     * Synthesize commands for every source file under the project root.
     *
     * @param projectRoot Directory to search
     * @param compiler    Compiler name placed in argument 0
     * @param includeDirs Include directories, emitted as absolute {@code -I<dir>}
     * @param extraFlags  Flags placed before the include directories
     */
    public List<CompileCommand> fromSources(Path projectRoot, String compiler,
                                            List<String> includeDirs, List<String> extraFlags) throws IOException {
        Path root = projectRoot.toAbsolutePath().normalize();
        List<CompileCommand> commands = new ArrayList<>();
        for (Path source : findSourceFiles(root)) {
            List<String> args = new ArrayList<>();
            args.add(compiler);
            args.addAll(extraFlags);
            // relative include dirs resolve against the project root
            for (String include : includeDirs) {
                args.add("-I" + root.resolve(include).normalize());
            }
            args.add(source.toString());
            commands.add(new CompileCommand(source.getParent(), source, args));
        }
        return commands;
    }

    /**
     * All C/C++ source files under a directory, sorted by path.
     */
    public static List<Path> findSourceFiles(Path root) throws IOException {
        try (Stream<Path> stream = Files.walk(root)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(p -> isSourceFile(p.getFileName().toString()))
                    .map(p -> p.toAbsolutePath().normalize())
                    .sorted()
                    .toList();
        }
    }

    static boolean isSourceFile(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return SOURCE_EXTENSIONS.stream().anyMatch(lower::endsWith);
    }

    private static boolean startsWithCompiler(String line) {
        return COMPILER_PREFIXES.stream().anyMatch(line::startsWith);
    }
}
