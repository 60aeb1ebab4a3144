package io.callmap.ast;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Parses translation units by running clang and reading its JSON AST dump.
 * <p>
 * The dump goes to a temporary file rather than a pipe so clang never blocks on
 * a full stdout buffer while its diagnostics are being collected.
 */
public class ClangAstProvider implements AstProvider {

    private static final int MAX_DIAGNOSTIC_CHARS = 2000;

    private final String clangExecutable;
    private final long timeoutSeconds;

    public ClangAstProvider(String clangExecutable, long timeoutSeconds) {
        this.clangExecutable = clangExecutable;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public AstNode parse(Path source, Path workDir, List<String> flags) throws ParseException {
        Path dumpFile = null;
        Path errorFile = null;
        try {
            dumpFile = Files.createTempFile("callmap-ast", ".json");
            errorFile = Files.createTempFile("callmap-clang", ".log");

            ProcessBuilder pb = new ProcessBuilder(buildCommand(source, flags));
            if (workDir != null && Files.isDirectory(workDir)) {
                pb.directory(workDir.toFile());
            }
            pb.redirectOutput(dumpFile.toFile());
            pb.redirectError(errorFile.toFile());

            Process process = pb.start();
            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new ParseException(source, "clang timed out after " + timeoutSeconds + " seconds");
            }

            int exitCode = process.exitValue();
            // clang still dumps the AST when the unit has recoverable errors
            if (Files.size(dumpFile) == 0) {
                throw new ParseException(source,
                        "clang exited with code " + exitCode + ": " + readDiagnostics(errorFile));
            }

            try (InputStream in = Files.newInputStream(dumpFile)) {
                return new ClangJsonAstReader().read(in);
            }

        } catch (IOException e) {
            throw new ParseException(source, "Failed to read AST: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ParseException(source, "Interrupted while waiting for clang", e);
        } finally {
            deleteQuietly(dumpFile);
            deleteQuietly(errorFile);
        }
    }

    @Override
    public String name() {
        return "clang (" + clangExecutable + ")";
    }

    List<String> buildCommand(Path source, List<String> flags) {
        List<String> command = new ArrayList<>();
        command.add(clangExecutable);
        command.add("-fsyntax-only");
        command.add("-Xclang");
        command.add("-ast-dump=json");
        command.addAll(flags);
        command.add(source.toString());
        return command;
    }

    private static String readDiagnostics(Path errorFile) throws IOException {
        String text = Files.readString(errorFile).trim();
        if (text.length() > MAX_DIAGNOSTIC_CHARS) {
            return text.substring(0, MAX_DIAGNOSTIC_CHARS) + "...";
        }
        return text.isEmpty() ? "(no diagnostics)" : text;
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            System.err.println("Warning: Failed to delete temporary file " + file + ": " + e.getMessage());
        }
    }
}
