package io.callmap.compdb;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A loaded {@code compile_commands.json}.
 * <p>
 * Entries keep the order of the file; that order is the order translation units are analyzed in.
 */
public class CompilationDatabase {

    public static final String FILE_NAME = "compile_commands.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final List<CompileCommand> commands;

    public CompilationDatabase(List<CompileCommand> commands) {
        this.commands = List.copyOf(commands);
    }

    /**
     * Load {@code compile_commands.json} from a build directory.
     *
     * @throws CompilationDatabaseException If the file is missing, unreadable or malformed
     */
    public static CompilationDatabase fromDirectory(Path buildDir) throws CompilationDatabaseException {
        return load(buildDir.resolve(FILE_NAME));
    }

    /**
     * Load a compilation database file.
     *
     * @throws CompilationDatabaseException If the file is missing, unreadable or malformed
     */
    public static CompilationDatabase load(Path databaseFile) throws CompilationDatabaseException {
        if (!Files.isRegularFile(databaseFile)) {
            throw new CompilationDatabaseException("Missing " + databaseFile.getFileName() + " in " + databaseFile.getParent());
        }

        List<Entry> entries;
        try {
            entries = MAPPER.readValue(databaseFile.toFile(), new TypeReference<List<Entry>>() {});
        } catch (IOException e) {
            throw new CompilationDatabaseException("Failed to load compile database " + databaseFile + ": " + e.getMessage(), e);
        }

        List<CompileCommand> commands = new ArrayList<>();
        if (entries != null) {
            for (Entry entry : entries) {
                commands.add(toCommand(entry, databaseFile));
            }
        }
        return new CompilationDatabase(commands);
    }

    private static CompileCommand toCommand(Entry entry, Path databaseFile) throws CompilationDatabaseException {
        if (entry.file() == null || entry.file().isBlank()) {
            throw new CompilationDatabaseException("Entry without 'file' in " + databaseFile);
        }

        Path databaseDir = databaseFile.toAbsolutePath().getParent();
        Path directory = entry.directory() != null
                ? databaseDir.resolve(entry.directory())
                : databaseDir;
        Path file = directory.resolve(entry.file()).normalize();

        List<String> arguments;
        if (entry.arguments() != null && !entry.arguments().isEmpty()) {
            arguments = entry.arguments();
        } else if (entry.command() != null) {
            try {
                arguments = CommandLineSplitter.split(entry.command());
            } catch (IllegalArgumentException e) {
                throw new CompilationDatabaseException("Bad command for " + entry.file() + ": " + e.getMessage(), e);
            }
        } else {
            throw new CompilationDatabaseException("Entry for " + entry.file() + " has neither 'arguments' nor 'command'");
        }

        return new CompileCommand(directory, file, arguments);
    }

    /**
     * Write commands as a compilation database file.
     */
    public static void write(List<CompileCommand> commands, Path databaseFile) throws IOException {
        List<Entry> entries = commands.stream()
                .map(c -> new Entry(
                        c.directory() != null ? c.directory().toString() : null,
                        c.file().toString(),
                        null,
                        c.arguments()))
                .toList();
        MAPPER.writeValue(databaseFile.toFile(), entries);
    }

    public List<CompileCommand> commands() {
        return commands;
    }

    /**
     * First command for each distinct source file, in database order.
     */
    public List<CompileCommand> uniqueUnits() {
        Set<Path> seen = new LinkedHashSet<>();
        List<CompileCommand> units = new ArrayList<>();
        for (CompileCommand command : commands) {
            if (seen.add(command.file())) {
                units.add(command);
            }
        }
        return units;
    }

    public boolean isEmpty() {
        return commands.isEmpty();
    }

    public int size() {
        return commands.size();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Entry(
            String directory,
            String file,
            String command,
            List<String> arguments
    ) {}
}
