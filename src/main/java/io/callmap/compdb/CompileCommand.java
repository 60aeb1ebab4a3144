package io.callmap.compdb;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * One entry of a compilation database.
 *
 * @param directory Working directory of the compile command
 * @param file      Absolute path of the source file
 * @param arguments Full argument vector, compiler name first
 */
public record CompileCommand(
        Path directory,
        Path file,
        List<String> arguments
) {
    public CompileCommand {
        arguments = List.copyOf(arguments);
    }

    /**
     * The compiler name (argument 0), or an empty string for an empty command.
     */
    public String compiler() {
        return arguments.isEmpty() ? "" : arguments.get(0);
    }

    /**
     * Arguments to hand to a parser: the compiler name, the source file itself,
     * {@code -c} and the {@code -o} output are removed.
     */
    public List<String> flags() {
        List<String> flags = new ArrayList<>();
        for (int i = 1; i < arguments.size(); i++) {
            String arg = arguments.get(i);
            if (arg.equals("-c")) {
                continue;
            }
            if (arg.equals("-o")) {
                i++; // skip the output file as well
                continue;
            }
            if (arg.startsWith("-o") && arg.length() > 2) {
                continue;
            }
            if (isSourceFile(arg)) {
                continue;
            }
            flags.add(arg);
        }
        return flags;
    }

    private boolean isSourceFile(String arg) {
        if (arg.startsWith("-")) {
            return false;
        }
        Path candidate = directory != null ? directory.resolve(arg) : Path.of(arg);
        return candidate.normalize().equals(file.normalize());
    }
}
