package io.callmap.ast;

import java.nio.file.Path;
import java.util.List;

/**
 * Parses a single translation unit.
 */
public interface AstProvider {

    /**
     * Parse a source file with the given compiler-style flags.
     *
     * @param source  Source file to parse
     * @param workDir Directory the compile command runs in (relative include paths resolve against it)
     * @param flags   Ordered compiler arguments, compiler name already removed
     * @return Root node of the translation unit
     * @throws ParseException If the unit cannot be parsed
     */
    AstNode parse(Path source, Path workDir, List<String> flags) throws ParseException;

    /**
     * Human-readable provider name for diagnostics.
     */
    String name();
}
