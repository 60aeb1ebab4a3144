package io.callmap.ast;

import java.nio.file.Path;

/**
 * Thrown when a translation unit cannot be turned into an AST.
 */
public class ParseException extends Exception {

    private final Path source;

    public ParseException(Path source, String message) {
        super(message);
        this.source = source;
    }

    public ParseException(Path source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public Path source() {
        return source;
    }
}
