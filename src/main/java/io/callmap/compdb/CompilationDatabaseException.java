package io.callmap.compdb;

/**
 * Thrown when no usable compilation database can be loaded.
 */
public class CompilationDatabaseException extends Exception {

    public CompilationDatabaseException(String message) {
        super(message);
    }

    public CompilationDatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
