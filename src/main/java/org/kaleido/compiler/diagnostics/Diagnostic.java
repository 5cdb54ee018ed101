package org.kaleido.compiler.diagnostics;

/**
 * Represents a single diagnostic message
 * that occurs while a session compiles its input.
 *
 * @param type The type of the diagnostic (currently always ERROR).
 * @param message The diagnostic message.
 * @param fileName The name of the input where the issue occurred.
 * @param lineNumber The line number of the issue.
 * @param columnNumber The column of the issue on its line.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber,
        int columnNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that discards the current top-level unit. */
        ERROR
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d:%d: %s", type, fileName, lineNumber, columnNumber, message);
    }
}
