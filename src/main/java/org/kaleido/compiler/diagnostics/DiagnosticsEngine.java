package org.kaleido.compiler.diagnostics;

import org.kaleido.compiler.api.CompilerError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages
 * that occur during the compilation process.
 * <p>
 * This decouples error reporting from the actual compiler logic (parser, emitter).
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message    The error message.
     * @param fileName   The input in which the error occurred.
     * @param lineNumber The line number of the error.
     * @param columnNumber The column of the error.
     */
    public void reportError(String message, String fileName, int lineNumber, int columnNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, fileName, lineNumber, columnNumber));
    }

    /**
     * Reports a compiler error produced by a phase.
     *
     * @param error The error to record.
     */
    public void reportError(CompilerError error) {
        reportError(error.message(), error.source().fileName(), error.source().lineNumber(),
                error.source().columnNumber());
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
