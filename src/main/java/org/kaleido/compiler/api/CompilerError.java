package org.kaleido.compiler.api;

/**
 * A single failure of a compiler phase, carried by a {@link Result} instead of being thrown.
 *
 * @param code The machine-readable error code.
 * @param message The human-readable, one-line message.
 * @param source Where in the input the error was detected.
 */
public record CompilerError(CompilerErrorCode code, String message, SourceInfo source) {

    @Override
    public String toString() {
        return String.format("%s at %s", message, source);
    }
}
