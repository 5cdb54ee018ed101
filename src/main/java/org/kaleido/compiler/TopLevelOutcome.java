package org.kaleido.compiler;

import org.kaleido.compiler.api.CompilerError;
import org.kaleido.compiler.ir.IrFunction;

import java.util.Optional;

/**
 * What happened to one top-level unit of the input.
 *
 * @param kind The kind of unit, or {@link Kind#ERROR} / {@link Kind#END}.
 * @param function The declared or defined function on success, otherwise {@code null}.
 * @param error The failure for {@link Kind#ERROR}, otherwise {@code null}.
 */
public record TopLevelOutcome(Kind kind, IrFunction function, CompilerError error) {

    /**
     * The possible outcomes of {@link CompilationSession#handleNext()}.
     */
    public enum Kind {
        /** A {@code def} was parsed and emitted. */
        DEFINITION("Parsed a function definition."),
        /** An {@code extern} was parsed and emitted. */
        EXTERN("Parsed an extern"),
        /** A bare expression was parsed and emitted as an anonymous function. */
        TOP_LEVEL_EXPRESSION("Parsed a top-level expr"),
        /** The unit failed to parse or emit and was discarded. */
        ERROR("Error"),
        /** The input is exhausted. */
        END("End of input");

        private final String message;

        Kind(String message) {
            this.message = message;
        }

        public String message() {
            return message;
        }
    }

    static TopLevelOutcome success(Kind kind, IrFunction function) {
        return new TopLevelOutcome(kind, function, null);
    }

    static TopLevelOutcome failure(CompilerError error) {
        return new TopLevelOutcome(Kind.ERROR, null, error);
    }

    static TopLevelOutcome end() {
        return new TopLevelOutcome(Kind.END, null, null);
    }

    public boolean isError() {
        return kind == Kind.ERROR;
    }

    public Optional<IrFunction> functionOptional() {
        return Optional.ofNullable(function);
    }

    /**
     * @return The one-line message a console shows for this outcome.
     */
    public String message() {
        if (kind == Kind.ERROR) {
            return "Error: " + error.message() + " (" + error.source() + ")";
        }
        return kind.message();
    }
}
