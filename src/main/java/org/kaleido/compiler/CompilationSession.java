package org.kaleido.compiler;

import org.kaleido.compiler.api.CompilerError;
import org.kaleido.compiler.api.Result;
import org.kaleido.compiler.diagnostics.DiagnosticsEngine;
import org.kaleido.compiler.frontend.irgen.IrEmitter;
import org.kaleido.compiler.frontend.lexer.Lexer;
import org.kaleido.compiler.frontend.lexer.Token;
import org.kaleido.compiler.frontend.parser.Parser;
import org.kaleido.compiler.frontend.parser.PrecedenceTable;
import org.kaleido.compiler.frontend.parser.ast.AstFormatter;
import org.kaleido.compiler.frontend.parser.ast.FunctionNode;
import org.kaleido.compiler.frontend.parser.ast.PrototypeNode;
import org.kaleido.compiler.ir.IrFunction;
import org.kaleido.compiler.ir.IrModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * One compilation session: a token stream, the parser reading it and the module that collects
 * everything emitted from it. Sessions share no state, so several can run side by side.
 * <p>
 * The input is processed one top-level unit at a time ({@code def}, {@code extern} or a bare
 * expression), each parsed and emitted to completion before the next is read. A unit that fails
 * is reported and skipped; it never ends the session. This class is not thread-safe.
 */
public class CompilationSession {

    private static final Logger LOG = LoggerFactory.getLogger(CompilationSession.class);

    private final Lexer lexer;
    private final Parser parser;
    private final IrEmitter emitter;
    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    /**
     * Creates a session over a character stream.
     *
     * @param input The input to compile.
     * @param inputName The logical name of the input, used in diagnostics.
     * @param module The module emitted functions are registered in.
     * @param precedences The binary operators of the language.
     */
    public CompilationSession(Reader input, String inputName, IrModule module, PrecedenceTable precedences) {
        this.lexer = new Lexer(input, inputName);
        this.parser = new Parser(lexer, precedences);
        this.emitter = new IrEmitter(module);
    }

    /**
     * Parses and emits the next top-level unit. Top-level semicolons are skipped.
     *
     * @return The outcome of the unit, or {@link TopLevelOutcome.Kind#END} once the input is exhausted.
     */
    public TopLevelOutcome handleNext() {
        while (true) {
            Token token = parser.current();
            switch (token.type()) {
                case END_OF_FILE:
                    return TopLevelOutcome.end();
                case DEF:
                    return handleDefinition();
                case EXTERN:
                    return handleExtern();
                default:
                    if (token.isChar(';')) {
                        parser.advance(); // ignore top-level semicolons
                        continue;
                    }
                    return handleTopLevelExpression();
            }
        }
    }

    /**
     * Handles units until the input is exhausted.
     * @param listener Receives the outcome of every unit, but not the final end marker.
     */
    public void run(Consumer<TopLevelOutcome> listener) {
        for (TopLevelOutcome outcome = handleNext(); outcome.kind() != TopLevelOutcome.Kind.END; outcome = handleNext()) {
            listener.accept(outcome);
        }
    }

    private TopLevelOutcome handleDefinition() {
        Result<FunctionNode> parsed = parser.parseDefinition();
        if (parsed.isError()) {
            return recoverFromSyntaxError(parsed.error());
        }
        return emit(TopLevelOutcome.Kind.DEFINITION, parsed.value());
    }

    private TopLevelOutcome handleExtern() {
        Result<PrototypeNode> parsed = parser.parseExtern();
        if (parsed.isError()) {
            return recoverFromSyntaxError(parsed.error());
        }
        return emit(TopLevelOutcome.Kind.EXTERN, FunctionNode.declaration(parsed.value()));
    }

    private TopLevelOutcome handleTopLevelExpression() {
        Result<FunctionNode> parsed = parser.parseTopLevelExpression();
        if (parsed.isError()) {
            return recoverFromSyntaxError(parsed.error());
        }
        return emit(TopLevelOutcome.Kind.TOP_LEVEL_EXPRESSION, parsed.value());
    }

    private TopLevelOutcome emit(TopLevelOutcome.Kind kind, FunctionNode node) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("Parsed {}", AstFormatter.format(node));
        }
        Result<IrFunction> emitted = emitter.emitFunction(node);
        if (emitted.isError()) {
            return report(emitted.error());
        }
        return TopLevelOutcome.success(kind, emitted.value());
    }

    private TopLevelOutcome recoverFromSyntaxError(CompilerError error) {
        // Skip the offending token so the next unit starts past it.
        parser.advance();
        return report(error);
    }

    private TopLevelOutcome report(CompilerError error) {
        LOG.info("Discarding top-level unit: {}", error);
        diagnostics.reportError(error);
        return TopLevelOutcome.failure(error);
    }

    public IrModule module() {
        return emitter.module();
    }

    /**
     * @return The I/O error that cut the input short, if reading failed.
     */
    public Optional<IOException> readFailure() {
        return lexer.readFailure();
    }

    public DiagnosticsEngine diagnostics() {
        return diagnostics;
    }
}
