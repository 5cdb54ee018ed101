package org.kaleido.compiler;

import org.kaleido.compiler.api.CompilerErrorCode;
import org.kaleido.compiler.diagnostics.Diagnostic;
import org.kaleido.compiler.frontend.parser.PrecedenceTable;
import org.kaleido.compiler.ir.IrModule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Contains unit tests for the {@link CompilationSession}.
 * These tests drive whole inputs through the session and check the reported outcome of every
 * top-level unit, including recovery after errors.
 */
@ExtendWith(MockitoExtension.class)
public class CompilationSessionTest {

    @Mock
    private Consumer<TopLevelOutcome> listener;

    @Captor
    private ArgumentCaptor<TopLevelOutcome> outcomes;

    private final List<IrModule> modules = new ArrayList<>();

    @AfterEach
    void tearDown() {
        modules.forEach(IrModule::close);
    }

    private CompilationSession session(String source) {
        return session(new StringReader(source));
    }

    private CompilationSession session(Reader input) {
        IrModule module = new IrModule("test");
        modules.add(module);
        return new CompilationSession(input, "test.k", module, PrecedenceTable.defaults());
    }

    /**
     * Verifies that each kind of top-level unit is reported with its message and function.
     */
    @Test
    @Tag("unit")
    void testOutcomeOfEachUnitKind() {
        // Arrange
        CompilationSession session = session("extern sin(x); def f(a) sin(a) * 2; f(1)");

        // Act
        session.run(listener);

        // Assert
        verify(listener, times(3)).accept(outcomes.capture());
        List<TopLevelOutcome> all = outcomes.getAllValues();
        assertThat(all).extracting(TopLevelOutcome::kind).containsExactly(
                TopLevelOutcome.Kind.EXTERN, TopLevelOutcome.Kind.DEFINITION, TopLevelOutcome.Kind.TOP_LEVEL_EXPRESSION);
        assertThat(all).extracting(TopLevelOutcome::message).containsExactly(
                "Parsed an extern", "Parsed a function definition.", "Parsed a top-level expr");
        assertThat(all.get(1).function().name()).isEqualTo("f");
        assertThat(all.get(2).functionOptional()).isPresent();
        assertThat(session.diagnostics().hasErrors()).isFalse();
    }

    /**
     * Verifies that the session skips the token a syntax error stopped at, reports the leftovers
     * of the broken unit as further errors, and still compiles the following definition.
     */
    @Test
    @Tag("unit")
    void testRecoveryAfterSyntaxError() {
        // Arrange
        CompilationSession session = session("def (x) 1;\ndef bar(x) x+1;");

        // Act
        session.run(listener);

        // Assert
        verify(listener, times(5)).accept(outcomes.capture());
        List<TopLevelOutcome> all = outcomes.getAllValues();
        assertThat(all).extracting(TopLevelOutcome::kind).containsExactly(
                TopLevelOutcome.Kind.ERROR, TopLevelOutcome.Kind.ERROR, TopLevelOutcome.Kind.ERROR,
                TopLevelOutcome.Kind.TOP_LEVEL_EXPRESSION, TopLevelOutcome.Kind.DEFINITION);
        assertThat(all.subList(0, 3)).extracting(o -> o.error().code()).containsExactly(
                CompilerErrorCode.EXPECTED_FUNCTION_NAME,
                CompilerErrorCode.UNKNOWN_VARIABLE,
                CompilerErrorCode.UNEXPECTED_TOKEN_IN_EXPRESSION);
        assertThat(session.module().getFunction("bar")).isPresent();
        assertThat(session.diagnostics().getDiagnostics()).hasSize(3);
    }

    @Test
    @Tag("unit")
    void testErrorMessageAndDiagnostic() {
        CompilationSession session = session("\n  x + 1;");

        TopLevelOutcome outcome = session.handleNext();

        assertThat(outcome.isError()).isTrue();
        assertThat(outcome.message()).isEqualTo("Error: Unknown variable name 'x' (test.k:2:3)");
        Diagnostic diagnostic = session.diagnostics().getDiagnostics().get(0);
        assertThat(diagnostic.type()).isEqualTo(Diagnostic.Type.ERROR);
        assertThat(diagnostic.toString()).isEqualTo("[ERROR] test.k:2:3: Unknown variable name 'x'");
    }

    @Test
    @Tag("unit")
    void testSemicolonsOnlyReachEnd() {
        CompilationSession session = session(";;; ;");

        session.run(listener);

        verifyNoInteractions(listener);
        assertThat(session.module().functions()).isEmpty();
    }

    /**
     * Verifies that the end of input is reported again on every further request.
     */
    @Test
    @Tag("unit")
    void testEndIsRepeated() {
        CompilationSession session = session("1");

        assertThat(session.handleNext().kind()).isEqualTo(TopLevelOutcome.Kind.TOP_LEVEL_EXPRESSION);
        assertThat(session.handleNext().kind()).isEqualTo(TopLevelOutcome.Kind.END);
        assertThat(session.handleNext().kind()).isEqualTo(TopLevelOutcome.Kind.END);
    }

    @Test
    @Tag("unit")
    void testSessionsAreIndependent() {
        CompilationSession first = session("def f(x) x");
        CompilationSession second = session("f(1)");

        first.run(outcome -> { });
        TopLevelOutcome outcome = second.handleNext();

        assertThat(first.module().getFunction("f")).isPresent();
        assertThat(outcome.error().code()).isEqualTo(CompilerErrorCode.UNKNOWN_FUNCTION);
        assertThat(second.module().getFunction("f")).isEmpty();
    }

    @Test
    @Tag("unit")
    void testLaterUnitsSeeEarlierDeclarations() {
        CompilationSession session = session("def double(x) x * 2\ndef quad(x) double(double(x))\nquad(3)");

        session.run(listener);

        verify(listener, times(3)).accept(outcomes.capture());
        assertThat(outcomes.getAllValues()).noneMatch(TopLevelOutcome::isError);
        assertThat(session.module().functions()).hasSize(3);
    }

    /**
     * Verifies that a reader failing mid-input ends the session and that the failure is kept,
     * while the units read before it are still emitted.
     */
    @Test
    @Tag("unit")
    void testReadFailureIsSurfaced() {
        // Arrange
        IOException failure = new IOException("disk gone");
        Reader failing = new Reader() {
            private final Reader head = new StringReader("def a(x) x\n");

            @Override
            public int read(char[] buffer, int offset, int length) throws IOException {
                int n = head.read(buffer, offset, length);
                if (n == -1) {
                    throw failure;
                }
                return n;
            }

            @Override
            public void close() {
            }
        };
        CompilationSession session = session(failing);

        // Act
        session.run(listener);

        // Assert
        verify(listener, times(1)).accept(outcomes.capture());
        assertThat(outcomes.getValue().kind()).isEqualTo(TopLevelOutcome.Kind.DEFINITION);
        assertThat(session.readFailure()).containsSame(failure);
        assertThat(session.handleNext().kind()).isEqualTo(TopLevelOutcome.Kind.END);
    }

    @Test
    @Tag("unit")
    void testNoReadFailureOnCleanInput() {
        CompilationSession session = session("1");

        session.run(outcome -> { });

        assertThat(session.readFailure()).isEmpty();
    }
}
