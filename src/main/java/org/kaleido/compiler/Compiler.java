package org.kaleido.compiler;

import org.kaleido.compiler.api.CompilationException;
import org.kaleido.compiler.frontend.parser.PrecedenceTable;
import org.kaleido.compiler.ir.IrModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.Optional;

/**
 * Compiles a complete input in one go, for callers that want a module or an exception
 * rather than per-unit outcomes. It is not thread-safe.
 */
public class Compiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    private final String moduleName;
    private final PrecedenceTable precedences;

    /**
     * Creates a compiler with the default operator table.
     * @param moduleName The name given to produced modules.
     */
    public Compiler(String moduleName) {
        this(moduleName, PrecedenceTable.defaults());
    }

    /**
     * Creates a compiler.
     * @param moduleName The name given to produced modules.
     * @param precedences The binary operators of the language.
     */
    public Compiler(String moduleName, PrecedenceTable precedences) {
        this.moduleName = moduleName;
        this.precedences = precedences;
    }

    /**
     * Compiles every top-level unit of the input into a fresh module. The caller owns the
     * returned module and must close it.
     *
     * @param input The source text.
     * @param inputName The logical name of the input, used in diagnostics.
     * @return The module holding all declared and defined functions.
     * @throws CompilationException if any unit failed; the message lists every diagnostic.
     * @throws IOException if the input could not be read to its end.
     */
    public IrModule compile(Reader input, String inputName) throws CompilationException, IOException {
        IrModule module = new IrModule(moduleName);
        CompilationSession session = new CompilationSession(input, inputName, module, precedences);
        int[] units = {0};
        session.run(outcome -> units[0]++);
        Optional<IOException> readFailure = session.readFailure();
        if (readFailure.isPresent()) {
            module.close();
            throw readFailure.get();
        }
        if (session.diagnostics().hasErrors()) {
            module.close();
            throw new CompilationException(session.diagnostics().summary());
        }
        LOG.debug("Compiled {} top-level unit(s) from '{}'", units[0], inputName);
        return module;
    }

    /**
     * Compiles source text held in memory.
     * @param source The source text.
     * @return The module; the caller must close it.
     * @throws CompilationException if any unit failed.
     */
    public IrModule compile(String source) throws CompilationException {
        try {
            return compile(new StringReader(source), "<memory>");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
