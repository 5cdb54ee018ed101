package org.kaleido.cli.commands;

import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.kaleido.cli.CommandLineInterface;
import org.kaleido.cli.ConsoleLineReader;
import org.kaleido.cli.config.CompilerSettings;
import org.kaleido.compiler.CompilationSession;
import org.kaleido.compiler.TopLevelOutcome;
import org.kaleido.compiler.ir.IrModule;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.util.concurrent.Callable;

@Command(name = "repl",
        mixinStandardHelpOptions = true,
        description = "Reads definitions, externs and expressions interactively and prints the IR they produce.")
public class ReplCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Override
    public Integer call() throws IOException {
        CompilerSettings settings = CompilerSettings.from(parent.getConfig());
        try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
            LineReader lineReader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .build();
            try (Reader input = new ConsoleLineReader(lineReader, settings.prompt());
                 IrModule ignored = runLoop(input, "<stdin>", terminal.writer(), settings)) {
                terminal.flush();
            }
        }
        return 0;
    }

    /**
     * Runs one session over the input, reporting every top-level unit as it completes and
     * printing the whole module once the input ends.
     *
     * @param input The character stream to read.
     * @param inputName The logical name of the input.
     * @param out Where messages and IR are written.
     * @param settings The compiler settings.
     * @return The module the session emitted into; the caller must close it.
     */
    public static IrModule runLoop(Reader input, String inputName, PrintWriter out, CompilerSettings settings) {
        CompilationSession session = new CompilationSession(
                input, inputName, new IrModule(settings.moduleName()), settings.precedences());
        session.run(outcome -> report(outcome, out, settings.printIr()));
        session.readFailure().ifPresent(e -> out.println("Error: input could not be read: " + e));
        out.println();
        out.print(session.module().print());
        out.flush();
        return session.module();
    }

    private static void report(TopLevelOutcome outcome, PrintWriter out, boolean printIr) {
        out.println(outcome.message());
        if (printIr) {
            outcome.functionOptional().ifPresent(function -> out.println(function.print().strip()));
        }
        out.flush();
    }
}
