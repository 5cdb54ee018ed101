package org.kaleido.cli.commands;

import org.kaleido.cli.CommandLineInterface;
import org.kaleido.cli.config.CompilerSettings;
import org.kaleido.compiler.Compiler;
import org.kaleido.compiler.api.CompilationException;
import org.kaleido.compiler.ir.IrModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(name = "compile",
        mixinStandardHelpOptions = true,
        description = "Compiles a source file and writes the IR module it produces.")
public class CompileCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CompileCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(index = "0", description = "The source file to compile.")
    private File file;

    @Option(names = {"-o", "--output"}, description = "Write the IR to this file instead of standard output.")
    private File output;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        if (!file.isFile()) {
            LOG.error("File not found: {}", file.getAbsolutePath());
            spec.commandLine().getErr().println("Error: File not found: " + file.getAbsolutePath());
            return 2;
        }

        CompilerSettings settings = CompilerSettings.from(parent.getConfig());
        Compiler compiler = new Compiler(settings.moduleName(), settings.precedences());

        String ir;
        int functionCount;
        try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8);
             IrModule module = compiler.compile(reader, file.getPath())) {
            ir = module.print();
            functionCount = module.functions().size();
        } catch (CompilationException e) {
            spec.commandLine().getErr().println(e.getMessage());
            return 1;
        } catch (IOException e) {
            LOG.error("Failed to read {}: {}", file.getAbsolutePath(), e.toString());
            spec.commandLine().getErr().println("Error: Cannot read " + file.getAbsolutePath() + ": " + e);
            return 2;
        }

        if (output == null) {
            spec.commandLine().getOut().print(ir);
            spec.commandLine().getOut().flush();
            return 0;
        }
        try (Writer writer = Files.newBufferedWriter(output.toPath(), StandardCharsets.UTF_8)) {
            writer.write(ir);
        } catch (IOException e) {
            LOG.error("Failed to write {}: {}", output.getAbsolutePath(), e.getMessage());
            spec.commandLine().getErr().println("Error: Cannot write " + output.getAbsolutePath() + ": " + e.getMessage());
            return 2;
        }
        LOG.info("Wrote IR of {} function(s) to {}", functionCount, output.getAbsolutePath());
        return 0;
    }
}
