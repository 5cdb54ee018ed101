package org.kaleido.cli.config;

import com.typesafe.config.Config;
import org.kaleido.compiler.frontend.parser.PrecedenceTable;

/**
 * The compiler-related part of the configuration, read from the {@code kaleido} block.
 *
 * @param moduleName The name of the IR module a session emits into.
 * @param prompt The prompt the interactive loop shows before reading a line.
 * @param printIr Whether the interactive loop prints the IR of every emitted function.
 * @param precedences The binary operators and their precedences.
 */
public record CompilerSettings(
        String moduleName,
        String prompt,
        boolean printIr,
        PrecedenceTable precedences
) {

    /**
     * Reads the settings.
     * @param config The resolved application configuration, including reference.conf defaults.
     * @return The settings.
     * @throws com.typesafe.config.ConfigException if a key is missing or malformed.
     */
    public static CompilerSettings from(Config config) {
        Config kaleido = config.getConfig("kaleido");
        return new CompilerSettings(
                kaleido.getString("module-name"),
                kaleido.getString("repl.prompt"),
                kaleido.getBoolean("repl.print-ir"),
                PrecedenceTable.fromConfig(kaleido.getConfig("parser.precedence")));
    }
}
