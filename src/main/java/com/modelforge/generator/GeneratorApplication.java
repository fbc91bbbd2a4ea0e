package com.modelforge.generator;

import com.modelforge.generator.cli.GenerateCommand;
import picocli.CommandLine;

/**
 * Command line entry point: {@code generate -m models.json -o out/}.
 */
public final class GeneratorApplication {

    private GeneratorApplication() {
    }

    public static CommandLine commandLine() {
        return new CommandLine(new GenerateCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setUsageHelpAutoWidth(true);
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }
}
