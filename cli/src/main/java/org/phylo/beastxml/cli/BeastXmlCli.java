package org.phylo.beastxml.cli;

import org.phylo.beastxml.BeastAssemblyException;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;

/**
 * Command-line entry point.
 *
 * <pre>
 * beastxml assemble --skeleton skeleton.xml --manifest data.json [--scheme run.best_scheme.nex] -o run.xml
 * beastxml edit run-length --length 10000000 run.xml -o run.xml
 * </pre>
 *
 * Exit codes: 0 on success, 1 when the inputs cannot be assembled, 2 on a usage error.
 */
@Command(
        name = "beastxml",
        mixinStandardHelpOptions = true,
        version = "beastxml 1.0.0",
        description = "Assemble and edit BEAST XML documents from templates.",
        subcommands = {AssembleCommand.class, EditCommand.class})
public class BeastXmlCli implements Runnable {

    static final int EXIT_FAILED = 1;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    public static int run(String... args) {
        return commandLine().execute(args);
    }

    static CommandLine commandLine() {
        CommandLine commandLine = new CommandLine(new BeastXmlCli());
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setExecutionExceptionHandler((e, cmd, parseResult) -> {
            if (e instanceof BeastAssemblyException || e instanceof IOException
                    || e instanceof UncheckedIOException || e instanceof IllegalArgumentException) {
                PrintWriter err = cmd.getErr();
                err.println("error: " + e.getMessage());
                err.flush();
                return EXIT_FAILED;
            }
            throw e;
        });
        return commandLine;
    }

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
    }
}
