package org.phylo.beastxml.cli;

import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * One run of the command line with captured output and no environment.
 */
record Invocation(int exitCode, String out, String err) {

    static Invocation run(String... args) {
        return run(Map.of(), args);
    }

    static Invocation run(Map<String, String> environment, String... args) {
        CommandLine commandLine = BeastXmlCli.commandLine();
        AssembleCommand assemble = commandLine.getSubcommands().get("assemble").getCommand();
        assemble.environment = environment;

        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        int exitCode = commandLine.execute(args);
        return new Invocation(exitCode, out.toString(), err.toString());
    }

    static Path skeleton(Path directory) {
        Path target = directory.resolve("skeleton.xml");
        try (InputStream in = Invocation.class.getResourceAsStream("/fixtures/skeleton.xml")) {
            Files.copy(in, target);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return target;
    }

    static Path write(Path directory, String name, String content) {
        try {
            return Files.writeString(directory.resolve(name), content);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
