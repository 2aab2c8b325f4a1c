package org.phylo.beastxml.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class BeastXmlCliTest {

    @Test
    void subcommandIsRequired() {
        var result = Invocation.run();

        assertEquals(2, result.exitCode());
        assertTrue(result.err().contains("Missing required subcommand"), result.err());
    }

    @Test
    void editNeedsSubcommandToo() {
        assertEquals(2, Invocation.run("edit").exitCode());
    }

    @Test
    void printsVersion() {
        var result = Invocation.run("--version");

        assertEquals(0, result.exitCode());
        assertTrue(result.out().contains("beastxml 1.0.0"), result.out());
    }

    @Test
    void helpListsSubcommands() {
        var result = Invocation.run("--help");

        assertEquals(0, result.exitCode());
        assertTrue(result.out().contains("assemble"), result.out());
        assertTrue(result.out().contains("edit"), result.out());
    }

    @Test
    void unknownOptionIsUsageError() {
        assertEquals(2, Invocation.run("assemble", "--bogus").exitCode());
    }

    @Test
    void failuresExitWithOne(@TempDir Path dir) {
        var skeleton = Invocation.skeleton(dir);

        var result = Invocation.run("edit", "run-length", "--length", "10", "--samples", "100", skeleton.toString());

        assertEquals(BeastXmlCli.EXIT_FAILED, result.exitCode());
        assertTrue(result.err().startsWith("error: Cannot take 100 samples from 10 steps"), result.err());
        assertEquals("", result.out());
    }

    @Test
    void missingInputFileExitsWithOne(@TempDir Path dir) {
        var result = Invocation.run("edit", "run-length", "--length", "10", dir.resolve("none.xml").toString());

        assertEquals(BeastXmlCli.EXIT_FAILED, result.exitCode());
        assertTrue(result.err().startsWith("error:"), result.err());
    }
}
