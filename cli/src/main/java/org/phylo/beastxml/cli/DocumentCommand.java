package org.phylo.beastxml.cli;

import org.phylo.beastxml.xml.BeastDocument;
import org.phylo.beastxml.xml.BeastXmlReader;
import org.phylo.beastxml.xml.BeastXmlWriter;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Base of the commands that read one document, change it and write it back.
 */
abstract class DocumentCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "<input>", description = "BEAST XML document to edit")
    Path input;

    @Option(names = {"-o", "--output"}, paramLabel = "<file>",
            description = "Output file (default: standard output)")
    Path output;

    @Override
    public Integer call() throws IOException {
        BeastDocument document = BeastXmlReader.parse(input);
        apply(document);
        document.validate();
        write(document, output, spec.commandLine().getOut());
        return 0;
    }

    protected abstract void apply(BeastDocument document) throws IOException;

    static void write(BeastDocument document, Path output, PrintWriter out) throws IOException {
        if (output == null) {
            out.print(BeastXmlWriter.toXml(document));
            out.flush();
        } else {
            BeastXmlWriter.write(document, output);
        }
    }
}
