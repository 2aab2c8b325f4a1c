package org.phylo.beastxml.cli;

import org.phylo.beastxml.bind.DecimalYear;
import org.phylo.beastxml.edit.MarkovJumpEditor;
import org.phylo.beastxml.edit.PredictorEditor;
import org.phylo.beastxml.edit.PredictorOptions;
import org.phylo.beastxml.edit.PredictorTable;
import org.phylo.beastxml.edit.RunSettingsEditor;
import org.phylo.beastxml.edit.StartingTreeEditor;
import org.phylo.beastxml.edit.TaxonEditor;
import org.phylo.beastxml.edit.TaxonOptions;
import org.phylo.beastxml.edit.TraitEditor;
import org.phylo.beastxml.merge.CollisionPolicy;
import org.phylo.beastxml.merge.FragmentMerger;
import org.phylo.beastxml.merge.FragmentRemover;
import org.phylo.beastxml.merge.MergeOptions;
import org.phylo.beastxml.xml.BeastDocument;
import org.phylo.beastxml.xml.BeastXmlReader;
import picocli.CommandLine;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Single edits of an existing document.
 */
@Command(
        name = "edit",
        mixinStandardHelpOptions = true,
        description = "Edit an existing BEAST XML document.",
        subcommands = {
                EditCommand.RunLength.class,
                EditCommand.OutputName.class,
                EditCommand.StartingTree.class,
                EditCommand.SetAttribute.class,
                EditCommand.AddTaxon.class,
                EditCommand.Traits.class,
                EditCommand.MarkovJumps.class,
                EditCommand.Predictor.class,
                EditCommand.Merge.class,
                EditCommand.Remove.class})
class EditCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
    }

    @Command(name = "run-length", description = "Set the chain length and log frequency.")
    static class RunLength extends DocumentCommand {

        @Option(names = "--length", required = true, paramLabel = "<steps>", description = "MCMC chain length")
        long length;

        @Option(names = "--samples", defaultValue = "10000", paramLabel = "<n>",
                description = "Samples logged over the chain (default: ${DEFAULT-VALUE})")
        long samples;

        @Override
        protected void apply(BeastDocument document) {
            RunSettingsEditor.setRunLength(document, length, samples);
        }
    }

    @Command(name = "output-name", description = "Rename the log, tree and operator output files.")
    static class OutputName extends DocumentCommand {

        @ArgGroup(exclusive = true, multiplicity = "1")
        Naming naming;

        static class Naming {
            @Option(names = "--stem", paramLabel = "<stem>", description = "Replace file names, keeping extensions")
            String stem;

            @Option(names = "--prefix", paramLabel = "<prefix>", description = "Prefix every file name")
            String prefix;
        }

        @Override
        protected void apply(BeastDocument document) {
            if (naming.stem != null) {
                RunSettingsEditor.setOutputStem(document, naming.stem);
            } else {
                RunSettingsEditor.setOutputPrefix(document, naming.prefix);
            }
        }
    }

    @Command(name = "starting-tree", description = "Replace the starting tree.")
    static class StartingTree extends DocumentCommand {

        @ArgGroup(exclusive = true, multiplicity = "1")
        Tree tree;

        static class Tree {
            @Option(names = "--upgma", description = "UPGMA tree of the first alignment")
            boolean upgma;

            @Option(names = "--newick", paramLabel = "<file>", description = "Newick tree read from a file")
            Path newick;
        }

        @Override
        protected void apply(BeastDocument document) throws IOException {
            if (tree.upgma) {
                StartingTreeEditor.useUpgma(document);
            } else {
                StartingTreeEditor.useNewick(document, Files.readString(tree.newick, StandardCharsets.UTF_8));
            }
        }
    }

    @Command(name = "set", description = "Set an attribute of the element with a given id.")
    static class SetAttribute extends DocumentCommand {

        @Option(names = "--id", required = true, paramLabel = "<id>")
        String id;

        @Option(names = "--attribute", required = true, paramLabel = "<name>")
        String attribute;

        @Option(names = "--value", required = true, paramLabel = "<value>")
        String value;

        @Override
        protected void apply(BeastDocument document) {
            RunSettingsEditor.setAttribute(document, id, attribute, value);
        }
    }

    @Command(name = "add-taxon", description = "Add a taxon with its date and sequences.")
    static class AddTaxon extends DocumentCommand {

        @Option(names = "--id", required = true, paramLabel = "<taxon>")
        String id;

        @Option(names = "--date", paramLabel = "<date>", description = "Decimal year or YYYY-MM-DD")
        String date;

        @Option(names = "--sequence", paramLabel = "<alignment>=<sequence>",
                description = "Sequence for an alignment; repeat for several alignments")
        Map<String, String> sequences = new LinkedHashMap<>();

        @Option(names = "--unsampled", description = "Pad every alignment with unknown characters")
        boolean unsampled;

        @Option(names = "--taxa", defaultValue = "taxa", paramLabel = "<id>", description = "Id of the taxa block")
        String taxa;

        @Override
        protected void apply(BeastDocument document) {
            Double decimalDate = date == null ? null : DecimalYear.parse(date);
            TaxonOptions options = new TaxonOptions(taxa, "-", "nucleotide", "forwards", "years");
            if (unsampled) {
                if (!sequences.isEmpty()) {
                    throw new IllegalArgumentException("--unsampled cannot be combined with --sequence");
                }
                TaxonEditor.addUnsampledTaxon(document, id, decimalDate, options);
            } else {
                TaxonEditor.addTaxon(document, id, decimalDate, sequences, options);
            }
        }
    }

    @Command(name = "traits", description = "Add or replace taxon attributes from a CSV of taxon,value rows.")
    static class Traits extends DocumentCommand {

        @Option(names = "--trait", required = true, paramLabel = "<name>")
        String trait;

        @Option(names = "--table", required = true, paramLabel = "<csv>",
                description = "Header row, then one taxon,value row per taxon")
        Path table;

        @Option(names = "--continuous", description = "Store values only, without a discrete data type")
        boolean continuous;

        @Option(names = "--taxa", defaultValue = "taxa", paramLabel = "<id>", description = "Id of the taxa block")
        String taxa;

        @Override
        protected void apply(BeastDocument document) throws IOException {
            List<String> lines = Files.readAllLines(table, StandardCharsets.UTF_8);
            for (int i = 1; i < lines.size(); i++) {
                if (lines.get(i).isBlank()) {
                    continue;
                }
                String[] cells = lines.get(i).split(",", -1);
                if (cells.length != 2) {
                    throw new IllegalArgumentException(table + " line " + (i + 1) + ": expected taxon,value");
                }
                if (continuous) {
                    TraitEditor.setAttribute(document, cells[0].trim(), trait, cells[1].trim());
                } else {
                    TraitEditor.setDiscreteAttribute(document, cells[0].trim(), trait, cells[1].trim(), taxa);
                }
            }
            if (!continuous) {
                TraitEditor.updateDimensions(document, trait);
                MarkovJumpEditor.refresh(document, trait);
            }
        }
    }

    @Command(name = "markov-jumps", description = "Log Markov jump counts and rewards of a discrete trait.")
    static class MarkovJumps extends DocumentCommand {

        @Option(names = "--trait", required = true, paramLabel = "<name>")
        String trait;

        @Option(names = "--counts", negatable = true, defaultValue = "true", fallbackValue = "true",
                description = "Log jump counts (default: ${DEFAULT-VALUE})")
        boolean counts;

        @Option(names = "--rewards", description = "Log time spent in each state")
        boolean rewards;

        @Override
        protected void apply(BeastDocument document) {
            if (counts) {
                MarkovJumpEditor.logJumpCounts(document, trait);
            }
            if (rewards) {
                MarkovJumpEditor.logRewards(document, trait);
            }
        }
    }

    @Command(name = "predictor", description = "Add a GLM predictor from a CSV table.")
    static class Predictor extends DocumentCommand {

        @Option(names = "--table", required = true, paramLabel = "<csv>",
                description = "State per row; one value column (scalar) or one column per state (matrix)")
        Path table;

        @Option(names = "--name", paramLabel = "<name>", description = "Predictor name (matrix predictors)")
        String name;

        @Option(names = "--model-id", defaultValue = "location.model", paramLabel = "<id>")
        String modelId;

        @Option(names = "--datatype-id", defaultValue = "location.dataType", paramLabel = "<id>")
        String dataTypeId;

        @Option(names = "--prefix", defaultValue = "location", paramLabel = "<prefix>")
        String prefix;

        @Option(names = "--log", negatable = true, defaultValue = "true", fallbackValue = "true",
                description = "Log-transform values (default: ${DEFAULT-VALUE})")
        boolean log;

        @Option(names = "--standardise", negatable = true, defaultValue = "true", fallbackValue = "true",
                description = "Standardise values (default: ${DEFAULT-VALUE})")
        boolean standardise;

        @Option(names = "--update-prior", negatable = true, defaultValue = "true", fallbackValue = "true",
                description = "Adjust the inclusion prior to the predictor count (default: ${DEFAULT-VALUE})")
        boolean updatePrior;

        @Override
        protected void apply(BeastDocument document) throws IOException {
            PredictorTable values = PredictorTable.parse(Files.readString(table, StandardCharsets.UTF_8));
            PredictorOptions options = new PredictorOptions(dataTypeId, modelId, prefix, log, standardise,
                    updatePrior);
            PredictorEditor.addPredictor(document, name, values, options);
        }
    }

    @Command(name = "merge", description = "Merge template fragments into the document, in order.")
    static class Merge extends DocumentCommand {

        @Option(names = "--fragment", required = true, paramLabel = "<file>", description = "Fragment; repeatable")
        List<Path> fragments;

        @Option(names = "--collision", defaultValue = "RENAME_INCOMING", paramLabel = "<policy>",
                description = "${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
        CollisionPolicy collision;

        @Option(names = "--prefix", paramLabel = "<prefix>", description = "Isolate fragment ids as prefix.id")
        String prefix;

        @Option(names = "--protect", split = ",", paramLabel = "<id>", description = "Ids never prefixed")
        Set<String> protectedIds = Set.of();

        @Override
        protected void apply(BeastDocument document) throws IOException {
            MergeOptions options = MergeOptions.defaults()
                    .withCollisionPolicy(collision)
                    .withIsolationPrefix(prefix)
                    .withProtectedIds(protectedIds);
            FragmentMerger merger = new FragmentMerger();
            for (Path fragment : fragments) {
                merger.merge(document, BeastXmlReader.parse(fragment), options);
            }
        }
    }

    @Command(name = "remove", description = "Remove the elements described by a removal template.")
    static class Remove extends DocumentCommand {

        @Option(names = "--template", required = true, paramLabel = "<file>")
        Path template;

        @Override
        protected void apply(BeastDocument document) throws IOException {
            new FragmentRemover().remove(document, BeastXmlReader.parse(template));
        }
    }
}
