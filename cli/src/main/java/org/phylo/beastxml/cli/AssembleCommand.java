package org.phylo.beastxml.cli;

import org.phylo.beastxml.bind.BindOptions;
import org.phylo.beastxml.bind.BindingContext;
import org.phylo.beastxml.bind.BindingContextReader;
import org.phylo.beastxml.bind.FrequencyLinkage;
import org.phylo.beastxml.bind.ParameterBinder;
import org.phylo.beastxml.edit.RunSettingsEditor;
import org.phylo.beastxml.edit.StartingTreeEditor;
import org.phylo.beastxml.iqtree.IqTreeScheme;
import org.phylo.beastxml.iqtree.IqTreeSchemeReader;
import org.phylo.beastxml.merge.CollisionPolicy;
import org.phylo.beastxml.merge.FragmentMerger;
import org.phylo.beastxml.model.ModelSelector;
import org.phylo.beastxml.model.TemplateLibrary;
import org.phylo.beastxml.xml.BeastDocument;
import org.phylo.beastxml.xml.BeastXmlReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import picocli.CommandLine.TypeConversionException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Binds a skeleton document to a dataset: taxa, alignments, one substitution
 * model per partition, then run settings.
 */
@Command(
        name = "assemble",
        mixinStandardHelpOptions = true,
        description = "Assemble a BEAST XML document from a skeleton, a data manifest and model templates.")
class AssembleCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(AssembleCommand.class);

    @Spec
    CommandSpec spec;

    @Option(names = "--skeleton", required = true, paramLabel = "<file>",
            description = "Skeleton document holding the tree, clock, operators and mcmc blocks")
    Path skeleton;

    @Option(names = "--manifest", required = true, paramLabel = "<file>",
            description = "JSON manifest with partitions, taxa, dates and traits")
    Path manifest;

    @Option(names = "--scheme", paramLabel = "<file>",
            description = "IQ-TREE best_scheme.nex giving partitions and models")
    Path scheme;

    @Option(names = "--frequencies", paramLabel = "<linkage>", defaultValue = "per-partition",
            converter = LinkageConverter.class,
            description = "Base frequencies shared by all partitions or one set per partition: "
                    + "shared, per-partition (default: ${DEFAULT-VALUE})")
    FrequencyLinkage frequencies;

    @Option(names = "--relative-rates", negatable = true, defaultValue = "true", fallbackValue = "true",
            description = "Give partitions relative rates (default: ${DEFAULT-VALUE})")
    boolean relativeRates;

    @Option(names = "--collision", paramLabel = "<policy>", defaultValue = "RENAME_INCOMING",
            description = "Which side is renamed when ids collide: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    CollisionPolicy collision;

    @Option(names = "--templates", paramLabel = "<dir>",
            description = "Template directory overriding the bundled templates (env: BEASTXML_TEMPLATES)")
    Path templates;

    @Option(names = "--run-length", paramLabel = "<steps>", description = "MCMC chain length")
    Long runLength;

    @Option(names = "--samples", paramLabel = "<n>", defaultValue = "10000",
            description = "Samples logged over the chain (default: ${DEFAULT-VALUE})")
    long samples;

    @Option(names = "--output-stem", paramLabel = "<stem>", description = "Stem of every output file name")
    String outputStem;

    @ArgGroup(exclusive = true)
    StartingTree startingTree;

    @Option(names = {"-o", "--output"}, paramLabel = "<file>",
            description = "Output file (default: standard output)")
    Path output;

    Map<String, String> environment = System.getenv();

    static class StartingTree {
        @Option(names = "--upgma", description = "Start from a UPGMA tree of the first alignment")
        boolean upgma;

        @Option(names = "--newick", paramLabel = "<file>", description = "Start from the Newick tree in this file")
        Path newick;
    }

    @Override
    public Integer call() throws IOException {
        BeastDocument document = BeastXmlReader.parse(skeleton);
        IqTreeScheme partitions = scheme == null ? null : IqTreeSchemeReader.read(scheme);
        BindingContext context = BindingContextReader.read(manifest, partitions);

        TemplateLibrary library = TemplateSource.resolve(templates, environment);
        LOGGER.debug("Using {}", library);
        ParameterBinder binder = new ParameterBinder(new ModelSelector(library), new FragmentMerger());
        binder.bind(document, context, bindOptions());

        if (runLength != null) {
            RunSettingsEditor.setRunLength(document, runLength, samples);
        }
        if (outputStem != null) {
            RunSettingsEditor.setOutputStem(document, outputStem);
        }
        if (startingTree != null && startingTree.upgma) {
            StartingTreeEditor.useUpgma(document);
        } else if (startingTree != null && startingTree.newick != null) {
            StartingTreeEditor.useNewick(document, Files.readString(startingTree.newick, StandardCharsets.UTF_8));
        }
        document.validate();

        DocumentCommand.write(document, output, spec.commandLine().getOut());
        return 0;
    }

    BindOptions bindOptions() {
        return BindOptions.defaults()
                .withFrequencyLinkage(frequencies)
                .withRelativeRates(relativeRates)
                .withCollisionPolicy(collision);
    }

    /**
     * Reads the lower-case linkage names; anything else is a usage error.
     */
    static class LinkageConverter implements ITypeConverter<FrequencyLinkage> {
        @Override
        public FrequencyLinkage convert(String value) {
            return switch (value) {
                case "shared" -> FrequencyLinkage.SHARED;
                case "per-partition" -> FrequencyLinkage.PER_PARTITION;
                default -> throw new TypeConversionException("expected 'shared' or 'per-partition' but was '"
                        + value + "'");
            };
        }
    }
}
