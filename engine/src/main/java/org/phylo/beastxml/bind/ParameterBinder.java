package org.phylo.beastxml.bind;

import org.phylo.beastxml.edit.EditException;
import org.phylo.beastxml.edit.MarkovJumpEditor;
import org.phylo.beastxml.edit.Placement;
import org.phylo.beastxml.edit.TaxonEditor;
import org.phylo.beastxml.edit.TaxonOptions;
import org.phylo.beastxml.edit.TraitEditor;
import org.phylo.beastxml.merge.FragmentMerger;
import org.phylo.beastxml.merge.MergeOptions;
import org.phylo.beastxml.model.FrequencyMode;
import org.phylo.beastxml.model.ModelSelector;
import org.phylo.beastxml.model.SubstitutionModelSpec;
import org.phylo.beastxml.xml.BeastDocument;
import org.phylo.beastxml.xml.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Binds a skeleton document to a dataset.
 *
 * <p>Every quantity that depends on the dataset's shape is rewritten from the
 * {@link BindingContext}: the taxon set and dates, one alignment and one
 * patterns block per partition, one {@code <partition>} per partition in the
 * tree likelihood, one model clone per partition (identifiers prefixed with the
 * partition name, so {@code gtr.ac} becomes {@code gene1.gtr.ac}), relative
 * rates across partitions, and the state-dependent dimensions of discrete traits.
 *
 * <p>The document-level skeleton (operators, mcmc, joint, prior, likelihood,
 * logs) is never duplicated; partition clones add children to it. The document
 * must be discarded if binding fails.
 */
public final class ParameterBinder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ParameterBinder.class);

    private static final String PATTERNS = "patterns";
    private static final String PARTITION = "partition";
    private static final String SITE_MODEL = "siteModel";
    private static final String TREE_DATA_LIKELIHOOD = "treeDataLikelihood";
    private static final String ALL_NUS = "allNus";

    private final ModelSelector selector;
    private final FragmentMerger merger;

    public ParameterBinder(ModelSelector selector, FragmentMerger merger) {
        this.selector = Objects.requireNonNull(selector, "Model selector cannot be null");
        this.merger = Objects.requireNonNull(merger, "Fragment merger cannot be null");
    }

    public ParameterBinder() {
        this(new ModelSelector(), new FragmentMerger());
    }

    public BeastDocument bind(BeastDocument document, BindingContext context) {
        return bind(document, context, BindOptions.defaults());
    }

    /**
     * Binds {@code document} in place.
     *
     * @return The document, for chaining
     * @throws UnmappedPartitionException if a partition has no usable model
     * @throws BindingException if the context does not fit the document
     * @throws org.phylo.beastxml.BeastAssemblyException for merge and reference errors
     */
    public BeastDocument bind(BeastDocument document, BindingContext context, BindOptions options) {
        // Fail on unmapped partitions and unlinkable frequencies before anything is changed
        PartitionBinding first = null;
        FrequencyMode firstMode = null;
        for (PartitionBinding partition : context.partitions()) {
            FrequencyMode mode = resolveModel(partition).frequencies();
            if (first == null) {
                first = partition;
                firstMode = mode;
            } else if (options.frequencyLinkage() == FrequencyLinkage.SHARED && mode != firstMode) {
                throw new BindingException("Shared frequencies need one frequency mode, but partition '"
                        + first.name() + "' uses " + firstMode.label() + " and '" + partition.name()
                        + "' uses " + mode.label());
            }
        }

        try {
            bindTaxa(document, context, options);
            bindAlignments(document, context, options);
            bindPatterns(document, context);
            bindModels(document, context, options);
            bindPartitions(document, context, options);
            if (options.relativeRates() && context.partitions().size() > 1) {
                bindRelativeRates(document, context);
            }
            bindTraits(document, context, options);
        } catch (EditException e) {
            throw new BindingException(e.getMessage(), e);
        }

        document.validate();
        LOGGER.debug("Bound '{}' to {} partitions, {} taxa and {} traits", document.name(),
                context.partitions().size(), context.taxa().size(), context.traits().size());
        return document;
    }

    // ========== TAXA AND DATA ==========

    private static void bindTaxa(BeastDocument document, BindingContext context, BindOptions options) {
        TaxonOptions taxonOptions = taxonOptions(options, PartitionBinding.NUCLEOTIDE);
        Element taxa = TaxonEditor.taxa(document, options.taxaId());
        document.detachChildren(taxa);
        for (TaxonBinding taxon : context.taxa()) {
            TaxonEditor.addTaxonBlock(document, taxon.id(), taxon.date(), taxonOptions);
        }
    }

    private static void bindAlignments(BeastDocument document, BindingContext context, BindOptions options) {
        for (TaxonBinding taxon : context.taxa()) {
            for (String partition : taxon.sequences().keySet()) {
                if (context.partition(partition).isEmpty()) {
                    throw new BindingException("Taxon '" + taxon.id() + "' has a sequence for unknown partition '"
                            + partition + "'");
                }
            }
        }

        for (PartitionBinding partition : context.partitions()) {
            TaxonOptions taxonOptions = taxonOptions(options, partition.dataType());
            Element alignment = TaxonEditor.getOrCreateAlignment(document, partition.name(), taxonOptions);
            document.detachChildren(alignment);
            alignment.setAttribute("dataType", partition.dataType());
            alignment.setAttribute("missing", options.missing());

            for (TaxonBinding taxon : context.taxa()) {
                String sequence = taxon.sequences().get(partition.name());
                if (sequence == null) {
                    LOGGER.debug("Taxon '{}' has no data for '{}', padding", taxon.id(), partition.name());
                    sequence = TaxonEditor.unknownSequence(partition.dataType(), partition.length());
                } else if (sequence.length() != partition.length()) {
                    throw new BindingException("Sequence of taxon '" + taxon.id() + "' for partition '"
                            + partition.name() + "' has length " + sequence.length() + ", expected "
                            + partition.length());
                }
                TaxonEditor.addSequence(document, partition.name(), taxon.id(), sequence, taxonOptions);
            }
        }
    }

    private static void bindPatterns(BeastDocument document, BindingContext context) {
        for (PartitionBinding partition : context.partitions()) {
            String id = patternsId(partition);
            if (document.declares(id)) {
                continue;
            }
            Element patterns = new Element(PATTERNS)
                    .setAttribute(Element.ID, id)
                    .setAttribute("from", "1")
                    .setAttribute("strip", "false");
            patterns.append(Element.reference(TaxonEditor.ALIGNMENT, partition.name()));
            Placement.insertAfterLast(document, patterns, PATTERNS, TaxonEditor.ALIGNMENT);
        }
    }

    // ========== MODELS ==========

    private SubstitutionModelSpec resolveModel(PartitionBinding partition) {
        if (!PartitionBinding.NUCLEOTIDE.equals(partition.dataType())) {
            throw new UnmappedPartitionException(partition.name(),
                    "no model templates for data type '" + partition.dataType() + "'");
        }
        if (partition.model() == null) {
            throw new UnmappedPartitionException(partition.name(), "no model given");
        }
        return selector.resolve(partition.model())
                .orElseThrow(() -> new UnmappedPartitionException(partition.name(),
                        "'" + partition.model() + "' is not in the model catalogue"));
    }

    private void bindModels(BeastDocument document, BindingContext context, BindOptions options) {
        Set<String> shared = options.frequencyLinkage() == FrequencyLinkage.SHARED
                ? Set.of(ModelSelector.FREQUENCIES_ID)
                : Set.of();
        for (PartitionBinding partition : context.partitions()) {
            SubstitutionModelSpec spec = resolveModel(partition);
            MergeOptions mergeOptions = MergeOptions.defaults()
                    .withCollisionPolicy(options.collisionPolicy())
                    .withIsolationPrefix(partition.name())
                    .withProtectedIds(shared);
            for (BeastDocument fragment : selector.select(spec, partition.name())) {
                merger.merge(document, fragment, mergeOptions);
            }
            LOGGER.debug("Partition '{}' uses {}", partition.name(), spec);
            siteModel(document, partition);
        }
    }

    private static void bindPartitions(BeastDocument document, BindingContext context, BindOptions options) {
        Element likelihood = document.find(options.treeLikelihoodId())
                .filter(e -> TREE_DATA_LIKELIHOOD.equals(e.tag()))
                .orElseThrow(() -> new BindingException("No <" + TREE_DATA_LIKELIHOOD + "> with id '"
                        + options.treeLikelihoodId() + "' found"));

        List<Element> existing = likelihood.children(PARTITION);
        int index = existing.isEmpty() ? 0 : likelihood.indexOf(existing.get(existing.size() - 1)) + 1;
        for (PartitionBinding partition : context.partitions()) {
            if (hasPartition(likelihood, patternsId(partition))) {
                continue;
            }
            Element block = new Element(PARTITION);
            block.append(Element.reference(PATTERNS, patternsId(partition)));
            block.append(Element.reference(SITE_MODEL, siteModelId(partition)));
            document.attach(likelihood, index++, block);
        }
        Placement.moveAfterDependencies(document, Placement.topLevelAncestor(likelihood));
    }

    private static boolean hasPartition(Element likelihood, String patternsId) {
        for (Element partition : likelihood.children(PARTITION)) {
            if (partition.first(PATTERNS, Element.IDREF, patternsId).isPresent()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Switches every partition from a free {@code mu} to a share {@code nu} of
     * the overall rate. The {@code nu}s sum to one, and each relative rate is
     * weighted by total length over partition length so the length-weighted mean
     * rate stays one.
     */
    private static void bindRelativeRates(BeastDocument document, BindingContext context) {
        int total = context.totalLength();
        Element compound = new Element("compoundParameter").setAttribute(Element.ID, ALL_NUS);

        for (PartitionBinding partition : context.partitions()) {
            String muId = partition.name() + ".mu";
            String nuId = partition.name() + ".nu";
            Element mu = document.find(muId)
                    .orElseThrow(() -> new BindingException("Site model of partition '" + partition.name()
                            + "' has no relative rate '" + muId + "'"));
            document.rename(muId, nuId);
            mu.setAttribute("value", String.valueOf((double) partition.length() / total));
            mu.setAttribute("lower", "0.0");
            mu.setAttribute("upper", "1.0");
            mu.parent().setAttribute("weight", String.valueOf((double) total / partition.length()));

            Element statistic = new Element("statistic")
                    .setAttribute(Element.ID, muId)
                    .setAttribute("name", "mu");
            statistic.append(Element.reference(SITE_MODEL, siteModelId(partition)));
            document.attachAfter(siteModel(document, partition), statistic);
            compound.append(Element.reference("parameter", nuId));

            Element log = fileLog(document);
            document.attach(log, Element.reference("statistic", muId));
            document.attach(log, Element.reference("parameter", nuId));
        }

        Element operators = container(document, "operators");
        document.attach(document.root(), document.root().indexOf(operators), compound);

        Element exchange = new Element("deltaExchange").setAttribute("delta", "0.01").setAttribute("weight", "3");
        exchange.append(Element.reference("parameter", ALL_NUS));
        document.attach(operators, exchange);

        Element dirichlet = new Element("dirichletPrior").setAttribute("alpha", "1.0").setAttribute("sumsTo", "1.0");
        dirichlet.append(Element.reference("parameter", ALL_NUS));
        document.attach(container(document, "prior"), dirichlet);
        LOGGER.debug("Relative rates over {} partitions", context.partitions().size());
    }

    // ========== TRAITS ==========

    private static void bindTraits(BeastDocument document, BindingContext context, BindOptions options) {
        for (TraitBinding trait : context.traits()) {
            if (trait.kind() == TraitKind.DISCRETE) {
                document.find(TraitEditor.dataTypeId(trait.name()))
                        .ifPresent(dataType -> dataType.children("state").forEach(document::detach));
            }
        }

        for (TaxonBinding taxon : context.taxa()) {
            for (Map.Entry<String, String> attribute : taxon.attributes().entrySet()) {
                boolean discrete = context.traits().stream()
                        .anyMatch(t -> t.name().equals(attribute.getKey()) && t.kind() == TraitKind.DISCRETE);
                if (discrete) {
                    TraitEditor.setDiscreteAttribute(document, taxon.id(), attribute.getKey(), attribute.getValue(),
                            options.taxaId());
                } else {
                    TraitEditor.setAttribute(document, taxon.id(), attribute.getKey(), attribute.getValue());
                }
            }
        }

        for (TraitBinding trait : context.traits()) {
            if (trait.kind() == TraitKind.DISCRETE && document.declares(TraitEditor.dataTypeId(trait.name()))) {
                TraitEditor.updateDimensions(document, trait.name());
                MarkovJumpEditor.refresh(document, trait.name());
            }
        }
    }

    // ========== LOOKUP ==========

    private static String patternsId(PartitionBinding partition) {
        return partition.name() + "." + PATTERNS;
    }

    private static String siteModelId(PartitionBinding partition) {
        return partition.name() + "." + SITE_MODEL;
    }

    private static Element siteModel(BeastDocument document, PartitionBinding partition) {
        return document.find(siteModelId(partition))
                .filter(e -> SITE_MODEL.equals(e.tag()))
                .orElseThrow(() -> new BindingException("Model of partition '" + partition.name()
                        + "' declares no <" + SITE_MODEL + ">"));
    }

    private static Element fileLog(BeastDocument document) {
        return document.find("fileLog")
                .filter(e -> "log".equals(e.tag()))
                .orElseGet(() -> container(document, "log"));
    }

    private static Element container(BeastDocument document, String tag) {
        if (document.root().first(tag).isPresent()) {
            return document.root().first(tag).get();
        }
        List<Element> nested = document.root().descendants(tag);
        if (nested.isEmpty()) {
            throw new BindingException("Document '" + document.name() + "' has no <" + tag + "> block");
        }
        return nested.get(0);
    }

    private static TaxonOptions taxonOptions(BindOptions options, String dataType) {
        return new TaxonOptions(options.taxaId(), options.missing(), dataType, options.dateDirection(),
                options.dateUnits());
    }
}
