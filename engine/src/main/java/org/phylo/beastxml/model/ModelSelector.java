package org.phylo.beastxml.model;

import org.phylo.beastxml.iqtree.IqTreeModelTranslator;
import org.phylo.beastxml.merge.StructuralMismatchException;
import org.phylo.beastxml.xml.BeastDocument;
import org.phylo.beastxml.xml.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Chooses the template fragments that make up a substitution model.
 *
 * The result is always ordered base model first, then the companions
 * (estimated frequencies, gamma, invariant sites). Equal-rate groupings live
 * inside the family templates as shared references, so nothing here is
 * family specific.
 */
public final class ModelSelector {

    private static final Logger LOGGER = LoggerFactory.getLogger(ModelSelector.class);

    public static final String ESTIMATED_FREQUENCIES = "modifiers/estimated_frequencies.xml";
    public static final String GAMMA = "modifiers/gamma.xml";
    public static final String PROPORTION_INVARIANT = "modifiers/proportion_invariant.xml";

    public static final String FREQUENCIES_ID = "frequencies";

    private static final String UNIFORM_FREQUENCIES = "0.25 0.25 0.25 0.25";
    private static final int DEFAULT_GAMMA_CATEGORIES = 4;
    private static final int NUCLEOTIDE_STATES = 4;

    private final TemplateLibrary library;

    public ModelSelector(TemplateLibrary library) {
        this.library = Objects.requireNonNull(library, "Template library cannot be null");
    }

    public ModelSelector() {
        this(TemplateLibrary.bundled());
    }

    public TemplateLibrary library() {
        return library;
    }

    /**
     * Translates an IQ-TREE style model name, e.g. {@code GTR+F+G4}.
     *
     * @return The model, or empty if the name is not in the catalogue
     */
    public Optional<SubstitutionModelSpec> resolve(String modelName) {
        try {
            return Optional.of(IqTreeModelTranslator.translate(modelName));
        } catch (IllegalArgumentException e) {
            LOGGER.debug("Model '{}' not in catalogue: {}", modelName, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @throws IllegalArgumentException if the name is not in the catalogue
     */
    public List<BeastDocument> select(String modelName, String alignmentId) {
        return select(IqTreeModelTranslator.translate(modelName), alignmentId);
    }

    /**
     * Loads fresh fragments for {@code spec}.
     *
     * @param spec        The model to build
     * @param alignmentId Alignment the empirical frequencies are computed from;
     *                    required only for {@link FrequencyMode#EMPIRICAL}
     * @return Base fragment followed by its companions, in merge order
     */
    public List<BeastDocument> select(SubstitutionModelSpec spec, String alignmentId) {
        List<BeastDocument> fragments = new ArrayList<>();

        BeastDocument base = library.load(spec.family().templatePath());
        applyFrequencies(base, spec.frequencies(), alignmentId);
        fragments.add(base);

        if (spec.frequencies() == FrequencyMode.ESTIMATED) {
            fragments.add(library.load(ESTIMATED_FREQUENCIES));
        }
        if (spec.hasGamma()) {
            BeastDocument gamma = library.load(GAMMA);
            if (spec.gammaCategories() != DEFAULT_GAMMA_CATEGORIES) {
                for (Element shape : gamma.root().descendants("gammaShape")) {
                    shape.setAttribute("gammaCategories", String.valueOf(spec.gammaCategories()));
                }
            }
            fragments.add(gamma);
        }
        if (spec.proportionInvariant()) {
            fragments.add(library.load(PROPORTION_INVARIANT));
        }

        LOGGER.debug("Selected {} fragments for {}", fragments.size(), spec);
        return fragments;
    }

    private void applyFrequencies(BeastDocument base, FrequencyMode mode, String alignmentId) {
        Element parameter = base.find(FREQUENCIES_ID)
                .orElseThrow(() -> new StructuralMismatchException(
                        "Model template declares no '" + FREQUENCIES_ID + "' parameter", base.name()));
        Element frequencyModel = parameter.parent().parent();
        if (frequencyModel == null || !"frequencyModel".equals(frequencyModel.tag())) {
            throw new StructuralMismatchException("'" + FREQUENCIES_ID + "' is not inside a <frequencyModel>",
                    parameter.path());
        }

        for (Element alignment : frequencyModel.children("alignment")) {
            base.detach(alignment);
        }
        if (mode == FrequencyMode.EMPIRICAL) {
            if (alignmentId == null) {
                throw new IllegalArgumentException("Empirical frequencies need an alignment id");
            }
            parameter.removeAttribute("value");
            parameter.setAttribute("dimension", String.valueOf(NUCLEOTIDE_STATES));
            base.attach(frequencyModel, 0, Element.reference("alignment", alignmentId));
        } else {
            parameter.setAttribute("value", UNIFORM_FREQUENCIES);
            parameter.removeAttribute("dimension");
        }

        if (mode != FrequencyMode.ESTIMATED) {
            removeSamplers(base);
        }
    }

    /**
     * Removes operators and priors acting on the frequencies, which stay fixed.
     */
    private static void removeSamplers(BeastDocument base) {
        for (Element reference : base.registry().referencesTo(FREQUENCIES_ID)) {
            Element sampler = reference.parent();
            Element block = sampler == null ? null : sampler.parent();
            if (block != null && ("operators".equals(block.tag()) || "prior".equals(block.tag()))) {
                base.detach(sampler);
            }
        }
    }
}
