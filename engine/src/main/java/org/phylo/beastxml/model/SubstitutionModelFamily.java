package org.phylo.beastxml.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The closed catalogue of nucleotide model families with a bundled template.
 *
 * Families whose definition implies equal base frequencies (JC69, K80, K3P, SYM)
 * are marked so model-name translation can reject contradicting modifiers.
 */
public enum SubstitutionModelFamily {
    JC69("jc69", true),
    F81("f81", false),
    K80("k80", true),
    HKY("hky", false),
    TN93("tn93", false),
    K3P("k3p", true),
    TIM("tim", false),
    TVM("tvm", false),
    SYM("sym", true),
    GTR("gtr", false);

    private final String templateName;
    private final boolean equalFrequencies;

    SubstitutionModelFamily(String templateName, boolean equalFrequencies) {
        this.templateName = templateName;
        this.equalFrequencies = equalFrequencies;
    }

    /**
     * @return Template path relative to the library root, e.g. {@code models/gtr.xml}
     */
    public String templatePath() {
        return "models/" + templateName + ".xml";
    }

    public boolean equalFrequencies() {
        return equalFrequencies;
    }

    public static Optional<SubstitutionModelFamily> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
