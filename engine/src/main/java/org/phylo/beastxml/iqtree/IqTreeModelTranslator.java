package org.phylo.beastxml.iqtree;

import org.phylo.beastxml.model.FrequencyMode;
import org.phylo.beastxml.model.SubstitutionModelFamily;
import org.phylo.beastxml.model.SubstitutionModelSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Translates IQ-TREE model strings into {@link SubstitutionModelSpec}s.
 *
 * Supported syntax: {@code NAME[e|u](+F|+FQ|+FO)?(+G[n]|+R[n])?(+I)?}, modifiers
 * in any order. A name's trailing {@code e} or {@code u} fixes the frequency
 * class; without one the family decides. Models with unequal frequencies use
 * empirical frequencies unless a {@code +F} modifier says otherwise, as IQ-TREE does.
 * FreeRate ({@code +R}) is not available in BEAST and is approximated by a gamma
 * with the same number of categories.
 */
public final class IqTreeModelTranslator {

    private static final Logger LOGGER = LoggerFactory.getLogger(IqTreeModelTranslator.class);

    private static final Map<String, SubstitutionModelFamily> ALIASES = Map.of(
            "JC", SubstitutionModelFamily.JC69,
            "K2P", SubstitutionModelFamily.K80,
            "HKY85", SubstitutionModelFamily.HKY,
            "TN", SubstitutionModelFamily.TN93,
            "K81", SubstitutionModelFamily.K3P);

    private static final int DEFAULT_RATE_CATEGORIES = 4;

    private IqTreeModelTranslator() {
        // Static utility class
    }

    /**
     * @throws IllegalArgumentException for an unknown model, unknown modifier or
     *                                  contradicting frequency settings
     */
    public static SubstitutionModelSpec translate(String modelString) {
        if (modelString == null || modelString.isBlank()) {
            throw new IllegalArgumentException("Model string cannot be empty");
        }
        String[] components = modelString.trim().split("\\+");
        String baseName = components[0].trim();

        Boolean equalClass = null;
        Optional<SubstitutionModelFamily> family = family(baseName);
        if (family.isEmpty() && baseName.length() > 1) {
            char suffix = baseName.charAt(baseName.length() - 1);
            String stripped = baseName.substring(0, baseName.length() - 1);
            if (suffix == 'e' || suffix == 'u') {
                family = family(stripped);
                equalClass = suffix == 'e';
            }
        }
        SubstitutionModelFamily resolved = family
                .orElseThrow(() -> new IllegalArgumentException("Unrecognized model: " + baseName));
        boolean equalFrequencies = equalClass != null ? equalClass : resolved.equalFrequencies();

        FrequencyMode frequencies = null;
        Integer gamma = null;
        boolean invariant = false;
        for (int i = 1; i < components.length; i++) {
            String modifier = components[i].trim();
            if (modifier.startsWith("F")) {
                if (frequencies != null) {
                    throw new IllegalArgumentException("Conflicting frequency modifiers in '" + modelString + "'");
                }
                frequencies = frequencyMode(modifier);
            } else if (modifier.startsWith("G") || modifier.startsWith("R")) {
                gamma = rateCategories(modifier, modelString);
            } else if (modifier.equals("I")) {
                invariant = true;
            } else {
                throw new IllegalArgumentException("Unrecognized model modifier '" + modifier + "' in '"
                        + modelString + "'");
            }
        }

        if (frequencies == null) {
            frequencies = equalFrequencies ? FrequencyMode.EQUAL : FrequencyMode.EMPIRICAL;
        } else if (equalFrequencies && frequencies != FrequencyMode.EQUAL) {
            throw new IllegalArgumentException("Model name implies equal frequencies, but frequencies are not "
                    + "equal in '" + modelString + "'");
        } else if (!equalFrequencies && frequencies == FrequencyMode.EQUAL) {
            throw new IllegalArgumentException("Model name implies unequal frequencies, but frequencies are "
                    + "equal in '" + modelString + "'");
        }
        return new SubstitutionModelSpec(resolved, frequencies, gamma, invariant);
    }

    private static Optional<SubstitutionModelFamily> family(String name) {
        SubstitutionModelFamily alias = ALIASES.get(name);
        return alias != null ? Optional.of(alias) : SubstitutionModelFamily.fromName(name);
    }

    private static FrequencyMode frequencyMode(String modifier) {
        switch (modifier) {
            case "F":
                return FrequencyMode.EMPIRICAL;
            case "FQ":
                return FrequencyMode.EQUAL;
            case "FO":
                return FrequencyMode.ESTIMATED;
            default:
                throw new IllegalArgumentException("Unrecognized frequency modifier: " + modifier);
        }
    }

    private static int rateCategories(String modifier, String modelString) {
        if (modifier.startsWith("R")) {
            LOGGER.warn("Model '{}' uses FreeRate heterogeneity, which BEAST does not support; "
                    + "using gamma-distributed rates instead", modelString);
        }
        String count = modifier.substring(1);
        if (count.isEmpty()) {
            return DEFAULT_RATE_CATEGORIES;
        }
        try {
            int categories = Integer.parseInt(count);
            if (categories < 1) {
                throw new IllegalArgumentException("Rate categories must be positive in '" + modelString + "'");
            }
            return categories;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unrecognized rate variation modifier: " + modifier, e);
        }
    }
}
