package org.phylo.beastxml.edit;

import org.phylo.beastxml.xml.BeastDocument;
import org.phylo.beastxml.xml.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Taxon attributes and the discrete-trait blocks built from them.
 *
 * For a discrete trait {@code location} the document holds:
 * <ul>
 *   <li>{@code <attr name="location">UK</attr>} inside each taxon</li>
 *   <li>{@code <generalDataType id="location.dataType">} with one {@code <state code>} per observed value</li>
 *   <li>{@code <attributePatterns id="location.pattern" attribute="location">}</li>
 *   <li>dimension-bearing parameters {@code location.frequencies}, {@code location.rates}
 *       and {@code location.indicators}, re-derived by {@link #updateDimensions}</li>
 * </ul>
 */
public final class TraitEditor {

    private static final Logger LOGGER = LoggerFactory.getLogger(TraitEditor.class);

    private static final String ATTR = "attr";
    private static final String GENERAL_DATA_TYPE = "generalDataType";
    private static final String ATTRIBUTE_PATTERNS = "attributePatterns";
    private static final String STATE = "state";

    private TraitEditor() {
        // Static utility class
    }

    public static String dataTypeId(String trait) {
        return trait + ".dataType";
    }

    public static String patternId(String trait) {
        return trait + ".pattern";
    }

    /**
     * Adds or replaces a taxon's attribute value. Nothing else changes, which is
     * what a continuous trait needs.
     */
    public static void setAttribute(BeastDocument document, String taxonId, String trait, String value) {
        Element taxon = document.find(taxonId)
                .filter(e -> TaxonEditor.TAXON.equals(e.tag()))
                .orElseThrow(() -> new EditException("Taxon '" + taxonId + "' not found in <taxa> block"));
        Optional<Element> existing = taxon.first(ATTR, "name", trait);
        if (existing.isPresent()) {
            existing.get().setText(value);
        } else {
            document.attach(taxon, new Element(ATTR).setAttribute("name", trait).setText(value));
        }
    }

    /**
     * Sets a discrete attribute value and records it as a state of the trait's data type.
     */
    public static void setDiscreteAttribute(BeastDocument document, String taxonId, String trait, String value,
                                            String taxaId) {
        setAttribute(document, taxonId, trait, value);
        Element dataType = document.findTopLevel(GENERAL_DATA_TYPE, dataTypeId(trait))
                .orElseGet(() -> addDataType(document, trait, taxaId));
        if (dataType.first(STATE, "code", value).isEmpty()) {
            dataType.append(new Element(STATE).setAttribute("code", value));
        }
    }

    /**
     * Adds an empty {@code <generalDataType>} and its {@code <attributePatterns>}
     * after the last patterns block.
     */
    public static Element addDataType(BeastDocument document, String trait, String taxaId) {
        Element dataType = new Element(GENERAL_DATA_TYPE).setAttribute(Element.ID, dataTypeId(trait));
        Placement.insertAfterLast(document, dataType, "patterns", TaxonEditor.ALIGNMENT, TaxonEditor.TAXA);

        Element patterns = new Element(ATTRIBUTE_PATTERNS)
                .setAttribute(Element.ID, patternId(trait))
                .setAttribute("attribute", trait);
        patterns.append(Element.reference(TaxonEditor.TAXA, taxaId));
        patterns.append(Element.reference(GENERAL_DATA_TYPE, dataTypeId(trait)));
        document.attachAfter(dataType, patterns);
        LOGGER.debug("Added data type for trait '{}'", trait);
        return dataType;
    }

    /**
     * @return State codes of a discrete trait, in document order
     */
    public static List<String> states(BeastDocument document, String trait) {
        Element dataType = document.findTopLevel(GENERAL_DATA_TYPE, dataTypeId(trait))
                .orElseThrow(() -> new EditException("No <generalDataType> for trait '" + trait + "' found"));
        List<String> states = new ArrayList<>();
        for (Element state : dataType.children(STATE)) {
            states.add(state.attribute("code"));
        }
        return Collections.unmodifiableList(states);
    }

    /**
     * Rewrites the dimension of the trait's frequency, rate and indicator
     * parameters to match the number of states. Parameters that are absent are skipped.
     *
     * @return Number of states
     */
    public static int updateDimensions(BeastDocument document, String trait) {
        int states = states(document, trait).size();
        for (String id : List.of(trait + ".frequencies", trait + ".root.frequencies")) {
            document.find(id).ifPresent(p -> setDimension(p, states));
        }
        for (String id : List.of(trait + ".rates", trait + ".indicators")) {
            document.find(id).ifPresent(p -> {
                int pairs = states * (states - 1);
                setDimension(p, isSymmetric(p) ? pairs / 2 : pairs);
            });
        }
        LOGGER.debug("Trait '{}' has {} states", trait, states);
        return states;
    }

    private static boolean isSymmetric(Element parameter) {
        for (Element e = parameter.parent(); e != null; e = e.parent()) {
            if ("false".equals(e.attribute("symmetric")) || "complexSubstitutionModel".equals(e.tag())) {
                return false;
            }
        }
        return true;
    }

    static void setDimension(Element parameter, int dimension) {
        parameter.setAttribute("dimension", String.valueOf(dimension));
        String value = parameter.attribute("value");
        if (value == null) {
            return;
        }
        String[] values = value.trim().split("\\s+");
        if (values.length > 1 && values.length != dimension) {
            String[] resized = new String[dimension];
            Arrays.fill(resized, values[0]);
            parameter.setAttribute("value", String.join(" ", resized));
        }
    }
}
