package org.phylo.beastxml.edit;

import org.phylo.beastxml.xml.BeastDocument;
import org.phylo.beastxml.xml.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Adds taxa, sampling dates and sequences.
 *
 * A taxon is declared once in the {@code <taxa>} block and referenced from one
 * {@code <sequence>} per alignment:
 * <pre>
 * &lt;taxon id="A"&gt;&lt;date value="2019.25" direction="forwards" units="years"/&gt;&lt;/taxon&gt;
 * &lt;alignment id="gene1" dataType="nucleotide" missing="-"&gt;
 *     &lt;sequence&gt;&lt;taxon idref="A"/&gt;ACGT...&lt;/sequence&gt;
 * &lt;/alignment&gt;
 * </pre>
 */
public final class TaxonEditor {

    private static final Logger LOGGER = LoggerFactory.getLogger(TaxonEditor.class);

    public static final String TAXA = "taxa";
    public static final String TAXON = "taxon";
    public static final String ALIGNMENT = "alignment";
    public static final String SEQUENCE = "sequence";

    private static final char UNKNOWN_NUCLEOTIDE = 'N';
    private static final char UNKNOWN_STATE = '?';

    private TaxonEditor() {
        // Static utility class
    }

    /**
     * Adds a taxon with its sequences, creating alignments that do not exist yet.
     *
     * @param sequences Alignment id to sequence
     */
    public static void addTaxon(BeastDocument document, String taxonId, Double date, Map<String, String> sequences,
                                TaxonOptions options) {
        for (Map.Entry<String, String> entry : sequences.entrySet()) {
            alignment(document, entry.getKey(), options)
                    .ifPresent(a -> checkCompatible(a, entry.getValue(), options, taxonId));
        }
        addTaxonBlock(document, taxonId, date, options);
        for (Map.Entry<String, String> entry : sequences.entrySet()) {
            addSequence(document, entry.getKey(), taxonId, entry.getValue(), options);
        }
    }

    /**
     * Adds a taxon without data: every alignment gets an all-unknown sequence of
     * the alignment's length.
     *
     * @throws EditException if there is no alignment, or one without sequences
     */
    public static void addUnsampledTaxon(BeastDocument document, String taxonId, Double date, TaxonOptions options) {
        List<Element> alignments = document.topLevel(ALIGNMENT);
        if (alignments.isEmpty()) {
            throw new EditException("At least one <alignment> must be present to add an unsampled taxon");
        }
        Map<String, String> sequences = new LinkedHashMap<>();
        for (Element alignment : alignments) {
            int length = sequenceLength(alignment);
            if (length < 0) {
                throw new EditException("Alignment '" + alignment.id() + "' has no sequence to take the length from");
            }
            sequences.put(alignment.id(), unknownSequence(alignment.attribute("dataType"), length));
        }
        addTaxon(document, taxonId, date, sequences, options);
    }

    // ========== BUILDING BLOCKS ==========

    /**
     * @return The {@code <taxa>} block, created as the first element if missing
     */
    public static Element taxa(BeastDocument document, String taxaId) {
        Optional<Element> existing = document.findTopLevel(TAXA, taxaId);
        if (existing.isPresent()) {
            return existing.get();
        }
        Element taxa = new Element(TAXA);
        taxa.setAttribute(Element.ID, taxaId);
        return document.attach(document.root(), 0, taxa);
    }

    /**
     * @throws org.phylo.beastxml.ids.DuplicateIdentifierException if the id is already taken
     */
    public static Element addTaxonBlock(BeastDocument document, String taxonId, Double date, TaxonOptions options) {
        Element taxon = new Element(TAXON);
        taxon.setAttribute(Element.ID, taxonId);
        if (date != null) {
            Element dateElement = new Element("date");
            dateElement.setAttribute("value", String.valueOf(date));
            dateElement.setAttribute("direction", options.direction());
            dateElement.setAttribute("units", options.units());
            taxon.append(dateElement);
        }
        return document.attach(taxa(document, options.taxaId()), taxon);
    }

    public static Optional<Element> alignment(BeastDocument document, String alignmentId, TaxonOptions options) {
        return document.findTopLevel(ALIGNMENT, alignmentId);
    }

    /**
     * @return The alignment, created after the last alignment (or the taxa block) if missing
     */
    public static Element getOrCreateAlignment(BeastDocument document, String alignmentId, TaxonOptions options) {
        Optional<Element> existing = alignment(document, alignmentId, options);
        if (existing.isPresent()) {
            return existing.get();
        }
        Element alignment = new Element(ALIGNMENT);
        alignment.setAttribute(Element.ID, alignmentId);
        alignment.setAttribute("missing", options.missing());
        alignment.setAttribute("dataType", options.dataType());
        LOGGER.debug("Creating alignment '{}'", alignmentId);
        return Placement.insertAfterLast(document, alignment, ALIGNMENT, TAXA);
    }

    public static Element addSequence(BeastDocument document, String alignmentId, String taxonId, String sequence,
                                      TaxonOptions options) {
        Element alignment = getOrCreateAlignment(document, alignmentId, options);
        checkCompatible(alignment, sequence, options, taxonId);
        Element block = new Element(SEQUENCE);
        block.append(Element.reference(TAXON, taxonId));
        block.setText(sequence);
        return document.attach(alignment, block);
    }

    /**
     * @return Length of the alignment's first sequence, or -1 if it has none
     */
    public static int sequenceLength(Element alignment) {
        for (Element sequence : alignment.children(SEQUENCE)) {
            if (sequence.text() != null) {
                return sequence.text().length();
            }
        }
        return -1;
    }

    public static String unknownSequence(String dataType, int length) {
        char unknown = dataType == null || "nucleotide".equals(dataType) ? UNKNOWN_NUCLEOTIDE : UNKNOWN_STATE;
        return String.valueOf(unknown).repeat(length);
    }

    private static void checkCompatible(Element alignment, String sequence, TaxonOptions options, String taxonId) {
        String where = "does not match existing alignment '" + alignment.id() + "' (taxon: " + taxonId + ")";
        String missing = alignment.attribute("missing");
        if (missing != null && !missing.equals(options.missing())) {
            throw new EditException("Missing data character '" + options.missing() + "' " + where);
        }
        if (!Objects.equals(alignment.attribute("dataType"), options.dataType())) {
            throw new EditException("Sequence type '" + options.dataType() + "' " + where);
        }
        int length = sequenceLength(alignment);
        if (length >= 0 && length != sequence.length()) {
            throw new EditException("Sequence length (" + sequence.length() + ") " + where);
        }
    }
}
