package org.phylo.beastxml.edit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.phylo.beastxml.Fixtures;
import org.phylo.beastxml.ids.DuplicateIdentifierException;
import org.phylo.beastxml.xml.BeastDocument;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaxonEditorTest {

    private final TaxonOptions options = TaxonOptions.defaults();
    private BeastDocument doc;

    @BeforeEach
    void setUp() {
        doc = Fixtures.fragment("taxa", """
                <taxa id="taxa"><taxon id="A"/></taxa>
                <alignment id="gene1" dataType="nucleotide" missing="-">
                    <sequence><taxon idref="A"/>ACGT</sequence>
                </alignment>
                <treeModel id="treeModel"/>
                """);
    }

    @Test
    void addsDatedTaxonWithSequence() {
        TaxonEditor.addTaxon(doc, "B", 2021.5, Map.of("gene1", "ACGA"), options);

        var taxon = doc.lookup("B");
        assertSame(doc.lookup("taxa"), taxon.parent());
        assertEquals("2021.5", taxon.first("date").orElseThrow().attribute("value"));
        var sequences = doc.lookup("gene1").children("sequence");
        assertEquals(2, sequences.size());
        assertEquals("ACGA", sequences.get(1).text());
        assertEquals("B", sequences.get(1).first("taxon").orElseThrow().idref());
        doc.validate();
    }

    @Test
    void wrongLengthIsRejectedBeforeAnythingChanges() {
        var e = assertThrows(EditException.class,
                () -> TaxonEditor.addTaxon(doc, "B", null, Map.of("gene1", "ACG"), options));

        assertTrue(e.getMessage().contains("Sequence length (3)"), e.getMessage());
        assertFalse(doc.declares("B"));
    }

    @Test
    void dataTypeMustMatchAlignment() {
        assertThrows(EditException.class, () -> TaxonEditor.addTaxon(doc, "B", null, Map.of("gene1", "MKVL"),
                options.withDataType("amino acid")));
    }

    @Test
    void newAlignmentGoesAfterExistingOnes() {
        TaxonEditor.addTaxon(doc, "B", null, Map.of("gene2", "ACGTAA"), options);

        var gene2 = doc.lookup("gene2");
        assertEquals(doc.root().indexOf(doc.lookup("gene1")) + 1, doc.root().indexOf(gene2));
        assertEquals("nucleotide", gene2.attribute("dataType"));
        assertEquals(6, TaxonEditor.sequenceLength(gene2));
    }

    @Test
    void unsampledTaxonIsPadded() {
        TaxonEditor.addUnsampledTaxon(doc, "B", 2020.0, options);

        var sequences = doc.lookup("gene1").children("sequence");
        assertEquals("NNNN", sequences.get(1).text());
    }

    @Test
    void unsampledTaxonNeedsAlignment() {
        var empty = Fixtures.fragment("empty", "<taxa id=\"taxa\"/>");
        assertThrows(EditException.class, () -> TaxonEditor.addUnsampledTaxon(empty, "B", null, options));
    }

    @Test
    void duplicateTaxonIsRejected() {
        assertThrows(DuplicateIdentifierException.class,
                () -> TaxonEditor.addTaxonBlock(doc, "A", null, options));
    }

    @Test
    void taxaBlockIsCreatedFirst() {
        var empty = Fixtures.fragment("empty", "<treeModel id=\"treeModel\"/>");

        var taxa = TaxonEditor.taxa(empty, "taxa");

        assertEquals(0, empty.root().indexOf(taxa));
        assertSame(taxa, TaxonEditor.taxa(empty, "taxa"));
    }

    @Test
    void unknownStatesDependOnDataType() {
        assertEquals("NNN", TaxonEditor.unknownSequence("nucleotide", 3));
        assertEquals("??", TaxonEditor.unknownSequence("amino acid", 2));
    }
}
