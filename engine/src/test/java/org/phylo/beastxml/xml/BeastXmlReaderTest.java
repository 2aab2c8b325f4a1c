package org.phylo.beastxml.xml;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.phylo.beastxml.Fixtures;
import org.phylo.beastxml.ids.DuplicateIdentifierException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for reading BEAST XML into element trees.
 */
class BeastXmlReaderTest {

    @Nested
    @DisplayName("Element trees")
    class TreeTests {

        @Test
        void readsAttributesInDocumentOrder() {
            var doc = BeastXmlReader.parse("test", """
                    <beast version="1.10.4">
                        <parameter id="kappa" value="2.0" lower="0.0"/>
                    </beast>
                    """);

            var kappa = doc.lookup("kappa");
            assertEquals("parameter", kappa.tag());
            assertEquals(List.of("id", "value", "lower"), List.copyOf(kappa.attributes().keySet()));
            assertEquals("1.10.4", doc.version());
        }

        @Test
        void keepsSequenceTextNextToTaxonReference() {
            var doc = BeastXmlReader.parse("test", """
                    <beast>
                        <alignment id="gene1">
                            <sequence>
                                <taxon idref="A"/>
                                ACGT
                            </sequence>
                        </alignment>
                    </beast>
                    """);

            var sequence = doc.lookup("gene1").first("sequence").orElseThrow();
            assertEquals("ACGT", sequence.text());
            assertEquals("A", sequence.first("taxon").orElseThrow().idref());
        }

        @Test
        void whitespaceOnlyTextIsDropped() {
            var doc = BeastXmlReader.parse("test", "<beast>\n  <taxa id=\"taxa\">\n  </taxa>\n</beast>");
            assertNull(doc.lookup("taxa").text());
        }

        @Test
        void registersEveryIdentifierAndReference() {
            var doc = Fixtures.skeleton();

            assertTrue(doc.declares("treeModel"));
            assertTrue(doc.declares("clock.rate"));
            assertEquals(5, doc.registry().referencesTo("treeModel").size());
        }
    }

    @Nested
    @DisplayName("Errors")
    class ErrorTests {

        @Test
        void malformedXmlReportsLocation() {
            var e = assertThrows(XmlParseException.class,
                    () -> BeastXmlReader.parse("broken.xml", "<beast>\n<taxa>\n</beast>"));
            assertTrue(e.hasLocation());
            assertEquals(3, e.getLine());
            assertTrue(e.getMessage().contains("broken.xml"));
        }

        @Test
        void doctypeIsRejected() {
            assertThrows(XmlParseException.class, () -> BeastXmlReader.parse("test",
                    "<?xml version=\"1.0\"?><!DOCTYPE beast [<!ENTITY x \"y\">]><beast/>"));
        }

        @Test
        void duplicateIdentifierIsRejected() {
            var e = assertThrows(DuplicateIdentifierException.class, () -> BeastXmlReader.parse("test",
                    "<beast><parameter id=\"mu\"/><parameter id=\"mu\"/></beast>"));
            assertEquals("mu", e.getIdentifier());
        }
    }
}
