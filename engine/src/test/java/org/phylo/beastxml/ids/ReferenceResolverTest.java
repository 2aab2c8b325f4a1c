package org.phylo.beastxml.ids;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.phylo.beastxml.Fixtures;
import org.phylo.beastxml.xml.BeastXmlWriter;
import org.phylo.beastxml.xml.Element;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceResolverTest {

    @Test
    @DisplayName("Rename onto a taken identifier leaves the document untouched")
    void failedRenameChangesNothing() {
        var doc = Fixtures.skeleton();
        var before = BeastXmlWriter.toXml(doc);

        assertThrows(DuplicateIdentifierException.class, () -> doc.resolver().rename("clock.rate", "constant.popSize"));

        assertEquals(before, BeastXmlWriter.toXml(doc));
        assertTrue(doc.declares("clock.rate"));
    }

    @Test
    @DisplayName("Rename of an unknown identifier fails")
    void renameUnknown() {
        var doc = Fixtures.skeleton();
        assertThrows(UnknownIdentifierException.class, () -> doc.resolver().rename("gtr.ac", "gene1.gtr.ac"));
    }

    @Test
    @DisplayName("Rename to the same identifier is a no-op")
    void renameToSelf() {
        var doc = Fixtures.skeleton();
        doc.resolver().rename("clock.rate", "clock.rate");
        assertEquals(3, doc.registry().referencesTo("clock.rate").size());
    }

    @Test
    @DisplayName("Subtree validation names the fragment")
    void validateReferencesNamesFragment() {
        var doc = Fixtures.skeleton();
        var log = doc.lookup("fileLog");
        doc.attach(log, Element.reference("parameter", "alpha"));

        var e = assertThrows(DanglingReferenceException.class,
                () -> doc.resolver().validateReferences(log, "modifiers/gamma.xml"));
        assertEquals("alpha", e.getIdentifier());
        assertEquals("modifiers/gamma.xml", e.getFragment());
        assertTrue(e.getMessage().contains("modifiers/gamma.xml"), e.getMessage());
    }

    @Test
    @DisplayName("Whole-document validation detects duplicates without a registry")
    void validateDetectsDuplicates() {
        var doc = Fixtures.skeleton();
        // Appended without registering
        doc.lookup("fileLog").append(new Element("parameter").setAttribute(Element.ID, "clock.rate"));

        assertThrows(DuplicateIdentifierException.class, () -> ReferenceResolver.validate(doc));
    }
}
