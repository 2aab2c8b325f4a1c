package org.phylo.beastxml.xml;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for structural comparison of element trees.
 */
class ElementTest {

    private static Element model(Element kappa) {
        var model = new Element("HKYModel").setAttribute(Element.ID, "hky");
        model.append(new Element("kappa")).append(kappa);
        return model;
    }

    private static Element kappa(String value) {
        return new Element("parameter").setAttribute(Element.ID, "kappa").setAttribute("value", value);
    }

    @Test
    void structuralEqualityComparesWholeTree() {
        assertTrue(model(kappa("2.0")).structurallyEquals(model(kappa("2.0"))));
        assertFalse(model(kappa("2.0")).structurallyEquals(model(kappa("3.0"))));
    }

    @Test
    void nestedReferenceMatchesDeclaration() {
        var declared = model(kappa("2.0"));
        var referenced = model(Element.reference("parameter", "kappa"));

        assertFalse(declared.structurallyEquals(referenced));
        assertTrue(declared.equivalentTo(referenced, Set.of()));
        assertTrue(referenced.equivalentTo(declared, Set.of()));
    }

    @Test
    void referenceMustNameSameTagAndIdentifier() {
        var declared = model(kappa("2.0"));

        assertFalse(declared.equivalentTo(model(Element.reference("parameter", "kappa_2")), Set.of()));
        assertFalse(declared.equivalentTo(model(Element.reference("statistic", "kappa")), Set.of()));
    }

    @Test
    void ignoredAttributesApplyBelowReferences() {
        var target = model(kappa("2.0").setAttribute("lower", "0.0"));
        var incoming = model(kappa("2.0").setAttribute("lower", "0"));

        assertFalse(target.equivalentTo(incoming, Set.of()));
        assertTrue(target.equivalentTo(incoming, Set.of("lower")));
    }
}
