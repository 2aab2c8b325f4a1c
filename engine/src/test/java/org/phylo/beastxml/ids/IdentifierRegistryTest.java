package org.phylo.beastxml.ids;

import org.junit.jupiter.api.Test;
import org.phylo.beastxml.xml.Element;

import static org.junit.jupiter.api.Assertions.*;

class IdentifierRegistryTest {

    @Test
    void registeringSameOwnerTwiceIsNoOp() {
        var registry = new IdentifierRegistry();
        var owner = new Element("parameter");

        registry.register("kappa", owner);
        registry.register("kappa", owner);

        assertEquals(1, registry.size());
        assertSame(owner, registry.lookup("kappa"));
    }

    @Test
    void registeringOtherOwnerFails() {
        var registry = new IdentifierRegistry();
        registry.register("kappa", new Element("parameter"));

        var e = assertThrows(DuplicateIdentifierException.class,
                () -> registry.register("kappa", new Element("parameter")));
        assertEquals("kappa", e.getIdentifier());
    }

    @Test
    void allocateUniqueSuffixesTakenNames() {
        var registry = new IdentifierRegistry();
        registry.register("mu", new Element("parameter"));
        registry.register("mu_2", new Element("parameter"));

        assertEquals("mu_3", registry.allocateUnique("mu", new Element("parameter")));
        assertEquals("alpha", registry.allocateUnique("alpha", new Element("parameter")));
        assertTrue(registry.contains("mu_3"));
    }

    @Test
    void allocateUniqueSkipsNamesReservedElsewhere() {
        var registry = new IdentifierRegistry();
        registry.register("mu", new Element("parameter"));

        var fresh = registry.allocateUnique("mu", new Element("parameter"), name -> name.equals("mu_2"));

        assertEquals("mu_3", fresh);
    }

    @Test
    void tracksReferencesInRegistrationOrder() {
        var registry = new IdentifierRegistry();
        var first = Element.reference("parameter", "kappa");
        var second = Element.reference("parameter", "kappa");

        registry.addReference(first);
        registry.addReference(second);
        registry.removeReference(first);

        assertEquals(1, registry.referencesTo("kappa").size());
        assertSame(second, registry.referencesTo("kappa").get(0));
        assertTrue(registry.referencesTo("other").isEmpty());
    }

    @Test
    void unknownLookupFailsButFindIsEmpty() {
        var registry = new IdentifierRegistry();

        assertThrows(UnknownIdentifierException.class, () -> registry.lookup("x"));
        assertTrue(registry.find("x").isEmpty());
    }
}
