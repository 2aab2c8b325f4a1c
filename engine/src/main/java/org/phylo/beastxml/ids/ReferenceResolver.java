package org.phylo.beastxml.ids;

import org.phylo.beastxml.xml.BeastDocument;
import org.phylo.beastxml.xml.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps {@code idref} attributes consistent with the identifiers they point at.
 *
 * Renames go through the registry's reference index, so no caller ever edits
 * {@code idref} strings by hand.
 */
public final class ReferenceResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReferenceResolver.class);

    private final IdentifierRegistry registry;

    public ReferenceResolver(IdentifierRegistry registry) {
        this.registry = registry;
    }

    /**
     * Renames an identifier and rewrites every reference to it.
     *
     * All checks run before anything is changed, so a failed rename leaves the
     * document untouched.
     *
     * @throws UnknownIdentifierException   if {@code oldId} is not declared
     * @throws DuplicateIdentifierException if {@code newId} is owned by another element
     */
    public void rename(String oldId, String newId) {
        if (oldId.equals(newId)) {
            return;
        }
        Element owner = registry.lookup(oldId);
        Element clash = registry.find(newId).orElse(owner);
        if (clash != owner) {
            throw new DuplicateIdentifierException(newId, clash.path(), owner.path());
        }

        List<Element> referrers = registry.referencesTo(oldId);
        registry.move(oldId, newId, owner);
        owner.setAttribute(Element.ID, newId);
        for (Element referrer : referrers) {
            referrer.setAttribute(Element.IDREF, newId);
        }
        LOGGER.debug("Renamed '{}' to '{}' ({} references)", oldId, newId, referrers.size());
    }

    /**
     * Checks every {@code idref} in a subtree against the registry.
     *
     * @param subtree  Root of the subtree to check
     * @param fragment Name reported when a reference does not resolve (may be null)
     * @throws DanglingReferenceException on the first unresolved reference
     */
    public void validateReferences(Element subtree, String fragment) {
        List<Element> dangling = new ArrayList<>();
        subtree.walk(e -> {
            if (e.isReference() && !registry.contains(e.idref())) {
                dangling.add(e);
            }
        });
        if (!dangling.isEmpty()) {
            Element first = dangling.get(0);
            throw new DanglingReferenceException(first.idref(), first.path(), fragment);
        }
    }

    /**
     * Walks a whole document, independently of any registry, and confirms that
     * identifiers are unique and every reference has exactly one target.
     *
     * @throws DuplicateIdentifierException if an identifier is declared twice
     * @throws DanglingReferenceException   if a reference has no target
     */
    public static void validate(BeastDocument document) {
        Map<String, Element> declared = new HashMap<>();
        List<Element> referrers = new ArrayList<>();
        document.root().walk(e -> {
            if (e.hasId()) {
                Element previous = declared.putIfAbsent(e.id(), e);
                if (previous != null) {
                    throw new DuplicateIdentifierException(e.id(), previous.path(), e.path());
                }
            }
            if (e.isReference()) {
                referrers.add(e);
            }
        });
        for (Element referrer : referrers) {
            if (!declared.containsKey(referrer.idref())) {
                throw new DanglingReferenceException(referrer.idref(), referrer.path());
            }
        }
    }
}
