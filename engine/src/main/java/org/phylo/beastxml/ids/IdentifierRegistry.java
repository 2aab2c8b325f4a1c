package org.phylo.beastxml.ids;

import org.eclipse.collections.api.factory.Maps;
import org.eclipse.collections.impl.factory.Multimaps;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.multimap.list.MutableListMultimap;
import org.phylo.beastxml.xml.Element;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Index of every identifier declared in one document, and of the elements that
 * refer to each identifier.
 *
 * This is the single place that answers "is this id already used" during an
 * assembly run. A registry belongs to exactly one document and is not shared
 * across runs or threads.
 */
public final class IdentifierRegistry {

    private static final String SUFFIX_SEPARATOR = "_";

    private final MutableMap<String, Element> owners = Maps.mutable.empty();
    private final MutableListMultimap<String, Element> references = Multimaps.mutable.list.empty();

    /**
     * Registers an identifier for its owning element.
     *
     * Registering the same element under the same identifier twice is a no-op.
     *
     * @throws DuplicateIdentifierException if another element owns the identifier
     */
    public void register(String id, Element owner) {
        Element existing = owners.get(id);
        if (existing == owner) {
            return;
        }
        if (existing != null) {
            throw new DuplicateIdentifierException(id, existing.path(), owner.path());
        }
        owners.put(id, owner);
    }

    /**
     * Derives a free identifier from {@code baseName} and registers it for {@code owner}.
     *
     * The base name itself is used when free, otherwise {@code base_2}, {@code base_3}, ...
     */
    public String allocateUnique(String baseName, Element owner) {
        return allocateUnique(baseName, owner, candidate -> false);
    }

    /**
     * As {@link #allocateUnique(String, Element)}, also skipping names for which
     * {@code alsoTaken} holds (e.g. names used by a fragment not yet merged).
     */
    public String allocateUnique(String baseName, Element owner, Predicate<String> alsoTaken) {
        String candidate = baseName;
        int suffix = 1;
        while (owners.containsKey(candidate) || alsoTaken.test(candidate)) {
            suffix++;
            candidate = baseName + SUFFIX_SEPARATOR + suffix;
        }
        owners.put(candidate, owner);
        return candidate;
    }

    /**
     * @throws UnknownIdentifierException if the identifier was never registered
     */
    public Element lookup(String id) {
        Element owner = owners.get(id);
        if (owner == null) {
            throw new UnknownIdentifierException(id);
        }
        return owner;
    }

    public Optional<Element> find(String id) {
        return Optional.ofNullable(owners.get(id));
    }

    public boolean contains(String id) {
        return owners.containsKey(id);
    }

    public void unregister(String id) {
        owners.remove(id);
    }

    public int size() {
        return owners.size();
    }

    // ========== REFERENCES ==========

    public void addReference(Element referrer) {
        references.put(referrer.idref(), referrer);
    }

    public void removeReference(Element referrer) {
        references.remove(referrer.idref(), referrer);
    }

    /**
     * @return Elements currently referring to {@code id}, in registration order
     */
    public List<Element> referencesTo(String id) {
        return List.copyOf(references.get(id));
    }

    /**
     * Moves an owner entry and its references to a new identifier.
     * Attribute values are rewritten by the caller.
     */
    void move(String oldId, String newId, Element owner) {
        owners.remove(oldId);
        owners.put(newId, owner);
        var referrers = references.removeAll(oldId);
        references.putAll(newId, referrers);
    }
}
