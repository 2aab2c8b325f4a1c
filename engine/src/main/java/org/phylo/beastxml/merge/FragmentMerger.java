package org.phylo.beastxml.merge;

import org.phylo.beastxml.ids.DuplicateIdentifierException;
import org.phylo.beastxml.xml.BeastDocument;
import org.phylo.beastxml.xml.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Merges template fragments into a target document.
 *
 * A merge runs in three passes over a private copy of the fragment:
 * <ol>
 *   <li>Isolation: with a prefix set, every id the fragment declares becomes
 *       {@code prefix.id} and references inside the fragment follow.</li>
 *   <li>Reconciliation, bottom-up: a declaration equivalent to one already in the
 *       target is dropped (top level) or replaced by a reference (nested); a
 *       non-equivalent one is renamed or rejected per {@link CollisionPolicy}.</li>
 *   <li>Insertion: container blocks ({@link Role}) are unioned with the target's,
 *       everything else is inserted, and the inserted references are checked.</li>
 * </ol>
 * The fragment passed in is never modified, so templates can be merged any
 * number of times.
 */
public final class FragmentMerger {

    private static final Logger LOGGER = LoggerFactory.getLogger(FragmentMerger.class);

    private static final String PREFIX_SEPARATOR = ".";

    /**
     * Merges {@code fragment} into {@code target} in place.
     *
     * @return The target, for chaining
     * @throws StructuralMismatchException on a root or container mismatch
     * @throws DuplicateIdentifierException on a collision under {@link CollisionPolicy#FAIL}, or when a
     *         protected identifier is declared differently on both sides (whatever the policy)
     * @throws org.phylo.beastxml.ids.DanglingReferenceException if an inserted reference has no target
     */
    public BeastDocument merge(BeastDocument target, BeastDocument fragment, MergeOptions options) {
        checkRoots(target, fragment);
        checkProtected(target, fragment, options);
        BeastDocument incoming = fragment.copy(fragment.name());
        MergeStats stats = new MergeStats();

        if (options.isolated()) {
            isolate(target, incoming, options);
        }
        reconcile(target, incoming, incoming.root(), options, stats);

        List<Element> inserted = new ArrayList<>();
        insert(target, incoming, options, inserted, stats);
        for (Element subtree : inserted) {
            target.resolver().validateReferences(subtree, fragment.name());
        }

        LOGGER.debug("Merged '{}' into '{}': {} inserted, {} reused, {} renamed",
                fragment.name(), target.name(), inserted.size(), stats.reused, stats.renamed);
        return target;
    }

    public BeastDocument merge(BeastDocument target, BeastDocument fragment) {
        return merge(target, fragment, MergeOptions.defaults());
    }

    static void checkRoots(BeastDocument target, BeastDocument fragment) {
        if (!BeastDocument.ROOT_TAG.equals(target.root().tag())) {
            throw new StructuralMismatchException("Target root is <" + target.root().tag() + ">, expected <beast>",
                    target.name());
        }
        if (!BeastDocument.ROOT_TAG.equals(fragment.root().tag())) {
            throw new StructuralMismatchException("Fragment root is <" + fragment.root().tag() + ">, expected <beast>",
                    fragment.name());
        }
        if (!Objects.equals(target.version(), fragment.version())) {
            throw new StructuralMismatchException("Fragment '" + fragment.name() + "' targets BEAST version "
                    + fragment.version() + " but the document is version " + target.version(), null);
        }
    }

    /**
     * Protected identifiers are shared across merges and never renamed. A fragment that
     * declares one differently from the target is rejected before anything changes.
     */
    static void checkProtected(BeastDocument target, BeastDocument fragment, MergeOptions options) {
        for (String id : options.protectedIds()) {
            Optional<Element> existing = target.find(id);
            Optional<Element> declared = fragment.find(id);
            if (existing.isPresent() && declared.isPresent()
                    && !existing.get().equivalentTo(declared.get(), options.ignoredAttributes())) {
                throw new DuplicateIdentifierException(id, existing.get().path(),
                        fragment.name() + ":" + declared.get().path());
            }
        }
    }

    // ========== ISOLATION ==========

    /**
     * Prefixes the fragment's own declarations. A reference to something the
     * fragment does not declare is pointed at the prefixed name when the target
     * already holds it, so a companion fragment (e.g. gamma rates) attaches to the
     * same partition's base model rather than to an unprefixed id.
     */
    private void isolate(BeastDocument target, BeastDocument incoming, MergeOptions options) {
        String prefix = options.isolationPrefix() + PREFIX_SEPARATOR;
        List<String> declared = new ArrayList<>();
        List<Element> external = new ArrayList<>();
        incoming.root().walk(e -> {
            if (e != incoming.root() && e.hasId() && !Role.isDocumentContainer(e)
                    && !options.protectedIds().contains(e.id())) {
                declared.add(e.id());
            }
            if (e.isReference() && !incoming.declares(e.idref())) {
                external.add(e);
            }
        });
        for (String id : declared) {
            incoming.rename(id, prefix + id);
        }
        for (Element reference : external) {
            String idref = reference.idref();
            if (!options.protectedIds().contains(idref) && target.declares(prefix + idref)) {
                incoming.retarget(reference, prefix + idref);
            }
        }
    }

    // ========== RECONCILIATION ==========

    private void reconcile(BeastDocument target, BeastDocument incoming, Element element,
                           MergeOptions options, MergeStats stats) {
        for (Element child : List.copyOf(element.children())) {
            reconcile(target, incoming, child, options, stats);
        }
        if (element == incoming.root() || !element.hasId() || Role.of(element).isPresent()) {
            return;
        }
        Optional<Element> existing = target.find(element.id());
        if (existing.isEmpty()) {
            return;
        }
        if (existing.get().equivalentTo(element, options.ignoredAttributes())) {
            reuse(target, incoming, element);
            stats.reused++;
            return;
        }
        resolveCollision(target, incoming, element, existing.get(), options);
        stats.renamed++;
    }

    /**
     * Drops an equivalent top-level declaration, or swaps a nested one for a reference.
     */
    private void reuse(BeastDocument target, BeastDocument incoming, Element element) {
        Element parent = element.parent();
        forgetAllocations(target, element);
        if (parent == incoming.root()) {
            incoming.detach(element);
            return;
        }
        int index = parent.indexOf(element);
        incoming.detach(element);
        incoming.attach(parent, index, Element.reference(element.tag(), element.id()));
    }

    private void resolveCollision(BeastDocument target, BeastDocument incoming, Element element,
                                  Element existing, MergeOptions options) {
        String id = element.id();
        switch (options.collisionPolicy()) {
            case FAIL -> throw new DuplicateIdentifierException(id, existing.path(),
                    incoming.name() + ":" + element.path());
            case RENAME_INCOMING -> {
                String fresh = target.registry().allocateUnique(id, element, incoming::declares);
                incoming.rename(id, fresh);
                LOGGER.debug("'{}' from '{}' collides with {}, renamed to '{}'", id, incoming.name(),
                        existing.path(), fresh);
            }
            case RENAME_EXISTING -> {
                String fresh = target.registry().allocateUnique(id, existing, incoming::declares);
                target.rename(id, fresh);
                LOGGER.debug("'{}' in '{}' renamed to '{}' to make room for '{}'", id, target.name(), fresh,
                        incoming.name());
            }
        }
    }

    /**
     * Releases target ids reserved for elements of a subtree that is about to be dropped.
     */
    private static void forgetAllocations(BeastDocument target, Element subtree) {
        subtree.walk(e -> {
            if (e.hasId() && target.find(e.id()).orElse(null) == e) {
                target.registry().unregister(e.id());
            }
        });
    }

    // ========== INSERTION ==========

    private void insert(BeastDocument target, BeastDocument incoming, MergeOptions options,
                        List<Element> inserted, MergeStats stats) {
        List<Element> children = List.copyOf(incoming.root().children());
        int fragmentOperators = indexOfRole(incoming.root(), Role.OPERATORS);
        for (int i = 0; i < children.size(); i++) {
            boolean beforeOperators = fragmentOperators >= 0 ? i < fragmentOperators : options.beforeOperators();
            mergeChild(target, target.root(), children.get(i), beforeOperators, options, inserted, stats);
        }
    }

    private void mergeChild(BeastDocument target, Element targetParent, Element child, boolean beforeOperators,
                            MergeOptions options, List<Element> inserted, MergeStats stats) {
        if (Role.of(child).isPresent()) {
            Optional<Element> container = findContainer(target, targetParent, child);
            if (container.isPresent()) {
                for (Element grandChild : List.copyOf(child.children())) {
                    mergeChild(target, container.get(), grandChild, false, options, inserted, stats);
                }
                return;
            }
        } else if (!child.hasId() && containsEquivalent(targetParent, child, options)) {
            stats.reused++;
            return;
        }

        child.parent().remove(child);
        int index = targetParent.childCount();
        if (beforeOperators && targetParent == target.root()) {
            int operators = indexOfRole(targetParent, Role.OPERATORS);
            if (operators >= 0) {
                index = operators;
            }
        }
        target.attach(targetParent, index, child);
        inserted.add(child);
    }

    /**
     * Finds the target container a fragment container lines up with.
     *
     * @throws StructuralMismatchException if the id is taken by an element of another tag or location
     */
    private Optional<Element> findContainer(BeastDocument target, Element targetParent, Element container) {
        if (container.hasId()) {
            Optional<Element> owner = target.find(container.id());
            if (owner.isPresent()) {
                Element existing = owner.get();
                if (!existing.tag().equals(container.tag()) || existing.parent() != targetParent) {
                    throw new StructuralMismatchException("Container <" + container.tag() + " id=\""
                            + container.id() + "\"> cannot be merged with " + existing.path(), container.path());
                }
                return owner;
            }
            return Optional.empty();
        }
        for (Element candidate : targetParent.children(container.tag())) {
            if (!candidate.isReference() && !candidate.hasId()) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static boolean containsEquivalent(Element parent, Element child, MergeOptions options) {
        for (Element candidate : parent.children()) {
            if (candidate.equivalentTo(child, options.ignoredAttributes())) {
                return true;
            }
        }
        return false;
    }

    private static int indexOfRole(Element parent, Role role) {
        List<Element> children = parent.children();
        for (int i = 0; i < children.size(); i++) {
            if (Role.of(children.get(i)).orElse(null) == role) {
                return i;
            }
        }
        return -1;
    }

    private static final class MergeStats {
        private int reused;
        private int renamed;
    }
}
