package org.phylo.beastxml.xml;

import org.phylo.beastxml.ids.IdentifierRegistry;
import org.phylo.beastxml.ids.ReferenceResolver;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A BEAST document (or template fragment) together with its identifier index.
 *
 * Structural edits that add or remove identified elements go through
 * {@link #attach}, {@link #detach} and {@link #adopt} so the registry always
 * mirrors the tree. A document is owned by one assembly run at a time.
 */
public final class BeastDocument {

    public static final String ROOT_TAG = "beast";
    public static final String VERSION = "version";

    private final String name;
    private final Element root;
    private final IdentifierRegistry registry = new IdentifierRegistry();
    private final ReferenceResolver resolver = new ReferenceResolver(registry);

    /**
     * Wraps a detached element tree, registering every identifier in it.
     *
     * @param name Source name used in error messages (file or template name)
     * @param root Root element; must not have a parent
     * @throws org.phylo.beastxml.ids.DuplicateIdentifierException if the tree declares an id twice
     */
    public BeastDocument(String name, Element root) {
        this.name = Objects.requireNonNull(name, "Document name cannot be null");
        this.root = Objects.requireNonNull(root, "Root cannot be null");
        if (root.parent() != null) {
            throw new IllegalArgumentException("Root element must not have a parent");
        }
        adopt(root);
    }

    /**
     * Creates a document holding only {@code <beast version="...">}.
     */
    public static BeastDocument empty(String name, String version) {
        Element root = new Element(ROOT_TAG);
        if (version != null) {
            root.setAttribute(VERSION, version);
        }
        return new BeastDocument(name, root);
    }

    public String name() {
        return name;
    }

    public Element root() {
        return root;
    }

    public String version() {
        return root.attribute(VERSION);
    }

    public IdentifierRegistry registry() {
        return registry;
    }

    public ReferenceResolver resolver() {
        return resolver;
    }

    // ========== LOOKUP ==========

    /**
     * @throws org.phylo.beastxml.ids.UnknownIdentifierException if nothing declares {@code id}
     */
    public Element lookup(String id) {
        return registry.lookup(id);
    }

    public Optional<Element> find(String id) {
        return registry.find(id);
    }

    public boolean declares(String id) {
        return registry.contains(id);
    }

    /**
     * Finds a direct child of the root by tag and id.
     */
    public Optional<Element> findTopLevel(String tag, String id) {
        return registry.find(id).filter(e -> e.tag().equals(tag) && e.parent() == root);
    }

    public List<Element> topLevel(String tag) {
        return root.children(tag);
    }

    // ========== STRUCTURAL EDITS ==========

    /**
     * Registers the identifiers and references of a subtree that was attached directly.
     */
    public void adopt(Element subtree) {
        subtree.walk(e -> {
            if (e.hasId()) {
                registry.register(e.id(), e);
            }
            if (e.isReference()) {
                registry.addReference(e);
            }
        });
    }

    public Element attach(Element parent, Element child) {
        return attach(parent, parent.childCount(), child);
    }

    public Element attach(Element parent, int index, Element child) {
        parent.insert(index, child);
        adopt(child);
        return child;
    }

    /**
     * Inserts {@code child} directly after {@code sibling}.
     */
    public Element attachAfter(Element sibling, Element child) {
        Element parent = sibling.parent();
        return attach(parent, parent.indexOf(sibling) + 1, child);
    }

    /**
     * Removes an element from its parent and forgets its identifiers and references.
     */
    public void detach(Element element) {
        Element parent = element.parent();
        if (parent != null) {
            parent.remove(element);
        }
        element.walk(e -> {
            if (e.hasId() && registry.find(e.id()).orElse(null) == e) {
                registry.unregister(e.id());
            }
            if (e.isReference()) {
                registry.removeReference(e);
            }
        });
    }

    /**
     * Removes all children of {@code parent}, keeping the registry in step.
     */
    public void detachChildren(Element parent) {
        for (Element child : List.copyOf(parent.children())) {
            detach(child);
        }
    }

    /**
     * Points an existing reference element at another identifier.
     */
    public void retarget(Element referrer, String idref) {
        if (referrer.isReference()) {
            registry.removeReference(referrer);
        }
        referrer.setAttribute(Element.IDREF, idref);
        registry.addReference(referrer);
    }

    public void rename(String oldId, String newId) {
        resolver.rename(oldId, newId);
    }

    /**
     * Walks the whole tree and checks identifier uniqueness and reference resolution.
     */
    public void validate() {
        ReferenceResolver.validate(this);
    }

    /**
     * @return An independent deep copy with its own registry
     */
    public BeastDocument copy(String copyName) {
        return new BeastDocument(copyName, root.deepCopy());
    }

    @Override
    public String toString() {
        return "BeastDocument[" + name + ", " + registry.size() + " ids]";
    }
}
