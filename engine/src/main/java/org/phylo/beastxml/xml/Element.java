package org.phylo.beastxml.xml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * A node of a BEAST XML document.
 *
 * Holds a tag, attributes in declaration order, ordered children and optional
 * text. Equality is identity: two elements with the same content are still
 * distinct nodes. Use {@link #structurallyEquals} to compare content.
 *
 * Attributes {@code id} and {@code idref} should only be changed through
 * {@link BeastDocument} or its resolver so the identifier index stays in step.
 */
public final class Element {

    public static final String ID = "id";
    public static final String IDREF = "idref";

    private final String tag;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final List<Element> children = new ArrayList<>();
    private Element parent;
    private String text;

    public Element(String tag) {
        this.tag = Objects.requireNonNull(tag, "Tag cannot be null");
    }

    public Element(String tag, Map<String, String> attributes) {
        this(tag);
        this.attributes.putAll(attributes);
    }

    /**
     * Creates an element that refers to another element by identifier.
     */
    public static Element reference(String tag, String idref) {
        Element element = new Element(tag);
        element.attributes.put(IDREF, idref);
        return element;
    }

    public String tag() {
        return tag;
    }

    public String id() {
        return attributes.get(ID);
    }

    public String idref() {
        return attributes.get(IDREF);
    }

    public boolean hasId() {
        return attributes.containsKey(ID);
    }

    public boolean isReference() {
        return attributes.containsKey(IDREF);
    }

    // ========== ATTRIBUTES ==========

    public String attribute(String name) {
        return attributes.get(name);
    }

    public Optional<String> findAttribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    /**
     * @return Read-only view of the attributes, in declaration order
     */
    public Map<String, String> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public Element setAttribute(String name, String value) {
        Objects.requireNonNull(value, "Attribute value cannot be null: " + name);
        attributes.put(name, value);
        return this;
    }

    public String removeAttribute(String name) {
        return attributes.remove(name);
    }

    // ========== TEXT ==========

    public String text() {
        return text;
    }

    public Element setText(String text) {
        this.text = text == null || text.isEmpty() ? null : text;
        return this;
    }

    // ========== TREE ==========

    public Element parent() {
        return parent;
    }

    /**
     * @return Read-only view of the children
     */
    public List<Element> children() {
        return Collections.unmodifiableList(children);
    }

    public List<Element> children(String childTag) {
        List<Element> matches = new ArrayList<>();
        for (Element child : children) {
            if (child.tag.equals(childTag)) {
                matches.add(child);
            }
        }
        return matches;
    }

    public Optional<Element> first(String childTag) {
        for (Element child : children) {
            if (child.tag.equals(childTag)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    public Optional<Element> first(String childTag, String attributeName, String attributeValue) {
        for (Element child : children) {
            if (child.tag.equals(childTag) && attributeValue.equals(child.attribute(attributeName))) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    public int childCount() {
        return children.size();
    }

    public int indexOf(Element child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                return i;
            }
        }
        return -1;
    }

    public Element append(Element child) {
        return insert(children.size(), child);
    }

    public Element insert(int index, Element child) {
        if (child.parent != null) {
            throw new IllegalStateException("Element <" + child.tag + "> already has a parent");
        }
        children.add(index, child);
        child.parent = this;
        return child;
    }

    /**
     * Appends a new child element and returns it.
     */
    public Element appendChild(String childTag, Map<String, String> childAttributes) {
        return append(new Element(childTag, childAttributes));
    }

    public boolean remove(Element child) {
        int index = indexOf(child);
        if (index < 0) {
            return false;
        }
        children.remove(index);
        child.parent = null;
        return true;
    }

    public void removeChildren() {
        for (Element child : children) {
            child.parent = null;
        }
        children.clear();
    }

    /**
     * Visits this element and all descendants in document order.
     */
    public void walk(Consumer<Element> visitor) {
        visitor.accept(this);
        for (Element child : List.copyOf(children)) {
            child.walk(visitor);
        }
    }

    public List<Element> descendants(String descendantTag) {
        List<Element> matches = new ArrayList<>();
        walk(e -> {
            if (e != this && e.tag.equals(descendantTag)) {
                matches.add(e);
            }
        });
        return matches;
    }

    /**
     * Copies this element and its subtree. The copy has no parent.
     */
    public Element deepCopy() {
        Element copy = new Element(tag, attributes);
        copy.text = text;
        for (Element child : children) {
            copy.append(child.deepCopy());
        }
        return copy;
    }

    /**
     * @return Location of this element, e.g. {@code /beast/operators[1]/scaleOperator[2]}
     */
    public String path() {
        if (parent == null) {
            return "/" + tag;
        }
        int position = 0;
        for (Element sibling : parent.children) {
            if (sibling.tag.equals(tag)) {
                position++;
            }
            if (sibling == this) {
                break;
            }
        }
        return parent.path() + "/" + tag + "[" + position + "]";
    }

    /**
     * Compares tag, attributes, text and children recursively.
     *
     * @param other              Element to compare with
     * @param ignoredAttributes  Attribute names left out of the comparison
     */
    public boolean structurallyEquals(Element other, Set<String> ignoredAttributes) {
        return compare(other, ignoredAttributes, false);
    }

    /**
     * Like {@link #structurallyEquals(Element, Set)}, except that at any depth a
     * reference {@code <x idref="k"/>} also matches a declaration {@code <x id="k" ...>}
     * of the same tag. A subtree whose nested declarations were swapped for
     * references therefore still matches the original.
     */
    public boolean equivalentTo(Element other, Set<String> ignoredAttributes) {
        return compare(other, ignoredAttributes, true);
    }

    private boolean compare(Element other, Set<String> ignoredAttributes, boolean resolveReferences) {
        if (other == this) {
            return true;
        }
        if (resolveReferences && (refersTo(this, other) || refersTo(other, this))) {
            return true;
        }
        if (!tag.equals(other.tag) || !Objects.equals(text, other.text)
                || children.size() != other.children.size()) {
            return false;
        }
        if (!filtered(attributes, ignoredAttributes).equals(filtered(other.attributes, ignoredAttributes))) {
            return false;
        }
        for (int i = 0; i < children.size(); i++) {
            if (!children.get(i).compare(other.children.get(i), ignoredAttributes, resolveReferences)) {
                return false;
            }
        }
        return true;
    }

    private static boolean refersTo(Element reference, Element declaration) {
        return reference.isReference() && declaration.hasId() && !declaration.isReference()
                && reference.tag.equals(declaration.tag) && reference.idref().equals(declaration.id());
    }

    public boolean structurallyEquals(Element other) {
        return structurallyEquals(other, Set.of());
    }

    private static Map<String, String> filtered(Map<String, String> attributes, Set<String> ignored) {
        if (ignored.isEmpty()) {
            return attributes;
        }
        Map<String, String> result = new LinkedHashMap<>(attributes);
        result.keySet().removeAll(ignored);
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("<").append(tag);
        attributes.forEach((name, value) -> sb.append(' ').append(name).append("=\"").append(value).append('"'));
        return sb.append(children.isEmpty() && text == null ? "/>" : ">").toString();
    }
}
