package org.phylo.beastxml.merge;

import org.phylo.beastxml.xml.BeastDocument;
import org.phylo.beastxml.xml.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Removes the elements described by a removal template from a document.
 *
 * A template element matches a target element with the same tag and the same
 * {@code id}, {@code idref} or {@code name} (whichever the template carries
 * first). A template leaf removes the first match; a template element with
 * children descends into the first match that contains all of them, and removes
 * the match itself once it would be left empty.
 */
public final class FragmentRemover {

    private static final Logger LOGGER = LoggerFactory.getLogger(FragmentRemover.class);

    private static final List<String> KEY_ATTRIBUTES = List.of(Element.ID, Element.IDREF, "name");

    /**
     * @throws StructuralMismatchException if a template element has no match in the document
     * @throws org.phylo.beastxml.ids.DanglingReferenceException if the removal leaves a reference without target
     */
    public BeastDocument remove(BeastDocument target, BeastDocument template) {
        FragmentMerger.checkRoots(target, template);
        for (Element element : template.root().children()) {
            removeMatching(target, target.root(), element);
        }
        target.resolver().validateReferences(target.root(), template.name());
        return target;
    }

    private void removeMatching(BeastDocument target, Element parent, Element template) {
        List<Element> candidates = candidates(parent, template);
        if (template.childCount() == 0) {
            if (candidates.isEmpty()) {
                throw notFound(parent, template);
            }
            if (candidates.size() > 1) {
                LOGGER.warn("{} matches {} elements under {}, removing the first", template, candidates.size(),
                        parent.path());
            }
            target.detach(candidates.get(0));
            return;
        }

        Element match = null;
        for (Element candidate : candidates) {
            if (containsAll(candidate, template)) {
                match = candidate;
                break;
            }
        }
        if (match == null) {
            throw notFound(parent, template);
        }
        boolean emptied = match.childCount() == template.childCount();
        for (Element child : template.children()) {
            removeMatching(target, match, child);
        }
        if (emptied) {
            target.detach(match);
        }
    }

    private static boolean containsAll(Element candidate, Element template) {
        for (Element child : template.children()) {
            boolean found = false;
            for (Element option : candidates(candidate, child)) {
                if (containsAll(option, child)) {
                    found = true;
                    break;
                }
            }
            if (!found) {
                return false;
            }
        }
        return true;
    }

    private static List<Element> candidates(Element parent, Element template) {
        String key = null;
        String value = null;
        for (String attribute : KEY_ATTRIBUTES) {
            if (template.attribute(attribute) != null) {
                key = attribute;
                value = template.attribute(attribute);
                break;
            }
        }
        List<Element> matches = new ArrayList<>();
        for (Element child : parent.children(template.tag())) {
            if (key == null || Objects.equals(value, child.attribute(key))) {
                matches.add(child);
            }
        }
        return matches;
    }

    private static StructuralMismatchException notFound(Element parent, Element template) {
        return new StructuralMismatchException("Element to be removed either does not exist or does not "
                + "contain the child elements given in the removal template: " + template, parent.path());
    }
}
