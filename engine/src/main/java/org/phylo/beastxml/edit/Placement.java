package org.phylo.beastxml.edit;

import org.phylo.beastxml.xml.BeastDocument;
import org.phylo.beastxml.xml.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Where new top-level blocks go.
 *
 * BEAST resolves a reference only to an element declared earlier in the file,
 * so new blocks are placed after the blocks they depend on.
 */
public final class Placement {

    private Placement() {
        // Static utility class
    }

    /**
     * Inserts {@code element} at the top level, after the last element with the
     * first anchor tag that is present, or first in the document if none is.
     *
     * @param anchorTags Candidate tags in order of preference
     */
    public static Element insertAfterLast(BeastDocument document, Element element, String... anchorTags) {
        Element root = document.root();
        for (String tag : anchorTags) {
            List<Element> anchors = root.children(tag);
            if (!anchors.isEmpty()) {
                return document.attachAfter(anchors.get(anchors.size() - 1), element);
            }
        }
        return document.attach(root, 0, element);
    }

    /**
     * Moves a top-level element below every top-level element it refers to.
     */
    public static void moveAfterDependencies(BeastDocument document, Element element) {
        Element root = document.root();
        int last = -1;
        for (Element reference : referencesIn(element)) {
            Element owner = document.find(reference.idref()).orElse(null);
            Element top = owner == null ? null : topLevelAncestor(owner);
            if (top != null && top != element) {
                last = Math.max(last, root.indexOf(top));
            }
        }
        if (last > root.indexOf(element)) {
            Element anchor = root.children().get(last);
            document.detach(element);
            document.attachAfter(anchor, element);
        }
    }

    public static Element topLevelAncestor(Element element) {
        Element current = element;
        while (current.parent() != null && current.parent().parent() != null) {
            current = current.parent();
        }
        return current.parent() == null ? null : current;
    }

    private static List<Element> referencesIn(Element element) {
        List<Element> references = new ArrayList<>();
        element.walk(e -> {
            if (e.isReference()) {
                references.add(e);
            }
        });
        return references;
    }
}
