package org.phylo.beastxml.edit;

import org.phylo.beastxml.xml.BeastDocument;
import org.phylo.beastxml.xml.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Replaces the starting tree of the {@code <treeModel>} with a UPGMA tree or a
 * fixed Newick tree, both held by a {@code <rescaledTree id="startingTree">}.
 */
public final class StartingTreeEditor {

    private static final Logger LOGGER = LoggerFactory.getLogger(StartingTreeEditor.class);

    public static final String STARTING_TREE = "startingTree";
    public static final String TREE_MODEL = "treeModel";

    private static final String RESCALED_TREE = "rescaledTree";

    // Children of <treeModel> that name the starting tree
    private static final Set<String> TREE_TYPES = Set.of("tree", "upgmaTree", "coalescentTree");

    private StartingTreeEditor() {
        // Static utility class
    }

    /**
     * Starts from a UPGMA tree built on JC distances of the first alignment.
     */
    public static void useUpgma(BeastDocument document) {
        String alignmentId = document.root().first(TaxonEditor.ALIGNMENT)
                .map(Element::id)
                .orElseThrow(() -> new EditException("No <alignment> block found"));

        Element upgma = new Element("upgmaTree");
        Element distances = new Element("distanceMatrix").setAttribute("correction", "JC");
        Element patterns = new Element("patterns");
        patterns.append(Element.reference(TaxonEditor.ALIGNMENT, alignmentId));
        distances.append(patterns);
        upgma.append(distances);

        replaceStartingTree(document, upgma, "upgmaTree");
    }

    /**
     * Starts from a given tree. The Newick string is not checked.
     */
    public static void useNewick(BeastDocument document, String newick) {
        if (newick == null || newick.isBlank()) {
            throw new IllegalArgumentException("Newick tree cannot be empty");
        }
        Element tree = new Element("newick").setAttribute("usingDates", "true").setText(newick.strip());
        replaceStartingTree(document, tree, "tree");
    }

    private static void replaceStartingTree(BeastDocument document, Element tree, String referenceTag) {
        Element treeModel = document.findTopLevel(TREE_MODEL, TREE_MODEL)
                .orElseThrow(() -> new EditException("No <treeModel> element with id '" + TREE_MODEL + "' found"));
        for (Element child : List.copyOf(treeModel.children())) {
            if (TREE_TYPES.contains(child.tag())) {
                document.detach(child);
            }
        }

        Element rescaled = rescaledTree(document);
        document.detachChildren(rescaled);
        document.attach(rescaled, tree);
        document.attach(treeModel, 0, Element.reference(referenceTag, STARTING_TREE));
        LOGGER.debug("Starting tree is now a {}", tree.tag());
    }

    /**
     * @return The {@code <rescaledTree>}, replacing any other element that declares the starting tree
     */
    private static Element rescaledTree(BeastDocument document) {
        Element existing = document.find(STARTING_TREE).orElse(null);
        if (existing != null && RESCALED_TREE.equals(existing.tag())) {
            return existing;
        }
        if (existing != null) {
            if (!document.registry().referencesTo(STARTING_TREE).isEmpty()) {
                throw new EditException("'" + STARTING_TREE + "' is still referenced outside <" + TREE_MODEL + ">");
            }
            document.detach(existing);
        }
        Element rescaled = new Element(RESCALED_TREE).setAttribute(Element.ID, STARTING_TREE);
        return Placement.insertAfterLast(document, rescaled, "constantSize", TaxonEditor.ALIGNMENT, TaxonEditor.TAXA);
    }
}
