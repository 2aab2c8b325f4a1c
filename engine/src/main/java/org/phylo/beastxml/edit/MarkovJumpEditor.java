package org.phylo.beastxml.edit;

import org.phylo.beastxml.xml.BeastDocument;
import org.phylo.beastxml.xml.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Markov jump counts and rewards of a discrete trait.
 *
 * Both live in the trait's {@code <markovJumpsTreeLikelihood id="{trait}.treeLikelihood">},
 * which must already exist. Parameters are created on first use and
 * rewritten from the current state list afterwards.
 */
public final class MarkovJumpEditor {

    private static final String MARKOV_JUMPS = "markovJumpsTreeLikelihood";
    private static final String PARAMETER = "parameter";
    private static final String REWARDS = "rewards";

    private MarkovJumpEditor() {
        // Static utility class
    }

    public static String countId(String trait) {
        return trait + ".count";
    }

    public static String rewardId(String state) {
        return state + ".reward";
    }

    /**
     * Counts jumps between every ordered pair of distinct states.
     */
    public static void logJumpCounts(BeastDocument document, String trait) {
        int states = TraitEditor.states(document, trait).size();
        Element likelihood = likelihood(document, trait);
        Element count = parameter(document, likelihood, countId(trait));
        count.setAttribute("value", " " + countMatrix(states));
    }

    /**
     * Adds one reward parameter per state, an indicator vector over the states.
     */
    public static void logRewards(BeastDocument document, String trait) {
        List<String> states = TraitEditor.states(document, trait);
        Element likelihood = likelihood(document, trait);
        Element rewards = likelihood.first(REWARDS)
                .orElseGet(() -> document.attach(likelihood, new Element(REWARDS)));
        List<String> ids = states.stream().map(MarkovJumpEditor::rewardId).toList();
        for (Element stale : rewards.children(PARAMETER)) {
            if (!ids.contains(stale.id())) {
                document.detach(stale);
            }
        }
        for (int i = 0; i < states.size(); i++) {
            Element reward = parameter(document, rewards, rewardId(states.get(i)));
            reward.setAttribute("value", indicator(states.size(), i));
        }
    }

    /**
     * Refreshes counts and rewards that are already logged, after the state set changed.
     */
    public static void refresh(BeastDocument document, String trait) {
        Optional<Element> likelihood = document.findTopLevel(MARKOV_JUMPS, trait + ".treeLikelihood");
        if (likelihood.isEmpty()) {
            return;
        }
        if (likelihood.get().first(PARAMETER, Element.ID, countId(trait)).isPresent()) {
            logJumpCounts(document, trait);
        }
        if (likelihood.get().first(REWARDS).isPresent()) {
            logRewards(document, trait);
        }
    }

    static String countMatrix(int states) {
        List<String> values = new ArrayList<>(states * states);
        for (int i = 0; i < states; i++) {
            for (int j = 0; j < states; j++) {
                values.add(i == j ? "0.0" : "1.0");
            }
        }
        return String.join(" ", values);
    }

    static String indicator(int states, int index) {
        List<String> values = new ArrayList<>(states);
        for (int i = 0; i < states; i++) {
            values.add(i == index ? "1.0" : "0.0");
        }
        return String.join(" ", values);
    }

    private static Element likelihood(BeastDocument document, String trait) {
        String id = trait + ".treeLikelihood";
        return document.findTopLevel(MARKOV_JUMPS, id)
                .orElseThrow(() -> new EditException("No " + MARKOV_JUMPS + " block with id '" + id + "' found"));
    }

    private static Element parameter(BeastDocument document, Element parent, String id) {
        return parent.first(PARAMETER, Element.ID, id)
                .orElseGet(() -> document.attach(parent, new Element(PARAMETER).setAttribute(Element.ID, id)));
    }
}
