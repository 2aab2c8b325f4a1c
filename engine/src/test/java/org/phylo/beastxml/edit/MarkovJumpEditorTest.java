package org.phylo.beastxml.edit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.phylo.beastxml.Fixtures;
import org.phylo.beastxml.xml.BeastDocument;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarkovJumpEditorTest {

    private BeastDocument doc;

    @BeforeEach
    void setUp() {
        doc = Fixtures.load(Fixtures.LOCATION);
    }

    @Test
    void countsEveryJumpBetweenDistinctStates() {
        MarkovJumpEditor.logJumpCounts(doc, "location");

        var count = doc.lookup(MarkovJumpEditor.countId("location"));
        assertSame(doc.lookup("location.treeLikelihood"), count.parent());
        assertEquals(" 0.0 1.0 1.0 0.0", count.attribute("value"));
    }

    @Test
    void rewardPerState() {
        MarkovJumpEditor.logRewards(doc, "location");

        assertEquals("1.0 0.0", doc.lookup("UK.reward").attribute("value"));
        assertEquals("0.0 1.0", doc.lookup("FR.reward").attribute("value"));
        assertEquals("rewards", doc.lookup("UK.reward").parent().tag());
    }

    @Test
    void loggingTwiceReusesParameters() {
        MarkovJumpEditor.logJumpCounts(doc, "location");
        MarkovJumpEditor.logJumpCounts(doc, "location");
        MarkovJumpEditor.logRewards(doc, "location");
        MarkovJumpEditor.logRewards(doc, "location");

        var likelihood = doc.lookup("location.treeLikelihood");
        assertEquals(1, likelihood.children("parameter").size());
        assertEquals(1, likelihood.children("rewards").size());
        assertEquals(2, likelihood.first("rewards").orElseThrow().childCount());
    }

    @Test
    void refreshFollowsNewState() {
        MarkovJumpEditor.logJumpCounts(doc, "location");
        MarkovJumpEditor.logRewards(doc, "location");
        TraitEditor.setDiscreteAttribute(doc, "C", "location", "DE", "taxa");

        MarkovJumpEditor.refresh(doc, "location");

        assertEquals(" " + MarkovJumpEditor.countMatrix(3), doc.lookup("location.count").attribute("value"));
        assertEquals("0.0 0.0 1.0", doc.lookup("DE.reward").attribute("value"));
        assertEquals("1.0 0.0 0.0", doc.lookup("UK.reward").attribute("value"));
    }

    @Test
    void refreshDropsRewardsOfRemovedStates() {
        MarkovJumpEditor.logRewards(doc, "location");
        var dataType = doc.lookup("location.dataType");
        dataType.remove(dataType.first("state", "code", "FR").orElseThrow());

        MarkovJumpEditor.refresh(doc, "location");

        assertFalse(doc.declares("FR.reward"));
        assertEquals("1.0", doc.lookup("UK.reward").attribute("value"));
    }

    @Test
    void refreshWithoutLoggingChangesNothing() {
        MarkovJumpEditor.refresh(doc, "location");

        var likelihood = doc.lookup("location.treeLikelihood");
        assertTrue(likelihood.children("parameter").isEmpty());
        assertTrue(likelihood.first("rewards").isEmpty());
    }

    @Test
    void likelihoodMustExist() {
        var skeleton = Fixtures.skeleton();
        TraitEditor.setDiscreteAttribute(skeleton, "placeholder", "host", "human", "taxa");

        assertThrows(EditException.class, () -> MarkovJumpEditor.logJumpCounts(skeleton, "host"));
        assertThrows(EditException.class, () -> MarkovJumpEditor.logRewards(skeleton, "host"));
    }

    @Test
    void matrices() {
        assertEquals("0.0 1.0 1.0 1.0 0.0 1.0 1.0 1.0 0.0", MarkovJumpEditor.countMatrix(3));
        assertEquals("0.0 1.0 0.0", MarkovJumpEditor.indicator(3, 1));
        assertEquals(List.of("UK", "FR"), TraitEditor.states(doc, "location"));
    }
}
