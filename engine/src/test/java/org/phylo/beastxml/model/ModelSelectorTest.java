package org.phylo.beastxml.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.phylo.beastxml.xml.BeastDocument;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for choosing and preparing model fragments.
 */
class ModelSelectorTest {

    private final ModelSelector selector = new ModelSelector();

    private static List<String> names(List<BeastDocument> fragments) {
        return fragments.stream().map(BeastDocument::name).toList();
    }

    @Nested
    @DisplayName("Fragment lists")
    class FragmentTests {

        @Test
        void baseModelOnly() {
            var fragments = selector.select(SubstitutionModelSpec.of(SubstitutionModelFamily.HKY)
                    .withFrequencies(FrequencyMode.EQUAL), null);

            assertEquals(List.of("models/hky.xml"), names(fragments));
        }

        @Test
        void companionsFollowBaseModel() {
            var spec = new SubstitutionModelSpec(SubstitutionModelFamily.GTR, FrequencyMode.ESTIMATED, 4, true);

            var fragments = selector.select(spec, "gene1");

            assertEquals(List.of("models/gtr.xml", ModelSelector.ESTIMATED_FREQUENCIES, ModelSelector.GAMMA,
                    ModelSelector.PROPORTION_INVARIANT), names(fragments));
        }

        @Test
        void gammaCategoriesAreApplied() {
            var fragments = selector.select("HKY+G8", "gene1");

            var gamma = fragments.get(fragments.size() - 1);
            assertEquals("8", gamma.root().descendants("gammaShape").get(0).attribute("gammaCategories"));
        }

        @Test
        void fragmentsAreFreshCopies() {
            var first = selector.select("HKY+G8", "gene1");
            var second = selector.select("HKY+G", "gene1");

            assertNotSame(first.get(0), second.get(0));
            assertEquals("4", second.get(1).root().descendants("gammaShape").get(0).attribute("gammaCategories"));
        }

        @ParameterizedTest
        @EnumSource(SubstitutionModelFamily.class)
        void everyFamilyHasUsableTemplate(SubstitutionModelFamily family) {
            var fragments = selector.select(SubstitutionModelSpec.of(family).withFrequencies(FrequencyMode.EQUAL), null);

            var base = fragments.get(0);
            assertTrue(base.declares(ModelSelector.FREQUENCIES_ID), family.name());
            assertTrue(base.declares("siteModel"), family.name());
            assertTrue(base.declares("mu"), family.name());
            base.validate();
        }
    }

    @Nested
    @DisplayName("Base frequencies")
    class FrequencyTests {

        @Test
        void empiricalFrequenciesComeFromAlignment() {
            var base = selector.select("HKY+F", "gene1").get(0);

            var parameter = base.lookup(ModelSelector.FREQUENCIES_ID);
            assertNull(parameter.attribute("value"));
            assertEquals("4", parameter.attribute("dimension"));
            var frequencyModel = parameter.parent().parent();
            assertEquals("gene1", frequencyModel.children().get(0).idref());
            assertEquals(1, base.registry().referencesTo("gene1").size());
        }

        @Test
        void empiricalFrequenciesNeedAlignment() {
            var spec = SubstitutionModelSpec.of(SubstitutionModelFamily.HKY).withFrequencies(FrequencyMode.EMPIRICAL);
            assertThrows(IllegalArgumentException.class, () -> selector.select(spec, null));
        }

        @Test
        void equalFrequenciesAreFixed() {
            var base = selector.select("JC", null).get(0);

            var parameter = base.lookup(ModelSelector.FREQUENCIES_ID);
            assertEquals("0.25 0.25 0.25 0.25", parameter.attribute("value"));
            assertEquals(1, selector.select("JC", null).size());
        }

        @Test
        void estimatedFrequenciesAddSamplers() {
            var fragments = selector.select("GTR+FO", "gene1");

            assertEquals(2, fragments.size());
            var samplers = fragments.get(1);
            assertEquals(3, samplers.registry().referencesTo(ModelSelector.FREQUENCIES_ID).size());
        }
    }

    @Test
    void resolveReportsUnknownModelsAsEmpty() {
        assertTrue(selector.resolve("HKY+G4").isPresent());
        assertTrue(selector.resolve("LG+G4").isEmpty());
        assertTrue(selector.resolve("GTR+X").isEmpty());
    }

    @Test
    void specDescribesItself() {
        var spec = new SubstitutionModelSpec(SubstitutionModelFamily.GTR, FrequencyMode.ESTIMATED, 4, true);
        assertEquals("GTR+G4+I (estimated frequencies)", spec.toString());
    }
}
