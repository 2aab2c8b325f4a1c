package org.phylo.beastxml.edit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.phylo.beastxml.Fixtures;
import org.phylo.beastxml.xml.BeastDocument;
import org.phylo.beastxml.xml.Element;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Taxon attributes, trait data types and the dimensions that follow the state count.
 */
class TraitEditorTest {

    private BeastDocument doc;

    @BeforeEach
    void setUp() {
        doc = Fixtures.load(Fixtures.LOCATION);
    }

    @Nested
    class Attributes {

        @Test
        void statesInDocumentOrder() {
            assertEquals(List.of("UK", "FR"), TraitEditor.states(doc, "location"));
        }

        @Test
        void newValueBecomesState() {
            TraitEditor.setDiscreteAttribute(doc, "C", "location", "DE", "taxa");

            assertEquals(List.of("UK", "FR", "DE"), TraitEditor.states(doc, "location"));
            assertEquals("DE", doc.lookup("C").first("attr", "name", "location").orElseThrow().text());
            assertEquals(1, doc.lookup("C").children("attr").size());
        }

        @Test
        void knownValueAddsNoState() {
            TraitEditor.setDiscreteAttribute(doc, "B", "location", "UK", "taxa");
            assertEquals(List.of("UK", "FR"), TraitEditor.states(doc, "location"));
        }

        @Test
        void continuousAttributeLeavesDataTypesAlone() {
            TraitEditor.setAttribute(doc, "A", "latitude", "51.5");

            assertEquals("51.5", doc.lookup("A").first("attr", "name", "latitude").orElseThrow().text());
            assertFalse(doc.declares(TraitEditor.dataTypeId("latitude")));
        }

        @Test
        void onlyTaxaCarryAttributes() {
            assertThrows(EditException.class, () -> TraitEditor.setAttribute(doc, "D", "location", "UK"));
            assertThrows(EditException.class, () -> TraitEditor.setAttribute(doc, "location.model", "location", "UK"));
        }

        @Test
        void dataTypeIsCreatedForNewTrait() {
            var skeleton = Fixtures.skeleton();

            TraitEditor.setDiscreteAttribute(skeleton, "placeholder", "host", "human", "taxa");

            var dataType = skeleton.lookup("host.dataType");
            var patterns = skeleton.lookup("host.pattern");
            var root = skeleton.root();
            assertEquals(root.indexOf(skeleton.lookup("taxa")) + 1, root.indexOf(dataType));
            assertEquals(root.indexOf(dataType) + 1, root.indexOf(patterns));
            assertEquals("host", patterns.attribute("attribute"));
            assertEquals(List.of("human"), TraitEditor.states(skeleton, "host"));
            skeleton.validate();
        }

        @Test
        void statesOfUnknownTrait() {
            assertThrows(EditException.class, () -> TraitEditor.states(doc, "host"));
        }
    }

    @Nested
    class Dimensions {

        @Test
        void followStateCount() {
            TraitEditor.setDiscreteAttribute(doc, "C", "location", "DE", "taxa");

            assertEquals(3, TraitEditor.updateDimensions(doc, "location"));

            assertEquals("3", doc.lookup("location.frequencies").attribute("dimension"));
            assertEquals("3", doc.lookup("location.root.frequencies").attribute("dimension"));
            assertEquals("3", doc.lookup("location.rates").attribute("dimension"));
            var indicators = doc.lookup("location.indicators");
            assertEquals("3", indicators.attribute("dimension"));
            assertEquals("1.0", indicators.attribute("value"));
        }

        @Test
        void asymmetricRatesCoverOrderedPairs() {
            doc.lookup("location.model").setAttribute("symmetric", "false");
            TraitEditor.setDiscreteAttribute(doc, "C", "location", "DE", "taxa");

            TraitEditor.updateDimensions(doc, "location");

            assertEquals("6", doc.lookup("location.rates").attribute("dimension"));
        }

        @Test
        void vectorValuesAreResized() {
            var parameter = new Element("parameter").setAttribute("value", "0.5 0.7");

            TraitEditor.setDimension(parameter, 3);

            assertEquals("3", parameter.attribute("dimension"));
            assertEquals("0.5 0.5 0.5", parameter.attribute("value"));
        }

        @Test
        void missingParametersAreSkipped() {
            var skeleton = Fixtures.skeleton();
            TraitEditor.setDiscreteAttribute(skeleton, "placeholder", "host", "human", "taxa");

            assertEquals(1, TraitEditor.updateDimensions(skeleton, "host"));
        }
    }
}
