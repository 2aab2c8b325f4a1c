package org.phylo.beastxml.edit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.phylo.beastxml.Fixtures;
import org.phylo.beastxml.xml.BeastDocument;
import org.phylo.beastxml.xml.Element;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * GLM predictors over the states A, B and C.
 */
class PredictorEditorTest {

    private static final String MATRIX = """
            ,A,B,C
            A,0,1,2
            B,3,0,5
            C,6,7,0
            """;

    private static final String SCALAR = """
            state,population
            A,10
            B,20
            C,40
            """;

    private final PredictorOptions raw = PredictorOptions.defaults().withTransforms(false, false);
    private BeastDocument doc;

    @BeforeEach
    void setUp() {
        doc = Fixtures.load(Fixtures.GLM);
    }

    private Element design() {
        return doc.lookup("location.designMatrix");
    }

    private String proportion() {
        return doc.lookup("prior").descendants("proportion").get(0).first("parameter").orElseThrow().attribute("value");
    }

    private static String inclusion(int predictors) {
        return String.valueOf(1 - Math.exp(Math.log(0.5) / predictors));
    }

    @Nested
    @DisplayName("Values")
    class Values {

        @Test
        @DisplayName("Upper triangle by rows, then lower triangle")
        void testFlatten() {
            double[][] matrix = {{0, 1, 2}, {3, 0, 5}, {6, 7, 0}};
            assertEquals("1.0 2.0 5.0 3.0 6.0 7.0", PredictorEditor.flatten(matrix));
        }

        @Test
        @DisplayName("Standardised values have mean 0 and standard deviation 1")
        void testStandardise() {
            double[][] matrix = {{0, 1, 2}, {3, 0, 5}, {6, 7, 0}};

            double[][] result = PredictorEditor.transform(matrix, true, true);

            double[] values = Arrays.stream(PredictorEditor.flatten(result).split(" "))
                    .mapToDouble(Double::parseDouble).toArray();
            double mean = Arrays.stream(values).average().orElseThrow();
            double variance = Arrays.stream(values).map(v -> (v - mean) * (v - mean)).sum() / values.length;
            assertEquals(0, mean, 1e-9);
            assertEquals(1, Math.sqrt(variance), 1e-9);
            assertTrue(Double.isNaN(result[1][1]));
            assertEquals(3, matrix[1][0]);
        }

        @Test
        @DisplayName("Log transform only touches off-diagonal values")
        void testLog() {
            double[][] result = PredictorEditor.transform(new double[][]{{-1, Math.E}, {1, 0}}, true, false);

            assertEquals(1, result[0][1], 1e-12);
            assertEquals(0, result[1][0], 1e-12);
            assertTrue(Double.isNaN(result[0][0]));
        }

        @Test
        @DisplayName("Log transform of non-positive values is rejected")
        void testLogOfZero() {
            assertThrows(IllegalArgumentException.class,
                    () -> PredictorEditor.transform(new double[][]{{0, 0}, {1, 0}}, true, false));
        }

        @Test
        @DisplayName("Non-square matrices are rejected")
        void testNotSquare() {
            assertThrows(IllegalArgumentException.class,
                    () -> PredictorEditor.transform(new double[][]{{0, 1}, {1}}, false, false));
        }
    }

    @Nested
    @DisplayName("Matrix predictors")
    class Matrices {

        @Test
        @DisplayName("New predictor grows coefficients and indicators and adjusts the prior")
        void testAdd() {
            PredictorEditor.addPredictor(doc, "flights", PredictorTable.parse(MATRIX), raw);

            var predictor = doc.lookup("location.flights");
            assertSame(design(), predictor.parent());
            assertEquals("1.0 2.0 5.0 3.0 6.0 7.0", predictor.attribute("value"));
            assertEquals("2", doc.lookup("location.coefficients").attribute("dimension"));
            assertEquals("2", doc.lookup("location.coefIndicators").attribute("dimension"));
            assertEquals(inclusion(2), proportion());
            doc.validate();
        }

        @Test
        @DisplayName("Rows and columns are taken in the document's state order")
        void testReorder() {
            var shuffled = """
                    ,C,A,B
                    C,0,6,7
                    A,2,0,1
                    B,5,3,0
                    """;

            PredictorEditor.addMatrixPredictor(doc, "flights", PredictorTable.parse(shuffled), raw);

            assertEquals("1.0 2.0 5.0 3.0 6.0 7.0", doc.lookup("location.flights").attribute("value"));
        }

        @Test
        @DisplayName("Existing predictor is overwritten")
        void testOverwrite() {
            PredictorEditor.addPredictor(doc, "distance", PredictorTable.parse(MATRIX), raw);

            assertEquals(1, design().childCount());
            assertEquals("1.0 2.0 5.0 3.0 6.0 7.0", doc.lookup("location.distance").attribute("value"));
            assertEquals(inclusion(1), proportion());
        }

        @Test
        @DisplayName("Prior is left alone when asked")
        void testKeepPrior() {
            PredictorEditor.addPredictor(doc, "flights", PredictorTable.parse(MATRIX), raw.withUpdatePrior(false));
            assertEquals("0.5", proportion());
        }

        @Test
        @DisplayName("Every state needs a row and a column")
        void testMissingState() {
            var partial = """
                    ,A,B
                    A,0,1
                    B,3,0
                    """;
            var e = assertThrows(IllegalArgumentException.class,
                    () -> PredictorEditor.addMatrixPredictor(doc, "flights", PredictorTable.parse(partial), raw));
            assertTrue(e.getMessage().contains("C"), e.getMessage());
            assertFalse(doc.declares("location.flights"));
        }

        @Test
        @DisplayName("Matrix predictor needs a name")
        void testName() {
            assertThrows(IllegalArgumentException.class,
                    () -> PredictorEditor.addMatrixPredictor(doc, " ", PredictorTable.parse(MATRIX), raw));
        }

        @Test
        @DisplayName("Unknown GLM model")
        void testNoModel() {
            var options = new PredictorOptions("location.dataType", "other", "location", false, false, true);
            assertThrows(EditException.class,
                    () -> PredictorEditor.addPredictor(doc, "flights", PredictorTable.parse(MATRIX), options));
        }
    }

    @Nested
    @DisplayName("Scalar predictors")
    class Scalars {

        @Test
        @DisplayName("Origin and destination predictors are added")
        void testAdd() {
            PredictorEditor.addPredictor(doc, "ignored", PredictorTable.parse(SCALAR), raw);

            assertEquals("10.0 10.0 20.0 20.0 40.0 40.0", doc.lookup("location.population_origin").attribute("value"));
            assertEquals("20.0 40.0 40.0 10.0 10.0 20.0",
                    doc.lookup("location.population_destination").attribute("value"));
            assertEquals(3, design().childCount());
            assertEquals("3", doc.lookup("location.coefficients").attribute("dimension"));
            assertEquals("0.1", doc.lookup("location.coefficients").attribute("value"));
            assertEquals(inclusion(3), proportion());
        }

        @Test
        @DisplayName("Tables with fewer than two rows are rejected")
        void testTooShort() {
            var table = PredictorTable.parse("state,population\nA,10\n");
            assertThrows(IllegalArgumentException.class, () -> PredictorEditor.addPredictor(doc, "p", table, raw));
        }

        @Test
        @DisplayName("Tables that are neither scalar nor matrix are rejected")
        void testUnknownShape() {
            var table = PredictorTable.parse("state,x,y\nA,1,2\nB,3,4\nC,5,6\n");
            assertThrows(IllegalArgumentException.class, () -> PredictorEditor.addPredictor(doc, "p", table, raw));
        }
    }
}
