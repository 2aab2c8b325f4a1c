package org.phylo.beastxml.edit;

import org.phylo.beastxml.xml.BeastDocument;
import org.phylo.beastxml.xml.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Adds predictors to a discrete-trait GLM ({@code <glmSubstitutionModel>}).
 *
 * A predictor is a square matrix over the trait's states; BEAST stores only
 * its off-diagonal values. After each insertion the coefficient and indicator
 * dimensions follow the number of predictors, and optionally the binomial
 * inclusion prior is adjusted so that no predictor being included keeps a
 * prior probability of one half.
 */
public final class PredictorEditor {

    private static final Logger LOGGER = LoggerFactory.getLogger(PredictorEditor.class);

    private static final String GLM_MODEL = "glmSubstitutionModel";
    private static final String PARAMETER = "parameter";

    private PredictorEditor() {
        // Static utility class
    }

    /**
     * Adds a table, as a matrix predictor if its columns are states and as a
     * scalar predictor (named by its value column) otherwise.
     */
    public static void addPredictor(BeastDocument document, String name, PredictorTable table,
                                    PredictorOptions options) {
        if (table.rows().size() < 2) {
            throw new IllegalArgumentException("Predictor table should contain at least 2 rows");
        }
        if (table.isMatrix()) {
            addMatrixPredictor(document, name, table, options);
        } else if (table.isScalar()) {
            addScalarPredictor(document, table, options);
        } else {
            throw new IllegalArgumentException("Predictor type cannot be determined from " + table.columns().size()
                    + " columns and " + table.rows().size() + " rows");
        }
    }

    /**
     * Adds {@code prefix.column_origin} and {@code prefix.column_destination},
     * where the column is the table's only value column.
     */
    public static void addScalarPredictor(BeastDocument document, PredictorTable table, PredictorOptions options) {
        if (!table.isScalar()) {
            throw new IllegalArgumentException("Scalar predictor needs exactly one value column");
        }
        List<String> states = states(document, options);
        checkStates(table.rows(), states, "Rows");
        String column = table.columns().get(0);

        int n = states.size();
        double[][] origin = new double[n][n];
        double[][] destination = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                origin[i][j] = table.value(states.get(i), column);
                destination[i][j] = table.value(states.get(j), column);
            }
        }
        insert(document, options.prefix() + "." + column + "_origin", origin, options);
        insert(document, options.prefix() + "." + column + "_destination", destination, options);
    }

    /**
     * Adds {@code prefix.name}, reordering rows and columns to the document's state order.
     */
    public static void addMatrixPredictor(BeastDocument document, String name, PredictorTable table,
                                          PredictorOptions options) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Matrix predictor needs a name");
        }
        List<String> states = states(document, options);
        checkStates(table.rows(), states, "Rows");
        checkStates(table.columns(), states, "Columns");

        int n = states.size();
        double[][] matrix = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                matrix[i][j] = table.value(states.get(i), states.get(j));
            }
        }
        insert(document, options.prefix() + "." + name, matrix, options);
    }

    // ========== VALUES ==========

    /**
     * Log-transforms and standardises the off-diagonal values; the diagonal becomes NaN.
     * Mean and (population) standard deviation are taken over the off-diagonal values.
     */
    static double[][] transform(double[][] matrix, boolean log, boolean standardise) {
        int n = matrix.length;
        double[][] result = new double[n][];
        for (int i = 0; i < n; i++) {
            if (matrix[i].length != n) {
                throw new IllegalArgumentException("Expected a square matrix");
            }
            result[i] = matrix[i].clone();
        }
        if (log) {
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < n; j++) {
                    if (i == j) {
                        continue;
                    }
                    if (result[i][j] <= 0) {
                        throw new IllegalArgumentException("Cannot log-transform predictor values <= 0");
                    }
                    result[i][j] = Math.log(result[i][j]);
                }
            }
        }
        if (standardise) {
            int count = n * (n - 1);
            double sum = 0;
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < n; j++) {
                    sum += i == j ? 0 : result[i][j];
                }
            }
            double mean = sum / count;
            double squares = 0;
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < n; j++) {
                    squares += i == j ? 0 : (result[i][j] - mean) * (result[i][j] - mean);
                }
            }
            double sd = Math.sqrt(squares / count);
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < n; j++) {
                    result[i][j] = (result[i][j] - mean) / sd;
                }
            }
        }
        for (int i = 0; i < n; i++) {
            result[i][i] = Double.NaN;
        }
        return result;
    }

    /**
     * Flattens as BEAUti does: the upper triangle row by row, then the lower
     * triangle column by column.
     */
    static String flatten(double[][] matrix) {
        int n = matrix.length;
        List<String> values = new ArrayList<>(n * (n - 1));
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                values.add(String.valueOf(matrix[i][j]));
            }
        }
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                values.add(String.valueOf(matrix[j][i]));
            }
        }
        return String.join(" ", values);
    }

    // ========== DOCUMENT ==========

    private static void insert(BeastDocument document, String id, double[][] matrix, PredictorOptions options) {
        String values = flatten(transform(matrix, options.logTransform(), options.standardise()));
        Element model = model(document, options);
        Element variables = path(model, "glmModel", "independentVariables");
        Element design = variables.first("designMatrix")
                .orElseThrow(() -> new EditException("No <designMatrix> in '" + options.modelId() + "'"));

        Element existing = design.first(PARAMETER, Element.ID, id).orElse(null);
        if (existing != null) {
            LOGGER.warn("A predictor named '{}' already exists. Values will be overwritten.", id);
            existing.setAttribute("value", values);
        } else {
            document.attach(design, new Element(PARAMETER).setAttribute(Element.ID, id).setAttribute("value", values));
        }

        int predictors = design.children(PARAMETER).size();
        for (Element coefficients : variables.children(PARAMETER)) {
            TraitEditor.setDimension(coefficients, predictors);
        }
        Element indicator = variables.first("indicator").flatMap(e -> e.first(PARAMETER)).orElse(null);
        if (indicator != null) {
            TraitEditor.setDimension(indicator, predictors);
        }
        if (options.updatePrior()) {
            if (indicator == null || indicator.id() == null) {
                throw new EditException("GLM '" + options.modelId() + "' has no indicator parameter");
            }
            updateInclusionPrior(document, indicator.id(), predictors);
        }
        LOGGER.debug("GLM '{}' now has {} predictors", options.modelId(), predictors);
    }

    /**
     * Sets the per-predictor inclusion probability p so that (1 - p)^n = 1/2.
     */
    private static void updateInclusionPrior(BeastDocument document, String indicatorId, int predictors) {
        Element prior = null;
        for (Element reference : document.registry().referencesTo(indicatorId)) {
            Element counts = reference.parent();
            if (counts != null && "counts".equals(counts.tag()) && counts.parent() != null
                    && "binomialLikelihood".equals(counts.parent().tag())) {
                prior = counts.parent();
                break;
            }
        }
        if (prior == null) {
            throw new EditException("No <binomialLikelihood> prior pointing to '" + indicatorId + "' found");
        }
        Element proportion = path(prior, "proportion", PARAMETER);
        double probability = 1 - Math.exp(Math.log(0.5) / predictors);
        proportion.setAttribute("value", String.valueOf(probability));
    }

    private static Element model(BeastDocument document, PredictorOptions options) {
        return document.findTopLevel(GLM_MODEL, options.modelId())
                .orElseThrow(() -> new EditException("No <" + GLM_MODEL + "> block with id '"
                        + options.modelId() + "' found"));
    }

    private static Element path(Element from, String... tags) {
        Element current = from;
        for (String tag : tags) {
            Element parent = current;
            current = parent.first(tag)
                    .orElseThrow(() -> new EditException("No <" + tag + "> found under " + parent.path()));
        }
        return current;
    }

    private static void checkStates(List<String> given, List<String> states, String what) {
        if (!given.containsAll(states)) {
            Set<String> missing = new HashSet<>(states);
            missing.removeAll(given);
            throw new IllegalArgumentException(what + " of predictor data do not contain all states listed "
                    + "in the document: missing " + missing);
        }
        if (!states.containsAll(given)) {
            LOGGER.warn("Predictor data contains states not listed in the document; these are ignored");
        }
    }

    private static List<String> states(BeastDocument document, PredictorOptions options) {
        Element dataType = document.findTopLevel("generalDataType", options.dataTypeId())
                .orElseThrow(() -> new EditException("No <generalDataType> block with id '"
                        + options.dataTypeId() + "' found"));
        List<String> states = new ArrayList<>();
        for (Element state : dataType.children("state")) {
            states.add(state.attribute("code"));
        }
        return states;
    }
}
