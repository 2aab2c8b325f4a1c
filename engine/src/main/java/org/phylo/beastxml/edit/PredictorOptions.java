package org.phylo.beastxml.edit;

import java.util.Objects;

/**
 * Where a GLM predictor goes and how its values are transformed.
 *
 * @param dataTypeId   Id of the {@code <generalDataType>} listing the states
 * @param modelId      Id of the {@code <glmSubstitutionModel>}
 * @param prefix       Predictor ids are {@code prefix.name}
 * @param logTransform Log-transform off-diagonal values
 * @param standardise  Standardise off-diagonal values (after the log transform)
 * @param updatePrior  Keep the prior probability of including no predictor at one half
 */
public record PredictorOptions(
        String dataTypeId,
        String modelId,
        String prefix,
        boolean logTransform,
        boolean standardise,
        boolean updatePrior) {

    public PredictorOptions {
        Objects.requireNonNull(dataTypeId, "Data type id cannot be null");
        Objects.requireNonNull(modelId, "Model id cannot be null");
        Objects.requireNonNull(prefix, "Prefix cannot be null");
    }

    public static PredictorOptions defaults() {
        return new PredictorOptions("location.dataType", "location.model", "location", true, true, true);
    }

    public PredictorOptions withTransforms(boolean log, boolean standardiseValues) {
        return new PredictorOptions(dataTypeId, modelId, prefix, log, standardiseValues, updatePrior);
    }

    public PredictorOptions withUpdatePrior(boolean update) {
        return new PredictorOptions(dataTypeId, modelId, prefix, logTransform, standardise, update);
    }
}
