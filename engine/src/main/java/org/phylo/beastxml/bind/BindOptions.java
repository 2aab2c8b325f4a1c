package org.phylo.beastxml.bind;

import org.phylo.beastxml.merge.CollisionPolicy;

import java.util.Objects;

/**
 * Policies for {@link ParameterBinder#bind}.
 *
 * @param frequencyLinkage  Shared or per-partition base frequencies
 * @param relativeRates     Whether partitions get relative rates (only applied with two or more partitions)
 * @param collisionPolicy   Passed on to every fragment merge
 * @param treeLikelihoodId  Id of the {@code <treeDataLikelihood>} receiving the partitions
 * @param taxaId            Id of the {@code <taxa>} block
 * @param dateDirection     {@code forwards} or {@code backwards}
 * @param dateUnits         Units of taxon dates
 * @param missing           Missing-data characters declared on alignments
 */
public record BindOptions(
        FrequencyLinkage frequencyLinkage,
        boolean relativeRates,
        CollisionPolicy collisionPolicy,
        String treeLikelihoodId,
        String taxaId,
        String dateDirection,
        String dateUnits,
        String missing) {

    public BindOptions {
        Objects.requireNonNull(frequencyLinkage, "Frequency linkage cannot be null");
        Objects.requireNonNull(collisionPolicy, "Collision policy cannot be null");
        Objects.requireNonNull(treeLikelihoodId, "Tree likelihood id cannot be null");
        Objects.requireNonNull(taxaId, "Taxa id cannot be null");
        if (!"forwards".equals(dateDirection) && !"backwards".equals(dateDirection)) {
            throw new IllegalArgumentException("Date direction must be 'forwards' or 'backwards', got " + dateDirection);
        }
        Objects.requireNonNull(dateUnits, "Date units cannot be null");
        Objects.requireNonNull(missing, "Missing characters cannot be null");
    }

    public static BindOptions defaults() {
        return new BindOptions(FrequencyLinkage.PER_PARTITION, true, CollisionPolicy.RENAME_INCOMING,
                "treeLikelihood", "taxa", "forwards", "years", "-");
    }

    public BindOptions withFrequencyLinkage(FrequencyLinkage linkage) {
        return new BindOptions(linkage, relativeRates, collisionPolicy, treeLikelihoodId, taxaId, dateDirection,
                dateUnits, missing);
    }

    public BindOptions withRelativeRates(boolean enabled) {
        return new BindOptions(frequencyLinkage, enabled, collisionPolicy, treeLikelihoodId, taxaId, dateDirection,
                dateUnits, missing);
    }

    public BindOptions withCollisionPolicy(CollisionPolicy policy) {
        return new BindOptions(frequencyLinkage, relativeRates, policy, treeLikelihoodId, taxaId, dateDirection,
                dateUnits, missing);
    }

    public BindOptions withTreeLikelihoodId(String id) {
        return new BindOptions(frequencyLinkage, relativeRates, collisionPolicy, id, taxaId, dateDirection,
                dateUnits, missing);
    }
}
