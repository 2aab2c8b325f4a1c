package org.phylo.beastxml.bind;

import java.util.Objects;

/**
 * A trait declared by the dataset, e.g. {@code location}.
 */
public record TraitBinding(String name, TraitKind kind) {

    public TraitBinding {
        Objects.requireNonNull(name, "Trait name cannot be null");
        Objects.requireNonNull(kind, "Trait kind cannot be null");
    }
}
