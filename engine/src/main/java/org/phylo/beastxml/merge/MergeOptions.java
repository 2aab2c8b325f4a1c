package org.phylo.beastxml.merge;

import java.util.Objects;
import java.util.Set;

/**
 * Options for a single {@link FragmentMerger#merge} call.
 *
 * @param collisionPolicy   Which side is renamed on a non-equivalent id collision
 * @param isolationPrefix   When set, every id declared by the fragment (except
 *                          document containers and protected ids) becomes
 *                          {@code prefix.id} before merging
 * @param protectedIds      Ids never prefixed (e.g. shared parameters, alignment names)
 * @param ignoredAttributes Attributes left out of the equivalence check
 * @param beforeOperators   Where top-level elements of a fragment without an
 *                          {@code <operators>} block go: before the target's
 *                          operators block (true) or at the end (false)
 */
public record MergeOptions(
        CollisionPolicy collisionPolicy,
        String isolationPrefix,
        Set<String> protectedIds,
        Set<String> ignoredAttributes,
        boolean beforeOperators) {

    public MergeOptions {
        Objects.requireNonNull(collisionPolicy, "Collision policy cannot be null");
        if (isolationPrefix != null && isolationPrefix.isBlank()) {
            throw new IllegalArgumentException("Isolation prefix cannot be blank");
        }
        protectedIds = protectedIds == null ? Set.of() : Set.copyOf(protectedIds);
        ignoredAttributes = ignoredAttributes == null ? Set.of() : Set.copyOf(ignoredAttributes);
    }

    public static MergeOptions defaults() {
        return new MergeOptions(CollisionPolicy.RENAME_INCOMING, null, Set.of(), Set.of(), true);
    }

    public MergeOptions withCollisionPolicy(CollisionPolicy policy) {
        return new MergeOptions(policy, isolationPrefix, protectedIds, ignoredAttributes, beforeOperators);
    }

    public MergeOptions withIsolationPrefix(String prefix) {
        return new MergeOptions(collisionPolicy, prefix, protectedIds, ignoredAttributes, beforeOperators);
    }

    public MergeOptions withProtectedIds(Set<String> ids) {
        return new MergeOptions(collisionPolicy, isolationPrefix, ids, ignoredAttributes, beforeOperators);
    }

    public MergeOptions withIgnoredAttributes(Set<String> attributes) {
        return new MergeOptions(collisionPolicy, isolationPrefix, protectedIds, attributes, beforeOperators);
    }

    public MergeOptions withBeforeOperators(boolean before) {
        return new MergeOptions(collisionPolicy, isolationPrefix, protectedIds, ignoredAttributes, before);
    }

    public boolean isolated() {
        return isolationPrefix != null;
    }
}
