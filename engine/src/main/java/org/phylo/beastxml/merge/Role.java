package org.phylo.beastxml.merge;

import org.phylo.beastxml.xml.Element;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Mergeable container blocks.
 *
 * When a fragment and the target both hold a container with the same role,
 * tag, id and location, the fragment's children are added to the target's
 * container instead of inserting a second one. Every other element is a plain
 * declaration subject to collision handling.
 */
public enum Role {
    OPERATORS("operators", Scope.DOCUMENT),
    MCMC("mcmc", Scope.DOCUMENT),
    JOINT("joint", Scope.DOCUMENT),
    PRIOR("prior", Scope.DOCUMENT),
    LIKELIHOOD("likelihood", Scope.DOCUMENT),
    LOG("log", Scope.DOCUMENT),
    LOG_TREE("logTree", Scope.DOCUMENT),
    TAXA("taxa", Scope.DOCUMENT),
    SITE_MODEL("siteModel", Scope.FRAGMENT);

    /**
     * DOCUMENT containers belong to the shared skeleton and are never prefixed.
     * FRAGMENT containers are per-partition and take the isolation prefix.
     */
    public enum Scope {
        DOCUMENT,
        FRAGMENT
    }

    private static final Map<String, Role> BY_TAG = new HashMap<>();

    static {
        for (Role role : values()) {
            BY_TAG.put(role.tag, role);
        }
    }

    private final String tag;
    private final Scope scope;

    Role(String tag, Scope scope) {
        this.tag = tag;
        this.scope = scope;
    }

    public String tag() {
        return tag;
    }

    public Scope scope() {
        return scope;
    }

    /**
     * @return The container role of a declaring element; references never have one
     */
    public static Optional<Role> of(Element element) {
        if (element.isReference()) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_TAG.get(element.tag()));
    }

    public static boolean isDocumentContainer(Element element) {
        return of(element).map(role -> role.scope == Scope.DOCUMENT).orElse(false);
    }
}
