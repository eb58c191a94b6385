package com.regnet.engine;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Edges reference node labels that are not in the node table. Carries every
 * unknown label, in first-seen order, split by endpoint role.
 */
public final class DanglingReferenceException extends NetworkValidationException {
    private static final long serialVersionUID = 1L;

    private final Set<String> unknownSources;
    private final Set<String> unknownTargets;

    public DanglingReferenceException(Set<String> unknownSources, Set<String> unknownTargets) {
        super("Edges reference unknown nodes:\n sources=" + unknownSources + "\n targets=" + unknownTargets);
        this.unknownSources = Collections.unmodifiableSet(new LinkedHashSet<>(unknownSources));
        this.unknownTargets = Collections.unmodifiableSet(new LinkedHashSet<>(unknownTargets));
    }

    public Set<String> unknownSources() {
        return unknownSources;
    }

    public Set<String> unknownTargets() {
        return unknownTargets;
    }
}
