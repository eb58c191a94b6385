package com.regnet.engine;

import java.util.List;

/**
 * A non-process node carries a class other than macromolecule.
 */
public final class ClassConsistencyException extends NetworkValidationException {
    private static final long serialVersionUID = 1L;

    private final List<String> labels;

    public ClassConsistencyException(List<String> labels) {
        super("Only the process node may have Class=biological_activity; offending nodes: " + labels);
        this.labels = List.copyOf(labels);
    }

    public List<String> labels() {
        return labels;
    }
}
