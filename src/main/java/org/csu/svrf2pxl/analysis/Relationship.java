package org.csu.svrf2pxl.analysis;

/**
 * How source symbols correspond to target symbols.
 */
public enum Relationship {
    ONE_TO_ONE("1:1"),
    MANY_TO_ONE("N:1"),
    ONE_TO_MANY("1:N"),
    SEMANTIC_EQUIVALENT("~"),
    SOURCE_ONLY("src only"),
    TARGET_ONLY("tgt only");

    private final String label;

    Relationship(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * True for the two kinds that mean a symbol has no counterpart at all.
     */
    public boolean isMismatch() {
        return this == SOURCE_ONLY || this == TARGET_ONLY;
    }
}
