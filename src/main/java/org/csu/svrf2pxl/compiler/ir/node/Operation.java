package org.csu.svrf2pxl.compiler.ir.node;

/**
 * Operations that compute a derived layer from other layers.
 */
public enum Operation {
    AND(true),
    OR(true),
    XOR(true),
    /** one operand: complement; two operands: first minus second */
    NOT(false),
    SIZE(false),
    GROW(false),
    SHRINK(false),
    /** keep shapes whose area satisfies the comparator and threshold parameters */
    SELECT_AREA(false),
    /** plain alias, {@code a = b} */
    COPY(false),
    /** a target-language call the operation table could not map back to an operation */
    EXTERNAL_FUNCTION(false);

    private final boolean associative;

    Operation(boolean associative) {
        this.associative = associative;
    }

    public boolean isAssociative() {
        return associative;
    }
}
