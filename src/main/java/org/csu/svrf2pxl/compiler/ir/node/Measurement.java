package org.csu.svrf2pxl.compiler.ir.node;

/**
 * Measurements a check compares against a threshold.
 */
public enum Measurement {
    WIDTH("Width", "um"),
    SPACING("Spacing", "um"),
    INTERNAL("Internal spacing", "um"),
    ENCLOSURE("Enclosure", "um"),
    AREA("Area", "um^2"),
    DENSITY("Density", ""),
    LENGTH("Length", "um");

    private final String displayName;
    private final String unit;

    Measurement(String displayName, String unit) {
        this.displayName = displayName;
        this.unit = unit;
    }

    public String displayName() {
        return displayName;
    }

    public String unit() {
        return unit;
    }
}
