package org.csu.svrf2pxl.compiler.ir.node;

import lombok.Getter;

import java.util.List;

/**
 * A drawn layer read straight from the layout by (layer number, datatype).
 */
@Getter
public class LayerNode extends IrNode {
    private final int gdsLayer;
    private final int datatype;

    public LayerNode(String symbol, int line, int gdsLayer, int datatype) {
        super(symbol, line, false);
        this.gdsLayer = gdsLayer;
        this.datatype = datatype;
    }

    @Override
    public List<String> getDependencies() {
        return List.of();
    }

    @Override
    public String describe() {
        return "LAYER " + gdsLayer + " DATATYPE " + datatype;
    }
}
