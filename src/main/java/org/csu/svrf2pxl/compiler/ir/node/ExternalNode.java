package org.csu.svrf2pxl.compiler.ir.node;

import java.util.List;

/**
 * Stand-in for a name a target deck uses but defines elsewhere, e.g. in an included file.
 */
public class ExternalNode extends IrNode {

    public ExternalNode(String symbol) {
        super(symbol, 0, true);
    }

    @Override
    public List<String> getDependencies() {
        return List.of();
    }

    @Override
    public String describe() {
        return "EXTERNAL";
    }
}
