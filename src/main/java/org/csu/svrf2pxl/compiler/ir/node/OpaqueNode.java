package org.csu.svrf2pxl.compiler.ir.node;

import lombok.Getter;

import java.util.List;

/**
 * Source text the translator cannot express. The generator passes it through as a marked
 * comment; it never invents target syntax for it.
 */
@Getter
public class OpaqueNode extends IrNode {
    private final String rawText;
    private final String reason;

    /**
     * @param synthetic true for unsupported statements that declare no symbol of their own
     */
    public OpaqueNode(String symbol, int line, boolean synthetic, String rawText, String reason) {
        super(symbol, line, synthetic);
        this.rawText = rawText;
        this.reason = reason;
    }

    @Override
    public List<String> getDependencies() {
        return List.of();
    }

    @Override
    public String describe() {
        return "OPAQUE " + rawText;
    }
}
