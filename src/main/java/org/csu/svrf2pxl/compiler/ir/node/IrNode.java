package org.csu.svrf2pxl.compiler.ir.node;

import lombok.Getter;

import java.util.List;

/**
 * @description: 所有IR节点的抽象基类
 *
 * A node is the definition of one named symbol of a rule deck. Nodes are immutable and only
 * refer to other nodes by symbol name, so one graph can be shared read-only by the classifier
 * and the code generator.
 */
@Getter
public abstract class IrNode {
    private final String symbol;
    private final int line;
    // hoisted sub-expressions and pass-through placeholders; not user variables
    private final boolean synthetic;

    protected IrNode(String symbol, int line, boolean synthetic) {
        this.symbol = symbol;
        this.line = line;
        this.synthetic = synthetic;
    }

    /**
     * Symbols this node reads, in operand order. Leaves return an empty list.
     */
    public abstract List<String> getDependencies();

    /**
     * Short label of what this node computes, used by the classifier and reports.
     */
    public abstract String describe();
}
