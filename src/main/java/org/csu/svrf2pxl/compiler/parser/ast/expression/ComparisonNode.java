package org.csu.svrf2pxl.compiler.parser.ast.expression;

import org.csu.svrf2pxl.compiler.lexer.Token;
import org.csu.svrf2pxl.compiler.parser.ast.ExpressionNode;

/**
 * AST 节点: 测量结果与阈值的比较 (e.g., WIDTH METAL1 < 0.09)
 */
public record ComparisonNode(
        ExpressionNode expression,
        Token operator,
        LiteralNode value
) implements ExpressionNode {

    @Override
    public int line() {
        return operator.line();
    }
}
