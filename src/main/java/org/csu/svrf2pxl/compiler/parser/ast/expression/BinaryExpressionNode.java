package org.csu.svrf2pxl.compiler.parser.ast.expression;

import org.csu.svrf2pxl.compiler.lexer.Token;
import org.csu.svrf2pxl.compiler.parser.ast.ExpressionNode;

/**
 * AST 节点: 表示一个二元布尔运算 (e.g., METAL1 AND VIA1, or prefix form AND METAL1 VIA1)
 */
public record BinaryExpressionNode(
        ExpressionNode left,
        Token operator,
        ExpressionNode right
) implements ExpressionNode {

    @Override
    public int line() {
        return operator.line();
    }
}
