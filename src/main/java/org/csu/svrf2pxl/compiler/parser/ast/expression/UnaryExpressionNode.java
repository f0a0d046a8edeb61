package org.csu.svrf2pxl.compiler.parser.ast.expression;

import org.csu.svrf2pxl.compiler.lexer.Token;
import org.csu.svrf2pxl.compiler.parser.ast.ExpressionNode;

public record UnaryExpressionNode(Token operator, ExpressionNode operand) implements ExpressionNode {

    @Override
    public int line() {
        return operator.line();
    }
}
