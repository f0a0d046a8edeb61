package org.csu.svrf2pxl.compiler.parser.ast.expression;

import org.csu.svrf2pxl.compiler.lexer.Token;
import org.csu.svrf2pxl.compiler.parser.ast.ExpressionNode;

import java.math.BigDecimal;

/**
 * AST 节点: 表示一个数值字面量
 *
 * @param literal the original token, unit suffix included
 * @param value   the value in microns ({@code nm} already divided by 1000)
 */
public record LiteralNode(Token literal, BigDecimal value) implements ExpressionNode {

    @Override
    public int line() {
        return literal.line();
    }
}
