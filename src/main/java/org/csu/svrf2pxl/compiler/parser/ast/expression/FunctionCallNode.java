package org.csu.svrf2pxl.compiler.parser.ast.expression;

import org.csu.svrf2pxl.compiler.lexer.Token;
import org.csu.svrf2pxl.compiler.parser.ast.ExpressionNode;

import java.util.List;

/**
 * AST 节点: 测量或派生层函数, e.g. {@code WIDTH METAL1}, {@code SIZE POLY BY 0.1}
 *
 * @param function  the keyword token naming the function
 * @param arguments layer operands and numeric parameters in source order ({@code BY} dropped)
 */
public record FunctionCallNode(Token function, List<ExpressionNode> arguments) implements ExpressionNode {

    @Override
    public int line() {
        return function.line();
    }
}
