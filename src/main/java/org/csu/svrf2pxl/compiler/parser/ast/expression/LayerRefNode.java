package org.csu.svrf2pxl.compiler.parser.ast.expression;

import org.csu.svrf2pxl.compiler.lexer.Token;
import org.csu.svrf2pxl.compiler.parser.ast.ExpressionNode;

/**
 * AST 节点: 对一个层或派生层的引用
 */
public record LayerRefNode(Token name) implements ExpressionNode {

    public String getName() {
        return name.lexeme();
    }

    @Override
    public int line() {
        return name.line();
    }
}
