package org.csu.svrf2pxl.compiler.parser.ast.statement;

import org.csu.svrf2pxl.compiler.parser.ast.ExpressionNode;
import org.csu.svrf2pxl.compiler.parser.ast.StatementNode;

/**
 * AST 节点: 规则块中没有名字的检查, e.g. {@code WIDTH METAL1 < 0.09}
 *
 * Only legal inside a rule block; the enclosing block lends it a name.
 */
public record ExpressionStatementNode(ExpressionNode expression, int line) implements StatementNode {
}
