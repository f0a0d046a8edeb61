package org.csu.svrf2pxl.compiler.parser.ast.statement;

import org.csu.svrf2pxl.compiler.parser.ast.ExpressionNode;
import org.csu.svrf2pxl.compiler.parser.ast.StatementNode;

/**
 * AST 节点: name = expression
 */
public record AssignmentNode(String name, ExpressionNode expression, int line) implements StatementNode {
}
