package org.csu.svrf2pxl.compiler.parser.ast;

public interface ExpressionNode extends AstNode {
}
