package org.csu.svrf2pxl.compiler.parser.ast;

/**
 * Marker for nodes that can appear at the top level of a deck or inside a rule block.
 */
public interface StatementNode extends AstNode {
}
