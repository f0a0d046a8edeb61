package org.csu.svrf2pxl.compiler.parser.ast.statement;

import org.csu.svrf2pxl.compiler.parser.ast.StatementNode;

/**
 * AST 节点: LAYER name number [DATATYPE number]
 */
public record LayerDeclarationNode(String name, int layerNumber, int datatype, int line) implements StatementNode {
}
