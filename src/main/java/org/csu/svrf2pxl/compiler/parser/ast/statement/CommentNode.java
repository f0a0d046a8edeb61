package org.csu.svrf2pxl.compiler.parser.ast.statement;

import org.csu.svrf2pxl.compiler.parser.ast.StatementNode;

public record CommentNode(String text, int line) implements StatementNode {
}
