package org.csu.svrf2pxl.compiler.parser.ast;

import java.util.List;

/**
 * AST 根节点: 一个完整的规则文件 (rule deck)
 */
public record DeckNode(List<StatementNode> statements) implements AstNode {

    @Override
    public int line() {
        return 1;
    }
}
