package org.csu.svrf2pxl.compiler.parser.ast.statement;

import org.csu.svrf2pxl.compiler.parser.ast.StatementNode;

import java.util.List;

/**
 * @description: 表示一个命名规则块 {@code NAME { @ description ... }}
 *
 * @param description the {@code @} text, or the first comment inside the block, or null
 * @param body        assignments and anonymous checks in source order
 */
public record RuleBlockNode(
        String name,
        String description,
        List<StatementNode> body,
        int line
) implements StatementNode {
}
