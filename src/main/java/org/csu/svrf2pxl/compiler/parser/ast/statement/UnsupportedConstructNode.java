package org.csu.svrf2pxl.compiler.parser.ast.statement;

import org.csu.svrf2pxl.compiler.parser.ast.StatementNode;

/**
 * AST 节点: 解析器不认识或无法解析的语句
 *
 * Kept verbatim instead of being dropped so the rest of the pipeline can count it
 * and pass it through.
 *
 * @param syntaxError what the parser expected when the statement was malformed; null for a
 *                    well-formed construct the translator does not support
 */
public record UnsupportedConstructNode(String rawText, int line, String syntaxError) implements StatementNode {

    public UnsupportedConstructNode(String rawText, int line) {
        this(rawText, line, null);
    }

    public boolean isMalformed() {
        return syntaxError != null;
    }
}
