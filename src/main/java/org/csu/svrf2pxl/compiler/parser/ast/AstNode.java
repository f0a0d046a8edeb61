package org.csu.svrf2pxl.compiler.parser.ast;

/**
 * @description: 所有AST节点的根接口
 *
 * Every node remembers the source line it came from so later stages can point at it.
 */
public interface AstNode {
    int line();
}
