package org.csu.svrf2pxl.compiler.ir;

import org.csu.svrf2pxl.compiler.parser.ast.ExpressionNode;
import org.csu.svrf2pxl.compiler.parser.ast.expression.*;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Walks expression trees for the IR builder: prints them back in SVRF syntax and collects
 * the layer references they contain.
 */
final class ExpressionPrinter {

    private ExpressionPrinter() {
    }

    static String print(ExpressionNode expression) {
        if (expression instanceof LayerRefNode ref) {
            return ref.getName();
        }
        if (expression instanceof LiteralNode literal) {
            return literal.literal().lexeme();
        }
        if (expression instanceof BinaryExpressionNode binary) {
            return "(" + print(binary.left()) + " " + binary.operator().lexeme() + " " + print(binary.right()) + ")";
        }
        if (expression instanceof UnaryExpressionNode unary) {
            return unary.operator().lexeme() + " " + print(unary.operand());
        }
        if (expression instanceof FunctionCallNode call) {
            StringJoiner joiner = new StringJoiner(" ");
            joiner.add(call.function().lexeme());
            call.arguments().forEach(a -> joiner.add(print(a)));
            return joiner.toString();
        }
        if (expression instanceof ComparisonNode comparison) {
            return print(comparison.expression()) + " " + comparison.operator().lexeme() + " "
                    + comparison.value().literal().lexeme();
        }
        throw new IllegalArgumentException("Unknown expression node " + expression);
    }

    /**
     * Layer references in left-to-right source order, duplicates included.
     */
    static List<LayerRefNode> references(ExpressionNode expression) {
        List<LayerRefNode> out = new ArrayList<>();
        collect(expression, out);
        return out;
    }

    private static void collect(ExpressionNode expression, List<LayerRefNode> out) {
        if (expression instanceof LayerRefNode ref) {
            out.add(ref);
        } else if (expression instanceof BinaryExpressionNode binary) {
            collect(binary.left(), out);
            collect(binary.right(), out);
        } else if (expression instanceof UnaryExpressionNode unary) {
            collect(unary.operand(), out);
        } else if (expression instanceof FunctionCallNode call) {
            call.arguments().forEach(a -> collect(a, out));
        } else if (expression instanceof ComparisonNode comparison) {
            collect(comparison.expression(), out);
        }
    }
}
