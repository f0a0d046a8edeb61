package org.csu.svrf2pxl.compiler.ir;

import lombok.extern.slf4j.Slf4j;
import org.csu.svrf2pxl.common.diagnostic.Diagnostic;
import org.csu.svrf2pxl.common.diagnostic.DiagnosticKind;
import org.csu.svrf2pxl.common.exception.CyclicDefinitionException;
import org.csu.svrf2pxl.common.exception.DuplicateSymbolException;
import org.csu.svrf2pxl.common.exception.SemanticException;
import org.csu.svrf2pxl.common.exception.UndefinedSymbolException;
import org.csu.svrf2pxl.compiler.ir.node.CheckNode;
import org.csu.svrf2pxl.compiler.ir.node.Comparator;
import org.csu.svrf2pxl.compiler.ir.node.DerivedNode;
import org.csu.svrf2pxl.compiler.ir.node.IrNode;
import org.csu.svrf2pxl.compiler.ir.node.LayerNode;
import org.csu.svrf2pxl.compiler.ir.node.Measurement;
import org.csu.svrf2pxl.compiler.ir.node.OpaqueNode;
import org.csu.svrf2pxl.compiler.ir.node.Operation;
import org.csu.svrf2pxl.compiler.lexer.TokenType;
import org.csu.svrf2pxl.compiler.parser.ast.DeckNode;
import org.csu.svrf2pxl.compiler.parser.ast.ExpressionNode;
import org.csu.svrf2pxl.compiler.parser.ast.StatementNode;
import org.csu.svrf2pxl.compiler.parser.ast.expression.*;
import org.csu.svrf2pxl.compiler.parser.ast.statement.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * @description: IR 构建器
 * 负责将AST转换为中间表示 (IR) 图
 *
 * One left-to-right pass over the deck. A symbol may only reference symbols declared above
 * it. A symbol whose definition is broken stays out of the graph, and so does everything
 * built on it; unrelated symbols are still built.
 */
@Slf4j
public class IrBuilder {

    private static final Map<TokenType, Measurement> MEASUREMENTS = Map.of(
            TokenType.WIDTH, Measurement.WIDTH,
            TokenType.EXTERNAL, Measurement.SPACING,
            TokenType.INTERNAL, Measurement.INTERNAL,
            TokenType.ENC, Measurement.ENCLOSURE,
            TokenType.AREA, Measurement.AREA,
            TokenType.DENSITY, Measurement.DENSITY,
            TokenType.LENGTH, Measurement.LENGTH
    );

    private static final Map<TokenType, Operation> OPERATIONS = Map.of(
            TokenType.AND, Operation.AND,
            TokenType.OR, Operation.OR,
            TokenType.XOR, Operation.XOR,
            TokenType.NOT, Operation.NOT,
            TokenType.SIZE, Operation.SIZE,
            TokenType.GROW, Operation.GROW,
            TokenType.SHRINK, Operation.SHRINK
    );

    private Map<String, IrNode> symbols;
    private Map<String, Integer> declaredAt;
    private Set<String> unresolved;
    private List<Diagnostic> diagnostics;
    private List<SemanticException> errors;
    private int opaqueCounter;

    public IrBuildResult build(DeckNode deck) {
        symbols = new LinkedHashMap<>();
        declaredAt = new HashMap<>();
        unresolved = new LinkedHashSet<>();
        diagnostics = new ArrayList<>();
        errors = new ArrayList<>();
        opaqueCounter = 0;

        for (StatementNode statement : deck.statements()) {
            if (statement instanceof LayerDeclarationNode layer) {
                buildLayer(layer);
            } else if (statement instanceof AssignmentNode assignment) {
                buildAssignment(assignment.name(), assignment.expression(), assignment.line(), null, null, false);
            } else if (statement instanceof RuleBlockNode block) {
                buildRuleBlock(block);
            } else if (statement instanceof UnsupportedConstructNode unsupported) {
                buildUnsupported(unsupported);
            }
            // comments carry no symbol
        }

        IrGraph graph = new IrGraph(symbols.values());
        log.debug("Built IR graph with {} nodes, {} unresolved symbols, {} diagnostics",
                graph.size(), unresolved.size(), diagnostics.size());
        return new IrBuildResult(graph, List.copyOf(diagnostics), Set.copyOf(unresolved), List.copyOf(errors));
    }

    private void buildLayer(LayerDeclarationNode layer) {
        if (!claim(layer.name(), layer.line())) {
            return;
        }
        symbols.put(layer.name(), new LayerNode(layer.name(), layer.line(), layer.layerNumber(), layer.datatype()));
    }

    private void buildRuleBlock(RuleBlockNode block) {
        int anonymous = 0;
        for (StatementNode statement : block.body()) {
            if (statement instanceof AssignmentNode assignment) {
                buildAssignment(assignment.name(), assignment.expression(), assignment.line(),
                        block.name(), block.description(), false);
            } else if (statement instanceof ExpressionStatementNode bare) {
                anonymous++;
                String name = anonymous == 1 ? block.name() : block.name() + "_" + anonymous;
                buildAssignment(name, bare.expression(), bare.line(), block.name(), block.description(), true);
            } else if (statement instanceof UnsupportedConstructNode unsupported) {
                buildUnsupported(unsupported);
            }
        }
    }

    private void buildUnsupported(UnsupportedConstructNode unsupported) {
        String symbol = "#unsupported@" + unsupported.line();
        while (symbols.containsKey(symbol)) {
            symbol = "#unsupported@" + unsupported.line() + "#" + (++opaqueCounter);
        }
        if (unsupported.isMalformed()) {
            // the parser already reported it as a syntax error
            symbols.put(symbol, new OpaqueNode(symbol, unsupported.line(), true, unsupported.rawText(),
                    "syntax error, expected " + unsupported.syntaxError()));
            return;
        }
        symbols.put(symbol, new OpaqueNode(symbol, unsupported.line(), true, unsupported.rawText(), "unsupported construct"));
        diagnostics.add(Diagnostic.of(DiagnosticKind.UNSUPPORTED_CONSTRUCT, unsupported.line(), null,
                "Unsupported construct passed through: " + unsupported.rawText()));
    }

    /**
     * @param ruleName   rule the symbol reports under when it turns out to be a check
     * @param reportBare whether a non-comparison expression should be reported as a rule result
     */
    private void buildAssignment(String name, ExpressionNode expression, int line,
                                 String ruleName, String description, boolean reportBare) {
        if (!claim(name, line)) {
            return;
        }
        if (!referencesResolve(name, expression, line)) {
            unresolved.add(name);
            return;
        }
        Lowering lowering = new Lowering(name, line);
        try {
            IrNode node;
            if (expression instanceof ComparisonNode comparison) {
                node = lowering.check(comparison, ruleName != null ? ruleName : name, description);
            } else {
                node = lowering.derived(name, expression, false,
                        reportBare ? ruleName : null, reportBare ? description : null);
            }
            lowering.hoisted.forEach(h -> symbols.put(h.getSymbol(), h));
            symbols.put(name, node);
        } catch (UnsupportedExpression e) {
            lowering.hoisted.forEach(h -> declaredAt.remove(h.getSymbol()));
            symbols.put(name, new OpaqueNode(name, line, false, ExpressionPrinter.print(expression), e.getMessage()));
            diagnostics.add(Diagnostic.of(DiagnosticKind.UNSUPPORTED_COMPARISON, line, name, e.getMessage()));
        }
    }

    /**
     * Reserves {@code name}; a second declaration is reported and ignored.
     */
    private boolean claim(String name, int line) {
        Integer first = declaredAt.get(name);
        if (first != null) {
            fail(new DuplicateSymbolException(name, line, first));
            return false;
        }
        declaredAt.put(name, line);
        return true;
    }

    private boolean referencesResolve(String owner, ExpressionNode expression, int line) {
        boolean ok = true;
        Set<String> seen = new LinkedHashSet<>();
        for (LayerRefNode ref : ExpressionPrinter.references(expression)) {
            String target = ref.getName();
            if (!seen.add(target)) {
                continue;
            }
            if (target.equals(owner)) {
                fail(new CyclicDefinitionException(owner, ref.line()));
                ok = false;
            } else if (!declaredAt.containsKey(target)) {
                fail(new UndefinedSymbolException(target, owner, ref.line()));
                ok = false;
            } else if (unresolved.contains(target)) {
                diagnostics.add(Diagnostic.of(DiagnosticKind.UNRESOLVED_DEPENDENCY, line, owner,
                        "'" + owner + "' depends on '" + target + "', which could not be built."));
                ok = false;
            }
        }
        return ok;
    }

    private void fail(SemanticException e) {
        log.debug("IR error: {}", e.getMessage());
        errors.add(e);
        diagnostics.add(e.toDiagnostic());
    }

    /**
     * Lowers one statement's expression tree. Nested sub-expressions become synthetic derived
     * symbols, committed only if the whole statement lowers.
     */
    private final class Lowering {
        private final String owner;
        private final int line;
        private final List<IrNode> hoisted = new ArrayList<>();
        private int temporaries = 0;

        Lowering(String owner, int line) {
            this.owner = owner;
            this.line = line;
        }

        CheckNode check(ComparisonNode comparison, String ruleName, String description) {
            if (!(comparison.expression() instanceof FunctionCallNode call)
                    || !MEASUREMENTS.containsKey(call.function().type())) {
                throw new UnsupportedExpression("Comparison of a non-measurement expression cannot be translated: "
                        + ExpressionPrinter.print(comparison));
            }
            Measurement measurement = MEASUREMENTS.get(call.function().type());
            Comparator comparator = comparatorOf(comparison);
            List<String> targets = new ArrayList<>();
            List<String> parameters = new ArrayList<>();
            splitArguments(call.arguments(), targets, parameters);
            if (targets.isEmpty()) {
                throw new UnsupportedExpression(call.function().lexeme() + " needs at least one layer operand");
            }
            double threshold = comparison.value().value().doubleValue();
            String message = description != null ? description
                    : CheckNode.defaultMessage(measurement, comparator, threshold);
            return new CheckNode(owner, line, measurement, targets, parameters, comparator, threshold, ruleName, message);
        }

        DerivedNode derived(String symbol, ExpressionNode expression, boolean synthetic, String ruleName, String message) {
            if (expression instanceof LayerRefNode ref) {
                return new DerivedNode(symbol, line, synthetic, Operation.COPY, List.of(ref.getName()), List.of(),
                        null, ruleName, message);
            }
            if (expression instanceof BinaryExpressionNode binary) {
                Operation operation = OPERATIONS.get(binary.operator().type());
                List<ExpressionNode> operandTrees = new ArrayList<>();
                if (operation.isAssociative()) {
                    flatten(binary, binary.operator().type(), operandTrees);
                } else {
                    operandTrees.add(binary.left());
                    operandTrees.add(binary.right());
                }
                List<String> operands = new ArrayList<>();
                for (ExpressionNode operand : operandTrees) {
                    operands.add(operandSymbol(operand));
                }
                return new DerivedNode(symbol, line, synthetic, operation, operands, List.of(), null, ruleName, message);
            }
            if (expression instanceof UnaryExpressionNode unary) {
                return new DerivedNode(symbol, line, synthetic, Operation.NOT, List.of(operandSymbol(unary.operand())),
                        List.of(), null, ruleName, message);
            }
            if (expression instanceof FunctionCallNode call && OPERATIONS.containsKey(call.function().type())) {
                List<String> operands = new ArrayList<>();
                List<String> parameters = new ArrayList<>();
                splitArguments(call.arguments(), operands, parameters);
                if (operands.isEmpty()) {
                    throw new UnsupportedExpression(call.function().lexeme() + " needs a layer operand");
                }
                return new DerivedNode(symbol, line, synthetic, OPERATIONS.get(call.function().type()),
                        operands, parameters, null, ruleName, message);
            }
            if (expression instanceof ComparisonNode comparison
                    && comparison.expression() instanceof FunctionCallNode call
                    && call.function().type() == TokenType.AREA) {
                // AREA x > n used as a layer selects shapes by area
                List<String> operands = new ArrayList<>();
                List<String> ignored = new ArrayList<>();
                splitArguments(call.arguments(), operands, ignored);
                if (operands.size() != 1 || !ignored.isEmpty()) {
                    throw new UnsupportedExpression("AREA selection takes exactly one layer");
                }
                return new DerivedNode(symbol, line, synthetic, Operation.SELECT_AREA, operands,
                        List.of(comparatorOf(comparison).symbol(),
                                CheckNode.formatNumber(comparison.value().value().doubleValue())),
                        null, ruleName, message);
            }
            throw new UnsupportedExpression("Expression cannot be expressed as a derived layer: "
                    + ExpressionPrinter.print(expression));
        }

        private void splitArguments(List<ExpressionNode> arguments, List<String> operands, List<String> parameters) {
            for (ExpressionNode argument : arguments) {
                if (argument instanceof LiteralNode literal) {
                    parameters.add(CheckNode.formatNumber(literal.value().doubleValue()));
                } else {
                    operands.add(operandSymbol(argument));
                }
            }
        }

        private String operandSymbol(ExpressionNode operand) {
            if (operand instanceof LayerRefNode ref) {
                return ref.getName();
            }
            if (operand instanceof LiteralNode) {
                throw new UnsupportedExpression("A number cannot be used as a layer operand");
            }
            String name;
            do {
                name = owner + "_t" + (++temporaries);
            } while (declaredAt.containsKey(name));
            DerivedNode node = derived(name, operand, true, null, null);
            declaredAt.put(name, line);
            hoisted.add(node);
            return name;
        }

        private void flatten(ExpressionNode expression, TokenType operator, List<ExpressionNode> out) {
            if (expression instanceof BinaryExpressionNode binary && binary.operator().type() == operator) {
                flatten(binary.left(), operator, out);
                flatten(binary.right(), operator, out);
            } else {
                out.add(expression);
            }
        }

        private Comparator comparatorOf(ComparisonNode comparison) {
            return Comparator.fromSymbol(comparison.operator().lexeme())
                    .orElseThrow(() -> new UnsupportedExpression("Unknown comparator " + comparison.operator().lexeme()));
        }
    }

    /**
     * Thrown while lowering a statement the IR has no shape for; the statement becomes opaque.
     */
    private static final class UnsupportedExpression extends RuntimeException {
        UnsupportedExpression(String message) {
            super(message);
        }
    }
}
