package org.csu.svrf2pxl.codegen;

import lombok.extern.slf4j.Slf4j;
import org.csu.svrf2pxl.common.diagnostic.Diagnostic;
import org.csu.svrf2pxl.common.diagnostic.DiagnosticKind;
import org.csu.svrf2pxl.common.exception.UnmappableOperationException;
import org.csu.svrf2pxl.compiler.ir.IrGraph;
import org.csu.svrf2pxl.compiler.ir.node.CheckNode;
import org.csu.svrf2pxl.compiler.ir.node.DerivedNode;
import org.csu.svrf2pxl.compiler.ir.node.ExternalNode;
import org.csu.svrf2pxl.compiler.ir.node.IrNode;
import org.csu.svrf2pxl.compiler.ir.node.LayerNode;
import org.csu.svrf2pxl.compiler.ir.node.OpaqueNode;
import org.csu.svrf2pxl.compiler.ir.node.Operation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * @description: PXL 代码生成器
 *
 * Walks an {@link IrGraph} in dependency order and writes one target statement per symbol,
 * two per check. Every function name comes from the {@link OperationTable}.
 */
@Slf4j
public class PxlCodeGenerator {

    static final String RULE = "// ============================================================================";
    static final String SECTION = "// ----------------------------------------------------------------------------";

    public static final String LAYER_KIND = "LAYER";
    public static final String REPORT_KIND = "REPORT";

    private final GenerationMode mode;

    public PxlCodeGenerator() {
        this(GenerationMode.LENIENT);
    }

    public PxlCodeGenerator(GenerationMode mode) {
        this.mode = mode;
    }

    /**
     * @throws UnmappableOperationException in strict mode, for the first node the table cannot express
     * @throws org.csu.svrf2pxl.common.exception.CyclicDefinitionException if the graph is not ordered
     */
    public GenerationResult generate(IrGraph graph, OperationTable table) {
        List<IrNode> order = graph.topologicalOrder();
        List<IrNode> layers = new ArrayList<>();
        List<IrNode> rules = new ArrayList<>();
        for (IrNode node : order) {
            if (node instanceof LayerNode) {
                layers.add(node);
            } else if (!(node instanceof ExternalNode)) {
                rules.add(node);
            }
        }

        Emitter emitter = new Emitter(table);
        List<String> out = emitter.lines;
        out.add(RULE);
        out.add("// Translated rule deck (" + table.getName() + ")");
        out.add("// Generated by svrf2pxl. Review before sign-off.");
        out.add(RULE);
        out.addAll(table.getHeader());
        out.add("");
        section(out, "Layer definitions");
        layers.forEach(emitter::emit);
        out.add("");
        section(out, "Derived layers and rule checks");
        rules.forEach(emitter::emit);
        out.add("");
        out.addAll(table.getFooter());
        out.add(RULE);
        out.add("// End of translated rule deck");
        out.add(RULE);

        log.debug("Generated {} statements for {} symbols, {} placeholders",
                emitter.statements, order.size(), emitter.placeholders.size());
        return new GenerationResult(String.join("\n", out) + "\n", List.copyOf(emitter.diagnostics),
                List.copyOf(emitter.placeholders), emitter.statements);
    }

    /**
     * The target statements for a single node, without comments or banners.
     *
     * @throws UnmappableOperationException if the table has no usable template for it
     */
    public List<String> statementsFor(IrNode node, OperationTable table) {
        if (node instanceof LayerNode layer) {
            return List.of(assign(layer.getSymbol(), apply(table, LAYER_KIND, layer, List.of(),
                    List.of(String.valueOf(layer.getGdsLayer()), String.valueOf(layer.getDatatype())), false)));
        }
        if (node instanceof CheckNode check) {
            String measured = apply(table, check.getMeasurement().name(), check, check.getTargets(),
                    check.getParameters(), false);
            String statement = assign(check.getSymbol(),
                    measured + " " + check.getComparator().symbol() + " " + check.getFormattedThreshold());
            return List.of(statement, report(table, check, check.getRuleName(), check.getMessage()));
        }
        if (node instanceof DerivedNode derived) {
            String expression;
            if (derived.getOperation() == Operation.EXTERNAL_FUNCTION) {
                List<String> args = new ArrayList<>(derived.getOperands());
                args.addAll(derived.getParameters());
                expression = derived.getFunctionName() + "(" + String.join(", ", args) + ")";
            } else {
                expression = apply(table, derived.getOperation().name(), derived, derived.getOperands(),
                        derived.getParameters(), derived.getOperation().isAssociative());
            }
            if (derived.isReported()) {
                String message = derived.getMessage() != null ? derived.getMessage()
                        : "Rule " + derived.getRuleName() + " violation";
                return List.of(assign(derived.getSymbol(), expression),
                        report(table, derived, derived.getRuleName(), message));
            }
            return List.of(assign(derived.getSymbol(), expression));
        }
        return List.of();
    }

    private String report(OperationTable table, IrNode node, String ruleName, String message) {
        return apply(table, REPORT_KIND, node, List.of(node.getSymbol()),
                List.of(escape(ruleName), escape(message)), false) + ";";
    }

    private String apply(OperationTable table, String kind, IrNode node, List<String> operands,
                         List<String> parameters, boolean associative) {
        int arity = operands.size();
        Optional<String> found = table.lookup(kind, arity);
        if (found.isEmpty() && associative && arity > 2) {
            found = table.lookup(kind, 2);
        }
        String template = found.orElseThrow(() -> unmappable(node, kind, arity));
        boolean variadic = template.contains("{args}");
        if (!variadic && associative && arity > 2 && OperationTable.placeholderCount(template) == 2) {
            String folded = OperationTable.render(template, List.of(operands.get(0), operands.get(1)));
            for (int i = 2; i < arity; i++) {
                folded = OperationTable.render(template, List.of(folded, operands.get(i)));
            }
            return folded;
        }
        List<String> arguments = new ArrayList<>(operands);
        arguments.addAll(parameters);
        if (OperationTable.placeholderCount(template) > arguments.size()) {
            throw unmappable(node, kind, arity);
        }
        return OperationTable.render(template, arguments);
    }

    private static UnmappableOperationException unmappable(IrNode node, String kind, int arity) {
        String operation = arity > 0 ? kind + "/" + arity : kind;
        return new UnmappableOperationException(node.getSymbol(), operation, node.getLine());
    }

    private static String assign(String symbol, String expression) {
        return symbol + " = " + expression + ";";
    }

    static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private static void section(List<String> out, String title) {
        out.add(SECTION);
        out.add("// " + title);
        out.add(SECTION);
    }

    /**
     * Per-run state: emitted lines and the symbols that could not be translated.
     */
    private final class Emitter {
        private final OperationTable table;
        private final List<String> lines = new ArrayList<>();
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private final List<String> placeholders = new ArrayList<>();
        // symbols with no target definition; anything reading them is a placeholder too
        private final Set<String> missing = new LinkedHashSet<>();
        private int statements;

        Emitter(OperationTable table) {
            this.table = table;
        }

        void emit(IrNode node) {
            if (node instanceof OpaqueNode opaque) {
                passThrough(opaque);
                return;
            }
            Optional<String> blockedBy = node.getDependencies().stream().filter(missing::contains).findFirst();
            if (blockedBy.isPresent()) {
                placeholder(node, "depends on untranslated '" + blockedBy.get() + "'");
                return;
            }
            List<String> statementLines;
            try {
                statementLines = statementsFor(node, table);
            } catch (UnmappableOperationException e) {
                if (mode == GenerationMode.STRICT) {
                    throw e;
                }
                log.warn("{}; emitting placeholder", e.getMessage());
                placeholder(node, "no operation table entry for " + e.getOperation());
                return;
            }
            if (node instanceof CheckNode check) {
                lines.add("");
                if (check.hasDescription()) {
                    lines.add("// " + check.getMessage());
                }
            } else if (node instanceof DerivedNode derived && derived.isReported()) {
                lines.add("");
                if (derived.getMessage() != null) {
                    lines.add("// " + derived.getMessage());
                }
            }
            lines.addAll(statementLines);
            statements += statementLines.size();
        }

        private void passThrough(OpaqueNode opaque) {
            missing.add(opaque.getSymbol());
            lines.add("");
            lines.add("// TODO: translate manually (line " + opaque.getLine() + "): " + opaque.getReason());
            for (String raw : opaque.getRawText().split("\\R")) {
                lines.add("// SVRF: " + raw);
            }
        }

        private void placeholder(IrNode node, String reason) {
            missing.add(node.getSymbol());
            placeholders.add(node.getSymbol());
            diagnostics.add(Diagnostic.of(DiagnosticKind.UNMAPPABLE_OPERATION, node.getLine(), node.getSymbol(),
                    "'" + node.getSymbol() + "' " + reason));
            lines.add("");
            lines.add("// TODO: UNMAPPED " + node.getSymbol() + " (line " + node.getLine() + "): " + reason);
            lines.add("// SVRF: " + node.getSymbol() + " = " + node.describe());
        }
    }
}
