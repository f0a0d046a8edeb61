package org.csu.svrf2pxl.cli.tool;

import lombok.extern.slf4j.Slf4j;
import org.csu.svrf2pxl.analysis.MappingRecord;
import org.csu.svrf2pxl.analysis.Relationship;
import org.csu.svrf2pxl.common.exception.UnmappableOperationException;
import org.csu.svrf2pxl.compiler.ir.IrGraph;
import org.csu.svrf2pxl.compiler.ir.node.CheckNode;
import org.csu.svrf2pxl.compiler.ir.node.DerivedNode;
import org.csu.svrf2pxl.compiler.ir.node.IrNode;
import org.csu.svrf2pxl.compiler.ir.node.LayerNode;
import org.csu.svrf2pxl.compiler.ir.node.OpaqueNode;
import org.csu.svrf2pxl.engine.TranslationResult;
import org.csu.svrf2pxl.engine.Translator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * @description: 同步脚本生成
 *
 * Writes the target statements a reference deck is missing: every SOURCE_ONLY symbol, plus
 * the hoisted temporaries it needs. Layers come first, then derived layers, then checks.
 * A symbol the operation table cannot express is written as a TODO with its source form.
 */
@Slf4j
public class SyncScriptWriter {

    private final Translator translator;

    public SyncScriptWriter(Translator translator) {
        this.translator = translator;
    }

    public String write(TranslationResult result, List<MappingRecord> records) {
        IrGraph graph = result.graph();
        Set<String> wanted = new LinkedHashSet<>();
        for (MappingRecord record : records) {
            if (record.relationship() == Relationship.SOURCE_ONLY) {
                wanted.addAll(record.sourceSymbols());
            }
        }
        Set<String> needed = withTemporaries(graph, wanted);

        List<IrNode> layers = new ArrayList<>();
        List<IrNode> derived = new ArrayList<>();
        List<IrNode> checks = new ArrayList<>();
        List<IrNode> other = new ArrayList<>();
        for (IrNode node : graph.topologicalOrder()) {
            if (!needed.contains(node.getSymbol())) {
                continue;
            }
            if (node instanceof LayerNode) {
                layers.add(node);
            } else if (node instanceof DerivedNode) {
                derived.add(node);
            } else if (node instanceof CheckNode) {
                checks.add(node);
            } else {
                other.add(node);
            }
        }

        List<String> out = new ArrayList<>();
        out.add("// Statements missing from the reference deck, translated from " + result.sourceName());
        out.add("// " + wanted.size() + " symbols");
        section(result, out, "Layers", layers);
        section(result, out, "Derived layers", derived);
        section(result, out, "Checks", checks);
        section(result, out, "Untranslated", other);
        log.debug("Sync script covers {} symbols ({} with temporaries)", wanted.size(), needed.size());
        return String.join("\n", out) + "\n";
    }

    private void section(TranslationResult result, List<String> out, String title, List<IrNode> nodes) {
        if (nodes.isEmpty()) {
            return;
        }
        out.add("");
        out.add("// ---- " + title + " ----");
        for (IrNode node : nodes) {
            if (node instanceof OpaqueNode opaque) {
                out.add("// TODO: translate manually (line " + opaque.getLine() + "): " + opaque.getRawText());
                continue;
            }
            try {
                out.addAll(translator.statementsFor(result, node.getSymbol()));
            } catch (UnmappableOperationException e) {
                out.add("// TODO: " + e.getMessage());
                out.add("// SVRF: " + node.getSymbol() + " = " + node.describe());
            }
        }
    }

    private static Set<String> withTemporaries(IrGraph graph, Set<String> wanted) {
        Set<String> needed = new LinkedHashSet<>(wanted);
        Deque<String> work = new ArrayDeque<>(wanted);
        while (!work.isEmpty()) {
            graph.get(work.pop()).ifPresent(node -> {
                for (String dependency : node.getDependencies()) {
                    boolean temporary = graph.get(dependency).map(IrNode::isSynthetic).orElse(false);
                    if (temporary && needed.add(dependency)) {
                        work.push(dependency);
                    }
                }
            });
        }
        return needed;
    }
}
