package org.csu.svrf2pxl.engine;

import org.csu.svrf2pxl.codegen.GenerationResult;
import org.csu.svrf2pxl.common.diagnostic.Diagnostic;
import org.csu.svrf2pxl.common.diagnostic.DiagnosticKind;
import org.csu.svrf2pxl.compiler.ir.IrGraph;
import org.csu.svrf2pxl.compiler.ir.node.CheckNode;
import org.csu.svrf2pxl.compiler.ir.node.DerivedNode;
import org.csu.svrf2pxl.compiler.ir.node.LayerNode;
import org.csu.svrf2pxl.compiler.ir.node.Measurement;
import org.csu.svrf2pxl.compiler.ir.node.Operation;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Counts reported by {@code --stats}. Hoisted temporaries are not counted as derived layers.
 */
public record TranslationStatistics(
        int layers,
        int derivedLayers,
        int checks,
        Map<Measurement, Integer> checksByMeasurement,
        int booleanOperations,
        int unsupportedConstructs,
        int placeholders,
        Map<DiagnosticKind, Integer> diagnosticsByKind,
        int outputLines,
        int outputBytes
) {

    public TranslationStatistics {
        checksByMeasurement = frozen(Measurement.class, checksByMeasurement);
        diagnosticsByKind = frozen(DiagnosticKind.class, diagnosticsByKind);
    }

    private static <K extends Enum<K>> Map<K, Integer> frozen(Class<K> type, Map<K, Integer> counts) {
        Map<K, Integer> copy = new EnumMap<>(type);
        copy.putAll(counts);
        return Collections.unmodifiableMap(copy);
    }

    public static TranslationStatistics of(IrGraph graph, List<Diagnostic> diagnostics, GenerationResult generated) {
        Map<Measurement, Integer> byMeasurement = new EnumMap<>(Measurement.class);
        for (CheckNode check : graph.nodesOfType(CheckNode.class)) {
            byMeasurement.merge(check.getMeasurement(), 1, Integer::sum);
        }
        int derived = 0;
        int booleans = 0;
        for (DerivedNode node : graph.nodesOfType(DerivedNode.class)) {
            if (!node.isSynthetic()) {
                derived++;
            }
            Operation operation = node.getOperation();
            if (operation == Operation.AND || operation == Operation.OR
                    || operation == Operation.XOR || operation == Operation.NOT) {
                booleans++;
            }
        }
        Map<DiagnosticKind, Integer> byKind = new EnumMap<>(DiagnosticKind.class);
        diagnostics.forEach(d -> byKind.merge(d.kind(), 1, Integer::sum));
        String text = generated == null ? "" : generated.text();
        return new TranslationStatistics(
                graph.nodesOfType(LayerNode.class).size(),
                derived,
                graph.nodesOfType(CheckNode.class).size(),
                byMeasurement,
                booleans,
                (int) graph.opaqueCount(),
                generated == null ? 0 : generated.placeholders().size(),
                byKind,
                text.isEmpty() ? 0 : text.split("\n", -1).length - 1,
                text.getBytes(StandardCharsets.UTF_8).length);
    }
}
