package org.csu.svrf2pxl.engine;

import org.csu.svrf2pxl.common.diagnostic.Diagnostic;
import org.csu.svrf2pxl.compiler.ir.IrGraph;

import java.util.List;

/**
 * Everything one file's translation produced.
 *
 * @param output   the generated deck, or null when the run failed outright
 * @param graph    the IR that was built; empty when the file could not be tokenized
 * @param failure  why no output was produced, or null
 */
public record TranslationResult(
        String sourceName,
        String output,
        IrGraph graph,
        List<Diagnostic> diagnostics,
        List<String> placeholders,
        TranslationStatistics statistics,
        String failure
) {

    public static TranslationResult failed(String sourceName, List<Diagnostic> diagnostics, String failure) {
        return new TranslationResult(sourceName, null, IrGraph.empty(), diagnostics, List.of(),
                TranslationStatistics.of(IrGraph.empty(), diagnostics, null), failure);
    }

    public boolean isFailed() {
        return output == null;
    }

    public boolean hasFatalErrors() {
        return isFailed() || diagnostics.stream().anyMatch(Diagnostic::isFatal);
    }
}
