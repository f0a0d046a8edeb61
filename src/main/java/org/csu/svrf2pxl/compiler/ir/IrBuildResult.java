package org.csu.svrf2pxl.compiler.ir;

import org.csu.svrf2pxl.common.diagnostic.Diagnostic;
import org.csu.svrf2pxl.common.exception.SemanticException;

import java.util.List;
import java.util.Set;

/**
 * Outcome of one {@link IrBuilder#build} run.
 *
 * @param graph       every symbol that could be built; never contains a broken reference
 * @param diagnostics all problems found, in source order
 * @param unresolved  symbols left out of the graph, including dependents of broken symbols
 * @param errors      the root-cause exceptions behind the fatal diagnostics
 */
public record IrBuildResult(
        IrGraph graph,
        List<Diagnostic> diagnostics,
        Set<String> unresolved,
        List<SemanticException> errors
) {

    public boolean hasFatalErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isFatal);
    }

    /**
     * Returns the graph, or throws the first root-cause error when the deck had any.
     */
    public IrGraph orThrow() {
        if (!errors.isEmpty()) {
            throw errors.get(0);
        }
        return graph;
    }
}
