package org.csu.svrf2pxl.common.exception;

import org.csu.svrf2pxl.common.diagnostic.DiagnosticKind;

import java.util.List;

public class CyclicDefinitionException extends SemanticException {

    public CyclicDefinitionException(String symbol, int line) {
        super(DiagnosticKind.CYCLIC_DEFINITION, symbol, line,
                "Symbol '" + symbol + "' at line " + line + " is defined in terms of itself.");
    }

    public CyclicDefinitionException(List<String> cycleMembers) {
        super(DiagnosticKind.CYCLIC_DEFINITION, cycleMembers.isEmpty() ? null : cycleMembers.get(0), 0,
                "Dependency cycle among symbols " + cycleMembers + ".");
    }
}
