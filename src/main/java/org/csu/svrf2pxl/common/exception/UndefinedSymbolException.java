package org.csu.svrf2pxl.common.exception;

import org.csu.svrf2pxl.common.diagnostic.DiagnosticKind;

public class UndefinedSymbolException extends SemanticException {

    public UndefinedSymbolException(String symbol, String referencedBy, int line) {
        super(DiagnosticKind.UNDEFINED_SYMBOL, symbol, line,
                "Symbol '" + symbol + "' referenced by '" + referencedBy + "' at line " + line
                        + " is not declared before use.");
    }
}
