package org.csu.svrf2pxl.common.exception;

import org.csu.svrf2pxl.common.diagnostic.DiagnosticKind;

public class DuplicateSymbolException extends SemanticException {

    public DuplicateSymbolException(String symbol, int line, int firstLine) {
        super(DiagnosticKind.DUPLICATE_SYMBOL, symbol, line,
                "Symbol '" + symbol + "' at line " + line + " was already declared at line " + firstLine + ".");
    }
}
