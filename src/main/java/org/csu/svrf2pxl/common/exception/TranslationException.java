package org.csu.svrf2pxl.common.exception;

import lombok.Getter;
import org.csu.svrf2pxl.common.diagnostic.Diagnostic;
import org.csu.svrf2pxl.common.diagnostic.DiagnosticKind;

/**
 * @description: 所有翻译阶段异常的基类
 *
 * Each subclass knows its {@link DiagnosticKind} so that a collected exception can be
 * reported as a {@link Diagnostic} without losing the line or the symbol.
 */
@Getter
public abstract class TranslationException extends RuntimeException {
    private final DiagnosticKind kind;
    private final int line;
    private final int column;
    private final String symbol;

    protected TranslationException(DiagnosticKind kind, String message, int line, int column, String symbol) {
        super(message);
        this.kind = kind;
        this.line = line;
        this.column = column;
        this.symbol = symbol;
    }

    public Diagnostic toDiagnostic() {
        return new Diagnostic(kind, kind.defaultSeverity(), line, column, symbol, getMessage());
    }
}
