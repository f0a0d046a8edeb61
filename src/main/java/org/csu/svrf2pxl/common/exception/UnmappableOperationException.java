package org.csu.svrf2pxl.common.exception;

import lombok.Getter;
import org.csu.svrf2pxl.common.diagnostic.DiagnosticKind;

/**
 * @description: 操作映射表中找不到对应模板
 */
@Getter
public class UnmappableOperationException extends TranslationException {
    private final String operation;

    public UnmappableOperationException(String symbol, String operation, int line) {
        super(DiagnosticKind.UNMAPPABLE_OPERATION,
                "No operation table entry for '" + operation + "' needed by symbol '" + symbol + "'.",
                line, 0, symbol);
        this.operation = operation;
    }
}
