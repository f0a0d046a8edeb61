package org.csu.svrf2pxl.common.exception;

import org.csu.svrf2pxl.common.diagnostic.DiagnosticKind;

/**
 * @description: IR 构建阶段的语义异常基类
 */
public class SemanticException extends TranslationException {

    public SemanticException(DiagnosticKind kind, String symbol, int line, String message) {
        super(kind, message, line, 0, symbol);
    }
}
