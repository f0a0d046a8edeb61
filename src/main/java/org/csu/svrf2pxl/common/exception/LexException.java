package org.csu.svrf2pxl.common.exception;

import lombok.Getter;
import org.csu.svrf2pxl.common.diagnostic.DiagnosticKind;

/**
 * @description: 词法分析阶段遇到无法识别的字符
 */
@Getter
public class LexException extends TranslationException {
    private final char unexpectedChar;

    public LexException(int line, int column, char unexpectedChar) {
        super(DiagnosticKind.LEX_ERROR,
                String.format("Lexical Error at line %d, column %d: unexpected character '%s'",
                        line, column, unexpectedChar),
                line, column, null);
        this.unexpectedChar = unexpectedChar;
    }
}
