package org.csu.svrf2pxl.common.exception;

import lombok.Getter;
import org.csu.svrf2pxl.common.diagnostic.DiagnosticKind;
import org.csu.svrf2pxl.compiler.lexer.Token;

/**
 * @description: 语法分析阶段的异常 (SyntaxError)
 */
@Getter
public class ParseException extends TranslationException {
    private final String expected;
    private final String found;

    public ParseException(Token token, String expected) {
        super(DiagnosticKind.SYNTAX_ERROR,
                String.format("Syntax Error at line %d, column %d: Expected %s, but found '%s' (%s)",
                        token.line(),
                        token.column(),
                        expected,
                        token.lexeme(),
                        token.type()),
                token.line(), token.column(), null);
        this.expected = expected;
        this.found = token.lexeme();
    }
}
