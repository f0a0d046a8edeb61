package org.csu.svrf2pxl.compiler.lexer;

/**
 * @description: 定义词法单元（Token）的类型，即“种别码”
 *
 * Keywords of the SVRF rule language get their own type; everything else falls into the
 * generic classes below them.
 */
public enum TokenType {
    // ---- 关键字 (Keywords) ----
    LAYER,      // "LAYER"
    DATATYPE,   // "DATATYPE"
    AND,        // "AND"
    OR,         // "OR"
    NOT,        // "NOT"
    XOR,        // "XOR"
    BY,         // "BY", as in SIZE x BY 0.1

    // ====== 测量关键字 ======
    WIDTH,
    EXTERNAL,
    INTERNAL,
    ENC,        // "ENC" and "ENCLOSURE"
    AREA,
    DENSITY,
    LENGTH,

    // ====== 派生层关键字 ======
    SIZE,
    GROW,
    SHRINK,

    // ---- 标识符和常量 ----
    IDENTIFIER,
    NUMBER,     // 0.09, -1, 90nm
    STRING,     // "text", quotes removed

    // ---- 注释和描述 ----
    COMMENT,     // // ... or /* ... */
    DESCRIPTION, // @ rest of line
    DIRECTIVE,   // #include ..., #IFDEF ...

    // ---- 运算符 ----
    ASSIGN,        // =
    EQUAL,         // ==
    NOT_EQUAL,     // !=
    LESS,          // <
    LESS_EQUAL,    // <=
    GREATER,       // >
    GREATER_EQUAL, // >=
    OPERATOR,      // any other punctuation the target language uses: + - * / . : [ ] & |

    // ---- 分隔符 ----
    LBRACE,
    RBRACE,
    LPAREN,
    RPAREN,
    COMMA,
    SEMICOLON,

    EOF;

    public boolean isKeyword() {
        return ordinal() <= SHRINK.ordinal();
    }

    /**
     * Identifiers and keywords both spell a word; the target deck reader treats them alike.
     */
    public boolean isWord() {
        return isKeyword() || this == IDENTIFIER;
    }

    public boolean isComparator() {
        return this == EQUAL || this == NOT_EQUAL || this == LESS || this == LESS_EQUAL
                || this == GREATER || this == GREATER_EQUAL;
    }
}
