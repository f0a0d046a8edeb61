package org.csu.svrf2pxl.compiler.lexer;

import lombok.extern.slf4j.Slf4j;
import org.csu.svrf2pxl.common.exception.LexException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * Splits rule deck text into tokens in one forward pass. Statements are not newline
 * terminated, so newlines are plain whitespace here; only {@code //} comments,
 * {@code @} descriptions and {@code #} directives run to the end of their line.
 */
@Slf4j
public class Lexer {

    private final String input;
    private int position = 0;
    private int line = 1;
    private int column = 1;

    private static final Map<String, TokenType> keywords;

    static {
        keywords = new HashMap<>();
        keywords.put("layer", TokenType.LAYER);
        keywords.put("datatype", TokenType.DATATYPE);
        keywords.put("and", TokenType.AND);
        keywords.put("or", TokenType.OR);
        keywords.put("not", TokenType.NOT);
        keywords.put("xor", TokenType.XOR);
        keywords.put("by", TokenType.BY);
        keywords.put("width", TokenType.WIDTH);
        keywords.put("external", TokenType.EXTERNAL);
        keywords.put("internal", TokenType.INTERNAL);
        keywords.put("enc", TokenType.ENC);
        keywords.put("enclosure", TokenType.ENC);
        keywords.put("area", TokenType.AREA);
        keywords.put("density", TokenType.DENSITY);
        keywords.put("length", TokenType.LENGTH);
        keywords.put("size", TokenType.SIZE);
        keywords.put("grow", TokenType.GROW);
        keywords.put("shrink", TokenType.SHRINK);
    }

    public Lexer(String input) {
        this.input = input;
    }

    /**
     * 执行词法分析并返回所有Token, 最后一个总是 EOF
     *
     * @throws LexException on the first character no token can start with
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        log.debug("Tokenized {} characters into {} tokens", input.length(), tokens.size());
        return tokens;
    }

    /**
     * Produces the next token. Once EOF has been returned every further call returns EOF again.
     */
    public Token nextToken() {
        skipWhitespace();

        if (position >= input.length()) {
            return new Token(TokenType.EOF, "", line, column);
        }

        char currentChar = peek();

        if (currentChar == '/' && peekNext() == '/') {
            return readLineComment();
        }
        if (currentChar == '/' && peekNext() == '*') {
            return readBlockComment();
        }
        if (currentChar == '@') {
            return readToEndOfLine(TokenType.DESCRIPTION);
        }
        if (currentChar == '#') {
            return readToEndOfLine(TokenType.DIRECTIVE);
        }
        if (isIdentifierStart(currentChar)) {
            return readIdentifierOrKeyword();
        }
        if (isDigit(currentChar) || ((currentChar == '-' || currentChar == '+') && isDigit(peekNext()))) {
            return readNumber();
        }
        if (currentChar == '"') {
            return readString();
        }

        switch (currentChar) {
            case '{':
                return consumeAndReturn(TokenType.LBRACE, "{");
            case '}':
                return consumeAndReturn(TokenType.RBRACE, "}");
            case '(':
                return consumeAndReturn(TokenType.LPAREN, "(");
            case ')':
                return consumeAndReturn(TokenType.RPAREN, ")");
            case ',':
                return consumeAndReturn(TokenType.COMMA, ",");
            case ';':
                return consumeAndReturn(TokenType.SEMICOLON, ";");
            case '=':
                if (peekNext() == '=') {
                    return consumeTwoAndReturn(TokenType.EQUAL, "==");
                }
                return consumeAndReturn(TokenType.ASSIGN, "=");
            case '!':
                if (peekNext() == '=') {
                    return consumeTwoAndReturn(TokenType.NOT_EQUAL, "!=");
                }
                throw new LexException(line, column, currentChar);
            case '<':
                if (peekNext() == '=') {
                    return consumeTwoAndReturn(TokenType.LESS_EQUAL, "<=");
                }
                return consumeAndReturn(TokenType.LESS, "<");
            case '>':
                if (peekNext() == '=') {
                    return consumeTwoAndReturn(TokenType.GREATER_EQUAL, ">=");
                }
                return consumeAndReturn(TokenType.GREATER, ">");
            case '+':
            case '-':
            case '*':
            case '/':
            case '.':
            case ':':
            case '[':
            case ']':
            case '&':
            case '|':
                return consumeAndReturn(TokenType.OPERATOR, String.valueOf(currentChar));
            default:
                throw new LexException(line, column, currentChar);
        }
    }

    private Token readIdentifierOrKeyword() {
        int startPos = position;
        int startCol = column;
        while (position < input.length() && isIdentifierPart(peek())) {
            advance();
        }
        String text = input.substring(startPos, position);
        // SVRF 关键字不区分大小写
        TokenType type = keywords.getOrDefault(text.toLowerCase(), TokenType.IDENTIFIER);
        return new Token(type, text, line, startCol);
    }

    private Token readNumber() {
        int startPos = position;
        int startCol = column;
        if (peek() == '-' || peek() == '+') {
            advance();
        }
        while (position < input.length() && isDigit(peek())) {
            advance();
        }
        if (position < input.length() && peek() == '.' && isDigit(peekNext())) {
            advance();
            while (position < input.length() && isDigit(peek())) {
                advance();
            }
        }
        // unit suffix stays part of the lexeme; the parser scales it
        if (startsWithUnit("um") || startsWithUnit("nm")) {
            advance();
            advance();
        }
        return new Token(TokenType.NUMBER, input.substring(startPos, position), line, startCol);
    }

    private boolean startsWithUnit(String unit) {
        if (!input.startsWith(unit, position)) {
            return false;
        }
        int after = position + unit.length();
        return after >= input.length() || !isIdentifierPart(input.charAt(after));
    }

    private Token readString() {
        int startCol = column;
        int startLine = line;
        advance();
        StringBuilder sb = new StringBuilder();
        while (position < input.length() && peek() != '"') {
            char c = peek();
            if (c == '\\' && position + 1 < input.length()) {
                advance();
                c = peek();
            }
            if (c == '\n') {
                throw new LexException(line, column, c);
            }
            sb.append(c);
            advance();
        }
        if (position >= input.length()) {
            // 未闭合的字符串
            throw new LexException(startLine, startCol, '"');
        }
        advance();
        return new Token(TokenType.STRING, sb.toString(), startLine, startCol);
    }

    private Token readLineComment() {
        int startCol = column;
        advance();
        advance();
        int startPos = position;
        while (position < input.length() && peek() != '\n') {
            advance();
        }
        return new Token(TokenType.COMMENT, input.substring(startPos, position).trim(), line, startCol);
    }

    private Token readBlockComment() {
        int startCol = column;
        int startLine = line;
        advance();
        advance();
        int startPos = position;
        while (position < input.length() && !(peek() == '*' && peekNext() == '/')) {
            advance();
        }
        String text = input.substring(startPos, position).trim();
        if (position < input.length()) {
            advance();
            advance();
        }
        return new Token(TokenType.COMMENT, text, startLine, startCol);
    }

    private Token readToEndOfLine(TokenType type) {
        int startCol = column;
        advance();
        int startPos = position;
        while (position < input.length() && peek() != '\n') {
            advance();
        }
        return new Token(type, input.substring(startPos, position).trim(), line, startCol);
    }

    // --- 辅助方法 ---

    private void skipWhitespace() {
        while (position < input.length() && Character.isWhitespace(peek())) {
            advance();
        }
    }

    private Token consumeAndReturn(TokenType type, String lexeme) {
        Token token = new Token(type, lexeme, line, column);
        advance();
        return token;
    }

    private Token consumeTwoAndReturn(TokenType type, String lexeme) {
        Token token = new Token(type, lexeme, line, column);
        advance();
        advance();
        return token;
    }

    private char peek() {
        return input.charAt(position);
    }

    private char peekNext() {
        if (position + 1 >= input.length()) return '\0';
        return input.charAt(position + 1);
    }

    private void advance() {
        if (input.charAt(position) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        position++;
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
