package org.csu.svrf2pxl.compiler.parser;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.csu.svrf2pxl.common.exception.ParseException;
import org.csu.svrf2pxl.compiler.lexer.Token;
import org.csu.svrf2pxl.compiler.lexer.TokenType;
import org.csu.svrf2pxl.compiler.parser.ast.DeckNode;
import org.csu.svrf2pxl.compiler.parser.ast.ExpressionNode;
import org.csu.svrf2pxl.compiler.parser.ast.StatementNode;
import org.csu.svrf2pxl.compiler.parser.ast.expression.*;
import org.csu.svrf2pxl.compiler.parser.ast.statement.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;

/**
 * @description: 语法分析器
 * 采用递归下降法，将Token流转换为抽象语法树(AST)
 *
 * Precedence, loosest first: comparison, OR/XOR, AND, infix NOT, unary NOT, primary.
 * Boolean operators are accepted both infix ({@code a AND b}) and prefix ({@code AND a b}).
 * Syntax errors are collected in {@link #getErrors()}; the parser skips to the next
 * statement or block boundary and keeps going. The skipped tokens stay in the tree as a
 * malformed {@link UnsupportedConstructNode}.
 * <p>
 * Statements are not terminated, so a measurement keyword on a later line than the operator
 * whose operands are being collected starts the next statement.
 */
@Slf4j
public class Parser {

    private static final Set<TokenType> FUNCTIONS = Set.of(
            TokenType.WIDTH, TokenType.EXTERNAL, TokenType.INTERNAL, TokenType.ENC,
            TokenType.AREA, TokenType.DENSITY, TokenType.LENGTH,
            TokenType.SIZE, TokenType.GROW, TokenType.SHRINK
    );

    private final List<Token> tokens;
    private int position = 0;
    private final List<Token> pendingComments = new ArrayList<>();

    @Getter
    private final List<ParseException> errors = new ArrayList<>();

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public DeckNode parse() {
        List<StatementNode> statements = new ArrayList<>();
        while (true) {
            peek();
            for (Token comment : pendingComments) {
                statements.add(new CommentNode(comment.lexeme(), comment.line()));
            }
            pendingComments.clear();
            if (isAtEnd()) {
                break;
            }
            int start = position;
            try {
                statements.add(parseTopLevelStatement());
            } catch (ParseException e) {
                log.warn("Recovering from syntax error: {}", e.getMessage());
                errors.add(e);
                if (position == start) {
                    advance();
                }
                synchronize();
                statements.add(malformed(start, position, e));
            }
        }
        log.debug("Parsed {} top-level statements with {} syntax errors", statements.size(), errors.size());
        return new DeckNode(statements);
    }

    private StatementNode parseTopLevelStatement() {
        if (check(TokenType.LAYER)) {
            return parseLayerDeclaration();
        }
        if (check(TokenType.DIRECTIVE)) {
            Token directive = advance();
            return new UnsupportedConstructNode("#" + directive.lexeme(), directive.line());
        }
        if (peek().type().isWord() && peekAt(1).type() == TokenType.ASSIGN) {
            return parseAssignment();
        }
        if (peek().type().isWord() && peekAt(1).type() == TokenType.LBRACE) {
            return parseRuleBlock();
        }
        return parseUnsupportedConstruct();
    }

    private LayerDeclarationNode parseLayerDeclaration() {
        Token layerToken = consume(TokenType.LAYER, "'LAYER' keyword");
        Token name = consumeWord("layer name");
        int layerNumber = parseInteger(consume(TokenType.NUMBER, "layer number"));
        int datatype = 0;
        if (match(TokenType.DATATYPE)) {
            datatype = parseInteger(consume(TokenType.NUMBER, "datatype number after 'DATATYPE'"));
        } else if (check(TokenType.NUMBER)) {
            // LAYER NAME 10 0 is accepted as shorthand for DATATYPE 0
            datatype = parseInteger(advance());
        }
        return new LayerDeclarationNode(name.lexeme(), layerNumber, datatype, layerToken.line());
    }

    private AssignmentNode parseAssignment() {
        Token name = consumeWord("symbol name");
        consume(TokenType.ASSIGN, "'=' after symbol name");
        ExpressionNode expression = parseExpression();
        return new AssignmentNode(name.lexeme(), expression, name.line());
    }

    private RuleBlockNode parseRuleBlock() {
        Token name = consumeWord("rule block name");
        consume(TokenType.LBRACE, "'{' after rule block name");
        String description = null;
        List<StatementNode> body = new ArrayList<>();
        List<Token> comments = new ArrayList<>();
        while (true) {
            peek();
            comments.addAll(pendingComments);
            pendingComments.clear();
            if (match(TokenType.RBRACE)) {
                break;
            }
            if (isAtEnd()) {
                throw new ParseException(peek(), "'}' to close rule block '" + name.lexeme() + "'");
            }
            if (check(TokenType.DESCRIPTION)) {
                String text = advance().lexeme();
                description = description == null ? text : description + " " + text;
                continue;
            }
            int start = position;
            try {
                body.add(parseBlockStatement());
            } catch (ParseException e) {
                log.warn("Skipping rest of rule block '{}': {}", name.lexeme(), e.getMessage());
                errors.add(e);
                skipToBlockEnd();
                int end = position;
                if (end > start && tokens.get(end - 1).type() == TokenType.RBRACE) {
                    end--;
                }
                body.add(malformed(start, end, e));
                break;
            }
        }
        if (description == null && !comments.isEmpty()) {
            description = comments.get(0).lexeme();
        }
        return new RuleBlockNode(name.lexeme(), description, body, name.line());
    }

    private StatementNode parseBlockStatement() {
        if (peek().type().isWord() && peekAt(1).type() == TokenType.ASSIGN) {
            return parseAssignment();
        }
        if (check(TokenType.LAYER) || (peek().type().isWord() && peekAt(1).type() == TokenType.LBRACE)) {
            throw new ParseException(peek(), "an assignment or a check inside the rule block");
        }
        int line = peek().line();
        return new ExpressionStatementNode(parseExpression(), line);
    }

    private UnsupportedConstructNode parseUnsupportedConstruct() {
        Token first = advance();
        StringJoiner raw = new StringJoiner(" ");
        raw.add(render(first));
        int lastLine = first.line();
        int depth = first.type() == TokenType.LBRACE ? 1 : 0;
        while (!isAtEnd()) {
            Token next = peek();
            if (depth == 0 && (next.line() != lastLine || atStatementStart())) {
                break;
            }
            if (next.type() == TokenType.LBRACE) {
                depth++;
            } else if (next.type() == TokenType.RBRACE) {
                depth = Math.max(0, depth - 1);
            }
            advance();
            raw.add(render(next));
            lastLine = next.line();
        }
        return new UnsupportedConstructNode(raw.toString(), first.line());
    }

    // ---- 表达式 ----

    private ExpressionNode parseExpression() {
        return parseComparison();
    }

    private ExpressionNode parseComparison() {
        ExpressionNode left = parseOrExpression();
        if (peek().type().isComparator()) {
            Token operator = advance();
            LiteralNode value = parseLiteral(consume(TokenType.NUMBER, "a numeric threshold after '" + operator.lexeme() + "'"));
            return new ComparisonNode(left, operator, value);
        }
        return left;
    }

    private ExpressionNode parseOrExpression() {
        ExpressionNode left = parseAndExpression();
        while (check(TokenType.OR) || check(TokenType.XOR)) {
            Token operator = advance();
            ExpressionNode right = parseAndExpression();
            left = new BinaryExpressionNode(left, operator, right);
        }
        return left;
    }

    private ExpressionNode parseAndExpression() {
        ExpressionNode left = parseNotExpression();
        while (check(TokenType.AND)) {
            Token operator = advance();
            ExpressionNode right = parseNotExpression();
            left = new BinaryExpressionNode(left, operator, right);
        }
        return left;
    }

    private ExpressionNode parseNotExpression() {
        ExpressionNode left = parseUnaryExpression();
        while (check(TokenType.NOT)) {
            Token operator = advance();
            ExpressionNode right = parseUnaryExpression();
            left = new BinaryExpressionNode(left, operator, right);
        }
        return left;
    }

    private ExpressionNode parseUnaryExpression() {
        if (check(TokenType.NOT)) {
            Token operator = advance();
            ExpressionNode operand = parseUnaryExpression();
            // NOT a b is the prefix spelling of a NOT b
            if (continuesOperands(operator)) {
                return new BinaryExpressionNode(operand, operator, parseAtom());
            }
            return new UnaryExpressionNode(operator, operand);
        }
        return parsePrimaryExpression();
    }

    private ExpressionNode parsePrimaryExpression() {
        if (check(TokenType.AND) || check(TokenType.OR) || check(TokenType.XOR)) {
            return parsePrefixBoolean();
        }
        if (startsAtom()) {
            return parseAtom();
        }
        throw new ParseException(peek(), "an expression (a layer name, a number, a measurement or a boolean operation)");
    }

    private ExpressionNode parsePrefixBoolean() {
        Token operator = advance();
        ExpressionNode result = parseAtom();
        int operands = 1;
        while (continuesOperands(operator)) {
            result = new BinaryExpressionNode(result, operator, parseAtom());
            operands++;
        }
        if (operands < 2) {
            throw new ParseException(peek(), "a second operand for '" + operator.lexeme() + "'");
        }
        return result;
    }

    private ExpressionNode parseAtom() {
        if (match(TokenType.LPAREN)) {
            ExpressionNode expr = parseExpression();
            consume(TokenType.RPAREN, "')' after expression");
            return expr;
        }
        if (check(TokenType.NUMBER)) {
            return parseLiteral(advance());
        }
        if (FUNCTIONS.contains(peek().type())) {
            return parseFunctionCall();
        }
        if (check(TokenType.IDENTIFIER) && !atStatementStart()) {
            return new LayerRefNode(advance());
        }
        throw new ParseException(peek(), "a layer name, a number or a parenthesized expression");
    }

    private FunctionCallNode parseFunctionCall() {
        Token function = advance();
        List<ExpressionNode> arguments = new ArrayList<>();
        while (true) {
            if (match(TokenType.BY)) {
                continue;
            }
            if (arguments.isEmpty() ? !startsAtom() : !continuesOperands(function)) {
                break;
            }
            arguments.add(parseAtom());
        }
        if (arguments.isEmpty()) {
            throw new ParseException(peek(), "an operand after '" + function.lexeme() + "'");
        }
        return new FunctionCallNode(function, arguments);
    }

    private boolean startsAtom() {
        Token token = peek();
        if (token.type() == TokenType.LPAREN || token.type() == TokenType.NUMBER || FUNCTIONS.contains(token.type())) {
            return true;
        }
        return token.type() == TokenType.IDENTIFIER && !atStatementStart();
    }

    /**
     * Whether the next token is one more operand of {@code operator}.
     */
    private boolean continuesOperands(Token operator) {
        if (!startsAtom()) {
            return false;
        }
        Token next = peek();
        return !(FUNCTIONS.contains(next.type()) && next.line() > operator.line());
    }

    private LiteralNode parseLiteral(Token token) {
        String text = token.lexeme();
        BigDecimal scale = BigDecimal.ONE;
        if (text.endsWith("um")) {
            text = text.substring(0, text.length() - 2);
        } else if (text.endsWith("nm")) {
            text = text.substring(0, text.length() - 2);
            scale = new BigDecimal("0.001");
        }
        try {
            return new LiteralNode(token, new BigDecimal(text).multiply(scale));
        } catch (NumberFormatException e) {
            throw new ParseException(token, "a valid number");
        }
    }

    private int parseInteger(Token token) {
        try {
            int value = Integer.parseInt(token.lexeme());
            if (value < 0) {
                throw new ParseException(token, "a non-negative integer");
            }
            return value;
        } catch (NumberFormatException e) {
            throw new ParseException(token, "an integer");
        }
    }

    // ---- 错误恢复 ----

    /**
     * Skips forward to something that can begin a top-level statement.
     */
    private void synchronize() {
        while (!isAtEnd() && !atStatementStart()) {
            if (check(TokenType.LBRACE)) {
                advance();
                skipToBlockEnd();
                continue;
            }
            advance();
        }
    }

    /**
     * Skips to just past the brace closing the current block, stopping early at a token that
     * can only begin a new top-level statement.
     */
    private void skipToBlockEnd() {
        int depth = 1;
        while (!isAtEnd()) {
            Token token = peek();
            if (depth == 1 && (token.type() == TokenType.LAYER
                    || (token.type().isWord() && peekAt(1).type() == TokenType.LBRACE))) {
                return;
            }
            advance();
            if (token.type() == TokenType.LBRACE) {
                depth++;
            } else if (token.type() == TokenType.RBRACE && --depth == 0) {
                return;
            }
        }
    }

    private UnsupportedConstructNode malformed(int from, int to, ParseException e) {
        StringJoiner raw = new StringJoiner(" ");
        int line = tokens.get(from).line();
        for (int i = from; i < to; i++) {
            Token token = tokens.get(i);
            if (token.type() != TokenType.COMMENT && token.type() != TokenType.EOF) {
                raw.add(render(token));
            }
        }
        return new UnsupportedConstructNode(raw.toString(), line, e.getExpected());
    }

    private boolean atStatementStart() {
        Token token = peek();
        if (token.type() == TokenType.LAYER || token.type() == TokenType.DIRECTIVE) {
            return true;
        }
        if (token.type().isWord()) {
            TokenType next = peekAt(1).type();
            return next == TokenType.ASSIGN || next == TokenType.LBRACE;
        }
        return false;
    }

    private static String render(Token token) {
        return switch (token.type()) {
            case STRING -> "\"" + token.lexeme() + "\"";
            case DESCRIPTION -> "@ " + token.lexeme();
            case DIRECTIVE -> "#" + token.lexeme();
            default -> token.lexeme();
        };
    }

    // ---- 辅助方法 ----

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw new ParseException(peek(), message);
    }

    private Token consumeWord(String message) {
        if (peek().type().isWord()) return advance();
        throw new ParseException(peek(), message);
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        Token token = peek();
        if (!isAtEnd()) position++;
        return token;
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    /**
     * Returns the next significant token. Comments passed on the way are queued in
     * {@link #pendingComments} for the caller to attach or emit.
     */
    private Token peek() {
        while (tokens.get(position).type() == TokenType.COMMENT) {
            pendingComments.add(tokens.get(position));
            position++;
        }
        return tokens.get(position);
    }

    private Token peekAt(int offset) {
        int index = position;
        int seen = -1;
        while (index < tokens.size()) {
            Token token = tokens.get(index);
            if (token.type() != TokenType.COMMENT && ++seen == offset) {
                return token;
            }
            if (token.type() == TokenType.EOF) {
                return token;
            }
            index++;
        }
        return tokens.get(tokens.size() - 1);
    }
}
