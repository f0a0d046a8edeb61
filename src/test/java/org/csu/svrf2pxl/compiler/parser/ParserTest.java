package org.csu.svrf2pxl.compiler.parser;

import org.csu.svrf2pxl.common.exception.ParseException;
import org.csu.svrf2pxl.compiler.lexer.Lexer;
import org.csu.svrf2pxl.compiler.lexer.TokenType;
import org.csu.svrf2pxl.compiler.parser.ast.DeckNode;
import org.csu.svrf2pxl.compiler.parser.ast.ExpressionNode;
import org.csu.svrf2pxl.compiler.parser.ast.expression.*;
import org.csu.svrf2pxl.compiler.parser.ast.statement.*;
import org.junit.Test;

import java.math.BigDecimal;

import static org.junit.Assert.*;

/**
 * @description: Parser 类的单元测试 (使用 JUnit 4)
 */
public class ParserTest {

    private Parser parser;

    private DeckNode parse(String text) {
        System.out.println("Input:\n" + text);
        parser = new Parser(new Lexer(text).tokenize());
        DeckNode deck = parser.parse();
        System.out.println("AST: " + deck);
        return deck;
    }

    private ExpressionNode expressionOf(String text) {
        DeckNode deck = parse(text);
        assertTrue("不应有语法错误", parser.getErrors().isEmpty());
        return ((AssignmentNode) deck.statements().get(0)).expression();
    }

    @Test
    public void testLayerDeclarations() {
        System.out.println("--- Running test: testLayerDeclarations ---");
        DeckNode deck = parse("LAYER METAL1 10 DATATYPE 2\nLAYER POLY 5\nLAYER VIA1 11 0");

        assertEquals("语句数量不匹配", 3, deck.statements().size());
        LayerDeclarationNode metal = (LayerDeclarationNode) deck.statements().get(0);
        assertEquals("METAL1", metal.name());
        assertEquals(10, metal.layerNumber());
        assertEquals(2, metal.datatype());
        assertEquals(1, metal.line());

        LayerDeclarationNode poly = (LayerDeclarationNode) deck.statements().get(1);
        assertEquals("未声明DATATYPE时应默认为0", 0, poly.datatype());
        assertEquals(0, ((LayerDeclarationNode) deck.statements().get(2)).datatype());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testMeasurementComparison() {
        System.out.println("--- Running test: testMeasurementComparison ---");
        ExpressionNode expr = expressionOf("M1_SPACE = EXTERNAL METAL1 < 0.09");

        assertTrue(expr instanceof ComparisonNode);
        ComparisonNode comparison = (ComparisonNode) expr;
        assertEquals(TokenType.LESS, comparison.operator().type());
        assertEquals(0, new BigDecimal("0.09").compareTo(comparison.value().value()));

        FunctionCallNode call = (FunctionCallNode) comparison.expression();
        assertEquals(TokenType.EXTERNAL, call.function().type());
        assertEquals(1, call.arguments().size());
        assertEquals("METAL1", ((LayerRefNode) call.arguments().get(0)).getName());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testNanometreThresholdIsScaledToMicrons() {
        System.out.println("--- Running test: testNanometreThresholdIsScaledToMicrons ---");
        ComparisonNode comparison = (ComparisonNode) expressionOf("S = EXTERNAL M1 >= 90nm");
        assertEquals(0, new BigDecimal("0.09").compareTo(comparison.value().value()));
        assertEquals("90nm", comparison.value().literal().lexeme());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testBooleanPrecedence() {
        System.out.println("--- Running test: testBooleanPrecedence ---");
        BinaryExpressionNode or = (BinaryExpressionNode) expressionOf("X = A OR B AND C");

        assertEquals("OR 的优先级应低于 AND", TokenType.OR, or.operator().type());
        assertEquals("A", ((LayerRefNode) or.left()).getName());
        BinaryExpressionNode and = (BinaryExpressionNode) or.right();
        assertEquals(TokenType.AND, and.operator().type());
        assertEquals("B", ((LayerRefNode) and.left()).getName());
        assertEquals("C", ((LayerRefNode) and.right()).getName());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testPrefixBooleanIsLeftNested() {
        System.out.println("--- Running test: testPrefixBooleanIsLeftNested ---");
        DeckNode deck = parse("Y = AND A B C\nZ = A");
        assertEquals(2, deck.statements().size());

        BinaryExpressionNode outer = (BinaryExpressionNode) ((AssignmentNode) deck.statements().get(0)).expression();
        assertEquals("C", ((LayerRefNode) outer.right()).getName());
        BinaryExpressionNode inner = (BinaryExpressionNode) outer.left();
        assertEquals("A", ((LayerRefNode) inner.left()).getName());
        assertEquals("B", ((LayerRefNode) inner.right()).getName());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testInfixAndUnaryNot() {
        System.out.println("--- Running test: testInfixAndUnaryNot ---");
        BinaryExpressionNode infix = (BinaryExpressionNode) expressionOf("G = POLY NOT DIFF");
        assertEquals(TokenType.NOT, infix.operator().type());
        assertEquals("POLY", ((LayerRefNode) infix.left()).getName());

        UnaryExpressionNode unary = (UnaryExpressionNode) expressionOf("H = NOT DIFF");
        assertEquals("DIFF", ((LayerRefNode) unary.operand()).getName());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testSizeWithByKeyword() {
        System.out.println("--- Running test: testSizeWithByKeyword ---");
        FunctionCallNode call = (FunctionCallNode) expressionOf("BIG = SIZE POLY BY 0.1");
        assertEquals(TokenType.SIZE, call.function().type());
        assertEquals("BY 应被丢弃", 2, call.arguments().size());
        assertTrue(call.arguments().get(1) instanceof LiteralNode);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testRuleBlockWithDescription() {
        System.out.println("--- Running test: testRuleBlockWithDescription ---");
        DeckNode deck = parse("M1_W {\n  @ Metal1 minimum width\n  WIDTH METAL1 < 0.1\n}");

        assertTrue(parser.getErrors().isEmpty());
        RuleBlockNode block = (RuleBlockNode) deck.statements().get(0);
        assertEquals("M1_W", block.name());
        assertEquals("Metal1 minimum width", block.description());
        assertEquals(1, block.body().size());
        ExpressionStatementNode check = (ExpressionStatementNode) block.body().get(0);
        assertTrue(check.expression() instanceof ComparisonNode);
        assertEquals(3, check.line());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testRuleBlockFallsBackToFirstComment() {
        System.out.println("--- Running test: testRuleBlockFallsBackToFirstComment ---");
        DeckNode deck = parse("R1 {\n  // spacing between wires\n  EXTERNAL M1 < 0.2\n}");
        RuleBlockNode block = (RuleBlockNode) deck.statements().get(0);
        assertEquals("spacing between wires", block.description());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testTopLevelCommentsAndDirectives() {
        System.out.println("--- Running test: testTopLevelCommentsAndDirectives ---");
        DeckNode deck = parse("// header\n#include \"rules.svrf\"\nLAYER M1 1");

        assertEquals(3, deck.statements().size());
        assertEquals("header", ((CommentNode) deck.statements().get(0)).text());
        UnsupportedConstructNode directive = (UnsupportedConstructNode) deck.statements().get(1);
        assertEquals("#include \"rules.svrf\"", directive.rawText());
        assertTrue(deck.statements().get(2) instanceof LayerDeclarationNode);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testUnknownStatementIsKeptVerbatim() {
        System.out.println("--- Running test: testUnknownStatementIsKeptVerbatim ---");
        DeckNode deck = parse("DRC RESULTS DATABASE \"out.db\" ASCII\nLAYER M1 10");

        assertTrue("未知语句不应报语法错误", parser.getErrors().isEmpty());
        UnsupportedConstructNode unsupported = (UnsupportedConstructNode) deck.statements().get(0);
        assertEquals("DRC RESULTS DATABASE \"out.db\" ASCII", unsupported.rawText());
        assertEquals(1, unsupported.line());
        assertTrue(deck.statements().get(1) instanceof LayerDeclarationNode);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testRecoversAfterSyntaxErrors() {
        System.out.println("--- Running test: testRecoversAfterSyntaxErrors ---");
        DeckNode deck = parse("LAYER M1\nLAYER M2 20\nX = M2 AND\nLAYER M3 30");

        assertEquals("应收集到两个语法错误", 2, parser.getErrors().size());
        ParseException first = parser.getErrors().get(0);
        assertEquals(2, first.getLine());
        assertEquals("layer number", first.getExpected());

        assertEquals("出错的语句应原样保留", 4, deck.statements().size());
        UnsupportedConstructNode brokenLayer = (UnsupportedConstructNode) deck.statements().get(0);
        assertEquals("LAYER M1", brokenLayer.rawText());
        assertEquals(1, brokenLayer.line());
        assertTrue(brokenLayer.isMalformed());
        assertEquals("M2", ((LayerDeclarationNode) deck.statements().get(1)).name());
        UnsupportedConstructNode brokenAssignment = (UnsupportedConstructNode) deck.statements().get(2);
        assertEquals("X = M2 AND", brokenAssignment.rawText());
        assertEquals(3, brokenAssignment.line());
        assertEquals("M3", ((LayerDeclarationNode) deck.statements().get(3)).name());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testBrokenBlockStatementKeepsTheRestOfTheBlock() {
        System.out.println("--- Running test: testBrokenBlockStatementKeepsTheRestOfTheBlock ---");
        DeckNode deck = parse("R {\n  WIDTH M1 < 0.1\n  X = M1 AND <\n  WIDTH M2 < 0.2\n}\nLAYER M3 30");

        assertEquals(1, parser.getErrors().size());
        RuleBlockNode block = (RuleBlockNode) deck.statements().get(0);
        assertEquals(2, block.body().size());
        assertTrue(block.body().get(0) instanceof ExpressionStatementNode);
        UnsupportedConstructNode rest = (UnsupportedConstructNode) block.body().get(1);
        assertEquals("块内剩余部分应原样保留", "X = M1 AND < WIDTH M2 < 0.2", rest.rawText());
        assertEquals(3, rest.line());
        assertTrue(deck.statements().get(1) instanceof LayerDeclarationNode);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testMeasurementOnNextLineStartsANewCheck() {
        System.out.println("--- Running test: testMeasurementOnNextLineStartsANewCheck ---");
        String[] assignments = {"x = AND a b", "x = SIZE a BY 0.1", "x = NOT a", "x = NOT a b"};
        for (String assignment : assignments) {
            DeckNode deck = parse("R {\n  " + assignment + "\n  WIDTH x < 0.1\n}");

            assertTrue("不应有语法错误", parser.getErrors().isEmpty());
            RuleBlockNode block = (RuleBlockNode) deck.statements().get(0);
            assertEquals("下一行的测量应成为独立的检查: " + assignment, 2, block.body().size());
            AssignmentNode x = (AssignmentNode) block.body().get(0);
            assertFalse(x.expression() instanceof ComparisonNode);
            ExpressionStatementNode check = (ExpressionStatementNode) block.body().get(1);
            ComparisonNode comparison = (ComparisonNode) check.expression();
            FunctionCallNode width = (FunctionCallNode) comparison.expression();
            assertEquals(TokenType.WIDTH, width.function().type());
            assertEquals(3, check.line());
        }
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testMeasurementOnSameLineIsStillAnOperand() {
        System.out.println("--- Running test: testMeasurementOnSameLineIsStillAnOperand ---");
        BinaryExpressionNode and = (BinaryExpressionNode) expressionOf("Y = AND a SIZE b BY 0.1");
        assertEquals(TokenType.AND, and.operator().type());
        assertTrue(and.right() instanceof FunctionCallNode);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testComparisonNeedsNumericThreshold() {
        System.out.println("--- Running test: testComparisonNeedsNumericThreshold ---");
        parse("W = WIDTH M1 < M2");
        assertEquals(1, parser.getErrors().size());
        assertTrue(parser.getErrors().get(0).getMessage().contains("numeric threshold"));
        System.out.println("Result: Test PASSED.\n");
    }
}
