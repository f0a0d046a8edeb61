package org.csu.svrf2pxl.compiler.ir;

import org.csu.svrf2pxl.common.diagnostic.Diagnostic;
import org.csu.svrf2pxl.common.diagnostic.DiagnosticKind;
import org.csu.svrf2pxl.common.exception.CyclicDefinitionException;
import org.csu.svrf2pxl.common.exception.DuplicateSymbolException;
import org.csu.svrf2pxl.common.exception.UndefinedSymbolException;
import org.csu.svrf2pxl.compiler.ir.node.*;
import org.csu.svrf2pxl.compiler.lexer.Lexer;
import org.csu.svrf2pxl.compiler.parser.Parser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @description: IrBuilder 的单元测试
 */
class IrBuilderTest {

    private IrBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new IrBuilder();
    }

    private IrBuildResult build(String text) {
        Parser parser = new Parser(new Lexer(text).tokenize());
        IrBuildResult result = builder.build(parser.parse());
        assertTrue(parser.getErrors().isEmpty(), "fixture should parse cleanly");
        return result;
    }

    private static List<DiagnosticKind> kinds(IrBuildResult result) {
        return result.diagnostics().stream().map(Diagnostic::kind).collect(Collectors.toList());
    }

    @Test
    void testLayersDerivedAndCheck() {
        IrBuildResult result = build("LAYER M1 10\nLAYER M2 11 DATATYPE 3\nX = M1 AND M2\n"
                + "M1_W {\n  @ Metal1 width\n  WIDTH M1 < 0.1\n}");
        IrGraph graph = result.graph();

        assertFalse(result.hasFatalErrors());
        assertEquals(4, graph.size());

        LayerNode m2 = (LayerNode) graph.get("M2").orElseThrow();
        assertEquals(11, m2.getGdsLayer());
        assertEquals(3, m2.getDatatype());

        DerivedNode x = (DerivedNode) graph.get("X").orElseThrow();
        assertEquals(Operation.AND, x.getOperation());
        assertEquals(List.of("M1", "M2"), x.getOperands());
        assertFalse(x.isReported());

        CheckNode check = (CheckNode) graph.get("M1_W").orElseThrow();
        assertEquals(Measurement.WIDTH, check.getMeasurement());
        assertEquals(List.of("M1"), check.getTargets());
        assertEquals(Comparator.LT, check.getComparator());
        assertEquals(0.1, check.getThreshold(), 1e-12);
        assertEquals("M1_W", check.getRuleName());
        assertEquals("Metal1 width", check.getMessage());
        assertTrue(check.hasDescription());
    }

    @Test
    void testForwardReferenceIsUndefined() {
        IrBuildResult result = build("X = M1 AND M2\nLAYER M1 10\nLAYER M2 11");

        assertTrue(result.hasFatalErrors());
        assertEquals(2, result.errors().size());
        assertInstanceOf(UndefinedSymbolException.class, result.errors().get(0));
        assertEquals("M1", result.errors().get(0).getSymbol());
        assertTrue(result.unresolved().contains("X"));
        assertFalse(result.graph().contains("X"));
        assertTrue(result.graph().contains("M1"));
        assertThrows(UndefinedSymbolException.class, result::orThrow);
    }

    @Test
    void testSelfReferenceIsCyclic() {
        IrBuildResult result = build("LAYER b 1\na = AND a b");

        assertEquals(1, result.errors().size());
        assertInstanceOf(CyclicDefinitionException.class, result.errors().get(0));
        assertEquals(List.of(DiagnosticKind.CYCLIC_DEFINITION), kinds(result));
        assertFalse(result.graph().contains("a"));
    }

    @Test
    void testDuplicateKeepsFirstDefinition() {
        IrBuildResult result = build("LAYER M1 10\nLAYER M1 11");

        assertInstanceOf(DuplicateSymbolException.class, result.errors().get(0));
        assertEquals(2, result.diagnostics().get(0).line());
        assertEquals(10, ((LayerNode) result.graph().get("M1").orElseThrow()).getGdsLayer());
    }

    @Test
    void testDependentsOfBrokenSymbolsAreLeftOut() {
        IrBuildResult result = build("LAYER A 1\nX = M9 AND A\nY = X\nZ = A");

        assertEquals(1, result.errors().size(), "M9 is reported once");
        assertTrue(kinds(result).contains(DiagnosticKind.UNRESOLVED_DEPENDENCY));
        assertEquals(java.util.Set.of("X", "Y"), result.unresolved());
        assertTrue(result.graph().contains("Z"));
        assertEquals(Operation.COPY, ((DerivedNode) result.graph().get("Z").orElseThrow()).getOperation());
    }

    @Test
    void testNestedExpressionsAreHoisted() {
        IrBuildResult result = build("LAYER A 1\nLAYER B 2\nLAYER C 3\nX = (A OR B) AND C");
        IrGraph graph = result.graph();

        DerivedNode temp = (DerivedNode) graph.get("X_t1").orElseThrow();
        assertTrue(temp.isSynthetic());
        assertEquals(Operation.OR, temp.getOperation());
        assertEquals(List.of("A", "B"), temp.getOperands());

        DerivedNode x = (DerivedNode) graph.get("X").orElseThrow();
        assertEquals(List.of("X_t1", "C"), x.getOperands());
        assertFalse(graph.declaredNodes().contains(temp));
    }

    @Test
    void testAssociativeChainsAreFlattened() {
        IrBuildResult result = build("LAYER A 1\nLAYER B 2\nLAYER C 3\nY = AND A B C\nZ = A OR B OR C");

        assertEquals(List.of("A", "B", "C"), ((DerivedNode) result.graph().get("Y").orElseThrow()).getOperands());
        assertEquals(List.of("A", "B", "C"), ((DerivedNode) result.graph().get("Z").orElseThrow()).getOperands());
        assertEquals(5, result.graph().size(), "no temporaries for a flat chain");
    }

    @Test
    void testAnonymousChecksTakeBlockName() {
        IrBuildResult result = build("LAYER M1 1\nR {\n  EXTERNAL M1 < 90nm\n  WIDTH M1 < 0.1\n}");

        CheckNode first = (CheckNode) result.graph().get("R").orElseThrow();
        CheckNode second = (CheckNode) result.graph().get("R_2").orElseThrow();
        assertEquals(Measurement.SPACING, first.getMeasurement());
        assertEquals("0.09", first.getFormattedThreshold());
        assertEquals("R", second.getRuleName());
        assertEquals("Spacing violation: < 0.09um", first.getMessage());
        assertFalse(first.hasDescription());
    }

    @Test
    void testSizeKeepsNumericParameters() {
        IrBuildResult result = build("LAYER P 1\nS = SIZE P BY 0.10");

        DerivedNode size = (DerivedNode) result.graph().get("S").orElseThrow();
        assertEquals(Operation.SIZE, size.getOperation());
        assertEquals(List.of("P"), size.getOperands());
        assertEquals(List.of("0.1"), size.getParameters());
    }

    @Test
    void testNestedAreaComparisonSelectsShapes() {
        IrBuildResult result = build("LAYER M1 1\nX = M1 AND (AREA M1 > 2)");

        DerivedNode select = (DerivedNode) result.graph().get("X_t1").orElseThrow();
        assertEquals(Operation.SELECT_AREA, select.getOperation());
        assertEquals(List.of(">", "2"), select.getParameters());
    }

    @Test
    void testUntranslatableComparisonBecomesOpaque() {
        IrBuildResult result = build("LAYER M1 1\nX = M1 < 0.5\nY = X");

        OpaqueNode x = (OpaqueNode) result.graph().get("X").orElseThrow();
        assertFalse(x.isSynthetic());
        assertEquals("M1 < 0.5", x.getRawText());
        assertEquals(List.of(DiagnosticKind.UNSUPPORTED_COMPARISON), kinds(result));
        assertFalse(result.hasFatalErrors());
        assertTrue(result.graph().contains("Y"));
    }

    @Test
    void testFailedStatementDoesNotLeakTemporaries() {
        IrBuildResult result = build("LAYER A 1\nLAYER B 2\nLAYER C 3\nX = (A OR B) AND (C < 1)\nX_t1 = A");

        assertInstanceOf(OpaqueNode.class, result.graph().get("X").orElseThrow());
        DerivedNode userDefined = (DerivedNode) result.graph().get("X_t1").orElseThrow();
        assertFalse(userDefined.isSynthetic());
        assertTrue(result.errors().isEmpty());
    }

    @Test
    void testUnsupportedStatementIsPassedThrough() {
        IrBuildResult result = build("DRC MAXIMUM RESULTS 1000\nLAYER M1 1");

        OpaqueNode opaque = (OpaqueNode) result.graph().get("#unsupported@1").orElseThrow();
        assertTrue(opaque.isSynthetic());
        assertEquals("DRC MAXIMUM RESULTS 1000", opaque.getRawText());
        assertEquals(List.of(DiagnosticKind.UNSUPPORTED_CONSTRUCT), kinds(result));
        assertEquals(1, result.graph().declaredNodes().size());
    }

    @Test
    void testBlockAssignmentFollowedByCheck() {
        IrBuildResult result = build("LAYER a 1\nLAYER b 2\nR {\n  x = AND a b\n  WIDTH x < 0.1\n}");

        assertTrue(result.diagnostics().isEmpty());
        DerivedNode x = (DerivedNode) result.graph().get("x").orElseThrow();
        assertEquals(Operation.AND, x.getOperation());
        assertEquals(List.of("a", "b"), x.getOperands());
        CheckNode check = (CheckNode) result.graph().get("R").orElseThrow();
        assertEquals(List.of("x"), check.getTargets());
        assertEquals(5, check.getLine());
    }

    @Test
    void testBlockSizeFollowedByCheck() {
        IrBuildResult result = build("LAYER a 1\nR {\n  x = SIZE a BY 0.1\n  WIDTH x < 0.1\n}");

        assertTrue(result.diagnostics().isEmpty());
        DerivedNode x = (DerivedNode) result.graph().get("x").orElseThrow();
        assertEquals(Operation.SIZE, x.getOperation());
        assertEquals(List.of("0.1"), x.getParameters());
        assertEquals(Measurement.WIDTH, ((CheckNode) result.graph().get("R").orElseThrow()).getMeasurement());
    }

    @Test
    void testMalformedStatementIsPassedThrough() {
        Parser parser = new Parser(new Lexer("LAYER M2 20\nX = M2 AND\nLAYER M3 30").tokenize());
        IrBuildResult result = builder.build(parser.parse());

        assertEquals(1, parser.getErrors().size());
        OpaqueNode opaque = (OpaqueNode) result.graph().get("#unsupported@2").orElseThrow();
        assertEquals("X = M2 AND", opaque.getRawText());
        assertTrue(opaque.getReason().startsWith("syntax error, expected "));
        assertTrue(result.diagnostics().isEmpty(), "the syntax error is reported by the parser only");
        assertTrue(result.graph().contains("M3"));
    }
}
