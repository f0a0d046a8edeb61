package org.csu.svrf2pxl.codegen;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class OperationTableTest {

    private OperationTable table;

    @BeforeEach
    void setUp() throws Exception {
        table = new OperationTableLoader().loadResource("operation-tables/icv-pxl.json");
    }

    @Test
    void testLookupPrefersExactArity() {
        assertEquals(Optional.of("not {0}"), table.lookup("NOT", 1));
        assertEquals(Optional.of("{0} not {1}"), table.lookup("NOT", 2));
        // AND has no arity, so every count falls back to it
        assertEquals(Optional.of("{0} and {1}"), table.lookup("AND", 3));
        assertTrue(table.lookup("DENSITY", 2).isEmpty());
        assertTrue(table.lookup("NO_SUCH_KIND", 1).isEmpty());
        assertTrue(table.lookup("ENCLOSURE", 2).isPresent());
    }

    @Test
    void testRender() {
        assertEquals("size(P, 0.1)", OperationTable.render("size({0}, {1})", List.of("P", "0.1")));
        assertEquals("external_distance(M1, M1)", OperationTable.render("external_distance({0}, {0})", List.of("M1")));
        assertEquals("density(A, B, 0.5)", OperationTable.render("density({args})", List.of("A", "B", "0.5")));
        assertEquals("cost($1)", OperationTable.render("cost({0})", List.of("$1")));
        assertThrows(IllegalArgumentException.class, () -> OperationTable.render("{0} and {1}", List.of("A")));
    }

    @Test
    void testRenderDoesNotReplaceInsideArguments() {
        assertEquals("f(\"{0}\", B)", OperationTable.render("f({args})", List.of("\"{0}\"", "B")));
        assertEquals("g({1}, B)", OperationTable.render("g({0}, {1})", List.of("{1}", "B")));
        assertEquals("h({args})", OperationTable.render("h({0})", List.of("{args}")));
    }

    @Test
    void testPlaceholderCount() {
        assertEquals(1, OperationTable.placeholderCount("external_distance({0}, {0})"));
        assertEquals(3, OperationTable.placeholderCount("area_filter({0}, \"{1}\", {2})"));
        assertEquals(0, OperationTable.placeholderCount("density({args})"));
    }

    @Test
    void testMatchIsInverseOfRender() {
        assertEquals(Optional.of(List.of("A", "B")), OperationTable.match("{0} and {1}", "A   and B"));
        assertEquals(Optional.of(List.of("M1")),
                OperationTable.match("external_distance({0}, {0})", "external_distance( M1 ,M1 )"));
        assertEquals(Optional.of(List.of("P", "0.1")), OperationTable.match("size({0}, {1})", "size(P, 0.1)"));
    }

    @Test
    void testMatchRejectsOtherShapes() {
        assertTrue(OperationTable.match("external_distance({0}, {0})", "external_distance(M1, M2)").isEmpty());
        assertTrue(OperationTable.match("{0} and {1}", "Aand B").isEmpty());
        assertTrue(OperationTable.match("width({0})", "width(A) < 0.1").isEmpty());
        assertTrue(OperationTable.match("width({0})", "width(A and B)").isEmpty());
    }

    @Test
    void testMatchUnescapesQuotedArguments() {
        Optional<List<String>> args = OperationTable.match("drc_deck({0}, \"{1}\", \"{2}\")",
                "drc_deck(W1, \"M1.W.1\", \"say \\\"hi\\\"\")");
        assertEquals(Optional.of(List.of("W1", "M1.W.1", "say \"hi\"")), args);
    }

    @Test
    void testMatchVariadic() {
        assertEquals(Optional.of(List.of("M1", "f(a, b)", "\"x, y\"")),
                OperationTable.match("density({args})", "density(M1, f(a, b), \"x, y\")"));
        assertEquals(List.of(), OperationTable.splitArguments("  "));
    }

    @Test
    void testInfixIndex() {
        Map<String, OperationKey> index = table.infixIndex();
        assertEquals(OperationKey.any("AND"), index.get("and"));
        assertEquals(OperationKey.any("XOR"), index.get("xor"));
        assertEquals(new OperationKey("NOT", 2), index.get("not"));
        assertEquals(4, index.size());
    }

    @Test
    void testOperationKeyParse() {
        assertEquals(new OperationKey("SPACING", 2), OperationKey.parse(" spacing/2 "));
        assertEquals(OperationKey.any("LAYER"), OperationKey.parse("layer"));
        assertEquals("SPACING/2", OperationKey.parse("SPACING/2").toString());
        assertThrows(IllegalArgumentException.class, () -> OperationKey.parse("AND/x"));
        assertThrows(IllegalArgumentException.class, () -> OperationKey.parse("AND/-1"));
    }
}
