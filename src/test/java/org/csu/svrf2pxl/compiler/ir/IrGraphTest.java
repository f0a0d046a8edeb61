package org.csu.svrf2pxl.compiler.ir;

import org.csu.svrf2pxl.common.exception.CyclicDefinitionException;
import org.csu.svrf2pxl.common.exception.UndefinedSymbolException;
import org.csu.svrf2pxl.compiler.ir.node.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class IrGraphTest {

    private static DerivedNode derived(String symbol, Operation operation, String... operands) {
        return new DerivedNode(symbol, 1, false, operation, List.of(operands), List.of());
    }

    private static List<String> symbols(List<? extends IrNode> nodes) {
        return nodes.stream().map(IrNode::getSymbol).collect(Collectors.toList());
    }

    @Test
    void testTopologicalOrderKeepsDeclarationOrderForTies() {
        IrGraph graph = new IrGraph(List.of(
                derived("X", Operation.COPY, "B"),
                new LayerNode("A", 2, 1, 0),
                new LayerNode("B", 3, 2, 0),
                derived("Y", Operation.AND, "A", "X")));

        assertEquals(List.of("A", "B", "X", "Y"), symbols(graph.topologicalOrder()));
        // 多次调用结果一致
        assertEquals(symbols(graph.topologicalOrder()), symbols(graph.topologicalOrder()));
    }

    @Test
    void testRejectsUnknownDependency() {
        assertThrows(UndefinedSymbolException.class,
                () -> new IrGraph(List.of(derived("X", Operation.COPY, "NOPE"))));
    }

    @Test
    void testRejectsCycle() {
        CyclicDefinitionException e = assertThrows(CyclicDefinitionException.class, () -> new IrGraph(List.of(
                derived("A", Operation.COPY, "B"),
                derived("B", Operation.COPY, "A"))));
        assertTrue(e.getMessage().contains("[A, B]"));
    }

    @Test
    void testRejectsDuplicateSymbol() {
        assertThrows(IllegalArgumentException.class, () -> new IrGraph(List.of(
                new LayerNode("A", 1, 1, 0),
                new LayerNode("A", 2, 2, 0))));
    }

    @Test
    void testQueries() {
        IrGraph graph = new IrGraph(List.of(
                new LayerNode("A", 1, 1, 0),
                new ExternalNode("LIB"),
                new DerivedNode("T", 2, true, Operation.NOT, List.of("A"), List.of()),
                derived("X", Operation.AND, "A", "A", "LIB"),
                new OpaqueNode("#unsupported@4", 4, true, "DRC SUMMARY", "unsupported construct")));

        assertEquals(List.of("T", "X"), graph.dependentsOf("A"));
        assertEquals(List.of(), graph.dependentsOf("X"));
        assertEquals(List.of("A", "X"), symbols(graph.declaredNodes()));
        assertEquals(List.of("T", "X"), symbols(graph.nodesOfType(DerivedNode.class)));
        assertEquals(1, graph.opaqueCount());
        assertTrue(IrGraph.empty().topologicalOrder().isEmpty());
    }
}
