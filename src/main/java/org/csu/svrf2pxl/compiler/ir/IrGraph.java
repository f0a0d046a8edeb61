package org.csu.svrf2pxl.compiler.ir;

import org.csu.svrf2pxl.common.exception.CyclicDefinitionException;
import org.csu.svrf2pxl.common.exception.UndefinedSymbolException;
import org.csu.svrf2pxl.compiler.ir.node.ExternalNode;
import org.csu.svrf2pxl.compiler.ir.node.IrNode;
import org.csu.svrf2pxl.compiler.ir.node.OpaqueNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.stream.Collectors;

/**
 * @description: 规则文件的中间表示 (IR)
 *
 * An immutable, insertion-ordered symbol table from name to {@link IrNode}. Construction
 * rejects references to unknown symbols and dependency cycles, so every graph that exists
 * can be topologically ordered.
 */
public final class IrGraph {

    private final Map<String, IrNode> nodes;
    private final Map<String, List<String>> dependents;

    public IrGraph(Collection<IrNode> definitions) {
        Map<String, IrNode> table = new LinkedHashMap<>();
        for (IrNode node : definitions) {
            if (table.putIfAbsent(node.getSymbol(), node) != null) {
                throw new IllegalArgumentException("Symbol '" + node.getSymbol() + "' defined twice.");
            }
        }
        Map<String, List<String>> reverse = new LinkedHashMap<>();
        for (IrNode node : table.values()) {
            reverse.putIfAbsent(node.getSymbol(), new ArrayList<>());
        }
        for (IrNode node : table.values()) {
            for (String dependency : node.getDependencies()) {
                if (!table.containsKey(dependency)) {
                    throw new UndefinedSymbolException(dependency, node.getSymbol(), node.getLine());
                }
                List<String> users = reverse.get(dependency);
                if (!users.contains(node.getSymbol())) {
                    users.add(node.getSymbol());
                }
            }
        }
        this.nodes = Collections.unmodifiableMap(table);
        this.dependents = reverse;
        topologicalOrder();
    }

    public static IrGraph empty() {
        return new IrGraph(List.of());
    }

    public Optional<IrNode> get(String symbol) {
        return Optional.ofNullable(nodes.get(symbol));
    }

    public boolean contains(String symbol) {
        return nodes.containsKey(symbol);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * All nodes in declaration order.
     */
    public Collection<IrNode> nodes() {
        return nodes.values();
    }

    /**
     * Symbols written by the deck author: hoisted temporaries, pass-through placeholders and
     * external stand-ins are left out.
     */
    public List<IrNode> declaredNodes() {
        return nodes.values().stream()
                .filter(n -> !n.isSynthetic())
                .filter(n -> !(n instanceof ExternalNode))
                .collect(Collectors.toList());
    }

    public <T extends IrNode> List<T> nodesOfType(Class<T> type) {
        return nodes.values().stream()
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }

    /**
     * Symbols that read {@code symbol} directly, in declaration order.
     */
    public List<String> dependentsOf(String symbol) {
        return Collections.unmodifiableList(dependents.getOrDefault(symbol, List.of()));
    }

    /**
     * Every symbol after all of the symbols it depends on; ties keep declaration order so the
     * result is the same on every run.
     *
     * @throws CyclicDefinitionException if the dependency edges contain a cycle
     */
    public List<IrNode> topologicalOrder() {
        Map<String, Integer> pending = new HashMap<>();
        Map<String, Integer> position = new HashMap<>();
        List<String> symbols = new ArrayList<>(nodes.keySet());
        for (int i = 0; i < symbols.size(); i++) {
            IrNode node = nodes.get(symbols.get(i));
            position.put(node.getSymbol(), i);
            pending.put(node.getSymbol(), (int) node.getDependencies().stream().distinct().count());
        }
        // smallest declaration index first
        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < symbols.size(); i++) {
            if (pending.get(symbols.get(i)) == 0) {
                ready.add(i);
            }
        }
        List<IrNode> order = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            String symbol = symbols.get(ready.poll());
            order.add(nodes.get(symbol));
            for (String user : dependents.getOrDefault(symbol, List.of())) {
                if (pending.merge(user, -1, Integer::sum) == 0) {
                    ready.add(position.get(user));
                }
            }
        }
        if (order.size() != nodes.size()) {
            List<String> cycle = nodes.keySet().stream()
                    .filter(s -> pending.get(s) > 0)
                    .collect(Collectors.toList());
            throw new CyclicDefinitionException(cycle);
        }
        return order;
    }

    /**
     * Count of pass-through nodes, i.e. source the translator could not express.
     */
    public long opaqueCount() {
        return nodes.values().stream().filter(n -> n instanceof OpaqueNode).count();
    }
}
