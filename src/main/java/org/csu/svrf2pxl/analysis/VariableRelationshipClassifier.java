package org.csu.svrf2pxl.analysis;

import lombok.extern.slf4j.Slf4j;
import org.csu.svrf2pxl.compiler.ir.IrGraph;
import org.csu.svrf2pxl.compiler.ir.node.CheckNode;
import org.csu.svrf2pxl.compiler.ir.node.DerivedNode;
import org.csu.svrf2pxl.compiler.ir.node.ExternalNode;
import org.csu.svrf2pxl.compiler.ir.node.IrNode;
import org.csu.svrf2pxl.compiler.ir.node.LayerNode;
import org.csu.svrf2pxl.compiler.ir.node.OpaqueNode;
import org.csu.svrf2pxl.compiler.ir.node.Operation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * @description: 变量对应关系分类器
 *
 * Classifies how the user-declared symbols of a source graph correspond to those of a
 * target graph. Passes run in a fixed order and every pass walks symbols sorted by name,
 * so two runs over the same graphs give the same records:
 * <ol>
 *     <li>exact name (then case-insensitive) matches: ONE_TO_ONE</li>
 *     <li>variants sharing a prefix, or unmatched intermediates feeding one matched symbol: MANY_TO_ONE</li>
 *     <li>an aggregate whose parts exist individually in the target: ONE_TO_MANY</li>
 *     <li>differently named symbols with the same definition shape: SEMANTIC_EQUIVALENT</li>
 *     <li>whatever is left: SOURCE_ONLY and TARGET_ONLY</li>
 * </ol>
 * Every source symbol ends up in exactly one record. Semantic equivalence is a hint for a
 * reviewer, not a proof.
 */
@Slf4j
public class VariableRelationshipClassifier {

    static final double EXACT = 1.0;
    static final double CASE_INSENSITIVE = 0.95;
    static final double CONSOLIDATED = 0.8;
    static final double DECOMPOSED = 0.7;
    static final double SEMANTIC = 0.6;
    static final double SEMANTIC_WEAK = 0.4;

    private final ClassifierOptions options;

    public VariableRelationshipClassifier() {
        this(ClassifierOptions.defaults());
    }

    public VariableRelationshipClassifier(ClassifierOptions options) {
        this.options = options;
    }

    /**
     * @param target the reference graph, or null when there is none
     */
    public List<MappingRecord> classify(IrGraph source, IrGraph target) {
        if (target == null) {
            List<MappingRecord> records = new ArrayList<>();
            for (IrNode node : sortedDeclared(source).values()) {
                records.add(new MappingRecord(Relationship.SOURCE_ONLY, List.of(node.getSymbol()), List.of(),
                        "no reference deck supplied", 0));
            }
            return records;
        }
        List<MappingRecord> records = new Run(source, target).classify();
        log.debug("Classified {} records", records.size());
        return records;
    }

    /**
     * Declared symbols by name; hoisted temporaries and pass-through statements are not variables.
     */
    private static TreeMap<String, IrNode> sortedDeclared(IrGraph graph) {
        TreeMap<String, IrNode> nodes = new TreeMap<>();
        for (IrNode node : graph.declaredNodes()) {
            nodes.put(node.getSymbol(), node);
        }
        return nodes;
    }

    /**
     * State of one classification.
     */
    private final class Run {
        private final IrGraph source;
        private final IrGraph target;
        private final TreeMap<String, IrNode> sources;
        private final TreeMap<String, IrNode> targets;
        private final Map<String, String> targetsByLowerName = new TreeMap<>();

        // source symbol -> the record it was placed in
        private final Map<String, MappingRecord> placed = new LinkedHashMap<>();
        private final Set<String> usedTargets = new TreeSet<>();
        private final List<MappingRecord> records = new ArrayList<>();

        Run(IrGraph source, IrGraph target) {
            this.source = source;
            this.target = target;
            this.sources = sortedDeclared(source);
            this.targets = sortedDeclared(target);
            for (String name : targets.keySet()) {
                targetsByLowerName.putIfAbsent(name.toLowerCase(), name);
            }
        }

        List<MappingRecord> classify() {
            matchNames();
            List<Group> groups = consolidationCandidates();
            Map<String, Decomposition> decompositions = decompositionCandidates(groups);
            resolveAndCommit(groups, decompositions);
            if (options.isSemanticEquivalence()) {
                matchShapes();
            }
            for (String name : sources.keySet()) {
                if (!placed.containsKey(name)) {
                    String rationale = target.get(name).filter(n -> n instanceof ExternalNode).isPresent()
                            ? "referenced but not defined by the reference deck"
                            : "no counterpart in the reference deck";
                    add(new MappingRecord(Relationship.SOURCE_ONLY, List.of(name), List.of(), rationale, 0));
                }
            }
            for (String name : targets.keySet()) {
                if (!usedTargets.contains(name)) {
                    records.add(new MappingRecord(Relationship.TARGET_ONLY, List.of(), List.of(name),
                            "no counterpart in the translated deck", 0));
                }
            }
            records.sort(Comparator
                    .comparing((MappingRecord r) -> r.sourceSymbols().isEmpty())
                    .thenComparing(r -> r.sourceSymbols().isEmpty() ? "" : r.sourceSymbols().get(0))
                    .thenComparing(r -> r.targetSymbols().isEmpty() ? "" : r.targetSymbols().get(0)));
            return List.copyOf(records);
        }

        // ---- pass 1 ----

        private void matchNames() {
            for (IrNode node : sources.values()) {
                String name = node.getSymbol();
                if (targets.containsKey(name)) {
                    add(new MappingRecord(Relationship.ONE_TO_ONE, List.of(name), List.of(name),
                            nameRationale("identical name", node, targets.get(name)), EXACT));
                }
            }
            if (!options.isIgnoreCase()) {
                return;
            }
            for (IrNode node : sources.values()) {
                String name = node.getSymbol();
                if (placed.containsKey(name)) {
                    continue;
                }
                String match = targetsByLowerName.get(name.toLowerCase());
                if (match != null && !usedTargets.contains(match)) {
                    add(new MappingRecord(Relationship.ONE_TO_ONE, List.of(name), List.of(match),
                            nameRationale("same name ignoring case", node, targets.get(match)), CASE_INSENSITIVE));
                }
            }
        }

        private String nameRationale(String reason, IrNode sourceNode, IrNode targetNode) {
            if (sameShape(sourceNode, targetNode)) {
                return reason + ", same definition";
            }
            return reason + ", definitions differ (" + sourceNode.describe() + " vs " + targetNode.describe() + ")";
        }

        // ---- pass 2 ----

        private List<Group> consolidationCandidates() {
            List<Group> groups = new ArrayList<>();
            Set<String> grouped = new HashSet<>();

            // 前缀相同的变体, e.g. metal1_wide / metal1_narrow -> METAL1
            Map<String, List<String>> byPrefix = new TreeMap<>();
            for (String name : sources.keySet()) {
                int cut = name.lastIndexOf(options.getPrefixSeparator());
                if (placed.containsKey(name) || cut <= 0) {
                    continue;
                }
                byPrefix.computeIfAbsent(name.substring(0, cut), k -> new ArrayList<>()).add(name);
            }
            byPrefix.forEach((prefix, candidates) -> {
                Optional<String> into = targetNamed(prefix);
                if (into.isEmpty()) {
                    return;
                }
                // only variants of the same kind, e.g. layers into a layer
                Class<?> kind = targets.get(into.get()).getClass();
                List<String> members = candidates.stream()
                        .filter(m -> sources.get(m).getClass() == kind)
                        .collect(Collectors.toList());
                if (members.size() < options.getMinConsolidationGroup()) {
                    return;
                }
                groups.add(new Group(into.get(), new TreeSet<>(members), prefixPattern(prefix, members, into.get()),
                        true));
                grouped.addAll(members);
            });

            // 未匹配的中间结果最终汇入一个目标中存在的符号
            for (MappingRecord record : List.copyOf(records)) {
                if (record.relationship() != Relationship.ONE_TO_ONE) {
                    continue;
                }
                String sink = record.sourceSymbols().get(0);
                IrNode node = sources.get(sink);
                if (!(node instanceof DerivedNode || node instanceof CheckNode)) {
                    continue;
                }
                TreeSet<String> feeders = unmatchedFeeders(sink, grouped);
                if (!feeders.isEmpty()) {
                    grouped.addAll(feeders);
                    groups.add(new Group(record.targetSymbols().get(0), feeders,
                            "intermediate layers " + feeders + " inlined into '" + record.targetSymbols().get(0) + "'",
                            false));
                }
            }
            return groups;
        }

        private String prefixPattern(String prefix, List<String> members, String into) {
            List<IrNode> nodes = members.stream().map(sources::get).collect(Collectors.toList());
            boolean layerVariants = nodes.stream().allMatch(n -> n instanceof LayerNode)
                    && nodes.stream().map(n -> ((LayerNode) n).getGdsLayer()).distinct().count() == 1
                    && nodes.stream().map(n -> ((LayerNode) n).getDatatype()).distinct().count() == nodes.size();
            if (layerVariants) {
                return "layer datatype variants consolidated via filtering into '" + into + "'";
            }
            return "variants sharing prefix '" + prefix + "' consolidated into '" + into + "'";
        }

        /**
         * Unmatched derived layers and checks that {@code sink} reads, directly or through
         * other unmatched or hoisted symbols.
         */
        private TreeSet<String> unmatchedFeeders(String sink, Set<String> excluded) {
            TreeSet<String> feeders = new TreeSet<>();
            Deque<String> work = new ArrayDeque<>(source.get(sink).map(IrNode::getDependencies).orElse(List.of()));
            Set<String> visited = new HashSet<>();
            while (!work.isEmpty()) {
                String symbol = work.pop();
                if (!visited.add(symbol)) {
                    continue;
                }
                IrNode node = source.get(symbol).orElse(null);
                boolean intermediate = node instanceof DerivedNode || node instanceof CheckNode;
                if (!intermediate || placed.containsKey(symbol) || excluded.contains(symbol)) {
                    continue;
                }
                if (!node.isSynthetic()) {
                    if (targetNamed(symbol).isPresent()) {
                        continue;
                    }
                    feeders.add(symbol);
                }
                node.getDependencies().forEach(work::push);
            }
            return feeders;
        }

        // ---- pass 3 ----

        private Map<String, Decomposition> decompositionCandidates(List<Group> groups) {
            Set<String> sinks = groups.stream().map(Group::into).collect(Collectors.toSet());
            Map<String, Decomposition> candidates = new TreeMap<>();
            for (IrNode node : sources.values()) {
                String name = node.getSymbol();
                if (placed.containsKey(name) || targetNamed(name).isPresent()) {
                    continue;
                }
                // 聚合: all_errors = OR err_a err_b err_c, 目标中只有各个 err_*
                if (node instanceof DerivedNode derived && derived.getOperation() == Operation.OR
                        && derived.getOperands().size() >= 2) {
                    List<String> parts = new ArrayList<>();
                    for (String operand : new TreeSet<>(derived.getOperands())) {
                        targetNamed(operand).ifPresent(parts::add);
                    }
                    if (parts.size() == new TreeSet<>(derived.getOperands()).size()) {
                        candidates.put(name, new Decomposition(name, new TreeSet<>(parts),
                                "aggregate '" + name + "' split into its " + parts.size()
                                        + " components in the reference deck"));
                        continue;
                    }
                }
                // 反向前缀: METAL1 -> METAL1_wide, METAL1_narrow
                TreeSet<String> variants = new TreeSet<>();
                String prefix = name.toLowerCase() + options.getPrefixSeparator().toLowerCase();
                for (String candidate : targets.keySet()) {
                    boolean prefixed = options.isIgnoreCase()
                            ? candidate.toLowerCase().startsWith(prefix)
                            : candidate.startsWith(name + options.getPrefixSeparator());
                    if (prefixed && !usedTargets.contains(candidate) && !sinks.contains(candidate)) {
                        variants.add(candidate);
                    }
                }
                if (variants.size() >= options.getMinConsolidationGroup()) {
                    candidates.put(name, new Decomposition(name, variants,
                            "'" + name + "' split into variants " + variants + " in the reference deck"));
                }
            }
            return candidates;
        }

        /**
         * A symbol that fits both a consolidation group and a decomposition goes with the larger
         * group; ties go to the consolidation. The losing alternative is kept in the rationale.
         */
        private void resolveAndCommit(List<Group> groups, Map<String, Decomposition> decompositions) {
            for (Group group : groups) {
                List<String> notes = new ArrayList<>();
                for (String member : List.copyOf(group.members())) {
                    Decomposition alternative = decompositions.get(member);
                    if (alternative == null) {
                        continue;
                    }
                    if (alternative.parts().size() > group.members().size()) {
                        group.members().remove(member);
                        decompositions.put(member, alternative.withNote("discarded consolidation into '"
                                + group.into() + "' (group of " + (group.members().size() + 1) + ")"));
                    } else {
                        decompositions.remove(member);
                        notes.add("discarded split of '" + member + "' into " + alternative.parts());
                    }
                }
                if (group.members().isEmpty()
                        || (group.byPrefix() && group.members().size() < options.getMinConsolidationGroup())) {
                    continue;
                }
                List<String> members = new ArrayList<>(group.members());
                String rationale = group.pattern();
                // the source symbol already matched 1:1 with the sink joins the group
                for (MappingRecord record : List.copyOf(records)) {
                    if (record.relationship() == Relationship.ONE_TO_ONE
                            && record.targetSymbols().equals(List.of(group.into()))) {
                        records.remove(record);
                        members.addAll(record.sourceSymbols());
                    }
                }
                if (!notes.isEmpty()) {
                    rationale += "; " + String.join("; ", notes);
                }
                add(new MappingRecord(Relationship.MANY_TO_ONE, members, List.of(group.into()), rationale,
                        CONSOLIDATED));
            }
            for (Decomposition decomposition : decompositions.values()) {
                if (!placed.containsKey(decomposition.symbol())) {
                    add(new MappingRecord(Relationship.ONE_TO_MANY, List.of(decomposition.symbol()),
                            List.copyOf(decomposition.parts()), decomposition.rationale(), DECOMPOSED));
                }
            }
        }

        // ---- pass 4 ----

        private void matchShapes() {
            for (IrNode node : source.topologicalOrder()) {
                if (!sources.containsKey(node.getSymbol()) || placed.containsKey(node.getSymbol())) {
                    continue;
                }
                for (IrNode candidate : targets.values()) {
                    if (usedTargets.contains(candidate.getSymbol()) || !sameShape(node, candidate)) {
                        continue;
                    }
                    Optional<Boolean> operands = operandsConsistent(node, candidate);
                    if (operands.isEmpty()) {
                        continue;
                    }
                    add(new MappingRecord(Relationship.SEMANTIC_EQUIVALENT, List.of(node.getSymbol()),
                            List.of(candidate.getSymbol()),
                            "same definition shape (" + node.describe() + ")"
                                    + (operands.get() ? "" : "; operands not confirmed") + "; review required",
                            operands.get() ? SEMANTIC : SEMANTIC_WEAK));
                    break;
                }
            }
        }

        /**
         * Empty when a mapped operand disagrees; otherwise whether every operand was confirmed
         * through an earlier mapping.
         */
        private Optional<Boolean> operandsConsistent(IrNode sourceNode, IrNode targetNode) {
            List<String> sourceOperands = sourceNode.getDependencies();
            List<String> targetOperands = targetNode.getDependencies();
            boolean unordered = sourceNode instanceof DerivedNode derived && derived.getOperation().isAssociative();
            boolean confirmed = true;
            Set<String> claimed = new HashSet<>();
            for (int i = 0; i < sourceOperands.size(); i++) {
                Set<String> mapped = mappedTargets(sourceOperands.get(i));
                if (mapped.isEmpty()) {
                    confirmed = false;
                    continue;
                }
                if (unordered) {
                    Optional<String> hit = targetOperands.stream()
                            .filter(mapped::contains).filter(t -> !claimed.contains(t)).findFirst();
                    if (hit.isEmpty()) {
                        return Optional.empty();
                    }
                    claimed.add(hit.get());
                } else if (!mapped.contains(targetOperands.get(i))) {
                    return Optional.empty();
                }
            }
            return Optional.of(confirmed);
        }

        private Set<String> mappedTargets(String sourceSymbol) {
            MappingRecord record = placed.get(sourceSymbol);
            return record == null ? Set.of() : Set.copyOf(record.targetSymbols());
        }

        // ---- helpers ----

        private Optional<String> targetNamed(String name) {
            if (targets.containsKey(name)) {
                return Optional.of(name);
            }
            return options.isIgnoreCase()
                    ? Optional.ofNullable(targetsByLowerName.get(name.toLowerCase()))
                    : Optional.empty();
        }

        private void add(MappingRecord record) {
            records.add(record);
            record.sourceSymbols().forEach(s -> placed.put(s, record));
            usedTargets.addAll(record.targetSymbols());
        }
    }

    /**
     * Whether two nodes compute the same kind of thing with the same constants; operand
     * names are not compared.
     */
    boolean sameShape(IrNode a, IrNode b) {
        if (a instanceof LayerNode x && b instanceof LayerNode y) {
            return x.getGdsLayer() == y.getGdsLayer() && x.getDatatype() == y.getDatatype();
        }
        if (a instanceof CheckNode x && b instanceof CheckNode y) {
            return x.getMeasurement() == y.getMeasurement()
                    && x.getTargets().size() == y.getTargets().size()
                    && x.getComparator() == y.getComparator()
                    && Math.abs(x.getThreshold() - y.getThreshold()) <= options.getThresholdTolerance()
                    && sameNumbers(x.getParameters(), y.getParameters());
        }
        if (a instanceof DerivedNode x && b instanceof DerivedNode y) {
            return x.getOperation() == y.getOperation()
                    && x.getOperands().size() == y.getOperands().size()
                    && Objects.equals(x.getFunctionName(), y.getFunctionName())
                    && sameNumbers(x.getParameters(), y.getParameters());
        }
        if (a instanceof OpaqueNode x && b instanceof OpaqueNode y) {
            return x.getRawText().equals(y.getRawText());
        }
        return false;
    }

    private boolean sameNumbers(List<String> a, List<String> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            String x = a.get(i);
            String y = b.get(i);
            try {
                if (Math.abs(Double.parseDouble(x) - Double.parseDouble(y)) > options.getThresholdTolerance()) {
                    return false;
                }
            } catch (NumberFormatException e) {
                // comparator symbols and quoted arguments compare as text
                if (!x.equals(y)) {
                    return false;
                }
            }
        }
        return true;
    }

    private record Group(String into, TreeSet<String> members, String pattern, boolean byPrefix) {
    }

    private record Decomposition(String symbol, TreeSet<String> parts, String rationale) {
        Decomposition withNote(String note) {
            return new Decomposition(symbol, parts, rationale + "; " + note);
        }
    }
}
