package org.csu.svrf2pxl.cli.tool;

import org.csu.svrf2pxl.analysis.MappingRecord;
import org.csu.svrf2pxl.analysis.Relationship;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 将变量对应关系格式化为控制台表格, 并给出汇总统计。
 */
public class MappingReportFormatter {

    private static final List<String> HEADERS = List.of("Relationship", "Source", "Target", "Confidence", "Rationale");

    public static String format(List<MappingRecord> records) {
        if (records.isEmpty()) {
            return "No symbols to compare.";
        }
        List<List<String>> rows = new ArrayList<>();
        for (MappingRecord record : records) {
            rows.add(List.of(
                    record.relationship().label(),
                    String.join(", ", record.sourceSymbols()),
                    String.join(", ", record.targetSymbols()),
                    String.format(Locale.ROOT, "%.2f", record.confidence()),
                    record.rationale()));
        }
        return ConsoleTable.format(HEADERS, rows) + "\n" + records.size() + " mapping records.";
    }

    /**
     * Totals, same-name match rate and per-relationship counts.
     */
    public static String summary(List<MappingRecord> records) {
        long sources = records.stream().mapToLong(r -> r.sourceSymbols().size()).sum();
        long targets = records.stream().flatMap(r -> r.targetSymbols().stream()).distinct().count();
        long sameName = records.stream()
                .filter(r -> r.relationship() == Relationship.ONE_TO_ONE)
                .filter(r -> r.sourceSymbols().equals(r.targetSymbols()))
                .count();
        Map<Relationship, Integer> counts = new EnumMap<>(Relationship.class);
        for (Relationship relationship : Relationship.values()) {
            counts.put(relationship, 0);
        }
        records.forEach(r -> counts.merge(r.relationship(), 1, Integer::sum));

        List<List<String>> rows = new ArrayList<>();
        rows.add(List.of("Source symbols", String.valueOf(sources)));
        rows.add(List.of("Target symbols", String.valueOf(targets)));
        rows.add(List.of("Same-name matches", sameName + " (" + percent(sameName, sources) + ")"));
        counts.forEach((relationship, count) -> rows.add(List.of(relationship.name(), String.valueOf(count))));
        return ConsoleTable.format(List.of("Metric", "Value"), rows);
    }

    public static List<String> mismatches(List<MappingRecord> records) {
        return records.stream()
                .filter(r -> r.relationship().isMismatch())
                .map(r -> r.relationship().label() + ": "
                        + String.join(", ", r.relationship() == Relationship.SOURCE_ONLY
                        ? r.sourceSymbols() : r.targetSymbols()))
                .collect(Collectors.toList());
    }

    private static String percent(long part, long whole) {
        if (whole == 0) {
            return "n/a";
        }
        return String.format(Locale.ROOT, "%.1f%%", 100.0 * part / whole);
    }
}
