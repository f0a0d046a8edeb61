package org.csu.svrf2pxl.cli.tool;

import org.csu.svrf2pxl.engine.TranslationStatistics;

import java.util.ArrayList;
import java.util.List;

public class StatisticsFormatter {

    public static String format(String sourceName, TranslationStatistics statistics) {
        List<List<String>> rows = new ArrayList<>();
        rows.add(List.of("Layers", String.valueOf(statistics.layers())));
        rows.add(List.of("Derived layers", String.valueOf(statistics.derivedLayers())));
        rows.add(List.of("Checks", String.valueOf(statistics.checks())));
        statistics.checksByMeasurement().forEach((measurement, count) ->
                rows.add(List.of("  " + measurement.displayName(), String.valueOf(count))));
        rows.add(List.of("Boolean operations", String.valueOf(statistics.booleanOperations())));
        rows.add(List.of("Unsupported constructs", String.valueOf(statistics.unsupportedConstructs())));
        rows.add(List.of("Placeholders", String.valueOf(statistics.placeholders())));
        statistics.diagnosticsByKind().forEach((kind, count) ->
                rows.add(List.of("Diagnostics " + kind, String.valueOf(count))));
        rows.add(List.of("Output lines", String.valueOf(statistics.outputLines())));
        rows.add(List.of("Output bytes", String.valueOf(statistics.outputBytes())));
        return "Statistics for " + sourceName + "\n" + ConsoleTable.format(List.of("Item", "Count"), rows);
    }
}
