package org.csu.svrf2pxl.cli.tool;

import org.csu.svrf2pxl.common.diagnostic.Diagnostic;
import org.csu.svrf2pxl.common.diagnostic.Severity;

import java.util.List;
import java.util.Locale;

/**
 * Renders diagnostics one per line as {@code file:line:column: severity: message [KIND]}.
 */
public class DiagnosticFormatter {

    public static String format(String sourceName, Diagnostic diagnostic) {
        StringBuilder sb = new StringBuilder(sourceName);
        if (diagnostic.line() > 0) {
            sb.append(':').append(diagnostic.line());
            if (diagnostic.column() > 0) {
                sb.append(':').append(diagnostic.column());
            }
        }
        sb.append(": ").append(diagnostic.severity().name().toLowerCase(Locale.ROOT)).append(": ")
                .append(diagnostic.message())
                .append(" [").append(diagnostic.kind()).append(']');
        return sb.toString();
    }

    /**
     * @param includeInfo whether INFO diagnostics are listed too
     */
    public static String formatAll(String sourceName, List<Diagnostic> diagnostics, boolean includeInfo) {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic diagnostic : diagnostics) {
            if (!includeInfo && diagnostic.severity() == Severity.INFO) {
                continue;
            }
            sb.append(format(sourceName, diagnostic)).append('\n');
        }
        return sb.toString();
    }
}
