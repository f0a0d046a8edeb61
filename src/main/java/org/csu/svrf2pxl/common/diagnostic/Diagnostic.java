package org.csu.svrf2pxl.common.diagnostic;

/**
 * A structured problem report. Rendering to text is left to the CLI formatters.
 *
 * @param kind     what went wrong
 * @param severity how bad it is
 * @param line     1-based source line, or 0 when unknown
 * @param column   1-based source column, or 0 when unknown
 * @param symbol   the offending symbol, or null when the problem is not tied to one
 * @param message  human readable detail
 */
public record Diagnostic(DiagnosticKind kind, Severity severity, int line, int column, String symbol, String message) {

    public static Diagnostic of(DiagnosticKind kind, int line, String symbol, String message) {
        return new Diagnostic(kind, kind.defaultSeverity(), line, 0, symbol, message);
    }

    public boolean isFatal() {
        return kind.isFatal();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(severity).append(' ').append(kind);
        if (line > 0) {
            sb.append(" at line ").append(line);
            if (column > 0) {
                sb.append(", column ").append(column);
            }
        }
        if (symbol != null) {
            sb.append(" [").append(symbol).append(']');
        }
        return sb.append(": ").append(message).toString();
    }
}
