package org.csu.svrf2pxl.common.diagnostic;

/**
 * @description: 诊断类别
 *
 * Every problem a translation run can report. {@code fatal} kinds make the file's result
 * unusable for strict consumers; the others are recovered or tracked for coverage.
 */
public enum DiagnosticKind {
    LEX_ERROR(Severity.ERROR, true),
    SYNTAX_ERROR(Severity.ERROR, false),
    UNDEFINED_SYMBOL(Severity.ERROR, true),
    DUPLICATE_SYMBOL(Severity.ERROR, true),
    CYCLIC_DEFINITION(Severity.ERROR, true),
    UNRESOLVED_DEPENDENCY(Severity.ERROR, true),
    UNMAPPABLE_OPERATION(Severity.WARNING, false),
    UNSUPPORTED_CONSTRUCT(Severity.WARNING, false),
    UNSUPPORTED_COMPARISON(Severity.WARNING, false),
    UNRESOLVED_REFERENCE(Severity.INFO, false);

    private final Severity defaultSeverity;
    private final boolean fatal;

    DiagnosticKind(Severity defaultSeverity, boolean fatal) {
        this.defaultSeverity = defaultSeverity;
        this.fatal = fatal;
    }

    public Severity defaultSeverity() {
        return defaultSeverity;
    }

    public boolean isFatal() {
        return fatal;
    }
}
