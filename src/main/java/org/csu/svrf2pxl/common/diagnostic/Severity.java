package org.csu.svrf2pxl.common.diagnostic;

public enum Severity {
    ERROR,
    WARNING,
    INFO
}
