package org.csu.svrf2pxl.codegen;

import org.csu.svrf2pxl.common.diagnostic.Diagnostic;

import java.util.List;

/**
 * @param text          the generated target deck
 * @param diagnostics   placeholders and pass-throughs, one per affected symbol
 * @param placeholders  symbols emitted as marked placeholders instead of statements, in output order
 * @param statements    number of target statements emitted (a check counts two)
 */
public record GenerationResult(String text, List<Diagnostic> diagnostics, List<String> placeholders, int statements) {
}
