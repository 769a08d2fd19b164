package com.typewarden.core.replacer;

/**
 * One compiler error.
 *
 * @param file    source file, or {@code null} for global diagnostics
 * @param line    1-based line, {@code 0} when unknown
 * @param column  1-based column, {@code 0} when unknown
 * @param code    compiler code such as {@code TS2304}, or {@code null}
 * @param message human-readable message
 * @param rawText the diagnostic as the compiler printed it
 */
public record CompilerDiagnostic(
    String file,
    int line,
    int column,
    String code,
    String message,
    String rawText
) {}
