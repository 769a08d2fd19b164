package com.typewarden.core.replacer;

import java.util.List;

/**
 * Outcome of parsing structured compiler output.
 */
public sealed interface ParseResult permits ParseResult.Ok, ParseResult.ParseError {

    record Ok(List<CompilerDiagnostic> diagnostics) implements ParseResult {
        public Ok {
            diagnostics = List.copyOf(diagnostics);
        }
    }

    record ParseError(String reason) implements ParseResult {}
}
