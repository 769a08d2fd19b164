package com.typewarden.core.model;

import java.util.List;

/**
 * Domain verdict for one occurrence together with the signals that shaped it.
 */
public record DomainContext(
    CodeDomain domain,
    List<String> intentionalityHints,
    List<String> suggestedTypes,
    List<String> preservationReasons
) {
    public DomainContext {
        intentionalityHints = intentionalityHints != null ? List.copyOf(intentionalityHints) : List.of();
        suggestedTypes = suggestedTypes != null ? List.copyOf(suggestedTypes) : List.of();
        preservationReasons = preservationReasons != null ? List.copyOf(preservationReasons) : List.of();
    }

    public static DomainContext of(CodeDomain domain) {
        return new DomainContext(domain, List.of(), List.of(), List.of());
    }
}
