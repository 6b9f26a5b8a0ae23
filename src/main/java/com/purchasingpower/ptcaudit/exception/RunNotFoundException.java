package com.purchasingpower.ptcaudit.exception;

import lombok.Getter;

/**
 * The requested run identifier matched no agent result. Fatal for report
 * generation and never retried.
 */
@Getter
public class RunNotFoundException extends RuntimeException {

    private final String identifier;
    private final String title;

    public RunNotFoundException(String identifier, String title) {
        super(title != null
                ? String.format("No result found for canvas_id=%s with title='%s'", identifier, title)
                : String.format("No result found for %s=%s", identifier.startsWith("c-") ? "canvas_id" : "result_id", identifier));
        this.identifier = identifier;
        this.title = title;
    }
}
