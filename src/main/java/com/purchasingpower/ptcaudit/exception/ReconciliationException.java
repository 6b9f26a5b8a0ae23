package com.purchasingpower.ptcaudit.exception;

import lombok.Getter;

/**
 * Fetching the snapshot of a run failed.
 */
@Getter
public class ReconciliationException extends RuntimeException {

    private final String resultId;

    public ReconciliationException(String message, String resultId, Throwable cause) {
        super(message, cause);
        this.resultId = resultId;
    }
}
