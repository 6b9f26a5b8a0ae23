package com.purchasingpower.ptcaudit.exception;

import lombok.Getter;

/**
 * Identifier is neither a result id ({@code ar-}, {@code sk-}) nor a canvas id ({@code c-}).
 */
@Getter
public class InvalidRunIdentifierException extends RuntimeException {

    private final String identifier;

    public InvalidRunIdentifierException(String identifier) {
        super("ID must start with 'ar-'/'sk-' (result_id) or 'c-' (canvas_id), got: " + identifier);
        this.identifier = identifier;
    }
}
