package com.purchasingpower.ptcaudit.model.calling;

import lombok.Builder;
import lombok.Value;

/**
 * Input, output and error text of one tool call, as stored.
 */
@Value
@Builder
public class CallPayload {

    private static final CallPayload EMPTY = CallPayload.builder().build();

    String callId;
    String input;
    String output;
    String error;

    public static CallPayload empty() {
        return EMPTY;
    }

    public boolean hasError() {
        return error != null && !error.isEmpty();
    }
}
