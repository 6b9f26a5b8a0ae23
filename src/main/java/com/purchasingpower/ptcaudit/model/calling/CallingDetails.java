package com.purchasingpower.ptcaudit.model.calling;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Conversation and per-call payloads of a run, rendered by the calling trace.
 */
@Value
@Builder
public class CallingDetails {

    /**
     * Ordered by creation time.
     */
    @Singular
    List<ConversationMessage> messages;

    /**
     * Keyed by call id.
     */
    @Singular
    Map<String, CallPayload> payloads;

    public static CallingDetails empty() {
        return CallingDetails.builder().build();
    }

    public CallPayload payloadOf(String callId) {
        return payloads.getOrDefault(callId, CallPayload.empty());
    }

    /**
     * Message count per type, types in alphabetical order.
     */
    public SortedMap<String, Long> getMessageTypeCounts() {
        SortedMap<String, Long> counts = new TreeMap<>();
        for (ConversationMessage message : messages) {
            counts.merge(Objects.toString(message.getType(), "unknown"), 1L, Long::sum);
        }
        return counts;
    }
}
