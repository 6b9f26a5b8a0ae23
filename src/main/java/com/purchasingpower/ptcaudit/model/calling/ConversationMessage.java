package com.purchasingpower.ptcaudit.model.calling;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * One row of {@code action_messages}; {@code toolCallMeta} is the raw JSON as stored.
 */
@Value
@Builder
public class ConversationMessage {
    String messageId;
    String type;
    String content;
    String toolCallMeta;
    LocalDateTime createdAt;
}
