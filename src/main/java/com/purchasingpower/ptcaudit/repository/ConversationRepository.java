package com.purchasingpower.ptcaudit.repository;

import com.purchasingpower.ptcaudit.config.ReconciliationProperties;
import com.purchasingpower.ptcaudit.model.calling.ConversationMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

import static com.purchasingpower.ptcaudit.repository.ToolCallRecordRepository.runParams;
import static com.purchasingpower.ptcaudit.repository.ToolCallRecordRepository.timestamp;

/**
 * Reads the conversation messages of a run for the calling trace.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class ConversationRepository {

    private static final String MESSAGES_SQL = """
            SELECT message_id, type, content, tool_call_meta, created_at
            FROM %s.action_messages
            WHERE result_id = :resultId AND version = :version
            ORDER BY created_at ASC
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ReconciliationProperties properties;

    /**
     * @return messages ordered by creation time ascending
     */
    public List<ConversationMessage> findMessages(String resultId, int version) {
        String sql = String.format(MESSAGES_SQL, properties.getSchema());
        List<ConversationMessage> messages = jdbc.query(sql, runParams(resultId, version),
                (rs, rowNum) -> ConversationMessage.builder()
                        .messageId(rs.getString("message_id"))
                        .type(rs.getString("type"))
                        .content(rs.getString("content"))
                        .toolCallMeta(rs.getString("tool_call_meta"))
                        .createdAt(timestamp(rs, "created_at"))
                        .build());
        log.debug("Fetched {} messages for {} v{}", messages.size(), resultId, version);
        return messages;
    }
}
