package com.purchasingpower.ptcaudit.repository;

import com.purchasingpower.ptcaudit.config.ConfigurationPropertiesEnablerConfig;
import com.purchasingpower.ptcaudit.model.calling.ConversationMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Conversation lookups against an in-memory H2 database in PostgreSQL mode.
 */
@JdbcTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({ConversationRepository.class, ConfigurationPropertiesEnablerConfig.class})
@DisplayName("Conversation Repository Tests")
class ConversationRepositoryTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2025, 3, 1, 10, 0);

    @Autowired
    private ConversationRepository repository;

    @Autowired
    private JdbcTemplate jdbc;

    @BeforeEach
    void setUp() {
        jdbc.execute("""
                CREATE TABLE IF NOT EXISTS refly.action_messages (
                    message_id     VARCHAR(64) PRIMARY KEY,
                    result_id      VARCHAR(64) NOT NULL,
                    version        INT         NOT NULL,
                    type           VARCHAR(16),
                    content        TEXT,
                    tool_call_meta TEXT,
                    created_at     TIMESTAMP
                )
                """);
        insert("m2", "ar-1", 0, "ai", null, "{\"toolName\":\"web_search\",\"status\":\"completed\"}", T0.plusSeconds(2));
        insert("m1", "ar-1", 0, "human", "Price of BTC?", null, T0);
        insert("m3", "ar-1", 1, "ai", "Other version", null, T0.plusSeconds(1));
        insert("m4", "ar-2", 0, "ai", "Other run", null, T0.plusSeconds(1));
    }

    @Test
    @DisplayName("Messages of one run version in creation order")
    void findMessages_ordersByCreation() {
        List<ConversationMessage> messages = repository.findMessages("ar-1", 0);

        assertThat(messages).extracting(ConversationMessage::getMessageId).containsExactly("m1", "m2");
        assertEquals("Price of BTC?", messages.get(0).getContent());
        assertEquals(T0, messages.get(0).getCreatedAt());
        assertThat(messages.get(1).getToolCallMeta()).contains("web_search");
    }

    @Test
    @DisplayName("Unknown run has no messages")
    void findMessages_unknownRun() {
        assertThat(repository.findMessages("ar-9", 0)).isEmpty();
    }

    private void insert(String messageId, String resultId, int version, String type, String content,
                        String toolCallMeta, LocalDateTime createdAt) {
        jdbc.update("INSERT INTO refly.action_messages "
                        + "(message_id, result_id, version, type, content, tool_call_meta, created_at) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?)",
                messageId, resultId, version, type, content, toolCallMeta, createdAt);
    }
}
