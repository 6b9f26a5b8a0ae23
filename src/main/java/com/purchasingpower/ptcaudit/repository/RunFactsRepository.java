package com.purchasingpower.ptcaudit.repository;

import com.purchasingpower.ptcaudit.config.ReconciliationProperties;
import com.purchasingpower.ptcaudit.model.verification.CredentialRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static com.purchasingpower.ptcaudit.repository.ToolCallRecordRepository.runParams;
import static com.purchasingpower.ptcaudit.repository.ToolCallRecordRepository.timestamp;

/**
 * Auxiliary per-run facts used by verification: PTC flag, message count and the
 * temporary sandbox API key.
 */
@Repository
@RequiredArgsConstructor
public class RunFactsRepository {

    private final NamedParameterJdbcTemplate jdbc;
    private final ReconciliationProperties properties;

    /**
     * Caller must check the column exists first.
     */
    public Optional<Boolean> findPtcEnabled(String resultId, int version) {
        String sql = String.format(
                "SELECT ptc_enabled FROM %s.action_results WHERE result_id = :resultId AND version = :version",
                properties.getSchema());
        List<Boolean> rows = jdbc.query(sql, runParams(resultId, version),
                (rs, rowNum) -> (Boolean) rs.getObject("ptc_enabled"));
        return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
    }

    public long countMessages(String resultId, int version) {
        String sql = String.format(
                "SELECT COUNT(*) FROM %s.action_messages WHERE result_id = :resultId AND version = :version",
                properties.getSchema());
        Long count = jdbc.queryForObject(sql, runParams(resultId, version), Long.class);
        return count != null ? count : 0L;
    }

    /**
     * Most recent API key of the user created at or after {@code since}.
     */
    public Optional<CredentialRecord> findLatestCredential(String uid, LocalDateTime since) {
        String sql = String.format("""
                SELECT expires_at, created_at
                FROM %s.user_api_keys
                WHERE uid = :uid AND created_at >= :since
                ORDER BY created_at DESC
                LIMIT 1
                """, properties.getSchema());
        List<CredentialRecord> rows = jdbc.query(sql, new MapSqlParameterSource()
                        .addValue("uid", uid)
                        .addValue("since", since),
                (rs, rowNum) -> new CredentialRecord(timestamp(rs, "created_at"), timestamp(rs, "expires_at")));
        return rows.stream().findFirst();
    }
}
