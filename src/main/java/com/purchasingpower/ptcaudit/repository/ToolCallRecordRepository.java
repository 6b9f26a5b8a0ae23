package com.purchasingpower.ptcaudit.repository;

import com.purchasingpower.ptcaudit.config.ReconciliationProperties;
import com.purchasingpower.ptcaudit.engine.SchemaCapabilities;
import com.purchasingpower.ptcaudit.model.billing.ToolsetBreakdownRow;
import com.purchasingpower.ptcaudit.model.call.CallRecord;
import com.purchasingpower.ptcaudit.model.calling.CallPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the tool-call log of a run joined with its tool-call billing rows.
 *
 * <p>The projection depends on {@link SchemaCapabilities}: on older schemas the
 * {@code type} and {@code ptc_call_id} columns are selected as NULL.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class ToolCallRecordRepository {

    private static final String BILLING_CALLS_SQL = """
            SELECT
                tc.call_id, tc.tool_name, %s AS type, tc.status,
                tc.created_at, tc.updated_at, %s AS ptc_call_id, tc.toolset_id,
                cu.amount        AS credits_charged,
                cu.due_amount    AS original_price,
                cu.tool_call_meta::json->>'toolsetKey' AS billing_toolset_key
            FROM %s.tool_call_results tc
            LEFT JOIN %s.credit_usages cu
                ON tc.call_id = cu.tool_call_id AND cu.usage_type = 'tool_call'
            WHERE tc.result_id = :resultId AND tc.version = :version AND tc.deleted_at IS NULL
            ORDER BY tc.created_at ASC
            """;

    private static final String BREAKDOWN_SQL = """
            SELECT
              COALESCE(cu.tool_call_meta::json->>'toolsetKey', tc.toolset_id) AS toolset,
              tc.tool_name,
              %s AS call_type,
              COUNT(*)                                              AS calls,
              COUNT(CASE WHEN tc.status = 'completed' THEN 1 END)   AS success,
              SUM(COALESCE(cu.amount,     0))                       AS total_credits,
              SUM(COALESCE(cu.due_amount, 0))                       AS original_price
            FROM %s.tool_call_results tc
            LEFT JOIN %s.credit_usages cu
              ON tc.call_id = cu.tool_call_id AND cu.usage_type = 'tool_call'
            WHERE tc.result_id = :resultId AND tc.version = :version AND tc.deleted_at IS NULL
            GROUP BY 1, 2, 3
            ORDER BY total_credits DESC
            """;

    private static final String PAYLOADS_SQL = """
            SELECT call_id, input, output, error
            FROM %s.tool_call_results
            WHERE result_id = :resultId AND version = :version AND deleted_at IS NULL
            ORDER BY created_at ASC
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ReconciliationProperties properties;

    /**
     * @return call records ordered by creation time ascending
     */
    public List<CallRecord> findBillingCalls(String resultId, int version, SchemaCapabilities capabilities) {
        String schema = properties.getSchema();
        String sql = String.format(BILLING_CALLS_SQL,
                capabilities.hasTypeTag() ? "tc.type" : "NULL",
                capabilities.hasParentRef() ? "tc.ptc_call_id" : "NULL",
                schema, schema);

        List<CallRecord> records = jdbc.query(sql, runParams(resultId, version), CALL_RECORD_MAPPER);
        log.debug("Fetched {} tool call records for {} v{}", records.size(), resultId, version);
        return records;
    }

    /**
     * Calls grouped by toolset, tool and type, most expensive first.
     */
    public List<ToolsetBreakdownRow> findToolsetBreakdown(String resultId, int version,
                                                          SchemaCapabilities capabilities) {
        String schema = properties.getSchema();
        String sql = String.format(BREAKDOWN_SQL, capabilities.hasTypeTag() ? "tc.type" : "NULL", schema, schema);

        return jdbc.query(sql, runParams(resultId, version), (rs, rowNum) -> ToolsetBreakdownRow.builder()
                .toolset(rs.getString("toolset"))
                .toolName(rs.getString("tool_name"))
                .callType(rs.getString("call_type"))
                .calls(rs.getLong("calls"))
                .successCount(rs.getLong("success"))
                .totalCredits(zeroIfNull(rs.getBigDecimal("total_credits")))
                .originalPrice(zeroIfNull(rs.getBigDecimal("original_price")))
                .build());
    }

    /**
     * Input, output and error of every call of the run, keyed by call id in
     * creation order.
     */
    public Map<String, CallPayload> findCallPayloads(String resultId, int version) {
        String sql = String.format(PAYLOADS_SQL, properties.getSchema());
        Map<String, CallPayload> payloads = new LinkedHashMap<>();
        jdbc.query(sql, runParams(resultId, version), (RowCallbackHandler) rs -> {
            CallPayload payload = CallPayload.builder()
                    .callId(rs.getString("call_id"))
                    .input(rs.getString("input"))
                    .output(rs.getString("output"))
                    .error(rs.getString("error"))
                    .build();
            payloads.put(payload.getCallId(), payload);
        });
        return payloads;
    }

    static MapSqlParameterSource runParams(String resultId, int version) {
        return new MapSqlParameterSource()
                .addValue("resultId", resultId)
                .addValue("version", version);
    }

    static final RowMapper<CallRecord> CALL_RECORD_MAPPER = (ResultSet rs, int rowNum) -> CallRecord.builder()
            .callId(rs.getString("call_id"))
            .toolName(rs.getString("tool_name"))
            .typeTag(rs.getString("type"))
            .status(rs.getString("status"))
            .createdAt(timestamp(rs, "created_at"))
            .updatedAt(timestamp(rs, "updated_at"))
            .explicitParentId(rs.getString("ptc_call_id"))
            .toolsetId(rs.getString("toolset_id"))
            .creditsCharged(zeroIfNull(rs.getBigDecimal("credits_charged")))
            .originalPrice(zeroIfNull(rs.getBigDecimal("original_price")))
            .billingToolsetKey(rs.getString("billing_toolset_key"))
            .build();

    static LocalDateTime timestamp(ResultSet rs, String column) throws SQLException {
        return rs.getObject(column, LocalDateTime.class);
    }

    static BigDecimal zeroIfNull(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
