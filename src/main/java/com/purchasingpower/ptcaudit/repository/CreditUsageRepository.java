package com.purchasingpower.ptcaudit.repository;

import com.purchasingpower.ptcaudit.config.ReconciliationProperties;
import com.purchasingpower.ptcaudit.model.billing.UsageTotals;
import com.purchasingpower.ptcaudit.model.verification.BillingLinkage;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import static com.purchasingpower.ptcaudit.repository.ToolCallRecordRepository.runParams;
import static com.purchasingpower.ptcaudit.repository.ToolCallRecordRepository.zeroIfNull;

/**
 * Run-level queries against {@code credit_usages}.
 */
@Repository
@RequiredArgsConstructor
public class CreditUsageRepository {

    private static final String USAGE_TOTALS_SQL = """
            SELECT
              SUM(CASE WHEN usage_type = 'tool_call'  THEN amount     ELSE 0 END) AS tool_credits,
              SUM(CASE WHEN usage_type = 'model_call' THEN amount     ELSE 0 END) AS model_credits,
              SUM(amount)                                                          AS total_credits,
              SUM(CASE WHEN usage_type = 'tool_call'  THEN due_amount ELSE 0 END) AS tool_original,
              SUM(CASE WHEN usage_type = 'model_call' THEN due_amount ELSE 0 END) AS model_original
            FROM %s.credit_usages
            WHERE action_result_id = :resultId AND version = :version
            """;

    private static final String LINKAGE_SQL = """
            SELECT
              COUNT(*)          AS total_billed,
              COUNT(tc.call_id) AS matched
            FROM %s.credit_usages cu
            LEFT JOIN %s.tool_call_results tc ON cu.tool_call_id = tc.call_id
            WHERE cu.action_result_id = :resultId AND cu.version = :version AND cu.usage_type = 'tool_call'
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ReconciliationProperties properties;

    /**
     * Credits and original prices split by usage type. Sums are zero when the run
     * has no billing rows.
     */
    public UsageTotals sumUsage(String resultId, int version) {
        String sql = String.format(USAGE_TOTALS_SQL, properties.getSchema());
        return jdbc.queryForObject(sql, runParams(resultId, version), (rs, rowNum) -> UsageTotals.builder()
                .toolCredits(zeroIfNull(rs.getBigDecimal("tool_credits")))
                .modelCredits(zeroIfNull(rs.getBigDecimal("model_credits")))
                .totalCredits(zeroIfNull(rs.getBigDecimal("total_credits")))
                .toolOriginalPrice(zeroIfNull(rs.getBigDecimal("tool_original")))
                .modelOriginalPrice(zeroIfNull(rs.getBigDecimal("model_original")))
                .build());
    }

    /**
     * How many tool-call billing rows exist and how many resolve to a call record.
     */
    public BillingLinkage findBillingLinkage(String resultId, int version) {
        String schema = properties.getSchema();
        String sql = String.format(LINKAGE_SQL, schema, schema);
        return jdbc.queryForObject(sql, runParams(resultId, version),
                (rs, rowNum) -> new BillingLinkage(rs.getLong("total_billed"), rs.getLong("matched")));
    }
}
