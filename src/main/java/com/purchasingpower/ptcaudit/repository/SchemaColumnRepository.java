package com.purchasingpower.ptcaudit.repository;

import com.purchasingpower.ptcaudit.config.ReconciliationProperties;
import com.purchasingpower.ptcaudit.engine.SchemaCapabilityProbe;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads {@code information_schema} to find out which optional columns and tables
 * the connected database has. Older databases predate several migrations.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class SchemaColumnRepository {

    private static final String COLUMNS_SQL = """
            SELECT column_name FROM information_schema.columns
            WHERE table_schema = :schema AND table_name = :table
              AND column_name IN (:columns)
            """;

    private static final String TABLE_SQL = """
            SELECT COUNT(*) FROM information_schema.columns
            WHERE table_schema = :schema AND table_name = :table
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ReconciliationProperties properties;

    /**
     * @return which of {@code type} / {@code ptc_call_id} exist on tool_call_results
     */
    public Set<String> findOptionalToolCallColumns() {
        return findColumns("tool_call_results",
                List.of(SchemaCapabilityProbe.TYPE_COLUMN, SchemaCapabilityProbe.PARENT_REF_COLUMN));
    }

    public boolean hasColumn(String table, String column) {
        return !findColumns(table, List.of(column)).isEmpty();
    }

    public boolean tableExists(String table) {
        Long count = jdbc.queryForObject(TABLE_SQL, new MapSqlParameterSource()
                .addValue("schema", properties.getSchema())
                .addValue("table", table), Long.class);
        return count != null && count > 0;
    }

    private Set<String> findColumns(String table, List<String> columns) {
        List<String> found = jdbc.queryForList(COLUMNS_SQL, new MapSqlParameterSource()
                .addValue("schema", properties.getSchema())
                .addValue("table", table)
                .addValue("columns", columns), String.class);
        log.debug("Columns present on {}.{}: {}", properties.getSchema(), table, found);
        return new LinkedHashSet<>(found);
    }
}
