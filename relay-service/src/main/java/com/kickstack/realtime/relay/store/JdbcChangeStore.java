package com.kickstack.realtime.relay.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kickstack.realtime.common.exception.ErrorCode;
import com.kickstack.realtime.common.exception.RelayException;
import com.kickstack.realtime.common.model.ChangeOperation;
import com.kickstack.realtime.common.model.ChangeRecord;
import com.kickstack.realtime.relay.config.RelayConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * JDBC access to the change table:
 * {@code (id, ts, table_name, op, row_pk, payload)}
 */
@Slf4j
@Repository
public class JdbcChangeStore implements ChangeStore {

    private static final Pattern IDENTIFIER =
            Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final String fetchSql;
    private final String maxIdSql;

    public JdbcChangeStore(NamedParameterJdbcTemplate jdbcTemplate,
                           ObjectMapper objectMapper,
                           RelayConfig config) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;

        String table = config.getStore().getTable();
        if (table == null || !IDENTIFIER.matcher(table).matches()) {
            throw new RelayException(ErrorCode.INVALID_STORE_CONFIG,
                    "Change store table must be a plain SQL identifier: " + table);
        }

        this.fetchSql = "SELECT id, ts, table_name, op, row_pk, payload FROM " + table
                + " WHERE id > :afterId AND table_name IN (:tables)"
                + " ORDER BY id ASC LIMIT :limit";
        this.maxIdSql = "SELECT COALESCE(MAX(id), 0) FROM " + table;

        log.info("Change store configured on table {}", table);
    }

    @Override
    public List<ChangeRecord> fetchSince(long afterId, Collection<String> tables, int limit) {
        if (tables == null || tables.isEmpty() || limit <= 0) {
            return Collections.emptyList();
        }

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("afterId", afterId)
                .addValue("tables", new ArrayList<>(tables))
                .addValue("limit", limit);

        List<ChangeRecord> records = jdbcTemplate.query(fetchSql, params, this::mapRow);
        log.debug("Fetched {} changes after id {} for tables {}", records.size(), afterId, tables);
        return records;
    }

    @Override
    public long currentMaxId() {
        Long maxId = jdbcTemplate.getJdbcTemplate().queryForObject(maxIdSql, Long.class);
        return maxId != null ? maxId : 0L;
    }

    private ChangeRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        long id = rs.getLong("id");
        return ChangeRecord.builder()
                .id(id)
                .timestamp(rs.getLong("ts"))
                .table(rs.getString("table_name"))
                .operation(ChangeOperation.fromValue(rs.getString("op")))
                .rowKey(rs.getString("row_pk"))
                .payload(parsePayload(id, rs.getString("payload")))
                .build();
    }

    private JsonNode parsePayload(long id, String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            // Payload is informational; the change itself is still delivered
            log.warn("Unparseable payload on change {}: {}", id, e.getOriginalMessage());
            return null;
        }
    }
}
