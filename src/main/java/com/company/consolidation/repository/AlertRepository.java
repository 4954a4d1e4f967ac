package com.company.consolidation.repository;

import com.company.consolidation.domain.AiClassification;
import com.company.consolidation.domain.Alert;
import com.company.consolidation.domain.AlertSource;
import com.company.consolidation.domain.GeoLocation;
import com.company.consolidation.domain.GeospatialData;
import com.company.consolidation.domain.enums.ConsolidationStatus;
import com.company.consolidation.exception.AlertStorageException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Alert store backed by the {@code alerts} table.
 *
 * Structured fields are kept in JSONB columns. Every write is an idempotent
 * upsert or update keyed by alert id.
 */
@Repository
@Slf4j
public class AlertRepository {

    private static final TypeReference<Map<String, String>> PARAMETERS_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<String>> IDS_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<AlertSource>> SOURCES_TYPE = new TypeReference<>() {};

    private static final String SELECT_BASE = """
        SELECT id, source_id, source_type, event_type, headline, description,
               location, geospatial_data, ai_classification, parameters,
               start_time, end_time, created_at, updated_at,
               consolidation_status, consolidated_into,
               consolidated_from, source_count, sources, enhanced_description
        FROM alerts
        """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final int writeChunkSize;

    public AlertRepository(JdbcTemplate jdbcTemplate,
                           ObjectMapper objectMapper,
                           @Value("${consolidation.batch.write-chunk-size:25}") int writeChunkSize) {
        if (writeChunkSize < 1) {
            throw new IllegalArgumentException("write-chunk-size must be at least 1: " + writeChunkSize);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.writeChunkSize = writeChunkSize;
    }

    /**
     * Alerts created at or after {@code since} that were never consolidated,
     * oldest first
     */
    public List<Alert> fetchUnconsolidated(Instant since, int limit) {
        String sql = SELECT_BASE + """
            WHERE created_at >= ?
            AND consolidation_status IS NULL
            ORDER BY created_at ASC, id ASC
            LIMIT ?
            """;

        try {
            return jdbcTemplate.query(sql, new AlertRowMapper(), Timestamp.from(since), limit);
        } catch (DataAccessException e) {
            log.error("Failed to fetch unconsolidated alerts since {}", since, e);
            throw new AlertStorageException("Failed to fetch unconsolidated alerts", e);
        }
    }

    public Optional<Alert> findById(String id) {
        try {
            List<Alert> results = jdbcTemplate.query(SELECT_BASE + " WHERE id = ?", new AlertRowMapper(), id);
            return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
        } catch (DataAccessException e) {
            throw new AlertStorageException("Failed to load alert " + id, e);
        }
    }

    public int countUnconsolidated() {
        try {
            Integer count = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM alerts WHERE consolidation_status IS NULL", Integer.class);
            return count != null ? count : 0;
        } catch (DataAccessException e) {
            throw new AlertStorageException("Failed to count unconsolidated alerts", e);
        }
    }

    /**
     * Insert or fully replace an alert
     */
    public Alert putAlert(Alert alert) {
        String sql = """
            INSERT INTO alerts (
                id, source_id, source_type, event_type, headline, description,
                location, geospatial_data, ai_classification, parameters,
                start_time, end_time, created_at, updated_at,
                consolidation_status, consolidated_into,
                consolidated_from, source_count, sources, enhanced_description
            ) VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?::jsonb, ?::jsonb,
                      ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?::jsonb, ?)
            ON CONFLICT (id) DO UPDATE SET
                source_id = EXCLUDED.source_id,
                source_type = EXCLUDED.source_type,
                event_type = EXCLUDED.event_type,
                headline = EXCLUDED.headline,
                description = EXCLUDED.description,
                location = EXCLUDED.location,
                geospatial_data = EXCLUDED.geospatial_data,
                ai_classification = EXCLUDED.ai_classification,
                parameters = EXCLUDED.parameters,
                start_time = EXCLUDED.start_time,
                end_time = EXCLUDED.end_time,
                updated_at = EXCLUDED.updated_at,
                consolidation_status = EXCLUDED.consolidation_status,
                consolidated_into = EXCLUDED.consolidated_into,
                consolidated_from = EXCLUDED.consolidated_from,
                source_count = EXCLUDED.source_count,
                sources = EXCLUDED.sources,
                enhanced_description = EXCLUDED.enhanced_description
            """;

        try {
            jdbcTemplate.update(sql,
                    alert.getId(),
                    alert.getSourceId(),
                    alert.getSourceType(),
                    alert.getEventType(),
                    alert.getHeadline(),
                    alert.getDescription(),
                    toJson(alert.getLocation()),
                    toJson(alert.getGeospatialData()),
                    toJson(alert.getAiClassification()),
                    toJson(alert.getParameters()),
                    toTimestamp(alert.getStartTime()),
                    toTimestamp(alert.getEndTime()),
                    toTimestamp(alert.getCreatedAt()),
                    toTimestamp(alert.getUpdatedAt()),
                    statusColumn(alert.getConsolidationStatus()),
                    alert.getConsolidatedInto(),
                    toJson(alert.getConsolidatedFrom()),
                    alert.getSourceCount(),
                    toJson(alert.getSources()),
                    alert.getEnhancedDescription()
            );
        } catch (DataAccessException e) {
            log.error("Failed to upsert alert {}", alert.getId(), e);
            throw new AlertStorageException("Failed to save alert " + alert.getId(), e);
        }

        log.debug("Upserted alert {} ({})", alert.getId(), alert.getConsolidationStatus());
        return alert;
    }

    public void updateAlertStatus(String id, ConsolidationStatus status, String consolidatedInto) {
        try {
            jdbcTemplate.update("""
                UPDATE alerts
                SET consolidation_status = ?,
                    consolidated_into = ?,
                    updated_at = NOW()
                WHERE id = ?
                """, statusColumn(status), consolidatedInto, id);
        } catch (DataAccessException e) {
            throw new AlertStorageException("Failed to update status of alert " + id, e);
        }
    }

    /**
     * Mark members as consolidated into {@code consolidatedInto}, issuing
     * batched updates of at most {@code writeChunkSize} rows each.
     *
     * @return number of chunks written
     */
    public int markConsolidated(List<String> alertIds, String consolidatedInto, Instant updatedAt) {
        String sql = """
            UPDATE alerts
            SET consolidation_status = ?,
                consolidated_into = ?,
                updated_at = ?
            WHERE id = ?
            """;

        int chunks = 0;
        for (int from = 0; from < alertIds.size(); from += writeChunkSize) {
            List<String> chunk = alertIds.subList(from, Math.min(from + writeChunkSize, alertIds.size()));

            List<Object[]> batchArgs = new ArrayList<>(chunk.size());
            for (String alertId : chunk) {
                batchArgs.add(new Object[]{
                        ConsolidationStatus.CONSOLIDATED.toColumnValue(),
                        consolidatedInto,
                        Timestamp.from(updatedAt),
                        alertId
                });
            }

            try {
                jdbcTemplate.batchUpdate(sql, batchArgs);
            } catch (DataAccessException e) {
                log.error("Failed to mark {} alerts as consolidated into {}", chunk.size(), consolidatedInto, e);
                throw new AlertStorageException("Failed to mark alerts as consolidated into " + consolidatedInto, e);
            }
            chunks++;
        }

        log.debug("Marked {} alerts as consolidated into {} in {} chunks",
                alertIds.size(), consolidatedInto, chunks);
        return chunks;
    }

    private String statusColumn(ConsolidationStatus status) {
        return status != null ? status.toColumnValue() : null;
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new AlertStorageException("Failed to serialise alert field", e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new AlertStorageException("Failed to read " + type.getSimpleName() + " column", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new AlertStorageException("Failed to read JSON column", e);
        }
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private class AlertRowMapper implements RowMapper<Alert> {
        @Override
        public Alert mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Alert.builder()
                    .id(rs.getString("id"))
                    .sourceId(rs.getString("source_id"))
                    .sourceType(rs.getString("source_type"))
                    .eventType(rs.getString("event_type"))
                    .headline(rs.getString("headline"))
                    .description(rs.getString("description"))
                    .location(fromJson(rs.getString("location"), GeoLocation.class))
                    .geospatialData(fromJson(rs.getString("geospatial_data"), GeospatialData.class))
                    .aiClassification(fromJson(rs.getString("ai_classification"), AiClassification.class))
                    .parameters(fromJson(rs.getString("parameters"), PARAMETERS_TYPE))
                    .startTime(toInstant(rs.getTimestamp("start_time")))
                    .endTime(toInstant(rs.getTimestamp("end_time")))
                    .createdAt(toInstant(rs.getTimestamp("created_at")))
                    .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                    .consolidationStatus(ConsolidationStatus.fromString(rs.getString("consolidation_status")))
                    .consolidatedInto(rs.getString("consolidated_into"))
                    .consolidatedFrom(fromJson(rs.getString("consolidated_from"), IDS_TYPE))
                    .sourceCount(rs.getObject("source_count", Integer.class))
                    .sources(fromJson(rs.getString("sources"), SOURCES_TYPE))
                    .enhancedDescription(rs.getString("enhanced_description"))
                    .build();
        }
    }
}
