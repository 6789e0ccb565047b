package com.delta.propertytracker.distress.persistence;

import com.delta.propertytracker.distress.model.NewPropertyRecord;
import com.delta.propertytracker.distress.model.PropertyRecord;
import com.delta.propertytracker.distress.model.RunMeta;
import com.delta.propertytracker.distress.model.SnapshotEntry;
import com.delta.propertytracker.distress.model.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Repository
public class DistressJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(DistressJdbcRepository.class);
    private static final Set<String> COUNTED_TABLES = Set.of("items", "runs", "snapshots");
    private static final String ITEM_COLUMNS = """
        id, stage, apn, address, city, state, zip, record_date, doc_type, source_url,
        assessor_url, resolved_situs, resolved_at
        """;

    private final NamedParameterJdbcTemplate jdbc;

    public DistressJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public Map<String, Long> tableCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("items", countTable("items"));
        counts.put("runs", countTable("runs"));
        counts.put("snapshots", countTable("snapshots"));
        return counts;
    }

    public long countTable(String tableName) {
        if (!COUNTED_TABLES.contains(tableName)) {
            throw new IllegalArgumentException("Unknown table: " + tableName);
        }
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + tableName, Long.class);
        return count == null ? 0L : count;
    }

    // ---- items ----

    public long insertRecord(NewPropertyRecord record) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO items (stage, apn, address, city, state, zip, record_date, doc_type, source_url)
                VALUES (:stage, :apn, :address, :city, :state, :zip, :recordDate, :docType, :sourceUrl)
                """,
            recordParams(record),
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert item for stage " + record.stage());
        }
        return key.longValue();
    }

    public int insertRecords(List<NewPropertyRecord> records) {
        if (records == null || records.isEmpty()) {
            return 0;
        }
        SqlParameterSource[] batch = records.stream()
            .map(this::recordParams)
            .toArray(SqlParameterSource[]::new);
        jdbc.batchUpdate(
            """
                INSERT INTO items (stage, apn, address, city, state, zip, record_date, doc_type, source_url)
                VALUES (:stage, :apn, :address, :city, :state, :zip, :recordDate, :docType, :sourceUrl)
                """,
            batch
        );
        return batch.length;
    }

    public PropertyRecord findRecordById(long itemId) {
        List<PropertyRecord> rows = jdbc.query(
            "SELECT " + ITEM_COLUMNS + " FROM items WHERE id = :id",
            new MapSqlParameterSource("id", itemId),
            propertyRecordRowMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<PropertyRecord> findAllRecordsOrdered() {
        return jdbc.query(
            "SELECT " + ITEM_COLUMNS + " FROM items ORDER BY stage, city, address, id",
            new MapSqlParameterSource(),
            propertyRecordRowMapper()
        );
    }

    public List<PropertyRecord> findAllRecordsById() {
        return jdbc.query(
            "SELECT " + ITEM_COLUMNS + " FROM items ORDER BY id",
            new MapSqlParameterSource(),
            propertyRecordRowMapper()
        );
    }

    public long countRecordsByStage(Stage stage) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM items WHERE stage = :stage",
            new MapSqlParameterSource("stage", stage.name()),
            Long.class
        );
        return count == null ? 0L : count;
    }

    public List<String> findSourceUrlsByStage(Stage stage) {
        return jdbc.queryForList(
            "SELECT source_url FROM items WHERE stage = :stage AND source_url IS NOT NULL",
            new MapSqlParameterSource("stage", stage.name()),
            String.class
        );
    }

    /**
     * Records with a parcel number and no resolved situs. Never-attempted records come first, then
     * the oldest attempt, so parcels that keep failing do not starve the rest.
     */
    public List<PropertyRecord> findRecordsAwaitingSitus(int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("limit", limit);
        return jdbc.query(
            "SELECT " + ITEM_COLUMNS + """
                FROM items
                WHERE apn IS NOT NULL
                  AND TRIM(apn) <> ''
                  AND (resolved_situs IS NULL OR TRIM(resolved_situs) = '')
                ORDER BY resolved_at NULLS FIRST, id
                LIMIT :limit
                """,
            params,
            propertyRecordRowMapper()
        );
    }

    /**
     * Stamps a lookup attempt. Never touches {@code resolved_situs}.
     */
    public void recordResolutionAttempt(long itemId, String assessorUrl, Instant attemptedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", itemId)
            .addValue("assessorUrl", assessorUrl)
            .addValue("attemptedAt", toTimestamp(attemptedAt));
        jdbc.update(
            """
                UPDATE items
                SET assessor_url = COALESCE(:assessorUrl, assessor_url),
                    resolved_at = :attemptedAt
                WHERE id = :id
                """,
            params
        );
    }

    /**
     * Stores a validated situs. Blank values are refused so a resolved record can only move to
     * another non-empty value.
     */
    public boolean updateResolvedSitus(long itemId, String assessorUrl, String resolvedSitus, Instant resolvedAt) {
        if (resolvedSitus == null || resolvedSitus.isBlank()) {
            log.warn("Refusing to store blank situs for item {}", itemId);
            return false;
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", itemId)
            .addValue("assessorUrl", assessorUrl)
            .addValue("resolvedSitus", resolvedSitus.trim())
            .addValue("resolvedAt", toTimestamp(resolvedAt));
        int updated = jdbc.update(
            """
                UPDATE items
                SET assessor_url = COALESCE(:assessorUrl, assessor_url),
                    resolved_situs = :resolvedSitus,
                    resolved_at = :resolvedAt
                WHERE id = :id
                """,
            params
        );
        return updated > 0;
    }

    public int deleteRecordsByStage(Stage stage) {
        return jdbc.update(
            "DELETE FROM items WHERE stage = :stage",
            new MapSqlParameterSource("stage", stage.name())
        );
    }

    /**
     * Swaps every record of {@code stage} for {@code records} in one transaction. Readers see
     * either the old set or the new one.
     */
    @Transactional
    public int replaceRecordsByStage(Stage stage, List<NewPropertyRecord> records) {
        int deleted = deleteRecordsByStage(stage);
        int inserted = insertRecords(records);
        log.info("Replaced {} records. deleted={} inserted={}", stage, deleted, inserted);
        return inserted;
    }

    // ---- runs and snapshots ----

    public long insertRun(Instant createdAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("createdAt", toTimestamp(createdAt));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            "INSERT INTO runs (created_at) VALUES (:createdAt)",
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert run");
        }
        return key.longValue();
    }

    public void insertSnapshotEntries(List<SnapshotEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return;
        }
        SqlParameterSource[] batch = entries.stream()
            .map(entry -> new MapSqlParameterSource()
                .addValue("runId", entry.runId())
                .addValue("itemId", entry.itemId())
                .addValue("itemKey", entry.key())
                .addValue("hash", entry.hash()))
            .toArray(SqlParameterSource[]::new);
        jdbc.batchUpdate(
            """
                INSERT INTO snapshots (run_id, item_id, item_key, hash)
                VALUES (:runId, :itemId, :itemKey, :hash)
                """,
            batch
        );
    }

    public List<SnapshotEntry> findSnapshotEntries(long runId) {
        return jdbc.query(
            """
                SELECT run_id, item_id, item_key, hash
                FROM snapshots
                WHERE run_id = :runId
                ORDER BY item_id
                """,
            new MapSqlParameterSource("runId", runId),
            (rs, rowNum) -> new SnapshotEntry(
                rs.getLong("run_id"),
                rs.getLong("item_id"),
                rs.getString("item_key"),
                rs.getString("hash")
            )
        );
    }

    public int countSnapshotEntries(long runId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM snapshots WHERE run_id = :runId",
            new MapSqlParameterSource("runId", runId),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    public RunMeta findRunById(long runId) {
        List<RunMeta> runs = jdbc.query(
            "SELECT id, created_at FROM runs WHERE id = :runId",
            new MapSqlParameterSource("runId", runId),
            runMetaRowMapper()
        );
        return runs.isEmpty() ? null : runs.get(0);
    }

    public List<RunMeta> findRecentRuns(int limit) {
        int safeLimit = limit <= 0 ? 10 : limit;
        return jdbc.query(
            """
                SELECT id, created_at
                FROM runs
                ORDER BY id DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource("limit", safeLimit),
            runMetaRowMapper()
        );
    }

    /**
     * Removes every snapshot, run and item. Children first.
     */
    @Transactional
    public void deleteAll() {
        MapSqlParameterSource none = new MapSqlParameterSource();
        int snapshots = jdbc.update("DELETE FROM snapshots", none);
        int runs = jdbc.update("DELETE FROM runs", none);
        int items = jdbc.update("DELETE FROM items", none);
        log.info("Store cleared. snapshots={} runs={} items={}", snapshots, runs, items);
    }

    private MapSqlParameterSource recordParams(NewPropertyRecord record) {
        Stage stage = record.stage() == null ? Stage.OTHER : record.stage();
        return new MapSqlParameterSource()
            .addValue("stage", stage.name())
            .addValue("apn", record.apn())
            .addValue("address", record.address())
            .addValue("city", record.city())
            .addValue("state", record.state())
            .addValue("zip", record.zip())
            .addValue("recordDate", record.recordDate())
            .addValue("docType", record.docType())
            .addValue("sourceUrl", record.sourceUrl());
    }

    private RowMapper<PropertyRecord> propertyRecordRowMapper() {
        return (rs, rowNum) -> new PropertyRecord(
            rs.getLong("id"),
            Stage.fromRaw(rs.getString("stage")),
            rs.getString("apn"),
            rs.getString("address"),
            rs.getString("city"),
            rs.getString("state"),
            rs.getString("zip"),
            rs.getString("record_date"),
            rs.getString("doc_type"),
            rs.getString("source_url"),
            rs.getString("assessor_url"),
            rs.getString("resolved_situs"),
            toInstant(rs.getTimestamp("resolved_at"))
        );
    }

    private RowMapper<RunMeta> runMetaRowMapper() {
        return (rs, rowNum) -> new RunMeta(
            rs.getLong("id"),
            toInstant(rs.getTimestamp("created_at"))
        );
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
