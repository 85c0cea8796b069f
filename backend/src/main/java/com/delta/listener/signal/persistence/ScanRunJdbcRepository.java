package com.delta.listener.signal.persistence;

import com.delta.listener.signal.model.RunCounts;
import com.delta.listener.signal.model.RunError;
import com.delta.listener.signal.model.RunStats;
import com.delta.listener.signal.model.RunStatus;
import com.delta.listener.signal.model.RunType;
import com.delta.listener.signal.model.ScanRun;
import com.delta.listener.signal.model.ScanSource;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class ScanRunJdbcRepository {
    public static final int MAX_ERROR_DETAILS = 50;

    private static final String COLUMNS = """
        id, source_type, run_type, started_at, completed_at, status, items_scanned, discoveries_created,
        duplicates_skipped, auto_promoted, errors_count, error_details, cursor_data
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final JsonColumns json;
    private final RowMapper<ScanRun> rowMapper;

    public ScanRunJdbcRepository(NamedParameterJdbcTemplate jdbc, JsonColumns json) {
        this.jdbc = jdbc;
        this.json = json;
        this.rowMapper = (rs, rowNum) -> new ScanRun(
            rs.getLong("id"),
            ScanSource.fromCode(rs.getString("source_type")),
            RunType.fromCode(rs.getString("run_type")),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("completed_at")),
            RunStatus.fromCode(rs.getString("status")),
            rs.getInt("items_scanned"),
            rs.getInt("discoveries_created"),
            rs.getInt("duplicates_skipped"),
            rs.getInt("auto_promoted"),
            rs.getInt("errors_count"),
            json.readErrors(rs.getString("error_details")),
            json.readMap(rs.getString("cursor_data"))
        );
    }

    public long insertRun(ScanSource source, RunType runType, Instant startedAt, Map<String, Object> cursor) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sourceType", source.code())
            .addValue("runType", (runType == null ? RunType.SCHEDULED : runType).code())
            .addValue("startedAt", toTimestamp(startedAt))
            .addValue("status", RunStatus.RUNNING.code())
            .addValue("errorDetails", json.writeErrors(List.of()))
            .addValue("cursorData", json.writeMap(cursor));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO listener_runs (
                    source_type,
                    run_type,
                    started_at,
                    status,
                    error_details,
                    cursor_data
                )
                VALUES (
                    :sourceType,
                    :runType,
                    :startedAt,
                    :status,
                    :errorDetails,
                    :cursorData
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert " + source.code() + " run");
        }
        return key.longValue();
    }

    public void updateProgress(long runId, RunCounts counts, Map<String, Object> cursor) {
        MapSqlParameterSource params = countParams(runId, counts)
            .addValue("cursorData", cursor == null ? null : json.writeMap(cursor), Types.VARCHAR);
        jdbc.update(
            """
                UPDATE listener_runs
                SET items_scanned = :itemsScanned,
                    discoveries_created = :discoveriesCreated,
                    duplicates_skipped = :duplicatesSkipped,
                    auto_promoted = :autoPromoted,
                    errors_count = :errorsCount,
                    cursor_data = COALESCE(:cursorData, cursor_data)
                WHERE id = :id
                """,
            params
        );
    }

    /**
     * Finalizes a run. Only a run still marked {@code running} is touched, so a run is completed once.
     */
    public boolean completeRun(
        long runId,
        RunStatus status,
        Instant completedAt,
        RunCounts counts,
        List<RunError> errors,
        Map<String, Object> cursor
    ) {
        MapSqlParameterSource params = countParams(runId, counts)
            .addValue("status", status.code())
            .addValue("running", RunStatus.RUNNING.code())
            .addValue("completedAt", toTimestamp(completedAt))
            .addValue("errorDetails", json.writeErrors(lastErrors(errors)))
            .addValue("cursorData", json.writeMap(cursor));
        int updated = jdbc.update(
            """
                UPDATE listener_runs
                SET status = :status,
                    completed_at = :completedAt,
                    items_scanned = :itemsScanned,
                    discoveries_created = :discoveriesCreated,
                    duplicates_skipped = :duplicatesSkipped,
                    auto_promoted = :autoPromoted,
                    errors_count = :errorsCount,
                    error_details = :errorDetails,
                    cursor_data = :cursorData
                WHERE id = :id
                  AND status = :running
                """,
            params
        );
        return updated > 0;
    }

    public void appendError(long runId, String message, Instant at) {
        Optional<ScanRun> run = findById(runId);
        if (run.isEmpty()) {
            return;
        }
        List<RunError> errors = new ArrayList<>(run.get().errorDetails());
        errors.add(new RunError(message, at));
        jdbc.update(
            """
                UPDATE listener_runs
                SET error_details = :errorDetails,
                    errors_count = errors_count + 1
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", runId)
                .addValue("errorDetails", json.writeErrors(lastErrors(errors)))
        );
    }

    /**
     * Marks runs still flagged {@code running} that started before {@code startedBefore} as failed.
     */
    public int failStaleRuns(Instant startedBefore, Instant completedAt, String reason) {
        return jdbc.update(
            """
                UPDATE listener_runs
                SET status = :failed,
                    completed_at = :completedAt,
                    error_details = :errorDetails,
                    errors_count = errors_count + 1
                WHERE status = :running
                  AND started_at < :startedBefore
                """,
            new MapSqlParameterSource()
                .addValue("failed", RunStatus.FAILED.code())
                .addValue("running", RunStatus.RUNNING.code())
                .addValue("completedAt", toTimestamp(completedAt))
                .addValue("startedBefore", toTimestamp(startedBefore))
                .addValue("errorDetails", json.writeErrors(List.of(new RunError(reason, completedAt))))
        );
    }

    public Optional<ScanRun> findById(long id) {
        List<ScanRun> rows = jdbc.query(
            "SELECT " + COLUMNS + " FROM listener_runs WHERE id = :id",
            new MapSqlParameterSource("id", id),
            rowMapper
        );
        return rows.stream().findFirst();
    }

    public List<ScanRun> list(ScanSource source, RunStatus status, int limit, int offset) {
        MapSqlParameterSource params = filterParams(source, status)
            .addValue("limit", limit)
            .addValue("offset", offset);
        return jdbc.query(
            "SELECT " + COLUMNS + " FROM listener_runs" + whereClause(source, status)
                + " ORDER BY started_at DESC, id DESC LIMIT :limit OFFSET :offset",
            params,
            rowMapper
        );
    }

    public long count(ScanSource source, RunStatus status) {
        Long total = jdbc.queryForObject(
            "SELECT COUNT(*) FROM listener_runs" + whereClause(source, status),
            filterParams(source, status),
            Long.class
        );
        return total == null ? 0L : total;
    }

    public Optional<ScanRun> findLastCompleted(ScanSource source) {
        List<ScanRun> rows = jdbc.query(
            "SELECT " + COLUMNS + """
                FROM listener_runs
                WHERE source_type = :sourceType
                  AND status = :completed
                ORDER BY completed_at DESC, id DESC
                LIMIT 1
                """,
            new MapSqlParameterSource()
                .addValue("sourceType", source.code())
                .addValue("completed", RunStatus.COMPLETED.code()),
            rowMapper
        );
        return rows.stream().findFirst();
    }

    /**
     * Latest run for the source still marked running that started at or after {@code since}.
     * Older running rows are treated as abandoned.
     */
    public Optional<ScanRun> findActiveRun(ScanSource source, Instant since) {
        List<ScanRun> rows = jdbc.query(
            "SELECT " + COLUMNS + """
                FROM listener_runs
                WHERE source_type = :sourceType
                  AND status = :running
                  AND started_at >= :since
                ORDER BY started_at DESC, id DESC
                LIMIT 1
                """,
            new MapSqlParameterSource()
                .addValue("sourceType", source.code())
                .addValue("running", RunStatus.RUNNING.code())
                .addValue("since", toTimestamp(since)),
            rowMapper
        );
        return rows.stream().findFirst();
    }

    public RunStats stats(Instant now) {
        Map<String, RunStats.SourceRunStats> bySource = new LinkedHashMap<>();
        long[] totals = new long[6];
        Timestamp dayAgo = toTimestamp(now.minus(Duration.ofHours(24)));
        jdbc.query(
            """
                SELECT source_type,
                       COUNT(*) AS runs,
                       SUM(CASE WHEN status = 'completed' THEN 1 ELSE 0 END) AS successful,
                       SUM(CASE WHEN status = 'failed' THEN 1 ELSE 0 END) AS failed,
                       SUM(items_scanned) AS items,
                       SUM(discoveries_created) AS discoveries,
                       SUM(CASE WHEN started_at >= :dayAgo THEN 1 ELSE 0 END) AS recent
                FROM listener_runs
                GROUP BY source_type
                ORDER BY source_type
                """,
            new MapSqlParameterSource("dayAgo", dayAgo),
            rs -> {
                long runs = rs.getLong("runs");
                long discoveries = rs.getLong("discoveries");
                bySource.put(rs.getString("source_type"), new RunStats.SourceRunStats(runs, discoveries));
                totals[0] += runs;
                totals[1] += rs.getLong("successful");
                totals[2] += rs.getLong("failed");
                totals[3] += rs.getLong("items");
                totals[4] += discoveries;
                totals[5] += rs.getLong("recent");
            }
        );
        return new RunStats(totals[0], totals[1], totals[2], totals[3], totals[4], totals[5], bySource);
    }

    static List<RunError> lastErrors(List<RunError> errors) {
        if (errors == null || errors.isEmpty()) {
            return List.of();
        }
        if (errors.size() <= MAX_ERROR_DETAILS) {
            return List.copyOf(errors);
        }
        return List.copyOf(errors.subList(errors.size() - MAX_ERROR_DETAILS, errors.size()));
    }

    private static MapSqlParameterSource countParams(long runId, RunCounts counts) {
        return new MapSqlParameterSource()
            .addValue("id", runId)
            .addValue("itemsScanned", counts.itemsScanned())
            .addValue("discoveriesCreated", counts.discoveriesCreated())
            .addValue("duplicatesSkipped", counts.duplicatesSkipped())
            .addValue("autoPromoted", counts.autoPromoted())
            .addValue("errorsCount", counts.errorsCount());
    }

    private static String whereClause(ScanSource source, RunStatus status) {
        List<String> clauses = new ArrayList<>();
        if (source != null) {
            clauses.add("source_type = :sourceType");
        }
        if (status != null) {
            clauses.add("status = :status");
        }
        return clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
    }

    private static MapSqlParameterSource filterParams(ScanSource source, RunStatus status) {
        return new MapSqlParameterSource()
            .addValue("sourceType", source == null ? null : source.code())
            .addValue("status", status == null ? null : status.code());
    }

    private static Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
