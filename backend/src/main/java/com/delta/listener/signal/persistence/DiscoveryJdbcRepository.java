package com.delta.listener.signal.persistence;

import com.delta.listener.signal.model.Discovery;
import com.delta.listener.signal.model.DiscoveryCandidate;
import com.delta.listener.signal.model.DiscoveryQuery;
import com.delta.listener.signal.model.DiscoveryStats;
import com.delta.listener.signal.model.DiscoveryStatus;
import com.delta.listener.signal.model.KeywordCategory;
import com.delta.listener.signal.model.SourceType;
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
public class DiscoveryJdbcRepository {
    private static final String COLUMNS = """
        id, company_domain, company_name, source_type, source_url, source_title, trigger_text,
        keywords_matched, keyword_category, confidence_score, product_tags, status, promoted_prospect_id,
        reviewed_by, reviewed_at, review_notes, discovered_at, source_published_at, updated_at
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final JsonColumns json;
    private final RowMapper<Discovery> rowMapper;

    public DiscoveryJdbcRepository(NamedParameterJdbcTemplate jdbc, JsonColumns json) {
        this.jdbc = jdbc;
        this.json = json;
        this.rowMapper = (rs, rowNum) -> {
            long prospectId = rs.getLong("promoted_prospect_id");
            Long promotedProspectId = rs.wasNull() ? null : prospectId;
            return new Discovery(
                rs.getLong("id"),
                rs.getString("company_domain"),
                rs.getString("company_name"),
                SourceType.fromCode(rs.getString("source_type")),
                rs.getString("source_url"),
                rs.getString("source_title"),
                rs.getString("trigger_text"),
                json.readList(rs.getString("keywords_matched")),
                KeywordCategory.fromCode(rs.getString("keyword_category")),
                rs.getInt("confidence_score"),
                json.readList(rs.getString("product_tags")),
                DiscoveryStatus.fromCode(rs.getString("status")),
                promotedProspectId,
                rs.getString("reviewed_by"),
                toInstant(rs.getTimestamp("reviewed_at")),
                rs.getString("review_notes"),
                toInstant(rs.getTimestamp("discovered_at")),
                toInstant(rs.getTimestamp("source_published_at")),
                toInstant(rs.getTimestamp("updated_at"))
            );
        };
    }

    public Optional<Discovery> findById(long id) {
        List<Discovery> rows = jdbc.query(
            "SELECT " + COLUMNS + " FROM listener_discoveries WHERE id = :id",
            new MapSqlParameterSource("id", id),
            rowMapper
        );
        return rows.stream().findFirst();
    }

    public Optional<Discovery> findByDomainAndSourceUrl(String domain, String sourceUrl) {
        List<Discovery> rows = jdbc.query(
            "SELECT " + COLUMNS + """
                FROM listener_discoveries
                WHERE company_domain = :domain
                  AND source_url = :sourceUrl
                """,
            new MapSqlParameterSource()
                .addValue("domain", domain)
                .addValue("sourceUrl", sourceUrl),
            rowMapper
        );
        return rows.stream().findFirst();
    }

    /**
     * Newest discovery for the domain that has not been dismissed, optionally restricted to those
     * discovered at or after {@code since}.
     */
    public Optional<Discovery> findLatestActiveByDomain(String domain, Instant since) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("domain", domain)
            .addValue("dismissed", DiscoveryStatus.DISMISSED.code())
            .addValue("since", toTimestamp(since));
        String sinceClause = since == null ? "" : "  AND discovered_at >= :since\n";
        List<Discovery> rows = jdbc.query(
            "SELECT " + COLUMNS + """
                FROM listener_discoveries
                WHERE company_domain = :domain
                  AND status <> :dismissed
                """ + sinceClause + """
                ORDER BY discovered_at DESC, id DESC
                LIMIT 1
                """,
            params,
            rowMapper
        );
        return rows.stream().findFirst();
    }

    /**
     * Inserts a new discovery with status {@code new}. A concurrent insert for the same
     * (domain, source url) surfaces as {@link org.springframework.dao.DuplicateKeyException}.
     */
    public long insert(DiscoveryCandidate candidate, Instant discoveredAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("companyDomain", candidate.companyDomain())
            .addValue("companyName", candidate.companyName())
            .addValue("sourceType", candidate.sourceType().code())
            .addValue("sourceUrl", candidate.sourceUrl())
            .addValue("sourceTitle", candidate.sourceTitle())
            .addValue("triggerText", candidate.triggerText() == null ? "" : candidate.triggerText())
            .addValue("keywordsMatched", json.writeList(candidate.keywordsMatched()))
            .addValue("keywordCategory", candidate.keywordCategory() == null ? null : candidate.keywordCategory().code())
            .addValue("confidenceScore", candidate.confidenceScore())
            .addValue("productTags", json.writeList(candidate.productTags()))
            .addValue("status", DiscoveryStatus.NEW.code())
            .addValue("discoveredAt", toTimestamp(discoveredAt))
            .addValue("sourcePublishedAt", toTimestamp(candidate.sourcePublishedAt()));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO listener_discoveries (
                    company_domain,
                    company_name,
                    source_type,
                    source_url,
                    source_title,
                    trigger_text,
                    keywords_matched,
                    keyword_category,
                    confidence_score,
                    product_tags,
                    status,
                    discovered_at,
                    source_published_at,
                    updated_at
                )
                VALUES (
                    :companyDomain,
                    :companyName,
                    :sourceType,
                    :sourceUrl,
                    :sourceTitle,
                    :triggerText,
                    :keywordsMatched,
                    :keywordCategory,
                    :confidenceScore,
                    :productTags,
                    :status,
                    :discoveredAt,
                    :sourcePublishedAt,
                    :discoveredAt
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert discovery for " + candidate.companyDomain());
        }
        return key.longValue();
    }

    /**
     * Refreshes score, keywords, tags and trigger text, but only when the new score is strictly higher.
     */
    public boolean raiseScore(long id, DiscoveryCandidate candidate, Instant now) {
        int updated = jdbc.update(
            """
                UPDATE listener_discoveries
                SET confidence_score = :score,
                    keywords_matched = :keywordsMatched,
                    product_tags = :productTags,
                    trigger_text = :triggerText,
                    updated_at = :now
                WHERE id = :id
                  AND confidence_score < :score
                """,
            new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("score", candidate.confidenceScore())
                .addValue("keywordsMatched", json.writeList(candidate.keywordsMatched()))
                .addValue("productTags", json.writeList(candidate.productTags()))
                .addValue("triggerText", candidate.triggerText() == null ? "" : candidate.triggerText())
                .addValue("now", toTimestamp(now))
        );
        return updated > 0;
    }

    public boolean updateStatus(long id, DiscoveryStatus status, String reviewer, String notes, Instant now) {
        int updated = jdbc.update(
            """
                UPDATE listener_discoveries
                SET status = :status,
                    reviewed_by = COALESCE(:reviewer, reviewed_by),
                    review_notes = COALESCE(:notes, review_notes),
                    reviewed_at = :now,
                    updated_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("status", status.code())
                .addValue("reviewer", reviewer, Types.VARCHAR)
                .addValue("notes", notes, Types.VARCHAR)
                .addValue("now", toTimestamp(now))
        );
        return updated > 0;
    }

    public boolean linkProspect(long id, long prospectId, DiscoveryStatus status, String reviewer, Instant now) {
        int updated = jdbc.update(
            """
                UPDATE listener_discoveries
                SET status = :status,
                    promoted_prospect_id = :prospectId,
                    reviewed_by = COALESCE(:reviewer, reviewed_by),
                    reviewed_at = :now,
                    updated_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("status", status.code())
                .addValue("prospectId", prospectId)
                .addValue("reviewer", reviewer, Types.VARCHAR)
                .addValue("now", toTimestamp(now))
        );
        return updated > 0;
    }

    public List<Discovery> list(DiscoveryQuery query) {
        MapSqlParameterSource params = filterParams(query)
            .addValue("limit", query.limit())
            .addValue("offset", query.offset());
        String order = query.orderBy() + (query.ascending() ? " ASC" : " DESC");
        return jdbc.query(
            "SELECT " + COLUMNS + " FROM listener_discoveries" + whereClause(query)
                + " ORDER BY " + order + ", id " + (query.ascending() ? "ASC" : "DESC")
                + " LIMIT :limit OFFSET :offset",
            params,
            rowMapper
        );
    }

    public long count(DiscoveryQuery query) {
        Long total = jdbc.queryForObject(
            "SELECT COUNT(*) FROM listener_discoveries" + whereClause(query),
            filterParams(query),
            Long.class
        );
        return total == null ? 0L : total;
    }

    public DiscoveryStats stats(Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("dayAgo", toTimestamp(now.minus(Duration.ofHours(24))))
            .addValue("weekAgo", toTimestamp(now.minus(Duration.ofDays(7))));
        Map<String, Object> totals = jdbc.queryForMap(
            """
                SELECT COUNT(*) AS total,
                       COALESCE(AVG(confidence_score), 0) AS avg_confidence,
                       COALESCE(SUM(CASE WHEN discovered_at >= :dayAgo THEN 1 ELSE 0 END), 0) AS last_24h,
                       COALESCE(SUM(CASE WHEN discovered_at >= :weekAgo THEN 1 ELSE 0 END), 0) AS last_7d
                FROM listener_discoveries
                """,
            params
        );
        long total = ((Number) totals.get("total")).longValue();
        double avgConfidence = Math.round(((Number) totals.get("avg_confidence")).doubleValue());
        return new DiscoveryStats(
            total,
            countBy("status"),
            countBy("source_type"),
            countBy("keyword_category"),
            avgConfidence,
            ((Number) totals.get("last_24h")).longValue(),
            ((Number) totals.get("last_7d")).longValue()
        );
    }

    private Map<String, Long> countBy(String column) {
        Map<String, Long> counts = new LinkedHashMap<>();
        jdbc.query(
            "SELECT " + column + " AS bucket, COUNT(*) AS total FROM listener_discoveries"
                + " WHERE " + column + " IS NOT NULL"
                + " GROUP BY " + column
                + " ORDER BY total DESC, " + column,
            new MapSqlParameterSource(),
            rs -> {
                counts.put(rs.getString("bucket"), rs.getLong("total"));
            }
        );
        return counts;
    }

    private static String whereClause(DiscoveryQuery query) {
        List<String> clauses = new ArrayList<>();
        if (!query.statuses().isEmpty()) {
            clauses.add("status IN (:statuses)");
        }
        if (query.sourceType() != null) {
            clauses.add("source_type = :sourceType");
        }
        if (query.minConfidence() != null) {
            clauses.add("confidence_score >= :minConfidence");
        }
        return clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
    }

    private static MapSqlParameterSource filterParams(DiscoveryQuery query) {
        return new MapSqlParameterSource()
            .addValue("statuses", query.statuses().stream().map(DiscoveryStatus::code).toList())
            .addValue("sourceType", query.sourceType() == null ? null : query.sourceType().code())
            .addValue("minConfidence", query.minConfidence());
    }

    private static Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
