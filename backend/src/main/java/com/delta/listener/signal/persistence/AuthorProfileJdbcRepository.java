package com.delta.listener.signal.persistence;

import com.delta.listener.signal.model.AuthorCompanyInfo;
import com.delta.listener.signal.model.AuthorProfile;
import com.delta.listener.signal.model.AuthorProfileStats;
import com.delta.listener.signal.model.AuthorProfileUpsert;
import com.delta.listener.signal.model.HnUser;
import com.delta.listener.signal.model.SocialProfiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Persistent per-author record backing the rescan window. Rows are upserted on every scan and only ever
 * flagged as excluded, never deleted.
 */
@Repository
public class AuthorProfileJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(AuthorProfileJdbcRepository.class);
    private static final String COLUMNS = """
        hn_username, hn_karma, hn_created_at, raw_about, company_domain, company_name, extraction_confidence,
        extraction_source, linkedin_url, twitter_handle, github_username, personal_website, first_seen_at,
        last_scanned_at, scan_count, discoveries_created, last_story_id, last_story_title, is_excluded,
        exclusion_reason
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final RowMapper<AuthorProfile> rowMapper = (rs, rowNum) -> mapRow(rs);

    public AuthorProfileJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public AuthorProfile upsert(AuthorProfileUpsert upsert, Instant now) {
        HnUser user = upsert.user();
        MapSqlParameterSource params = upsertParams(upsert, now);
        if (findByUsername(user.id()).isEmpty()) {
            try {
                jdbc.update(
                    """
                        INSERT INTO listener_hn_users (
                            hn_username,
                            hn_karma,
                            hn_created_at,
                            company_domain,
                            company_name,
                            extraction_confidence,
                            extraction_source,
                            raw_about,
                            linkedin_url,
                            twitter_handle,
                            github_username,
                            personal_website,
                            first_seen_at,
                            last_scanned_at,
                            scan_count,
                            discoveries_created,
                            last_story_id,
                            last_story_title,
                            is_excluded
                        )
                        VALUES (
                            :username,
                            :karma,
                            :createdAt,
                            :companyDomain,
                            :companyName,
                            :confidence,
                            :source,
                            :about,
                            :linkedinUrl,
                            :twitterHandle,
                            :githubUsername,
                            :personalWebsite,
                            :now,
                            :now,
                            1,
                            :discoveryIncrement,
                            :storyId,
                            :storyTitle,
                            FALSE
                        )
                        """,
                    params
                );
                return findByUsername(user.id()).orElseThrow();
            } catch (DuplicateKeyException e) {
                log.debug("Author {} inserted concurrently, updating instead", user.id());
            }
        }
        jdbc.update(
            """
                UPDATE listener_hn_users
                SET hn_karma = :karma,
                    hn_created_at = :createdAt,
                    company_domain = :companyDomain,
                    company_name = :companyName,
                    extraction_confidence = :confidence,
                    extraction_source = :source,
                    raw_about = :about,
                    linkedin_url = :linkedinUrl,
                    twitter_handle = :twitterHandle,
                    github_username = :githubUsername,
                    personal_website = :personalWebsite,
                    last_scanned_at = :now,
                    scan_count = scan_count + 1,
                    discoveries_created = discoveries_created + :discoveryIncrement,
                    last_story_id = COALESCE(:storyId, last_story_id),
                    last_story_title = COALESCE(:storyTitle, last_story_title)
                WHERE hn_username = :username
                """,
            params
        );
        return findByUsername(user.id()).orElseThrow();
    }

    public Optional<AuthorProfile> findByUsername(String username) {
        List<AuthorProfile> rows = jdbc.query(
            "SELECT " + COLUMNS + " FROM listener_hn_users WHERE hn_username = :username",
            new MapSqlParameterSource("username", username),
            rowMapper
        );
        return rows.stream().findFirst();
    }

    public Map<String, AuthorProfile> findByUsernames(Collection<String> usernames) {
        Map<String, AuthorProfile> profiles = new LinkedHashMap<>();
        if (usernames == null || usernames.isEmpty()) {
            return profiles;
        }
        for (AuthorProfile profile : jdbc.query(
            "SELECT " + COLUMNS + " FROM listener_hn_users WHERE hn_username IN (:usernames)",
            new MapSqlParameterSource("usernames", List.copyOf(usernames)),
            rowMapper
        )) {
            profiles.put(profile.username(), profile);
        }
        return profiles;
    }

    public Set<String> findRecentlyScanned(Collection<String> usernames, Instant since) {
        Set<String> recent = new LinkedHashSet<>();
        if (usernames == null || usernames.isEmpty()) {
            return recent;
        }
        recent.addAll(jdbc.queryForList(
            """
                SELECT hn_username
                FROM listener_hn_users
                WHERE hn_username IN (:usernames)
                  AND last_scanned_at >= :since
                """,
            new MapSqlParameterSource()
                .addValue("usernames", List.copyOf(usernames))
                .addValue("since", toTimestamp(since)),
            String.class
        ));
        return recent;
    }

    public Set<String> findExcluded(Collection<String> usernames) {
        Set<String> excluded = new LinkedHashSet<>();
        if (usernames == null || usernames.isEmpty()) {
            return excluded;
        }
        excluded.addAll(jdbc.queryForList(
            """
                SELECT hn_username
                FROM listener_hn_users
                WHERE hn_username IN (:usernames)
                  AND is_excluded = TRUE
                """,
            new MapSqlParameterSource().addValue("usernames", List.copyOf(usernames)),
            String.class
        ));
        return excluded;
    }

    public void incrementDiscoveryCount(String username) {
        jdbc.update(
            """
                UPDATE listener_hn_users
                SET discoveries_created = discoveries_created + 1
                WHERE hn_username = :username
                """,
            new MapSqlParameterSource("username", username)
        );
    }

    public List<AuthorProfile> listWithCompanies(Integer minKarma, Double minConfidence, int limit, int offset) {
        MapSqlParameterSource params = companyFilterParams(minKarma, minConfidence)
            .addValue("limit", limit)
            .addValue("offset", offset);
        return jdbc.query(
            "SELECT " + COLUMNS + " FROM listener_hn_users" + companyWhereClause(minKarma, minConfidence)
                + " ORDER BY last_scanned_at DESC, hn_username LIMIT :limit OFFSET :offset",
            params,
            rowMapper
        );
    }

    public long countWithCompanies(Integer minKarma, Double minConfidence) {
        Long total = jdbc.queryForObject(
            "SELECT COUNT(*) FROM listener_hn_users" + companyWhereClause(minKarma, minConfidence),
            companyFilterParams(minKarma, minConfidence),
            Long.class
        );
        return total == null ? 0L : total;
    }

    public List<AuthorProfile> listExcluded() {
        return jdbc.query(
            "SELECT " + COLUMNS + " FROM listener_hn_users WHERE is_excluded = TRUE ORDER BY hn_username",
            new MapSqlParameterSource(),
            rowMapper
        );
    }

    public boolean exclude(String username, String reason) {
        return jdbc.update(
            """
                UPDATE listener_hn_users
                SET is_excluded = TRUE,
                    exclusion_reason = :reason
                WHERE hn_username = :username
                """,
            new MapSqlParameterSource()
                .addValue("username", username)
                .addValue("reason", reason, Types.VARCHAR)
        ) > 0;
    }

    /**
     * Overwrites only the links that are non-null in {@code profiles}.
     */
    public boolean updateSocialProfiles(String username, SocialProfiles profiles) {
        return jdbc.update(
            """
                UPDATE listener_hn_users
                SET linkedin_url = COALESCE(:linkedinUrl, linkedin_url),
                    twitter_handle = COALESCE(:twitterHandle, twitter_handle),
                    github_username = COALESCE(:githubUsername, github_username),
                    personal_website = COALESCE(:personalWebsite, personal_website)
                WHERE hn_username = :username
                """,
            new MapSqlParameterSource()
                .addValue("username", username)
                .addValue("linkedinUrl", profiles.linkedinUrl(), Types.VARCHAR)
                .addValue("twitterHandle", profiles.twitterHandle(), Types.VARCHAR)
                .addValue("githubUsername", profiles.githubUsername(), Types.VARCHAR)
                .addValue("personalWebsite", profiles.personalWebsite(), Types.VARCHAR)
        ) > 0;
    }

    public AuthorProfileStats stats(Instant now) {
        Map<String, Object> row = jdbc.queryForMap(
            """
                SELECT COUNT(*) AS total,
                       COALESCE(SUM(CASE WHEN company_domain IS NOT NULL THEN 1 ELSE 0 END), 0) AS with_company,
                       COALESCE(SUM(CASE WHEN linkedin_url IS NOT NULL THEN 1 ELSE 0 END), 0) AS with_linkedin,
                       COALESCE(SUM(CASE WHEN is_excluded THEN 1 ELSE 0 END), 0) AS excluded,
                       COALESCE(SUM(CASE WHEN last_scanned_at >= :dayAgo THEN 1 ELSE 0 END), 0) AS last_24h,
                       COALESCE(SUM(CASE WHEN last_scanned_at >= :weekAgo THEN 1 ELSE 0 END), 0) AS last_7d,
                       COALESCE(AVG(hn_karma), 0) AS avg_karma
                FROM listener_hn_users
                """,
            new MapSqlParameterSource()
                .addValue("dayAgo", toTimestamp(now.minus(Duration.ofHours(24))))
                .addValue("weekAgo", toTimestamp(now.minus(Duration.ofDays(7))))
        );
        return new AuthorProfileStats(
            number(row, "total"),
            number(row, "with_company"),
            number(row, "with_linkedin"),
            number(row, "excluded"),
            number(row, "last_24h"),
            number(row, "last_7d"),
            Math.round(((Number) row.get("avg_karma")).doubleValue())
        );
    }

    private static long number(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value == null ? 0L : ((Number) value).longValue();
    }

    private static MapSqlParameterSource upsertParams(AuthorProfileUpsert upsert, Instant now) {
        HnUser user = upsert.user();
        AuthorCompanyInfo info = upsert.companyInfo();
        SocialProfiles social = info == null ? SocialProfiles.none() : info.social();
        return new MapSqlParameterSource()
            .addValue("username", user.id())
            .addValue("karma", user.karma())
            .addValue("createdAt", toTimestamp(user.createdAt()), Types.TIMESTAMP)
            .addValue("about", user.about(), Types.VARCHAR)
            .addValue("companyDomain", info == null ? null : info.companyDomain(), Types.VARCHAR)
            .addValue("companyName", info == null ? null : info.companyName(), Types.VARCHAR)
            .addValue("confidence", info == null || !info.hasDomain() ? null : info.confidence(), Types.DOUBLE)
            .addValue("source", info == null || info.source() == null || !info.hasDomain() ? null : info.source().code(), Types.VARCHAR)
            .addValue("linkedinUrl", social.linkedinUrl(), Types.VARCHAR)
            .addValue("twitterHandle", social.twitterHandle(), Types.VARCHAR)
            .addValue("githubUsername", social.githubUsername(), Types.VARCHAR)
            .addValue("personalWebsite", social.personalWebsite(), Types.VARCHAR)
            .addValue("now", toTimestamp(now))
            .addValue("discoveryIncrement", upsert.discoveryCreated() ? 1 : 0)
            .addValue("storyId", upsert.storyId(), Types.BIGINT)
            .addValue("storyTitle", upsert.storyTitle(), Types.VARCHAR);
    }

    private static String companyWhereClause(Integer minKarma, Double minConfidence) {
        List<String> clauses = new ArrayList<>();
        clauses.add("company_domain IS NOT NULL");
        clauses.add("is_excluded = FALSE");
        if (minKarma != null) {
            clauses.add("hn_karma >= :minKarma");
        }
        if (minConfidence != null) {
            clauses.add("extraction_confidence >= :minConfidence");
        }
        return " WHERE " + String.join(" AND ", clauses);
    }

    private static MapSqlParameterSource companyFilterParams(Integer minKarma, Double minConfidence) {
        return new MapSqlParameterSource()
            .addValue("minKarma", minKarma)
            .addValue("minConfidence", minConfidence);
    }

    private static AuthorProfile mapRow(ResultSet rs) throws SQLException {
        double confidence = rs.getDouble("extraction_confidence");
        Double companyConfidence = rs.wasNull() ? null : confidence;
        long storyId = rs.getLong("last_story_id");
        Long lastStoryId = rs.wasNull() ? null : storyId;
        return new AuthorProfile(
            rs.getString("hn_username"),
            rs.getInt("hn_karma"),
            toInstant(rs.getTimestamp("hn_created_at")),
            rs.getString("raw_about"),
            rs.getString("company_domain"),
            rs.getString("company_name"),
            companyConfidence,
            rs.getString("extraction_source"),
            rs.getString("linkedin_url"),
            rs.getString("twitter_handle"),
            rs.getString("github_username"),
            rs.getString("personal_website"),
            toInstant(rs.getTimestamp("first_seen_at")),
            toInstant(rs.getTimestamp("last_scanned_at")),
            rs.getInt("scan_count"),
            rs.getInt("discoveries_created"),
            lastStoryId,
            rs.getString("last_story_title"),
            rs.getBoolean("is_excluded"),
            rs.getString("exclusion_reason")
        );
    }

    private static Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
