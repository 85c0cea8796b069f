package com.delta.listener.signal.persistence;

import com.delta.listener.signal.model.KeywordCategory;
import com.delta.listener.signal.model.KeywordDefinition;
import com.delta.listener.signal.model.KeywordStats;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class KeywordJdbcRepository {
    private static final String COLUMNS = """
        id, keyword, category, weight, active, product_tags, created_at, updated_at
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final JsonColumns json;
    private final RowMapper<KeywordDefinition> rowMapper;

    public KeywordJdbcRepository(NamedParameterJdbcTemplate jdbc, JsonColumns json) {
        this.jdbc = jdbc;
        this.json = json;
        this.rowMapper = (rs, rowNum) -> new KeywordDefinition(
            rs.getLong("id"),
            rs.getString("keyword"),
            KeywordCategory.fromCode(rs.getString("category")),
            rs.getInt("weight"),
            rs.getBoolean("active"),
            json.readList(rs.getString("product_tags")),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    public List<KeywordDefinition> findActive() {
        return jdbc.query(
            "SELECT " + COLUMNS + """
                FROM listener_keywords
                WHERE active = TRUE
                ORDER BY weight DESC, keyword
                """,
            new MapSqlParameterSource(),
            rowMapper
        );
    }

    public List<KeywordDefinition> findAll() {
        return jdbc.query(
            "SELECT " + COLUMNS + """
                FROM listener_keywords
                ORDER BY category, weight DESC, keyword
                """,
            new MapSqlParameterSource(),
            rowMapper
        );
    }

    public List<KeywordDefinition> findActiveByCategory(KeywordCategory category) {
        return jdbc.query(
            "SELECT " + COLUMNS + """
                FROM listener_keywords
                WHERE category = :category
                  AND active = TRUE
                ORDER BY weight DESC, keyword
                """,
            new MapSqlParameterSource("category", category.code()),
            rowMapper
        );
    }

    public Optional<KeywordDefinition> findById(long id) {
        List<KeywordDefinition> rows = jdbc.query(
            "SELECT " + COLUMNS + " FROM listener_keywords WHERE id = :id",
            new MapSqlParameterSource("id", id),
            rowMapper
        );
        return rows.stream().findFirst();
    }

    public Optional<KeywordDefinition> findByKeyword(String keyword) {
        List<KeywordDefinition> rows = jdbc.query(
            "SELECT " + COLUMNS + " FROM listener_keywords WHERE keyword = :keyword",
            new MapSqlParameterSource("keyword", keyword),
            rowMapper
        );
        return rows.stream().findFirst();
    }

    /**
     * Inserts a keyword. A clash on the unique keyword surfaces as
     * {@link org.springframework.dao.DuplicateKeyException}.
     */
    public long insert(KeywordDefinition keyword, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("keyword", keyword.keyword())
            .addValue("category", keyword.category().code())
            .addValue("weight", keyword.weight())
            .addValue("active", keyword.active())
            .addValue("productTags", json.writeList(keyword.productTags()))
            .addValue("now", toTimestamp(now));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO listener_keywords (
                    keyword,
                    category,
                    weight,
                    active,
                    product_tags,
                    created_at,
                    updated_at
                )
                VALUES (
                    :keyword,
                    :category,
                    :weight,
                    :active,
                    :productTags,
                    :now,
                    :now
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert keyword " + keyword.keyword());
        }
        return key.longValue();
    }

    public boolean update(KeywordDefinition keyword, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", keyword.id())
            .addValue("keyword", keyword.keyword())
            .addValue("category", keyword.category().code())
            .addValue("weight", keyword.weight())
            .addValue("active", keyword.active())
            .addValue("productTags", json.writeList(keyword.productTags()))
            .addValue("now", toTimestamp(now));
        int updated = jdbc.update(
            """
                UPDATE listener_keywords
                SET keyword = :keyword,
                    category = :category,
                    weight = :weight,
                    active = :active,
                    product_tags = :productTags,
                    updated_at = :now
                WHERE id = :id
                """,
            params
        );
        return updated > 0;
    }

    public boolean toggleActive(long id, Instant now) {
        int updated = jdbc.update(
            """
                UPDATE listener_keywords
                SET active = NOT active,
                    updated_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("now", toTimestamp(now))
        );
        return updated > 0;
    }

    public int updateCategoryWeight(KeywordCategory category, int weight, Instant now) {
        return jdbc.update(
            """
                UPDATE listener_keywords
                SET weight = :weight,
                    updated_at = :now
                WHERE category = :category
                """,
            new MapSqlParameterSource()
                .addValue("category", category.code())
                .addValue("weight", weight)
                .addValue("now", toTimestamp(now))
        );
    }

    public boolean delete(long id) {
        return jdbc.update(
            "DELETE FROM listener_keywords WHERE id = :id",
            new MapSqlParameterSource("id", id)
        ) > 0;
    }

    public KeywordStats stats() {
        Map<String, long[]> counts = new LinkedHashMap<>();
        long[] totals = new long[3];
        jdbc.query(
            """
                SELECT category,
                       COUNT(*) AS total,
                       SUM(CASE WHEN active THEN 1 ELSE 0 END) AS active_total,
                       SUM(weight) AS weight_total
                FROM listener_keywords
                GROUP BY category
                ORDER BY category
                """,
            new MapSqlParameterSource(),
            rs -> {
                long total = rs.getLong("total");
                long active = rs.getLong("active_total");
                counts.put(rs.getString("category"), new long[]{total, active});
                totals[0] += total;
                totals[1] += active;
                totals[2] += rs.getLong("weight_total");
            }
        );
        Map<String, KeywordStats.CategoryCounts> byCategory = new LinkedHashMap<>();
        counts.forEach((category, values) -> byCategory.put(
            category,
            new KeywordStats.CategoryCounts(values[0], values[1])
        ));
        double avgWeight = totals[0] == 0 ? 0.0 : Math.round(totals[2] * 10.0 / totals[0]) / 10.0;
        return new KeywordStats(totals[0], totals[1], byCategory, avgWeight);
    }

    private static Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
