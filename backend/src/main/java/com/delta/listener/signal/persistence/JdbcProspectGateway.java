package com.delta.listener.signal.persistence;

import com.delta.listener.signal.model.ProspectSeed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcProspectGateway implements ProspectGateway {
    private static final Logger log = LoggerFactory.getLogger(JdbcProspectGateway.class);

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcProspectGateway(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<Long> findProspectId(String teamId, String domain) {
        List<Long> ids = jdbc.queryForList(
            """
                SELECT id
                FROM prospects
                WHERE team_id = :teamId
                  AND company_domain = :domain
                """,
            new MapSqlParameterSource()
                .addValue("teamId", teamId)
                .addValue("domain", domain),
            Long.class
        );
        return ids.stream().findFirst();
    }

    @Override
    public ProspectLink findOrCreateProspect(String teamId, String domain, ProspectSeed seed) {
        Optional<Long> existing = findProspectId(teamId, domain);
        if (existing.isPresent()) {
            return new ProspectLink(existing.get(), false);
        }
        String name = seed == null || seed.companyName() == null || seed.companyName().isBlank()
            ? domain
            : seed.companyName();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("teamId", teamId)
            .addValue("companyName", name)
            .addValue("domain", domain)
            .addValue("source", seed == null || seed.source() == null ? "listener" : seed.source())
            .addValue("discoveryId", seed == null ? null : seed.discoveryId())
            .addValue("notes", seed == null ? null : seed.notes())
            .addValue("createdAt", Timestamp.from(Instant.now()));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbc.update(
                """
                    INSERT INTO prospects (
                        team_id,
                        company_name,
                        company_domain,
                        source,
                        source_discovery_id,
                        notes,
                        created_at
                    )
                    VALUES (
                        :teamId,
                        :companyName,
                        :domain,
                        :source,
                        :discoveryId,
                        :notes,
                        :createdAt
                    )
                    """,
                params,
                keyHolder,
                new String[]{"id"}
            );
        } catch (DuplicateKeyException e) {
            log.debug("Prospect for {} created concurrently, linking to existing row", domain);
            long raced = findProspectId(teamId, domain)
                .orElseThrow(() -> new IllegalStateException("Prospect for " + domain + " vanished after conflict", e));
            return new ProspectLink(raced, false);
        }
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert prospect for " + domain);
        }
        log.info("Created prospect {} for {} (team {})", key.longValue(), domain, teamId);
        return new ProspectLink(key.longValue(), true);
    }
}
