package com.delta.listener.signal.persistence;

import com.delta.listener.signal.model.ProspectSeed;
import com.delta.listener.signal.persistence.ProspectGateway.ProspectLink;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class JdbcProspectGatewayTest {

    @Autowired
    private JdbcProspectGateway gateway;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @Test
    void createsProspectOncePerTeamAndDomain() {
        String team = "team-" + suffix();
        String domain = "prospect-" + suffix() + ".com";

        ProspectLink created = gateway.findOrCreateProspect(team, domain, new ProspectSeed("Prospect Co", "listener", null, "from HN"));
        ProspectLink again = gateway.findOrCreateProspect(team, domain, new ProspectSeed("Other Name", "manual", null, null));

        assertTrue(created.created());
        assertFalse(again.created());
        assertEquals(created.prospectId(), again.prospectId());
        assertEquals(created.prospectId(), gateway.findProspectId(team, domain).orElseThrow());

        Map<String, Object> row = jdbc.queryForMap(
            "SELECT company_name, source, notes FROM prospects WHERE id = :id",
            new MapSqlParameterSource("id", created.prospectId())
        );
        assertEquals("Prospect Co", row.get("company_name"));
        assertEquals("listener", row.get("source"));
        assertEquals("from HN", row.get("notes"));
    }

    @Test
    void prospectsAreScopedPerTeam() {
        String domain = "shared-" + suffix() + ".com";

        long first = gateway.findOrCreateProspect("team-a-" + suffix(), domain, null).prospectId();
        long second = gateway.findOrCreateProspect("team-b-" + suffix(), domain, null).prospectId();

        assertNotEquals(first, second);
    }

    @Test
    void missingNameFallsBackToDomain() {
        String team = "team-" + suffix();
        String domain = "nameless-" + suffix() + ".com";

        long id = gateway.findOrCreateProspect(team, domain, new ProspectSeed(" ", null, null, null)).prospectId();

        String name = jdbc.queryForObject(
            "SELECT company_name FROM prospects WHERE id = :id",
            new MapSqlParameterSource("id", id),
            String.class
        );
        assertEquals(domain, name);
        assertTrue(gateway.findProspectId("other-" + suffix(), domain).isEmpty());
    }

    private static String suffix() {
        return UUID.randomUUID().toString().substring(0, 6);
    }
}
