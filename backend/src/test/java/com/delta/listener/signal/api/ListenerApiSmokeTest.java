package com.delta.listener.signal.api;

import com.delta.listener.signal.keywords.KeywordMatcher;
import com.delta.listener.signal.model.CreateDiscoveryResult;
import com.delta.listener.signal.model.DiscoveryCandidate;
import com.delta.listener.signal.model.KeywordCategory;
import com.delta.listener.signal.model.RunStatus;
import com.delta.listener.signal.model.RunType;
import com.delta.listener.signal.model.ScanSource;
import com.delta.listener.signal.model.SourceType;
import com.delta.listener.signal.service.DiscoveryService;
import com.delta.listener.signal.service.RunTally;
import com.delta.listener.signal.service.ScanRunService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.context.WebApplicationContext;

import java.util.List;
import java.util.UUID;

import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class ListenerApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private DiscoveryService discoveryService;

    @Autowired
    private ScanRunService scanRunService;

    @Autowired
    private KeywordMatcher keywordMatcher;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @AfterEach
    void dropCachedTaxonomy() {
        keywordMatcher.invalidate();
    }

    @Test
    void unknownDiscoveryIsNotFound() throws Exception {
        mockMvc.perform(get("/api/listener/discoveries/{id}", Long.MAX_VALUE))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("not_found"));
    }

    @Test
    void reviewMovesDiscoveryAndRejectsUnknownStatus() throws Exception {
        long id = storeDiscovery("review-" + suffix() + ".com");

        mockMvc.perform(patch("/api/listener/discoveries/{id}", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\":\"bogus\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("bad_request"));

        mockMvc.perform(patch("/api/listener/discoveries/{id}", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\":\"reviewing\",\"reviewer\":\"sam\",\"notes\":\"looks real\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("reviewing"))
            .andExpect(jsonPath("$.reviewedBy").value("sam"));

        mockMvc.perform(patch("/api/listener/discoveries/{id}", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\":\"new\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void dismissedDiscoveryCannotBePromoted() throws Exception {
        long id = storeDiscovery("dismiss-" + suffix() + ".com");

        mockMvc.perform(post("/api/listener/discoveries/{id}/dismiss", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("dismissed"));

        mockMvc.perform(post("/api/listener/discoveries/{id}/promote", id))
            .andExpect(status().isBadRequest());
    }

    @Test
    void domainCheckNormalisesInput() throws Exception {
        String domain = "check-" + suffix() + ".com";
        long id = storeDiscovery(domain);

        mockMvc.perform(get("/api/listener/discoveries/domain-check")
                .param("domain", "https://www." + domain + "/pricing"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.domain").value(domain))
            .andExpect(jsonPath("$.hasDiscovery").value(true))
            .andExpect(jsonPath("$.discoveryId").value(id));
    }

    @Test
    void duplicateKeywordIsConflict() throws Exception {
        String body = "{\"keyword\":\"seat hoarding " + suffix() + "\",\"category\":\"pain_signal\",\"weight\":3}";

        mockMvc.perform(post("/api/listener/keywords").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.weight").value(3));

        mockMvc.perform(post("/api/listener/keywords").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("duplicate_keyword"));
    }

    @Test
    void runEndpointsReportStatsAndCursor() throws Exception {
        RunTally tally = scanRunService.startRun(ScanSource.RSS, RunType.MANUAL);
        tally.scanned(4);
        tally.cursor("feedsProcessed", 3);
        scanRunService.completeRun(tally, RunStatus.COMPLETED);

        mockMvc.perform(get("/api/listener/runs/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalRuns").value(greaterThanOrEqualTo(1)));

        mockMvc.perform(get("/api/listener/runs/{id}", tally.runId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.source").value("rss"))
            .andExpect(jsonPath("$.status").value("completed"))
            .andExpect(jsonPath("$.itemsScanned").value(4));

        mockMvc.perform(get("/api/listener/runs/cursor/{source}", "rss"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.feedsProcessed").value(3));

        mockMvc.perform(get("/api/listener/runs").param("source", "rss").param("limit", "5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.limit").value(5));
    }

    @Test
    void unknownRunIsNotFound() throws Exception {
        mockMvc.perform(get("/api/listener/runs/{id}", Long.MAX_VALUE))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("not_found"));
    }

    private long storeDiscovery(String domain) {
        CreateDiscoveryResult result = discoveryService.createDiscovery(
            new DiscoveryCandidate(
                domain,
                "Venue Co",
                SourceType.HN_POST,
                "https://news.ycombinator.com/item?id=" + System.nanoTime(),
                "Ask HN: bots at our box office",
                "scalper bots took the whole allocation",
                List.of("scalper"),
                KeywordCategory.PAIN_SIGNAL,
                45,
                List.of("bot_protection"),
                null
            ),
            "team-" + suffix(),
            80
        );
        return result.discoveryId();
    }

    private static String suffix() {
        return UUID.randomUUID().toString().substring(0, 6);
    }
}
