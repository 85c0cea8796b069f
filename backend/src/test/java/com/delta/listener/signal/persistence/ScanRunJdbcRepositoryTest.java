package com.delta.listener.signal.persistence;

import com.delta.listener.signal.model.RunCounts;
import com.delta.listener.signal.model.RunError;
import com.delta.listener.signal.model.RunStatus;
import com.delta.listener.signal.model.RunType;
import com.delta.listener.signal.model.ScanRun;
import com.delta.listener.signal.model.ScanSource;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class ScanRunJdbcRepositoryTest {

    @Autowired
    private ScanRunJdbcRepository repository;

    @Test
    void insertedRunStartsRunningWithCursor() {
        long id = repository.insertRun(ScanSource.HN, RunType.MANUAL, Instant.now(), Map.of("lastItemId", 4242));

        ScanRun run = repository.findById(id).orElseThrow();
        assertEquals(RunStatus.RUNNING, run.status());
        assertEquals(RunType.MANUAL, run.runType());
        assertNull(run.completedAt());
        assertEquals(0, run.itemsScanned());
        assertThat(run.errorDetails()).isEmpty();
        assertEquals(4242, ((Number) run.cursorData().get("lastItemId")).intValue());
    }

    @Test
    void progressWithoutCursorKeepsStoredCursor() {
        long id = repository.insertRun(ScanSource.RSS, null, Instant.now(), Map.of("feeds", 3));

        repository.updateProgress(id, new RunCounts(12, 2, 1, 0, 0), null);

        ScanRun run = repository.findById(id).orElseThrow();
        assertEquals(RunType.SCHEDULED, run.runType());
        assertEquals(12, run.itemsScanned());
        assertEquals(2, run.discoveriesCreated());
        assertEquals(3, ((Number) run.cursorData().get("feeds")).intValue());
    }

    @Test
    void runIsCompletedOnlyOnce() {
        long id = repository.insertRun(ScanSource.HN, RunType.SCHEDULED, Instant.now(), Map.of());
        Instant done = Instant.now();

        assertTrue(repository.completeRun(
            id,
            RunStatus.PARTIAL,
            done,
            new RunCounts(30, 4, 2, 1, 1),
            List.of(new RunError("item 17 failed", done)),
            Map.of("lastItemId", 17)
        ));
        assertFalse(repository.completeRun(
            id,
            RunStatus.FAILED,
            Instant.now(),
            new RunCounts(0, 0, 0, 0, 0),
            List.of(),
            Map.of()
        ));

        ScanRun run = repository.findById(id).orElseThrow();
        assertEquals(RunStatus.PARTIAL, run.status());
        assertEquals(30, run.itemsScanned());
        assertEquals(1, run.autoPromoted());
        assertEquals(1, run.errorsCount());
        assertEquals("item 17 failed", run.errorDetails().get(0).message());
        assertThat(run.completedAt()).isNotNull();
    }

    @Test
    void activeRunIgnoresAbandonedRows() {
        Instant now = Instant.now();
        long abandoned = repository.insertRun(ScanSource.HN_PROFILES, RunType.SCHEDULED, now.minus(Duration.ofHours(5)), Map.of());

        assertTrue(repository.findActiveRun(ScanSource.HN_PROFILES, now.minus(Duration.ofHours(2)))
            .filter(run -> run.id() == abandoned)
            .isEmpty());

        long live = repository.insertRun(ScanSource.HN_PROFILES, RunType.MANUAL, now, Map.of());
        assertEquals(live, repository.findActiveRun(ScanSource.HN_PROFILES, now.minus(Duration.ofHours(2))).orElseThrow().id());

        repository.completeRun(live, RunStatus.COMPLETED, Instant.now(), new RunCounts(0, 0, 0, 0, 0), List.of(), Map.of());
        assertTrue(repository.findActiveRun(ScanSource.HN_PROFILES, now.minus(Duration.ofHours(2)))
            .filter(run -> run.id() == live)
            .isEmpty());
    }

    @Test
    void staleRunsAreFailed() {
        Instant now = Instant.now();
        long stale = repository.insertRun(ScanSource.RSS, RunType.SCHEDULED, now.minus(Duration.ofHours(3)), Map.of());
        long fresh = repository.insertRun(ScanSource.RSS, RunType.SCHEDULED, now, Map.of());

        assertThat(repository.failStaleRuns(now.minus(Duration.ofHours(1)), now, "abandoned")).isGreaterThanOrEqualTo(1);

        ScanRun failed = repository.findById(stale).orElseThrow();
        assertEquals(RunStatus.FAILED, failed.status());
        assertEquals(1, failed.errorsCount());
        assertEquals("abandoned", failed.errorDetails().get(0).message());
        assertEquals(RunStatus.RUNNING, repository.findById(fresh).orElseThrow().status());
    }

    @Test
    void lastCompletedRunCarriesCursor() {
        Instant now = Instant.now();
        long first = repository.insertRun(ScanSource.HN, RunType.SCHEDULED, now.minusSeconds(60), Map.of());
        repository.completeRun(first, RunStatus.COMPLETED, now.plusSeconds(3600), new RunCounts(1, 0, 0, 0, 0), List.of(), Map.of("lastItemId", 100));
        long failed = repository.insertRun(ScanSource.HN, RunType.SCHEDULED, now, Map.of());
        repository.completeRun(failed, RunStatus.FAILED, now.plusSeconds(7200), new RunCounts(0, 0, 0, 0, 1), List.of(), Map.of("lastItemId", 999));

        ScanRun last = repository.findLastCompleted(ScanSource.HN).orElseThrow();

        assertEquals(first, last.id());
        assertEquals(100, ((Number) last.cursorData().get("lastItemId")).intValue());
    }

    @Test
    void appendErrorIncrementsCount() {
        long id = repository.insertRun(ScanSource.RSS, RunType.MANUAL, Instant.now(), Map.of());

        repository.appendError(id, "feed timed out", Instant.now());
        repository.appendError(id, "feed returned 500", Instant.now());

        ScanRun run = repository.findById(id).orElseThrow();
        assertEquals(2, run.errorsCount());
        assertThat(run.errorDetails()).extracting(RunError::message).containsExactly("feed timed out", "feed returned 500");
    }

    @Test
    void errorDetailsKeepOnlyTheNewestEntries() {
        List<RunError> errors = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            errors.add(new RunError("error " + i, Instant.now()));
        }

        List<RunError> kept = ScanRunJdbcRepository.lastErrors(errors);

        assertEquals(ScanRunJdbcRepository.MAX_ERROR_DETAILS, kept.size());
        assertEquals("error 10", kept.get(0).message());
        assertEquals("error 59", kept.get(kept.size() - 1).message());
    }

    @Test
    void listFiltersBySourceAndStatus() {
        long id = repository.insertRun(ScanSource.RSS, RunType.MANUAL, Instant.now().plusSeconds(600), Map.of());

        List<ScanRun> running = repository.list(ScanSource.RSS, RunStatus.RUNNING, 10, 0);

        assertEquals(id, running.get(0).id());
        assertThat(running).allMatch(run -> run.source() == ScanSource.RSS && run.status() == RunStatus.RUNNING);
        assertThat(repository.count(ScanSource.RSS, RunStatus.RUNNING)).isGreaterThanOrEqualTo(1);
        assertThat(repository.stats(Instant.now()).bySource()).containsKey("rss");
    }
}
