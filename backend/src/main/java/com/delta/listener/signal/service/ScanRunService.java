package com.delta.listener.signal.service;

import com.delta.listener.signal.model.RunCounts;
import com.delta.listener.signal.model.RunStats;
import com.delta.listener.signal.model.RunStatus;
import com.delta.listener.signal.model.RunType;
import com.delta.listener.signal.model.ScanRun;
import com.delta.listener.signal.model.ScanRunPage;
import com.delta.listener.signal.model.ScanSource;
import com.delta.listener.signal.persistence.ScanRunJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bookkeeping of scan runs: a run is opened as {@code running}, updated while it progresses and finalized once.
 */
@Service
public class ScanRunService {
    private static final Logger log = LoggerFactory.getLogger(ScanRunService.class);

    private final ScanRunJdbcRepository repository;

    public ScanRunService(ScanRunJdbcRepository repository) {
        this.repository = repository;
    }

    public RunTally startRun(ScanSource source, RunType runType) {
        Instant startedAt = Instant.now();
        RunType type = runType == null ? RunType.MANUAL : runType;
        long runId = repository.insertRun(source, type, startedAt, Map.of());
        log.info("Started {} {} scan run {}", type.code(), source.code(), runId);
        return new RunTally(runId, startedAt);
    }

    public void updateProgress(RunTally tally) {
        repository.updateProgress(tally.runId(), tally.counts(), tally.cursor());
    }

    public boolean completeRun(RunTally tally, RunStatus status) {
        boolean updated = repository.completeRun(
            tally.runId(),
            status,
            Instant.now(),
            tally.counts(),
            tally.errors(),
            tally.cursor()
        );
        if (!updated) {
            log.warn("Scan run {} was already finalized; status {} not applied", tally.runId(), status.code());
        }
        return updated;
    }

    public void addError(long runId, String message) {
        repository.appendError(runId, message, Instant.now());
    }

    public ScanRun getRun(long id) {
        return repository.findById(id).orElseThrow(() -> new ScanRunNotFoundException(id));
    }

    public ScanRunPage listRuns(ScanSource source, RunStatus status, int limit, int offset) {
        int safeLimit = limit <= 0 ? 20 : Math.min(limit, 200);
        int safeOffset = Math.max(0, offset);
        List<ScanRun> runs = repository.list(source, status, safeLimit, safeOffset);
        return new ScanRunPage(runs, repository.count(source, status), safeLimit, safeOffset);
    }

    public Optional<ScanRun> findActiveRun(ScanSource source, Instant since) {
        return repository.findActiveRun(source, since);
    }

    /**
     * Cursor of the last run of {@code source} that completed, or an empty map when there is none.
     */
    public Map<String, Object> getLastCursor(ScanSource source) {
        return repository.findLastCompleted(source).map(ScanRun::cursorData).orElse(Map.of());
    }

    public int failStaleRuns(Instant startedBefore) {
        return repository.failStaleRuns(startedBefore, Instant.now(), "abandoned: still running at startup");
    }

    public RunStats stats() {
        return repository.stats(Instant.now());
    }

    static RunStatus finalStatus(RunCounts counts) {
        return counts.errorsCount() > 0 ? RunStatus.PARTIAL : RunStatus.COMPLETED;
    }
}
