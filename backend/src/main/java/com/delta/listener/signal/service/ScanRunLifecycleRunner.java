package com.delta.listener.signal.service;

import com.delta.listener.config.ListenerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Runs left {@code running} by a previous process can never complete; they are failed at startup once they
 * are older than the active-run window.
 */
@Component
@Order(0)
public class ScanRunLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScanRunLifecycleRunner.class);

    private final ScanRunService scanRunService;
    private final ListenerProperties properties;

    public ScanRunLifecycleRunner(ScanRunService scanRunService, ListenerProperties properties) {
        this.scanRunService = scanRunService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        Instant cutoff = Instant.now().minus(Duration.ofMinutes(properties.getScan().getActiveRunMinutes()));
        try {
            int failed = scanRunService.failStaleRuns(cutoff);
            if (failed > 0) {
                log.info("Marked {} stale scan runs started before {} as failed", failed, cutoff);
            }
        } catch (DataAccessException e) {
            log.warn("Skipping stale scan run cleanup because the database is unreachable", e);
        }
    }
}
