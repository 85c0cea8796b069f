package com.delta.listener.signal.service;

import com.delta.listener.config.ListenerProperties;
import com.delta.listener.signal.model.ScanSource;
import com.delta.listener.signal.model.ScanSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(1)
public class ScanCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScanCliRunner.class);

    private final ListenerProperties properties;
    private final ScanOrchestratorService scanOrchestratorService;
    private final ConfigurableApplicationContext applicationContext;

    public ScanCliRunner(
        ListenerProperties properties,
        ScanOrchestratorService scanOrchestratorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.scanOrchestratorService = scanOrchestratorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        ScanSource source = ScanSource.fromCode(properties.getCli().getSource());
        int exitCode = 0;
        try {
            ScanSummary summary = scanOrchestratorService.scan(source);
            log.info(
                "Scan run {} ({}) completed with status {}: scanned={}, created={}, duplicates={}, autoPromoted={}, errors={}",
                summary.runId(),
                source.code(),
                summary.status().code(),
                summary.itemsScanned(),
                summary.discoveriesCreated(),
                summary.duplicatesSkipped(),
                summary.autoPromoted(),
                summary.errors().size()
            );
        } catch (RuntimeException e) {
            if (!properties.getCli().isExitAfterRun()) {
                throw e;
            }
            log.error("Scan run for {} failed", source.code(), e);
            exitCode = 1;
        }

        if (properties.getCli().isExitAfterRun()) {
            int code = exitCode;
            int status = SpringApplication.exit(applicationContext, () -> code);
            System.exit(status);
        }
    }
}
