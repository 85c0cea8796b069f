package com.delta.listener.signal.api;

import com.delta.listener.signal.model.HnScanRequest;
import com.delta.listener.signal.model.ProfileScanRequest;
import com.delta.listener.signal.model.RssScanRequest;
import com.delta.listener.signal.model.RunStats;
import com.delta.listener.signal.model.RunStatus;
import com.delta.listener.signal.model.ScanRun;
import com.delta.listener.signal.model.ScanRunPage;
import com.delta.listener.signal.model.ScanSource;
import com.delta.listener.signal.service.ScanOrchestratorService;
import com.delta.listener.signal.service.ScanRunService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Starts scans and exposes run history. Scans run inline unless {@code async=true}, in which case the
 * freshly opened run is returned with 202.
 */
@RestController
@RequestMapping("/api/listener")
public class ScanController {
    private final ScanOrchestratorService scanOrchestratorService;
    private final ScanRunService scanRunService;

    public ScanController(ScanOrchestratorService scanOrchestratorService, ScanRunService scanRunService) {
        this.scanOrchestratorService = scanOrchestratorService;
        this.scanRunService = scanRunService;
    }

    @PostMapping("/scans/hn")
    public ResponseEntity<?> scanHackerNews(
        @RequestBody(required = false) HnScanRequest request,
        @RequestParam(name = "async", required = false, defaultValue = "false") boolean async
    ) {
        if (async) {
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(scanOrchestratorService.submitHackerNews(request));
        }
        return ResponseEntity.ok(scanOrchestratorService.scanHackerNews(request));
    }

    @PostMapping("/scans/hn-profiles")
    public ResponseEntity<?> scanHackerNewsProfiles(
        @RequestBody(required = false) ProfileScanRequest request,
        @RequestParam(name = "async", required = false, defaultValue = "false") boolean async
    ) {
        if (async) {
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(scanOrchestratorService.submitHackerNewsProfiles(request));
        }
        return ResponseEntity.ok(scanOrchestratorService.scanHackerNewsProfiles(request));
    }

    @PostMapping("/scans/rss")
    public ResponseEntity<?> scanRss(
        @RequestBody(required = false) RssScanRequest request,
        @RequestParam(name = "async", required = false, defaultValue = "false") boolean async
    ) {
        if (async) {
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(scanOrchestratorService.submitRss(request));
        }
        return ResponseEntity.ok(scanOrchestratorService.scanRss(request));
    }

    @GetMapping("/runs")
    public ScanRunPage listRuns(
        @RequestParam(name = "source", required = false) String source,
        @RequestParam(name = "status", required = false) String status,
        @RequestParam(name = "limit", required = false, defaultValue = "20") int limit,
        @RequestParam(name = "offset", required = false, defaultValue = "0") int offset
    ) {
        return scanRunService.listRuns(
            source == null || source.isBlank() ? null : ScanSource.fromCode(source),
            RunStatus.fromCode(status),
            limit,
            offset
        );
    }

    @GetMapping("/runs/stats")
    public RunStats runStats() {
        return scanRunService.stats();
    }

    @GetMapping("/runs/cursor/{source}")
    public Map<String, Object> lastCursor(@PathVariable("source") String source) {
        return scanRunService.getLastCursor(ScanSource.fromCode(source));
    }

    @GetMapping("/runs/{id}")
    public ScanRun getRun(@PathVariable("id") long id) {
        return scanRunService.getRun(id);
    }
}
