package com.delta.listener.signal.api;

import com.delta.listener.signal.model.RunStatus;
import com.delta.listener.signal.model.RunType;
import com.delta.listener.signal.model.ScanRun;
import com.delta.listener.signal.model.ScanRunPage;
import com.delta.listener.signal.model.ScanSource;
import com.delta.listener.signal.model.ScanSummary;
import com.delta.listener.signal.service.ScanOrchestratorService;
import com.delta.listener.signal.service.ScanRunService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScanControllerTest {

    @Mock
    private ScanOrchestratorService scanOrchestratorService;
    @Mock
    private ScanRunService scanRunService;

    @Test
    void asyncScanIsAccepted() {
        ScanController controller = new ScanController(scanOrchestratorService, scanRunService);
        ScanRun running = new ScanRun(
            3L, ScanSource.RSS, RunType.MANUAL, Instant.now(), null, RunStatus.RUNNING,
            0, 0, 0, 0, 0, List.of(), Map.of()
        );
        when(scanOrchestratorService.submitRss(null)).thenReturn(running);

        ResponseEntity<?> response = controller.scanRss(null, true);

        assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
        assertSame(running, response.getBody());
        verify(scanOrchestratorService, never()).scanRss(any());
    }

    @Test
    void blockingScanReturnsSummary() {
        ScanController controller = new ScanController(scanOrchestratorService, scanRunService);
        ScanSummary summary = new ScanSummary(
            4L, ScanSource.HN, RunStatus.COMPLETED, 30, 2, 1, 0, List.of(), 1200L, Map.of("lastItemId", 42L)
        );
        when(scanOrchestratorService.scanHackerNews(null)).thenReturn(summary);

        ResponseEntity<?> response = controller.scanHackerNews(null, false);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertSame(summary, response.getBody());
    }

    @Test
    void runListingParsesFilters() {
        ScanController controller = new ScanController(scanOrchestratorService, scanRunService);
        when(scanRunService.listRuns(ScanSource.HN_PROFILES, RunStatus.PARTIAL, 10, 0))
            .thenReturn(new ScanRunPage(List.of(), 0, 10, 0));

        ScanRunPage page = controller.listRuns("hn_profile", "partial", 10, 0);

        assertEquals(10, page.limit());
    }

    @Test
    void unknownSourceIsRejected() {
        ScanController controller = new ScanController(scanOrchestratorService, scanRunService);

        assertThatThrownBy(() -> controller.lastCursor("reddit"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
