package com.delta.listener.signal.api;

import com.delta.listener.signal.model.DiscoveryPage;
import com.delta.listener.signal.model.DiscoveryQuery;
import com.delta.listener.signal.model.DiscoveryStatus;
import com.delta.listener.signal.model.SourceType;
import com.delta.listener.signal.service.DiscoveryService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DiscoveryControllerTest {

    @Mock
    private DiscoveryService discoveryService;

    @Test
    void listParsesCommaSeparatedStatuses() {
        DiscoveryController controller = new DiscoveryController(discoveryService);
        when(discoveryService.listDiscoveries(any())).thenReturn(new DiscoveryPage(List.of(), 0, 25, 0));

        controller.listDiscoveries("new, reviewing,", "hn_comment", 60, 25, 10, "confidence_score", "ASC");

        ArgumentCaptor<DiscoveryQuery> captor = ArgumentCaptor.forClass(DiscoveryQuery.class);
        verify(discoveryService).listDiscoveries(captor.capture());
        DiscoveryQuery query = captor.getValue();
        assertThat(query.statuses()).containsExactly(DiscoveryStatus.NEW, DiscoveryStatus.REVIEWING);
        assertEquals(SourceType.HN_COMMENT, query.sourceType());
        assertEquals(60, query.minConfidence());
        assertEquals(25, query.limit());
        assertEquals(10, query.offset());
        assertEquals("confidence_score", query.orderBy());
        assertTrue(query.ascending());
    }

    @Test
    void listDefaultsToNewestFirst() {
        DiscoveryController controller = new DiscoveryController(discoveryService);
        when(discoveryService.listDiscoveries(any())).thenReturn(new DiscoveryPage(List.of(), 0, 50, 0));

        controller.listDiscoveries(null, null, null, 50, 0, "sneaky; DROP TABLE", "desc");

        ArgumentCaptor<DiscoveryQuery> captor = ArgumentCaptor.forClass(DiscoveryQuery.class);
        verify(discoveryService).listDiscoveries(captor.capture());
        assertThat(captor.getValue().statuses()).isEmpty();
        assertNull(captor.getValue().sourceType());
        assertEquals("discovered_at", captor.getValue().orderBy());
        assertFalse(captor.getValue().ascending());
    }

    @Test
    void statusChangeRequiresStatus() {
        DiscoveryController controller = new DiscoveryController(discoveryService);

        assertThatThrownBy(() -> controller.updateStatus(7L, new DiscoveryReviewApiRequest(null, "sam", null, null)))
            .isInstanceOf(IllegalArgumentException.class);
        verify(discoveryService, never()).updateStatus(anyLong(), any(), any(), any());
    }

    @Test
    void promoteWithoutBodyUsesDefaultTeam() {
        DiscoveryController controller = new DiscoveryController(discoveryService);

        controller.promote(9L, null);

        verify(discoveryService).promoteDiscovery(9L, null, null);
    }
}
