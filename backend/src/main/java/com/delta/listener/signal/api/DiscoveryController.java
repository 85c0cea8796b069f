package com.delta.listener.signal.api;

import com.delta.listener.signal.model.Discovery;
import com.delta.listener.signal.model.DiscoveryPage;
import com.delta.listener.signal.model.DiscoveryQuery;
import com.delta.listener.signal.model.DiscoveryStats;
import com.delta.listener.signal.model.DiscoveryStatus;
import com.delta.listener.signal.model.DomainCheck;
import com.delta.listener.signal.model.PromotionResult;
import com.delta.listener.signal.model.SourceType;
import com.delta.listener.signal.service.DiscoveryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.List;

@RestController
@RequestMapping("/api/listener/discoveries")
public class DiscoveryController {
    private final DiscoveryService discoveryService;

    public DiscoveryController(DiscoveryService discoveryService) {
        this.discoveryService = discoveryService;
    }

    @GetMapping
    public DiscoveryPage listDiscoveries(
        @RequestParam(name = "status", required = false) String status,
        @RequestParam(name = "sourceType", required = false) String sourceType,
        @RequestParam(name = "minConfidence", required = false) Integer minConfidence,
        @RequestParam(name = "limit", required = false, defaultValue = "50") int limit,
        @RequestParam(name = "offset", required = false, defaultValue = "0") int offset,
        @RequestParam(name = "orderBy", required = false, defaultValue = "discovered_at") String orderBy,
        @RequestParam(name = "order", required = false, defaultValue = "desc") String order
    ) {
        List<DiscoveryStatus> statuses = status == null || status.isBlank()
            ? List.of()
            : Arrays.stream(status.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(DiscoveryStatus::fromCode)
                .toList();
        DiscoveryQuery query = new DiscoveryQuery(
            statuses,
            sourceType == null || sourceType.isBlank() ? null : SourceType.fromCode(sourceType),
            minConfidence,
            limit,
            offset,
            orderBy,
            "asc".equalsIgnoreCase(order)
        );
        return discoveryService.listDiscoveries(query);
    }

    @GetMapping("/stats")
    public DiscoveryStats stats() {
        return discoveryService.stats();
    }

    @GetMapping("/domain-check")
    public DomainCheck checkDomain(
        @RequestParam(name = "domain") String domain,
        @RequestParam(name = "teamId", required = false) String teamId
    ) {
        return discoveryService.checkDomainExists(domain, teamId);
    }

    @GetMapping("/{id}")
    public Discovery getDiscovery(@PathVariable("id") long id) {
        return discoveryService.getDiscovery(id);
    }

    @PatchMapping("/{id}")
    public Discovery updateStatus(@PathVariable("id") long id, @RequestBody DiscoveryReviewApiRequest request) {
        if (request == null || request.status() == null) {
            throw new IllegalArgumentException("status is required");
        }
        return discoveryService.updateStatus(
            id,
            DiscoveryStatus.fromCode(request.status()),
            request.reviewer(),
            request.notes()
        );
    }

    @PostMapping("/{id}/promote")
    public PromotionResult promote(
        @PathVariable("id") long id,
        @RequestBody(required = false) DiscoveryReviewApiRequest request
    ) {
        return discoveryService.promoteDiscovery(
            id,
            request == null ? null : request.teamId(),
            request == null ? null : request.reviewer()
        );
    }

    @PostMapping("/{id}/dismiss")
    public Discovery dismiss(
        @PathVariable("id") long id,
        @RequestBody(required = false) DiscoveryReviewApiRequest request
    ) {
        return discoveryService.dismissDiscovery(
            id,
            request == null ? null : request.reviewer(),
            request == null ? null : request.notes()
        );
    }
}
