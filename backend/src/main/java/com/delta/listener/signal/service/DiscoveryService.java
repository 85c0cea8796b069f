package com.delta.listener.signal.service;

import com.delta.listener.config.ListenerProperties;
import com.delta.listener.signal.extract.DomainExtractor;
import com.delta.listener.signal.metrics.ScanMetrics;
import com.delta.listener.signal.model.BatchCreateSummary;
import com.delta.listener.signal.model.CreateDiscoveryResult;
import com.delta.listener.signal.model.Discovery;
import com.delta.listener.signal.model.DiscoveryCandidate;
import com.delta.listener.signal.model.DiscoveryPage;
import com.delta.listener.signal.model.DiscoveryQuery;
import com.delta.listener.signal.model.DiscoveryStats;
import com.delta.listener.signal.model.DiscoveryStatus;
import com.delta.listener.signal.model.DomainCheck;
import com.delta.listener.signal.model.PromotionResult;
import com.delta.listener.signal.model.ProspectSeed;
import com.delta.listener.signal.model.ShouldCreateDecision;
import com.delta.listener.signal.persistence.DiscoveryJdbcRepository;
import com.delta.listener.signal.persistence.ProspectGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Discovery lifecycle: creation with deduplication on (domain, source url), promotion into prospects and
 * reviewer status changes.
 */
@Service
public class DiscoveryService {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryService.class);
    static final Duration RECENT_DISCOVERY_WINDOW = Duration.ofDays(7);
    static final String PROSPECT_SOURCE = "listener";

    private final DiscoveryJdbcRepository repository;
    private final ProspectGateway prospects;
    private final ListenerProperties properties;
    private final ScanMetrics scanMetrics;

    public DiscoveryService(
        DiscoveryJdbcRepository repository,
        ProspectGateway prospects,
        ListenerProperties properties,
        ScanMetrics scanMetrics
    ) {
        this.repository = repository;
        this.prospects = prospects;
        this.properties = properties;
        this.scanMetrics = scanMetrics;
    }

    public CreateDiscoveryResult createDiscovery(DiscoveryCandidate candidate, String teamId, int autoPromoteThreshold) {
        return scanMetrics.timeDb("create_discovery", () -> create(candidate, teamId, autoPromoteThreshold));
    }

    private CreateDiscoveryResult create(DiscoveryCandidate candidate, String teamId, int autoPromoteThreshold) {
        Long discoveryId = null;
        try {
            Optional<Discovery> existing = repository.findByDomainAndSourceUrl(candidate.companyDomain(), candidate.sourceUrl());
            if (existing.isPresent()) {
                return duplicateOf(existing.get().id(), candidate);
            }
            try {
                discoveryId = repository.insert(candidate, Instant.now());
            } catch (DuplicateKeyException e) {
                Discovery raced = repository.findByDomainAndSourceUrl(candidate.companyDomain(), candidate.sourceUrl())
                    .orElseThrow(() -> e);
                log.debug("Discovery for {} at {} inserted concurrently", candidate.companyDomain(), candidate.sourceUrl());
                return duplicateOf(raced.id(), candidate);
            }
            if (candidate.confidenceScore() >= autoPromoteThreshold) {
                PromotionResult promotion = promoteDiscovery(discoveryId, teamId, null);
                log.info(
                    "Auto-promoted discovery {} ({}, score {}) to prospect {}",
                    discoveryId,
                    candidate.companyDomain(),
                    candidate.confidenceScore(),
                    promotion.prospectId()
                );
                return CreateDiscoveryResult.autoPromoted(discoveryId, promotion.prospectId());
            }
            return CreateDiscoveryResult.created(discoveryId);
        } catch (DataAccessException | IllegalStateException e) {
            log.warn("Failed to create discovery for {} from {}", candidate.companyDomain(), candidate.sourceUrl(), e);
            if (discoveryId != null) {
                // the row exists; only promotion failed
                return CreateDiscoveryResult.created(discoveryId);
            }
            return CreateDiscoveryResult.error(null, e.getMessage());
        }
    }

    public BatchCreateSummary createDiscoveries(List<DiscoveryCandidate> candidates, String teamId, int autoPromoteThreshold) {
        int created = 0;
        int duplicates = 0;
        int autoPromoted = 0;
        int errors = 0;
        List<CreateDiscoveryResult> results = new ArrayList<>();
        for (DiscoveryCandidate candidate : candidates) {
            CreateDiscoveryResult result = createDiscovery(candidate, teamId, autoPromoteThreshold);
            results.add(result);
            switch (result.status()) {
                case ERROR -> errors++;
                case DUPLICATE -> duplicates++;
                case AUTO_PROMOTED -> {
                    autoPromoted++;
                    created++;
                }
                case CREATED -> created++;
            }
        }
        return new BatchCreateSummary(created, duplicates, autoPromoted, errors, results);
    }

    /**
     * Links the discovery to a prospect for (team, domain). An existing prospect marks the discovery as
     * {@code duplicate}; otherwise a minimal prospect is created and the discovery becomes {@code promoted}.
     * Promoting an already promoted discovery returns its prospect.
     */
    public PromotionResult promoteDiscovery(long id, String teamId, String reviewer) {
        Discovery discovery = getDiscovery(id);
        if (discovery.status() == DiscoveryStatus.PROMOTED
            || (discovery.status() == DiscoveryStatus.DUPLICATE && discovery.promotedProspectId() != null)) {
            return new PromotionResult(id, discovery.promotedProspectId(), discovery.status(), false);
        }
        if (discovery.status().isTerminal()) {
            throw new IllegalStateException("Discovery " + id + " is " + discovery.status().code() + " and cannot be promoted");
        }
        String team = resolveTeam(teamId);
        Optional<Long> existingProspect = prospects.findProspectId(team, discovery.companyDomain());
        if (existingProspect.isPresent()) {
            repository.linkProspect(id, existingProspect.get(), DiscoveryStatus.DUPLICATE, reviewer, Instant.now());
            return new PromotionResult(id, existingProspect.get(), DiscoveryStatus.DUPLICATE, false);
        }
        ProspectGateway.ProspectLink link = prospects.findOrCreateProspect(
            team,
            discovery.companyDomain(),
            new ProspectSeed(
                discovery.companyName() == null ? discovery.companyDomain() : discovery.companyName(),
                PROSPECT_SOURCE,
                id,
                discovery.triggerText()
            )
        );
        DiscoveryStatus status = link.created() ? DiscoveryStatus.PROMOTED : DiscoveryStatus.DUPLICATE;
        repository.linkProspect(id, link.prospectId(), status, reviewer, Instant.now());
        return new PromotionResult(id, link.prospectId(), status, link.created());
    }

    /**
     * Cheap pre-check used before scoring: skips domains that are already prospects or that produced a
     * non-dismissed discovery in the last seven days, whatever the source url.
     */
    public ShouldCreateDecision shouldCreateDiscovery(String domain, String teamId) {
        return scanMetrics.timeDb("should_create_discovery", () -> preCheck(domain, teamId));
    }

    private ShouldCreateDecision preCheck(String domain, String teamId) {
        Optional<Long> prospectId = prospects.findProspectId(resolveTeam(teamId), domain);
        if (prospectId.isPresent()) {
            return ShouldCreateDecision.skip(ShouldCreateDecision.ALREADY_PROSPECT, prospectId.get());
        }
        Optional<Discovery> recent = repository.findLatestActiveByDomain(domain, Instant.now().minus(RECENT_DISCOVERY_WINDOW));
        if (recent.isPresent()) {
            return ShouldCreateDecision.skip(ShouldCreateDecision.RECENT_DISCOVERY, recent.get().id());
        }
        return ShouldCreateDecision.proceed();
    }

    public Discovery getDiscovery(long id) {
        return repository.findById(id).orElseThrow(() -> new DiscoveryNotFoundException(id));
    }

    public DiscoveryPage listDiscoveries(DiscoveryQuery query) {
        return new DiscoveryPage(repository.list(query), repository.count(query), query.limit(), query.offset());
    }

    public DomainCheck checkDomainExists(String rawDomain, String teamId) {
        String domain = DomainExtractor.normalizeDomain(rawDomain);
        if (domain.isEmpty()) {
            throw new IllegalArgumentException("domain is required");
        }
        Optional<Long> prospectId = prospects.findProspectId(resolveTeam(teamId), domain);
        Optional<Discovery> discovery = repository.findLatestActiveByDomain(domain, null);
        return new DomainCheck(
            domain,
            prospectId.isPresent(),
            prospectId.orElse(null),
            discovery.isPresent(),
            discovery.map(Discovery::id).orElse(null),
            discovery.map(Discovery::status).orElse(null)
        );
    }

    /**
     * Reviewer status change. Only {@code new} and {@code reviewing} discoveries may move; a move to
     * {@code promoted} goes through {@link #promoteDiscovery}.
     */
    public Discovery updateStatus(long id, DiscoveryStatus target, String reviewer, String notes) {
        if (target == null) {
            throw new IllegalArgumentException("status is required");
        }
        Discovery discovery = getDiscovery(id);
        if (!discovery.status().canTransitionTo(target)) {
            throw new IllegalStateException(
                "Cannot move discovery " + id + " from " + discovery.status().code() + " to " + target.code()
            );
        }
        if (target == DiscoveryStatus.PROMOTED) {
            promoteDiscovery(id, null, reviewer);
            return getDiscovery(id);
        }
        repository.updateStatus(id, target, reviewer, notes, Instant.now());
        return getDiscovery(id);
    }

    public Discovery dismissDiscovery(long id, String reviewer, String notes) {
        return updateStatus(id, DiscoveryStatus.DISMISSED, reviewer, notes);
    }

    public DiscoveryStats stats() {
        return repository.stats(Instant.now());
    }

    private CreateDiscoveryResult duplicateOf(long existingId, DiscoveryCandidate candidate) {
        if (repository.raiseScore(existingId, candidate, Instant.now())) {
            log.debug("Raised score of discovery {} to {}", existingId, candidate.confidenceScore());
        }
        return CreateDiscoveryResult.duplicate(existingId);
    }

    private String resolveTeam(String teamId) {
        return teamId == null || teamId.isBlank() ? properties.getScan().getTeamId() : teamId;
    }
}
