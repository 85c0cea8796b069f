package com.delta.listener.signal.api;

/**
 * Body of status changes, promotions and dismissals. {@code status} is only read by the status endpoint and
 * {@code teamId} only by promotion.
 */
public record DiscoveryReviewApiRequest(
    String status,
    String reviewer,
    String notes,
    String teamId
) {
}
