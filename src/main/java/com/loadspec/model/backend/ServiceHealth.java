package com.loadspec.model.backend;

import java.time.Instant;

/**
 * Snapshot of a self-hosted backend's cached health and pool occupancy.
 */
public record ServiceHealth(boolean healthy, Instant lastCheck, int activeConnections, int queuedRequests) {
}
