package com.loadspec.service.backend;

import com.loadspec.exception.AiErrorType;
import com.loadspec.exception.AiServiceException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Caps the number of in-flight requests to a backend.
 * <p>
 * Callers beyond the ceiling wait in arrival order on a fair semaphore. A caller that waits longer
 * than the acquire timeout fails with {@link AiErrorType#RESOURCE_EXHAUSTED}. Every granted slot is
 * handed out as a {@link Lease} that gives the slot back exactly once.
 */
@Slf4j
public class ConnectionPool {

    private final String owner;
    private final int maxConnections;
    private final long acquireTimeoutMs;
    private final Semaphore permits;
    private final AtomicInteger queued = new AtomicInteger();

    public ConnectionPool(String owner, int maxConnections, long acquireTimeoutMs) {
        if (maxConnections < 1) {
            throw new IllegalArgumentException("maxConnections must be at least 1, was " + maxConnections);
        }
        this.owner = owner;
        this.maxConnections = maxConnections;
        this.acquireTimeoutMs = acquireTimeoutMs;
        this.permits = new Semaphore(maxConnections, true);
    }

    /**
     * Waits for a free slot.
     *
     * @return The lease to close once the request is done.
     * @throws AiServiceException RESOURCE_EXHAUSTED when no slot frees up in time or the wait is interrupted.
     */
    public Lease acquire() {
        queued.incrementAndGet();
        try {
            if (!permits.tryAcquire(acquireTimeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("{}: no connection free after {} ms ({} active)", owner, acquireTimeoutMs, activeConnections());
                throw new AiServiceException(AiErrorType.RESOURCE_EXHAUSTED, owner,
                        "Timed out after " + acquireTimeoutMs + " ms waiting for one of " + maxConnections + " connections");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AiServiceException(AiErrorType.RESOURCE_EXHAUSTED, owner,
                    "Interrupted while waiting for a connection", null, e);
        } finally {
            queued.decrementAndGet();
        }
        return new Lease();
    }

    /**
     * Runs {@code work} while holding a slot. The slot is released even when {@code work} throws.
     */
    public <T> T withConnection(Supplier<T> work) {
        try (Lease ignored = acquire()) {
            return work.get();
        }
    }

    public int activeConnections() {
        return maxConnections - permits.availablePermits();
    }

    public int queuedRequests() {
        return queued.get();
    }

    public int maxConnections() {
        return maxConnections;
    }

    /**
     * One granted slot. Closing it more than once has no further effect.
     */
    public final class Lease implements AutoCloseable {

        private final AtomicBoolean released = new AtomicBoolean();

        private Lease() {
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                permits.release();
            }
        }
    }
}
