package com.riftinsight.infrastructure.riot;

import com.riftinsight.domain.model.RateLimiterStats;

import java.util.concurrent.Semaphore;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Counting gate bounding concurrent outbound calls to the Riot API.
 *
 * Thread-safety:
 * - A fair Semaphore holds the permits (FIFO among blocked callers)
 * - inFlight/queued are mutated and read under one ReentrantLock, so
 *   {@link #stats()} never observes a half-updated pair
 *
 * A permit covers a single HTTP attempt. Retry backoff happens outside of it.
 */
public final class UpstreamRateLimiter {

    private final int maxConcurrent;
    private final Semaphore permits;
    private final ReentrantLock lock = new ReentrantLock();
    private int inFlight;
    private int queued;

    public UpstreamRateLimiter(int maxConcurrent) {
        this.maxConcurrent = Math.max(1, maxConcurrent);
        this.permits = new Semaphore(this.maxConcurrent, true);
    }

    /**
     * Runs {@code call} while holding one permit.
     *
     * @throws UpstreamException with kind CANCELLED if interrupted while waiting
     */
    public <T> T call(Supplier<T> call) {
        acquire();
        try {
            return call.get();
        } finally {
            release();
        }
    }

    public RateLimiterStats stats() {
        lock.lock();
        try {
            return RateLimiterStats.builder()
                    .maxConcurrent(maxConcurrent)
                    .inFlight(inFlight)
                    .queued(queued)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    private void acquire() {
        lock.lock();
        try {
            queued++;
        } finally {
            lock.unlock();
        }

        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            lock.lock();
            try {
                queued--;
            } finally {
                lock.unlock();
            }
            throw new UpstreamException(UpstreamFailureKind.CANCELLED, 0,
                    "Interrupted while waiting for an upstream permit", e);
        }

        lock.lock();
        try {
            queued--;
            inFlight++;
        } finally {
            lock.unlock();
        }
    }

    private void release() {
        lock.lock();
        try {
            inFlight = Math.max(0, inFlight - 1);
        } finally {
            lock.unlock();
        }
        permits.release();
    }
}
