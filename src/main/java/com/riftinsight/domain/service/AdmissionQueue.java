package com.riftinsight.domain.service;

import com.riftinsight.domain.model.QueueStats;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide gate limiting how many analyses run at once.
 *
 * Waiting callers register a {@link Waiter} so the stream can report a queue
 * position while the blocking {@link #acquire(Waiter)} is still pending on
 * another thread. A caller may {@link #register(Waiter)} ahead of handing the
 * acquire to another thread, so its position is known straight away.
 *
 * Fairness:
 * - Permits come from a fair Semaphore, so threads blocked in acquire are
 *   granted in arrival order. Waiters are ranked in registration order, which
 *   matches arrival order up to scheduling jitter between the two steps.
 *
 * Thread-safety:
 * - active and the waiter list are only touched under {@code lock}
 * - stats() and position() read under the same lock
 */
@Slf4j
@Component
public class AdmissionQueue {

    private final int maxConcurrent;
    private final Semaphore permits;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<Waiter> waiters = new ArrayList<>();
    private int active;

    public AdmissionQueue(
            @Value("${app.analysis.max-concurrent:3}") int maxConcurrent,
            MeterRegistry meterRegistry) {
        this.maxConcurrent = Math.max(1, maxConcurrent);
        this.permits = new Semaphore(this.maxConcurrent, true);

        Gauge.builder("analysis.queue", this, q -> q.stats().getActive())
                .tag("state", "active")
                .register(meterRegistry);
        Gauge.builder("analysis.queue", this, q -> q.stats().getQueued())
                .tag("state", "queued")
                .register(meterRegistry);

        log.info("Analysis queue initialised: maxConcurrent={}", this.maxConcurrent);
    }

    /**
     * Take a slot only if one is free now and nobody is waiting for it.
     */
    public Optional<Slot> tryAcquire() throws InterruptedException {
        // the timed form honours fairness, plain tryAcquire() would barge
        if (!permits.tryAcquire(0, TimeUnit.MILLISECONDS)) {
            return Optional.empty();
        }
        lock.lock();
        try {
            active++;
        } finally {
            lock.unlock();
        }
        return Optional.of(new Slot());
    }

    /**
     * Add the waiter to the end of the queue. Registering twice is a no-op.
     */
    public void register(Waiter waiter) {
        lock.lock();
        try {
            if (!waiters.contains(waiter)) {
                waiters.add(waiter);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove a registered waiter whose acquire will never run.
     */
    public void withdraw(Waiter waiter) {
        lock.lock();
        try {
            waiters.remove(waiter);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Register as waiting (unless already registered), block for a slot, then unregister.
     *
     * @throws InterruptedException if interrupted while waiting; the waiter is
     *                              unregistered and no slot is taken
     */
    public Slot acquire(Waiter waiter) throws InterruptedException {
        register(waiter);

        boolean granted = false;
        try {
            permits.acquire();
            granted = true;
        } finally {
            lock.lock();
            try {
                waiters.remove(waiter);
                if (granted) {
                    active++;
                }
            } finally {
                lock.unlock();
            }
        }
        return new Slot();
    }

    /**
     * Release a slot. Releasing the same slot twice is a no-op.
     */
    public void release(Slot slot) {
        slot.close();
    }

    /**
     * 1-based rank among current waiters, 0 when not waiting.
     */
    public int position(Waiter waiter) {
        lock.lock();
        try {
            return waiters.indexOf(waiter) + 1;
        } finally {
            lock.unlock();
        }
    }

    public QueueStats stats() {
        lock.lock();
        try {
            return QueueStats.builder()
                    .maxConcurrent(maxConcurrent)
                    .active(active)
                    .queued(waiters.size())
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    private void releasePermit() {
        lock.lock();
        try {
            active = Math.max(0, active - 1);
        } finally {
            lock.unlock();
        }
        permits.release();
    }

    /**
     * Identity-only registration token for one pending acquire.
     */
    public static final class Waiter {
    }

    /**
     * A held analysis slot. Close exactly once; later closes are ignored.
     */
    public final class Slot implements AutoCloseable {

        private final AtomicBoolean released = new AtomicBoolean();

        private Slot() {
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                releasePermit();
            }
        }

        public boolean isReleased() {
            return released.get();
        }
    }
}
