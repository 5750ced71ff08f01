package dev.storyeval.batch;

import java.util.concurrent.Callable;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.concurrent.ThreadSafe;

/**
 * A pool of slots bounding how many remote calls are in flight at once.
 *
 * <p>Every outbound call holds exactly one slot, and releases it whether the call succeeds or
 * fails. This is the only state in a pass shared between worker threads.
 */
@ThreadSafe
public final class ConcurrencyLimiter {
    private final int limit;
    private final Semaphore slots;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peak = new AtomicInteger();

    public ConcurrencyLimiter(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("concurrency limit must be at least 1: " + limit);
        }
        this.limit = limit;
        this.slots = new Semaphore(limit, true);
    }

    public int limit() {
        return limit;
    }

    /** Run {@code call} while holding a slot, waiting for one if all are taken. */
    public <T> T withSlot(Callable<T> call) throws Exception {
        slots.acquire();
        try {
            peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            return call.call();
        } finally {
            inFlight.decrementAndGet();
            slots.release();
        }
    }

    /** Calls currently holding a slot. */
    public int inFlight() {
        return inFlight.get();
    }

    /** Highest number of simultaneous calls seen so far. */
    public int peak() {
        return peak.get();
    }
}
