package io.markwise.core.grading;

import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

public final class ConcurrencyLimiter {
    private final Semaphore permits;
    private final int capacity;

    public ConcurrencyLimiter(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
        this.permits = new Semaphore(capacity, true);
    }

    public <T> T withPermit(Supplier<T> action) throws InterruptedException {
        permits.acquire();
        try {
            return action.get();
        } finally {
            permits.release();
        }
    }

    public int capacity() {
        return capacity;
    }

    public int available() {
        return permits.availablePermits();
    }
}
