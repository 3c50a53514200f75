package com.phototrack.service;

/**
 * Enforces a minimum pause between consecutive outbound requests. The upstream
 * usage policy allows roughly one request per second.
 */
public class RequestThrottle {

    private final long minIntervalMs;
    private long lastRequestEndNanos;
    private boolean hasPreviousRequest;
    private int requestCount;

    public RequestThrottle(long minIntervalMs) {
        this.minIntervalMs = Math.max(0, minIntervalMs);
    }

    /**
     * Blocks until the next request may start.
     */
    public void awaitTurn() {
        requestCount++;
        if (!hasPreviousRequest || minIntervalMs == 0) {
            return;
        }
        long elapsedMs = (System.nanoTime() - lastRequestEndNanos) / 1_000_000;
        long waitMs = minIntervalMs - elapsedMs;
        if (waitMs <= 0) {
            return;
        }
        try {
            Thread.sleep(waitMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public void requestFinished() {
        lastRequestEndNanos = System.nanoTime();
        hasPreviousRequest = true;
    }

    public long getMinIntervalMs() {
        return minIntervalMs;
    }

    /**
     * Number of requests let through so far.
     */
    public int getRequestCount() {
        return requestCount;
    }
}
