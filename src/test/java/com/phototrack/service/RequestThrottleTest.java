package com.phototrack.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RequestThrottleTest {

    @Test
    void firstRequestDoesNotWait() {
        RequestThrottle throttle = new RequestThrottle(500);

        long start = System.nanoTime();
        throttle.awaitTurn();
        long waitedMs = (System.nanoTime() - start) / 1_000_000;

        assertTrue(waitedMs < 400, "waited " + waitedMs + " ms");
        assertEquals(1, throttle.getRequestCount());
    }

    @Test
    void nextRequestWaitsForInterval() {
        RequestThrottle throttle = new RequestThrottle(200);
        throttle.awaitTurn();
        throttle.requestFinished();

        long start = System.nanoTime();
        throttle.awaitTurn();
        long waitedMs = (System.nanoTime() - start) / 1_000_000;

        assertTrue(waitedMs >= 150, "waited " + waitedMs + " ms");
        assertEquals(2, throttle.getRequestCount());
    }

    @Test
    void zeroIntervalNeverWaits() {
        RequestThrottle throttle = new RequestThrottle(0);
        long start = System.nanoTime();
        for (int i = 0; i < 50; i++) {
            throttle.awaitTurn();
            throttle.requestFinished();
        }
        assertTrue((System.nanoTime() - start) / 1_000_000 < 1000);
        assertEquals(50, throttle.getRequestCount());
    }

    @Test
    void negativeIntervalIsClampedToZero() {
        assertEquals(0, new RequestThrottle(-5).getMinIntervalMs());
    }
}
