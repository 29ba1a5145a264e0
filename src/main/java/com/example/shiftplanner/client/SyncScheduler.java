package com.example.shiftplanner.client;

import java.time.Duration;

/**
 * Runs the debounced flush. Tests drive it by hand.
 */
public interface SyncScheduler {

    Cancellable schedule(Runnable task, Duration delay);

    @FunctionalInterface
    interface Cancellable {
        void cancel();
    }
}
