package com.example.shiftplanner.client;

import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

public class TaskSchedulerSyncScheduler implements SyncScheduler {

    private final TaskScheduler taskScheduler;
    private final Clock clock;

    public TaskSchedulerSyncScheduler(TaskScheduler taskScheduler, Clock clock) {
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    @Override
    public Cancellable schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = taskScheduler.schedule(task, clock.instant().plus(delay));
        return () -> future.cancel(false);
    }
}
