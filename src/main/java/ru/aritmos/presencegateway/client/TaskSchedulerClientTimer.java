package ru.aritmos.presencegateway.client;

import io.micronaut.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link ClientTimer} поверх Micronaut {@link TaskScheduler}.
 */
public class TaskSchedulerClientTimer implements ClientTimer {

    private final TaskScheduler scheduler;

    public TaskSchedulerClientTimer(TaskScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public Handle schedule(Duration delay, Runnable task) {
        ScheduledFuture<?> future = scheduler.schedule(delay, task);
        return () -> future.cancel(false);
    }
}
