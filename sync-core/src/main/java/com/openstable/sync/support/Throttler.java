package com.openstable.sync.support;

import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;

/**
 * Runs the action at most once per interval. A call inside the interval is not lost:
 * one trailing run with the latest argument happens when the interval ends.
 */
public class Throttler<A> implements Consumer<A> {

    private final Consumer<A> action;
    private final Duration interval;
    private final TaskScheduler scheduler;

    private Instant lastRun;
    private ScheduledFuture<?> trailing;
    private A pendingArgument;

    public Throttler(Consumer<A> action, Duration interval, TaskScheduler scheduler) {
        this.action = action;
        this.interval = interval;
        this.scheduler = scheduler;
    }

    @Override
    public synchronized void accept(A argument) {
        Instant now = scheduler.getClock().instant();
        if (lastRun == null || !now.isBefore(lastRun.plus(interval))) {
            cancelTrailing();
            lastRun = now;
            action.accept(argument);
            return;
        }
        pendingArgument = argument;
        if (trailing == null) {
            trailing = scheduler.schedule(this::runTrailing, lastRun.plus(interval));
        }
    }

    private synchronized void runTrailing() {
        if (trailing == null) {
            return;
        }
        A argument = pendingArgument;
        trailing = null;
        pendingArgument = null;
        lastRun = scheduler.getClock().instant();
        action.accept(argument);
    }

    public synchronized void cancel() {
        cancelTrailing();
    }

    private void cancelTrailing() {
        if (trailing != null) {
            trailing.cancel(false);
            trailing = null;
            pendingArgument = null;
        }
    }
}
