package com.openstable.sync.support;

import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;

/**
 * Runs the action once calls have stopped for the configured delay, with the last argument.
 */
public class Debouncer<A> implements Consumer<A> {

    private final Consumer<A> action;
    private final Duration delay;
    private final TaskScheduler scheduler;

    private ScheduledFuture<?> pending;
    private A pendingArgument;

    public Debouncer(Consumer<A> action, Duration delay, TaskScheduler scheduler) {
        this.action = action;
        this.delay = delay;
        this.scheduler = scheduler;
    }

    @Override
    public synchronized void accept(A argument) {
        if (pending != null) {
            pending.cancel(false);
        }
        pendingArgument = argument;
        pending = scheduler.schedule(this::fire, scheduler.getClock().instant().plus(delay));
    }

    /**
     * Runs a pending call immediately.
     */
    public synchronized void flush() {
        if (pending != null) {
            pending.cancel(false);
            fire();
        }
    }

    public synchronized void cancel() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
            pendingArgument = null;
        }
    }

    private synchronized void fire() {
        if (pending == null) {
            return;
        }
        A argument = pendingArgument;
        pending = null;
        pendingArgument = null;
        action.accept(argument);
    }
}
