package com.openstable.sync.support;

import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;

/**
 * Collects items and hands them to the processor in arrival order, either when
 * {@code maxBatchSize} items are waiting or when {@code delay} has passed since the
 * first unflushed item, whichever comes first.
 */
public class Batcher<T> {

    private final Consumer<List<T>> processor;
    private final Duration delay;
    private final int maxBatchSize;
    private final TaskScheduler scheduler;

    private final List<T> batch = new ArrayList<>();
    private ScheduledFuture<?> timer;

    public Batcher(Consumer<List<T>> processor, Duration delay, int maxBatchSize, TaskScheduler scheduler) {
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize must be positive: " + maxBatchSize);
        }
        this.processor = processor;
        this.delay = delay;
        this.maxBatchSize = maxBatchSize;
        this.scheduler = scheduler;
    }

    public synchronized void add(T item) {
        batch.add(item);
        if (batch.size() >= maxBatchSize) {
            flush();
        } else if (timer == null) {
            timer = scheduler.schedule(this::flush, scheduler.getClock().instant().plus(delay));
        }
    }

    public synchronized void flush() {
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
        if (batch.isEmpty()) {
            return;
        }
        List<T> items = List.copyOf(batch);
        batch.clear();
        processor.accept(items);
    }

    /**
     * Drops waiting items without processing them.
     */
    public synchronized void clear() {
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
        batch.clear();
    }

    public synchronized int size() {
        return batch.size();
    }
}
