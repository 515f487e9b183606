package com.openstable.sync.support;

import com.openstable.sync.exception.RetryExhaustedException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Retries an asynchronous operation with exponential backoff.
 * Attempt bookkeeping and delay computation come from a Resilience4j {@link Retry};
 * waits are scheduled on the {@link TaskScheduler} so no thread sleeps between attempts.
 * Cancelling the returned future cancels any pending attempt.
 */
@Slf4j
public class BackoffRetrier {

    private final TaskScheduler scheduler;

    public BackoffRetrier(TaskScheduler scheduler) {
        this.scheduler = scheduler;
    }

    public <T> CompletableFuture<T> retryWithBackoff(String operationName, Supplier<CompletableFuture<T>> operation,
                                                     BackoffPolicy policy) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(policy.maxRetries() + 1)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        policy.initialDelay().toMillis(), policy.multiplier(), policy.maxDelay().toMillis()))
                .build();
        Retry retry = Retry.of(operationName, config);
        retry.getEventPublisher().onRetry(event -> log.warn("{} attempt {} failed, retrying in {} ms: {}",
                event.getName(), event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                event.getLastThrowable() == null ? null : event.getLastThrowable().getMessage()));

        Attempts<T> attempts = new Attempts<>(operationName, operation, retry.asyncContext());
        attempts.promise.whenComplete((result, error) -> attempts.cancelPending());
        attempts.run();
        return attempts.promise;
    }

    public <T> CompletableFuture<T> retryWithBackoff(String operationName, Supplier<CompletableFuture<T>> operation) {
        return retryWithBackoff(operationName, operation, BackoffPolicy.DEFAULT);
    }

    private final class Attempts<T> {
        private final String name;
        private final Supplier<CompletableFuture<T>> operation;
        private final Retry.AsyncContext<T> context;
        private final CompletableFuture<T> promise = new CompletableFuture<>();
        private final AtomicInteger count = new AtomicInteger();
        private final AtomicReference<ScheduledFuture<?>> pending = new AtomicReference<>();

        private Attempts(String name, Supplier<CompletableFuture<T>> operation, Retry.AsyncContext<T> context) {
            this.name = name;
            this.operation = operation;
            this.context = context;
        }

        private void run() {
            if (promise.isDone()) {
                return;
            }
            count.incrementAndGet();
            CompletableFuture<T> stage;
            try {
                stage = operation.get();
            } catch (RuntimeException e) {
                stage = CompletableFuture.failedFuture(e);
            }
            stage.whenComplete(this::onAttemptComplete);
        }

        private void onAttemptComplete(T result, Throwable error) {
            if (promise.isDone()) {
                return;
            }
            if (error == null) {
                context.onComplete();
                promise.complete(result);
                return;
            }
            Throwable cause = unwrap(error);
            long delayMillis = context.onError(cause);
            if (delayMillis < 0) {
                log.error("{} giving up after {} attempts", name, count.get());
                promise.completeExceptionally(new RetryExhaustedException(name, count.get(), cause));
                return;
            }
            pending.set(scheduler.schedule(this::run, scheduler.getClock().instant().plusMillis(delayMillis)));
        }

        private void cancelPending() {
            ScheduledFuture<?> next = pending.getAndSet(null);
            if (next != null) {
                next.cancel(false);
            }
        }
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
