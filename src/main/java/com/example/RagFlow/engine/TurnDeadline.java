package com.example.RagFlow.engine;

import com.example.RagFlow.exception.TurnTimeoutException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Wall-clock budget of one turn. Every blocking collaborator call made while dispatching
 * goes through {@link #await}, so an expired budget stops the turn at the next call.
 */
public final class TurnDeadline {

    private final Duration budget;
    private final long deadlineNanos;

    private TurnDeadline(Duration budget) {
        this.budget = budget;
        this.deadlineNanos = System.nanoTime() + budget.toNanos();
    }

    public static TurnDeadline after(Duration budget) {
        return new TurnDeadline(budget);
    }

    public Duration budget() {
        return budget;
    }

    public Duration remaining() {
        long left = deadlineNanos - System.nanoTime();
        return left <= 0 ? Duration.ZERO : Duration.ofNanos(left);
    }

    public boolean isExpired() {
        return remaining().isZero();
    }

    public void ensureNotExpired(String stage) {
        if (isExpired()) {
            throw new TurnTimeoutException(stage, budget);
        }
    }

    /**
     * Run a blocking call on the bounded-elastic scheduler within the remaining budget.
     */
    public <T> T await(String stage, Callable<T> call) {
        return await(stage, Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic()));
    }

    public <T> T await(String stage, Mono<T> pending) {
        ensureNotExpired(stage);
        return pending
                .timeout(remaining(), Mono.error(() -> new TurnTimeoutException(stage, budget)))
                .block();
    }
}
