package com.dcruver.promptloom.search;

import com.dcruver.promptloom.domain.CancellationSignal;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Runs refresh requests so that only the newest one is applied.
 *
 * Submitting a request cancels the one before it. A request that completes after a newer one was
 * submitted has its result dropped instead of handed to the consumer, and one that stops itself by
 * throwing {@link CancellationException} after being superseded completes normally with {@code false}.
 * Meant for interactive consumers that re-run a {@link TagSearchService} query on every keystroke;
 * the shell commands run one query at a time and do not need it.
 *
 * @param <T> result type of a request
 */
@Slf4j
public class LatestRequestGate<T> {

    private final Executor executor;
    private final Object lock = new Object();

    private long generation;
    private CancellationSignal current = CancellationSignal.none();

    public LatestRequestGate(Executor executor) {
        this.executor = executor;
    }

    /**
     * Start {@code request} and pass its result to {@code apply} if no newer request has been submitted.
     *
     * @return completes with {@code true} when the result was applied, {@code false} when it was superseded;
     *         completes exceptionally only when the current request fails
     */
    public CompletableFuture<Boolean> submit(Function<CancellationSignal, T> request, Consumer<T> apply) {
        CancellationSignal signal = new CancellationSignal();
        long ticket;
        synchronized (lock) {
            current.cancel();
            current = signal;
            ticket = ++generation;
        }

        return CompletableFuture
            .supplyAsync(() -> request.apply(signal), executor)
            .handle((result, failure) -> {
                synchronized (lock) {
                    boolean superseded = ticket != generation || signal.isCancelled();
                    if (failure != null) {
                        Throwable cause = unwrap(failure);
                        if (superseded && cause instanceof CancellationException) {
                            log.debug("Request {} stopped after being superseded", ticket);
                            return false;
                        }
                        if (failure instanceof CompletionException) {
                            throw (CompletionException) failure;
                        }
                        throw new CompletionException(cause);
                    }
                    if (superseded) {
                        log.debug("Dropping result of superseded request {}", ticket);
                        return false;
                    }
                    apply.accept(result);
                    return true;
                }
            });
    }

    private static Throwable unwrap(Throwable failure) {
        return failure instanceof CompletionException && failure.getCause() != null ? failure.getCause() : failure;
    }

    /**
     * Cancel whatever request is in flight without starting a new one.
     */
    public void cancel() {
        synchronized (lock) {
            current.cancel();
            generation++;
        }
    }
}
