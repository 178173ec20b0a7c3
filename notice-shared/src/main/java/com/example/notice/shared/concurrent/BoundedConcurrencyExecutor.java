package com.example.notice.shared.concurrent;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Runs a worker function over a list of items with at most {@code width} items in flight.
 * <p>
 * A fixed group of workers drains one shared queue; each worker takes the next unclaimed item as
 * soon as it finishes the previous one. A worker whose function throws stops, the others keep
 * draining, and the first failure is rethrown once every worker has finished.
 * <p>
 * If the underlying executor refuses some of the workers, the ones already started drain the whole
 * queue; only a refusal of the very first worker fails the call.
 */
@Slf4j
public class BoundedConcurrencyExecutor {

    private final Executor executor;
    private final int width;

    public BoundedConcurrencyExecutor(Executor executor, int width) {
        if (width < 1) {
            throw new IllegalArgumentException("width must be at least 1, was " + width);
        }
        this.executor = executor;
        this.width = width;
    }

    /**
     * Blocks until every item has been handed to {@code worker} and all in-flight calls returned.
     */
    public <T> void forEach(List<T> items, Consumer<? super T> worker) {
        if (items == null || items.isEmpty()) {
            return;
        }
        Queue<T> queue = new ConcurrentLinkedQueue<>(items);
        AtomicReference<RuntimeException> firstFailure = new AtomicReference<>();
        int workers = Math.min(width, items.size());

        List<CompletableFuture<Void>> running = new ArrayList<>(workers);
        for (int i = 0; i < workers; i++) {
            try {
                running.add(CompletableFuture.runAsync(() -> drain(queue, worker, firstFailure), executor));
            } catch (RejectedExecutionException e) {
                if (running.isEmpty()) {
                    throw e;
                }
                log.warn("Fan-out executor accepted {} of {} workers, continuing with those: {}",
                        running.size(), workers, e.getMessage());
                break;
            }
        }

        try {
            CompletableFuture.allOf(running.toArray(new CompletableFuture<?>[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }

        RuntimeException failure = firstFailure.get();
        if (failure != null) {
            throw failure;
        }
    }

    private static <T> void drain(Queue<T> queue, Consumer<? super T> worker,
                                  AtomicReference<RuntimeException> firstFailure) {
        T item;
        while ((item = queue.poll()) != null) {
            try {
                worker.accept(item);
            } catch (RuntimeException e) {
                if (!firstFailure.compareAndSet(null, e)) {
                    log.debug("Additional fan-out worker failure: {}", e.getMessage());
                }
                return;
            }
        }
    }
}
