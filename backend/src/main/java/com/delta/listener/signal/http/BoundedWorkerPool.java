package com.delta.listener.signal.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runs a function over a list with at most {@code concurrency} calls in flight. Workers pull the next index
 * from a shared counter until the list is exhausted; results keep the input order.
 */
public final class BoundedWorkerPool {
    private static final Logger log = LoggerFactory.getLogger(BoundedWorkerPool.class);

    private BoundedWorkerPool() {
    }

    public static <T, R> List<R> map(List<T> items, int concurrency, Executor executor, Function<T, R> fn) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        Object[] results = new Object[items.size()];
        AtomicInteger next = new AtomicInteger();
        int workers = Math.max(1, Math.min(concurrency, items.size()));
        List<CompletableFuture<Void>> futures = new ArrayList<>(workers);
        for (int i = 0; i < workers; i++) {
            futures.add(CompletableFuture.runAsync(() -> {
                int index;
                while ((index = next.getAndIncrement()) < items.size()) {
                    T item = items.get(index);
                    try {
                        results[index] = fn.apply(item);
                    } catch (RuntimeException e) {
                        log.warn("Worker task failed for {}", item, e);
                        results[index] = null;
                    }
                }
            }, executor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        @SuppressWarnings("unchecked")
        List<R> ordered = (List<R>) Arrays.asList(results);
        return new ArrayList<>(ordered);
    }
}
