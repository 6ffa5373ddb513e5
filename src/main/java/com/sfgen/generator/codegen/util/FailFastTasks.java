package com.sfgen.generator.codegen.util;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.BiFunction;

/**
 * Runs keyed tasks on a fixed pool and waits for all of them, stopping at
 * the first failure.
 */
public class FailFastTasks {

    private FailFastTasks() {
        // Utility class
    }

    /**
     * Runs every task and returns the results in the tasks' iteration order.
     *
     * When a task fails, the tasks still running are cancelled and the
     * failure is rethrown: unchanged when it is already a
     * {@link RuntimeException}, otherwise through {@code wrapFailure}.
     *
     * @param tasks       tasks by key
     * @param parallelism upper bound on worker threads
     * @param wrapFailure turns a checked failure of a key's task into the
     *                    exception to throw
     * @throws InterruptedException when the calling thread is interrupted
     *                              while waiting
     */
    public static <K, V> Map<K, V> runAll(Map<K, Callable<V>> tasks, int parallelism,
                                          BiFunction<K, Throwable, RuntimeException> wrapFailure)
            throws InterruptedException {
        if (tasks.isEmpty()) {
            return Map.of();
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, Math.min(parallelism, tasks.size())));
        CompletionService<V> completion = new ExecutorCompletionService<>(executor);
        Map<K, Future<V>> futures = new LinkedHashMap<>();
        try {
            tasks.forEach((key, task) -> futures.put(key, completion.submit(task)));

            for (int i = 0; i < futures.size(); i++) {
                Future<V> done = completion.take();
                try {
                    done.get();
                } catch (ExecutionException e) {
                    futures.values().forEach(future -> future.cancel(true));
                    throw unwrap(keyOf(futures, done), e.getCause(), wrapFailure);
                }
            }

            Map<K, V> results = new LinkedHashMap<>();
            for (Map.Entry<K, Future<V>> entry : futures.entrySet()) {
                results.put(entry.getKey(), getCompleted(entry.getValue()));
            }
            return results;
        } catch (InterruptedException e) {
            futures.values().forEach(future -> future.cancel(true));
            throw e;
        } finally {
            executor.shutdownNow();
        }
    }

    private static <K, V> K keyOf(Map<K, Future<V>> futures, Future<V> done) {
        return futures.entrySet().stream()
                .filter(entry -> entry.getValue() == done)
                .map(Map.Entry::getKey)
                .findFirst()
                .orElseThrow();
    }

    private static <K> RuntimeException unwrap(K key, Throwable cause,
                                               BiFunction<K, Throwable, RuntimeException> wrapFailure) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return wrapFailure.apply(key, cause);
    }

    private static <V> V getCompleted(Future<V> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("task failed after completing successfully", e.getCause());
        }
    }
}
