package com.propertyintel.gap.service;

import com.propertyintel.gap.config.GapScraperProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * Drains a backlog through a pool of exclusive resources, at most one task
 * per resource at a time.
 *
 * Results are gathered in completion order. A task that returns empty was
 * filtered by its own logic; a task that throws is counted as failed. Neither
 * stops the remaining backlog.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CollectionScheduler {

    private final GapScraperProperties properties;

    public record Report<V>(List<V> results, int submitted, int filtered, int failed) {}

    public <T, R, V> Report<V> run(List<T> backlog,
                                   int maxItems,
                                   ResourcePool<R> pool,
                                   BiFunction<? super R, ? super T, Optional<V>> task) throws InterruptedException {
        List<T> work = maxItems > 0 && backlog.size() > maxItems ? backlog.subList(0, maxItems) : backlog;
        int total = work.size();
        if (total == 0) {
            return new Report<>(List.of(), 0, 0, 0);
        }

        AtomicInteger threadNo = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(pool.capacity(), r -> {
            Thread t = new Thread(r, "detail-worker-" + threadNo.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        CompletionService<Optional<V>> completion = new ExecutorCompletionService<>(executor);
        for (T item : work) {
            completion.submit(() -> pool.withResource(resource -> task.apply(resource, item)));
        }

        int logEvery = Math.max(0, properties.getCollection().getProgressLogEvery());
        List<V> results = new ArrayList<>();
        int filtered = 0;
        int failed = 0;
        try {
            for (int i = 0; i < total; i++) {
                Future<Optional<V>> future = completion.take();
                try {
                    Optional<V> result = future.get();
                    if (result.isPresent()) {
                        results.add(result.get());
                    } else {
                        filtered++;
                    }
                } catch (ExecutionException e) {
                    failed++;
                    log.warn("Detail task failed: {}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
                }

                int completed = i + 1;
                if (logEvery > 0 && completed % logEvery == 0) {
                    log.info("Progress: {}/{} done, {} kept", completed, total, results.size());
                }
            }
        } finally {
            executor.shutdownNow();
        }

        return new Report<>(results, total, filtered, failed);
    }
}
