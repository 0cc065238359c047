package com.propertyintel.gap.service;

import com.propertyintel.gap.config.GapScraperProperties;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CollectionSchedulerTest {

    private final CollectionScheduler scheduler = new CollectionScheduler(new GapScraperProperties());

    @Test
    void run_shouldNeverHoldMoreResourcesThanPoolSize() throws Exception {
        int w = 3;
        int n = 25;
        ResourcePool<String> pool = new ResourcePool<>(List.of("tab-1", "tab-2", "tab-3"));
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        Set<String> busy = ConcurrentHashMap.newKeySet();
        AtomicInteger sharedUse = new AtomicInteger();

        CollectionScheduler.Report<Integer> report = scheduler.run(range(n), 0, pool, (tab, item) -> {
            if (!busy.add(tab)) sharedUse.incrementAndGet();
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            inFlight.decrementAndGet();
            busy.remove(tab);
            return Optional.of(item);
        });

        assertTrue(maxInFlight.get() <= w, "max in flight " + maxInFlight.get());
        assertTrue(pool.peakCheckedOut() <= w);
        assertEquals(0, sharedUse.get(), "a resource was used by two tasks at once");
        assertEquals(n, pool.releases());
        assertEquals(0, pool.checkedOut());
        assertEquals(n, report.submitted());
        assertEquals(new HashSet<>(range(n)), new HashSet<>(report.results()));
    }

    @Test
    void run_shouldCountFilteredAndFailedWithoutStopping() throws Exception {
        ResourcePool<String> pool = new ResourcePool<>(List.of("a", "b"));

        CollectionScheduler.Report<Integer> report = scheduler.run(range(10), 0, pool, (tab, item) -> {
            if (item % 5 == 0) throw new IllegalStateException("boom " + item);
            return item % 2 == 0 ? Optional.empty() : Optional.of(item);
        });

        assertEquals(10, report.submitted());
        assertEquals(2, report.failed());
        assertEquals(4, report.filtered());
        assertEquals(List.of(1, 3, 7, 9), report.results().stream().sorted().collect(Collectors.toList()));
        assertEquals(10, pool.releases());
        assertEquals(0, pool.checkedOut());
    }

    @Test
    void run_shouldStopAtMaxItemsKeepingBacklogOrder() throws Exception {
        ResourcePool<String> pool = new ResourcePool<>(List.of("only"));
        List<Integer> seen = Collections.synchronizedList(new ArrayList<>());

        CollectionScheduler.Report<Integer> report = scheduler.run(range(10), 4, pool, (tab, item) -> {
            seen.add(item);
            return Optional.of(item);
        });

        assertEquals(4, report.submitted());
        assertEquals(List.of(0, 1, 2, 3), seen);
    }

    @Test
    void run_shouldReturnEmptyReportForEmptyBacklog() throws Exception {
        ResourcePool<String> pool = new ResourcePool<>(List.of("a"));

        CollectionScheduler.Report<Integer> report = scheduler.run(List.<Integer>of(), 0, pool, (tab, item) -> Optional.of(item));

        assertTrue(report.results().isEmpty());
        assertEquals(0, report.submitted());
        assertEquals(0, pool.releases());
    }

    @Test
    void resourcePool_shouldReleaseOnFailureAndRejectEmpty() throws Exception {
        ResourcePool<String> pool = new ResourcePool<>(List.of("x"));

        assertThrows(IllegalArgumentException.class, () -> pool.withResource(r -> {
            throw new IllegalArgumentException("fail");
        }));
        assertEquals(0, pool.checkedOut());
        assertEquals(1, pool.releases());
        assertEquals("x", pool.acquire());
        assertFalse(pool.members().isEmpty());

        assertThrows(IllegalArgumentException.class, () -> new ResourcePool<String>(List.of()));
    }

    private static List<Integer> range(int n) {
        return IntStream.range(0, n).boxed().collect(Collectors.toList());
    }
}
