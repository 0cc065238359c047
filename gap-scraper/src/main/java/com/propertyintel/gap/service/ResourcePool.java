package com.propertyintel.gap.service;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Fixed set of reusable resources handed out one task at a time.
 * {@link #acquire()} blocks until a resource is free.
 */
public class ResourcePool<R> {

    private final List<R> members;
    private final BlockingQueue<R> idle;
    private final AtomicInteger checkedOut = new AtomicInteger();
    private final AtomicInteger peakCheckedOut = new AtomicInteger();
    private final AtomicInteger releases = new AtomicInteger();

    public ResourcePool(Collection<? extends R> resources) {
        if (resources.isEmpty()) {
            throw new IllegalArgumentException("Resource pool needs at least one member");
        }
        this.members = List.copyOf(resources);
        this.idle = new ArrayBlockingQueue<>(members.size(), true, members);
    }

    public R acquire() throws InterruptedException {
        R resource = idle.take();
        int now = checkedOut.incrementAndGet();
        peakCheckedOut.accumulateAndGet(now, Math::max);
        return resource;
    }

    public void release(R resource) {
        checkedOut.decrementAndGet();
        releases.incrementAndGet();
        if (!idle.offer(resource)) {
            throw new IllegalStateException("Released a resource into a full pool");
        }
    }

    /**
     * Runs {@code work} with a pooled resource, returning it on every exit path.
     */
    public <V> V withResource(Function<? super R, V> work) throws InterruptedException {
        R resource = acquire();
        try {
            return work.apply(resource);
        } finally {
            release(resource);
        }
    }

    public int capacity() {
        return members.size();
    }

    public List<R> members() {
        return members;
    }

    public int checkedOut() {
        return checkedOut.get();
    }

    public int peakCheckedOut() {
        return peakCheckedOut.get();
    }

    public int releases() {
        return releases.get();
    }
}
