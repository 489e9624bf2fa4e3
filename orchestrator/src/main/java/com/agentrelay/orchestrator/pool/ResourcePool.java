package com.agentrelay.orchestrator.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Bounded pool of reusable handles (HTTP clients, sessions, connections).
 *
 * <ul>
 *   <li>{@code minSize} handles are created up front.</li>
 *   <li>{@link #acquire()} waits up to {@code acquireWait} for a free handle; after
 *       that it creates a new one if fewer than {@code maxSize} exist, otherwise it
 *       keeps waiting on the free queue.</li>
 *   <li>{@link #release} puts a handle back, or destroys it if the queue is full.</li>
 *   <li>{@link #close()} destroys free handles, then handles still checked out.
 *       Later acquires fail with {@link PoolClosedException}.</li>
 * </ul>
 *
 * The free queue and the active set are guarded independently: the queue is a
 * {@link BlockingQueue}, the active set is a synchronized identity set.
 *
 * @param <T> handle type
 */
public class ResourcePool<T> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResourcePool.class);

    public static final Duration DEFAULT_ACQUIRE_WAIT = Duration.ofSeconds(5);

    private final String      name;
    private final Supplier<T> factory;
    private final Consumer<T> destroyer;
    private final int         minSize;
    private final int         maxSize;
    private final Duration    acquireWait;

    private final BlockingQueue<T> available;
    private final Set<T> active = Collections.synchronizedSet(
            Collections.newSetFromMap(new IdentityHashMap<>()));
    private final Object creationLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private int created;

    public ResourcePool(String name, Supplier<T> factory, Consumer<T> destroyer,
                        int minSize, int maxSize) {
        this(name, factory, destroyer, minSize, maxSize, DEFAULT_ACQUIRE_WAIT);
    }

    public ResourcePool(String name, Supplier<T> factory, Consumer<T> destroyer,
                        int minSize, int maxSize, Duration acquireWait) {
        if (minSize < 0 || maxSize < 1 || minSize > maxSize) {
            throw new IllegalArgumentException(
                    "Invalid pool bounds min=%d max=%d".formatted(minSize, maxSize));
        }
        this.name        = name;
        this.factory     = factory;
        this.destroyer   = destroyer;
        this.minSize     = minSize;
        this.maxSize     = maxSize;
        this.acquireWait = acquireWait;
        this.available   = new ArrayBlockingQueue<>(maxSize);

        for (int i = 0; i < minSize; i++) {
            available.add(create());
        }
        log.info("Pool '{}' initialised with {} handle(s) (max {})", name, minSize, maxSize);
    }

    // ------------------------------------------------------------------
    // Acquire / release
    // ------------------------------------------------------------------

    public T acquire() {
        ensureOpen();
        try {
            T handle = available.poll(acquireWait.toNanos(), TimeUnit.NANOSECONDS);
            if (handle == null) {
                handle = createIfUnderLimit();
            }
            while (handle == null) {
                ensureOpen();
                handle = available.poll(acquireWait.toNanos(), TimeUnit.NANOSECONDS);
                if (handle == null) {
                    // a destroyed handle may have freed a slot
                    handle = createIfUnderLimit();
                }
            }
            if (closed.get()) {
                destroyQuietly(handle);
                throw new PoolClosedException(name);
            }
            active.add(handle);
            return handle;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while acquiring from pool '" + name + "'", e);
        }
    }

    /**
     * Handles not checked out from this pool are ignored, including those
     * {@link #close()} already destroyed.
     */
    public void release(T handle) {
        if (handle == null) return;
        if (!active.remove(handle)) {
            log.debug("Pool '{}' ignoring release of a handle it does not track", name);
            return;
        }
        if (closed.get() || !available.offer(handle)) {
            destroyQuietly(handle);
        } else if (closed.get() && available.remove(handle)) {
            // close() drained the queue between the check and the offer
            destroyQuietly(handle);
        }
    }

    /** Acquire, run, release. */
    public <R> R withHandle(Function<T, R> work) {
        T handle = acquire();
        try {
            return work.apply(handle);
        } finally {
            release(handle);
        }
    }

    // ------------------------------------------------------------------
    // Shutdown
    // ------------------------------------------------------------------

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;

        int drained = 0;
        T handle;
        while ((handle = available.poll()) != null) {
            destroyQuietly(handle);
            drained++;
        }

        List<T> stillActive;
        synchronized (active) {
            stillActive = new ArrayList<>(active);
            active.clear();
        }
        stillActive.forEach(this::destroyQuietly);
        log.info("Pool '{}' closed: {} idle and {} active handle(s) destroyed",
                name, drained, stillActive.size());
    }

    public boolean isClosed() { return closed.get(); }

    public PoolStats stats() {
        synchronized (creationLock) {
            return new PoolStats(name, minSize, maxSize, created, available.size(), active.size(), closed.get());
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private T createIfUnderLimit() {
        synchronized (creationLock) {
            if (created >= maxSize) return null;
            return create();
        }
    }

    private T create() {
        synchronized (creationLock) {
            T handle = factory.get();
            created++;
            return handle;
        }
    }

    private void destroyQuietly(T handle) {
        synchronized (creationLock) {
            created--;
        }
        try {
            destroyer.accept(handle);
        } catch (RuntimeException e) {
            log.warn("Pool '{}' could not close handle: {}", name, e.getMessage());
        }
    }

    private void ensureOpen() {
        if (closed.get()) throw new PoolClosedException(name);
    }

    public record PoolStats(String name, int minSize, int maxSize, int created,
                            int available, int active, boolean closed) {}
}
