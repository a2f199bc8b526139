package com.vigil.service.core.cache;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derived index rebuilt lazily after invalidation.
 *
 * <p>{@link #invalidate()} only bumps a generation counter. Readers use the published snapshot while
 * its generation is current; otherwise one thread rebuilds under the rebuild lock and publishes the
 * complete result with a single reference swap. Readers therefore see either the old or the new
 * snapshot, never a partially built one. A snapshot built while a newer invalidation arrived is tagged
 * with the older generation and rebuilt on the next read.
 *
 * @param <S> immutable snapshot type
 */
public abstract class InvalidatingCache<S> {

    private static final Logger log = LoggerFactory.getLogger(InvalidatingCache.class);

    private final AtomicLong generation = new AtomicLong();
    private final AtomicReference<Built<S>> ref = new AtomicReference<>();
    private final ReentrantLock rebuildLock = new ReentrantLock();
    private final AtomicLong rebuilds = new AtomicLong();

    public void invalidate() {
        generation.incrementAndGet();
    }

    public boolean isValid() {
        Built<S> built = ref.get();
        return built != null && built.generation == generation.get();
    }

    /** Number of completed rebuilds. */
    public long rebuildCount() {
        return rebuilds.get();
    }

    /** Rebuilds now if stale. */
    public void validate() {
        current();
    }

    protected S current() {
        Built<S> built = ref.get();
        if (built != null && built.generation == generation.get()) {
            return built.value;
        }
        rebuildLock.lock();
        try {
            long gen = generation.get();
            built = ref.get();
            if (built != null && built.generation == gen) {
                return built.value;
            }
            long t0 = System.nanoTime();
            S value = build();
            ref.set(new Built<>(gen, value));
            rebuilds.incrementAndGet();
            if (log.isDebugEnabled()) {
                log.debug(
                        "{} rebuilt (generation={}) in {} us",
                        getClass().getSimpleName(),
                        gen,
                        (System.nanoTime() - t0) / 1_000L);
            }
            return value;
        } finally {
            rebuildLock.unlock();
        }
    }

    protected abstract S build();

    private record Built<S>(long generation, S value) {}
}
