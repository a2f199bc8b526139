package com.vigil.service.core.cache;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class InvalidatingCacheTest {

    static class CountingCache extends InvalidatingCache<Integer> {
        final AtomicInteger builds = new AtomicInteger();
        Runnable duringBuild = () -> {};

        int get() {
            return current();
        }

        @Override
        protected Integer build() {
            duringBuild.run();
            return builds.incrementAndGet();
        }
    }

    @Test
    void buildsLazilyAndOncePerInvalidationBurst() {
        CountingCache cache = new CountingCache();
        assertThat(cache.isValid()).isFalse();
        assertThat(cache.builds).hasValue(0);

        assertThat(cache.get()).isEqualTo(1);
        assertThat(cache.get()).isEqualTo(1);

        cache.invalidate();
        cache.invalidate();
        cache.invalidate();
        assertThat(cache.isValid()).isFalse();
        assertThat(cache.get()).isEqualTo(2);
        assertThat(cache.rebuildCount()).isEqualTo(2);
    }

    @Test
    void invalidationDuringBuildForcesAnotherRebuild() {
        CountingCache cache = new CountingCache();
        cache.duringBuild = () -> {
            cache.duringBuild = () -> {};
            cache.invalidate();
        };

        assertThat(cache.get()).isEqualTo(1);
        assertThat(cache.isValid()).isFalse();
        assertThat(cache.get()).isEqualTo(2);
        assertThat(cache.isValid()).isTrue();
    }

    @Test
    void validateRebuildsWhenStale() {
        CountingCache cache = new CountingCache();
        cache.validate();
        assertThat(cache.isValid()).isTrue();
        cache.validate();
        assertThat(cache.rebuildCount()).isEqualTo(1);
    }
}
