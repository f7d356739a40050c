package io.github.cachestats.cache;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reference-counted guard over one {@link Cache.Handle}.
 *
 * <p>Every {@code SharedCacheHandle} is one reference. {@link #share()} adds a
 * reference to the same cache handle without taking another handle from the
 * cache; {@link #close()} drops this reference, and the last one to close
 * releases the handle, which un-pins the entry.</p>
 *
 * <pre>{@code
 * try (SharedCacheHandle<Foo> guard = SharedCacheHandle.wrap(cache, handle, Foo.class)) {
 *     SharedCacheHandle<Foo> forWorker = guard.share();
 *     executor.submit(() -> {
 *         try (forWorker) {
 *             forWorker.get().doWork();
 *         }
 *     });
 * }
 * }</pre>
 *
 * <p>Thread-safe.</p>
 *
 * @param <T> type of the entry's value
 */
public final class SharedCacheHandle<T> implements AutoCloseable {

    private final Shared<T> shared;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private SharedCacheHandle(Shared<T> shared) {
        this.shared = shared;
    }

    /**
     * Take ownership of {@code handle}. The returned guard is its only reference.
     *
     * @throws ClassCastException if the entry's value is not a {@code type}
     */
    public static <T> SharedCacheHandle<T> wrap(Cache cache, Cache.Handle handle, Class<? super T> type) {
        @SuppressWarnings("unchecked")
        T value = (T) type.cast(cache.value(handle));
        return new SharedCacheHandle<>(new Shared<>(cache, handle, value));
    }

    /**
     * The guarded value.
     *
     * @throws IllegalStateException if this reference was closed
     */
    public T get() {
        if (closed.get()) {
            throw new IllegalStateException("SharedCacheHandle already closed");
        }
        return shared.value;
    }

    /**
     * Another reference to the same entry. Must be closed independently.
     *
     * @throws IllegalStateException if this reference was closed
     */
    public SharedCacheHandle<T> share() {
        if (closed.get()) {
            throw new IllegalStateException("Cannot share a closed SharedCacheHandle");
        }
        shared.refs.incrementAndGet();
        return new SharedCacheHandle<>(shared);
    }

    /**
     * Number of open references to the underlying cache handle.
     */
    public int referenceCount() {
        return shared.refs.get();
    }

    public Cache getCache() {
        return shared.cache;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Drop this reference. Idempotent.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true) && shared.refs.decrementAndGet() == 0) {
            shared.cache.release(shared.handle);
        }
    }

    @Override
    public String toString() {
        return "SharedCacheHandle[" + shared.value + ", refs=" + shared.refs.get() + (isClosed() ? ", closed" : "") + "]";
    }

    private static final class Shared<T> {
        final Cache cache;
        final Cache.Handle handle;
        final T value;
        final AtomicInteger refs = new AtomicInteger(1);

        Shared(Cache cache, Cache.Handle handle, T value) {
            this.cache = cache;
            this.handle = handle;
            this.value = value;
        }
    }
}
