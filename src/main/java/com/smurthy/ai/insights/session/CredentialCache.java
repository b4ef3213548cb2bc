package com.smurthy.ai.insights.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Lazily loaded, time-limited credential holder shared by concurrent callers.
 *
 * Lifecycle:
 * - EMPTY   -> CACHED   on the first successful load
 * - CACHED  -> EXPIRED  once now - fetchedAt exceeds the ttl (checked lazily, no timers)
 * - EXPIRED -> CACHED   on a successful reload
 * - any failed load     -> INVALID, which rethrows the failure until refresh() or invalidate()
 * - a transient failure  -> state left as it was, so the next caller loads again
 *
 * Every read, write and load happens under one lock, so a load in flight is awaited by
 * racing callers instead of being triggered again.
 */
public class CredentialCache<T> {

    public enum State { EMPTY, CACHED, EXPIRED, INVALID }

    private static final Logger log = LoggerFactory.getLogger(CredentialCache.class);

    private final String name;
    private final Duration ttl;
    private final Clock clock;
    private final Predicate<RuntimeException> transientFailure;
    private final ReentrantLock lock = new ReentrantLock();

    private State state = State.EMPTY;
    private T value;
    private Instant fetchedAt;
    private RuntimeException failure;

    public CredentialCache(String name, Duration ttl, Clock clock) {
        this(name, ttl, clock, e -> false);
    }

    /**
     * @param transientFailure failures that are rethrown without being recorded, such as timeouts
     */
    public CredentialCache(String name, Duration ttl, Clock clock, Predicate<RuntimeException> transientFailure) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive for cache " + name);
        }
        this.name = name;
        this.ttl = ttl;
        this.clock = clock;
        this.transientFailure = transientFailure;
    }

    /**
     * Returns the cached value, loading it when the cache is empty or expired.
     */
    public T get(Supplier<T> loader) {
        lock.lock();
        try {
            return switch (currentState()) {
                case CACHED -> value;
                case INVALID -> throw failure;
                case EMPTY, EXPIRED -> load(loader);
            };
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the cached value if it is fresh and acceptable, otherwise reloads.
     * A reload triggered here counts as an explicit refresh and clears INVALID.
     */
    public T getIf(Predicate<T> acceptable, Supplier<T> loader) {
        lock.lock();
        try {
            if (currentState() == State.CACHED && acceptable.test(value)) {
                return value;
            }
            return load(loader);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forces a reload regardless of ttl or state.
     */
    public T refresh(Supplier<T> loader) {
        lock.lock();
        try {
            return load(loader);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reloads only if the cache still holds {@code stale}. When another caller has already
     * replaced it, the newer value is returned without loading again.
     */
    public T refreshIfCurrent(T stale, Supplier<T> loader) {
        lock.lock();
        try {
            if (currentState() == State.CACHED && value != null && !value.equals(stale)) {
                log.debug("{} already refreshed by another caller", name);
                return value;
            }
            return load(loader);
        } finally {
            lock.unlock();
        }
    }

    public void invalidate() {
        lock.lock();
        try {
            clear();
            state = State.EMPTY;
            log.debug("{} cache invalidated", name);
        } finally {
            lock.unlock();
        }
    }

    public State state() {
        lock.lock();
        try {
            return currentState();
        } finally {
            lock.unlock();
        }
    }

    public Optional<Instant> fetchedAt() {
        lock.lock();
        try {
            return Optional.ofNullable(fetchedAt);
        } finally {
            lock.unlock();
        }
    }

    private State currentState() {
        if (state == State.CACHED && Duration.between(fetchedAt, clock.instant()).compareTo(ttl) > 0) {
            log.debug("{} cache expired (fetched at {}, ttl {})", name, fetchedAt, ttl);
            state = State.EXPIRED;
        }
        return state;
    }

    private T load(Supplier<T> loader) {
        try {
            T loaded = loader.get();
            if (loaded == null) {
                throw new IllegalStateException("Loader for " + name + " returned null");
            }
            value = loaded;
            fetchedAt = clock.instant();
            failure = null;
            state = State.CACHED;
            return loaded;
        } catch (RuntimeException e) {
            if (transientFailure.test(e)) {
                log.debug("{} load failed transiently, keeping state {}: {}", name, state, e.getMessage());
                throw e;
            }
            clear();
            failure = e;
            state = State.INVALID;
            log.warn("{} cache is invalid until refreshed: {}", name, e.getMessage());
            throw e;
        }
    }

    private void clear() {
        value = null;
        fetchedAt = null;
        failure = null;
    }
}
