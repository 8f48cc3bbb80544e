package com.treasurylens.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Named in-process cache over Caffeine. Either TTL-bound (expire after write) or permanent (size-bound only).
 * Writes are last-writer-wins; concurrent loads of the same key may both run and the later write stays.
 */
public final class TreasuryCache<K, V> {

    private final String name;
    private final Duration ttl;
    private final Cache<K, V> cache;

    private TreasuryCache(String name, Duration ttl, long maxSize, Ticker ticker) {
        this.name = name;
        this.ttl = ttl;
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .ticker(ticker)
                .recordStats();
        if (ttl != null) {
            builder.expireAfterWrite(ttl);
        }
        this.cache = builder.build();
    }

    public static <K, V> TreasuryCache<K, V> withTtl(String name, Duration ttl, long maxSize) {
        return withTtl(name, ttl, maxSize, Ticker.systemTicker());
    }

    public static <K, V> TreasuryCache<K, V> withTtl(String name, Duration ttl, long maxSize, Ticker ticker) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive for cache " + name);
        }
        return new TreasuryCache<>(name, ttl, maxSize, ticker);
    }

    /**
     * Entries never expire by time; used for data that cannot change once computed.
     */
    public static <K, V> TreasuryCache<K, V> permanent(String name, long maxSize) {
        return new TreasuryCache<>(name, null, maxSize, Ticker.systemTicker());
    }

    public Optional<V> get(K key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    public void set(K key, V value) {
        if (value != null) {
            cache.put(key, value);
        }
    }

    public void invalidate(K key) {
        cache.invalidate(key);
    }

    /**
     * Drops every entry whose key matches.
     */
    public void invalidateIf(Predicate<K> keyFilter) {
        cache.asMap().keySet().removeIf(keyFilter);
    }

    public void clear() {
        cache.invalidateAll();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    /**
     * Cached value if present, otherwise subscribes to the loader and stores its value. Empty or failed loads
     * are not stored.
     */
    public Mono<V> getOrLoad(K key, Supplier<Mono<V>> loader) {
        return Mono.defer(() -> {
            V cached = cache.getIfPresent(key);
            if (cached != null) {
                return Mono.just(cached);
            }
            return loader.get().doOnNext(value -> cache.put(key, value));
        });
    }

    public CacheStats stats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats s = cache.stats();
        return new CacheStats(name, ttl, size(), s.hitCount(), s.missCount());
    }

    public String getName() {
        return name;
    }

    public boolean isPermanent() {
        return ttl == null;
    }

    public record CacheStats(String name, Duration ttl, long size, long hits, long misses) {
    }
}
