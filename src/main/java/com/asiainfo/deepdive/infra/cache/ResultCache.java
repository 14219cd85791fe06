package com.asiainfo.deepdive.infra.cache;

import com.asiainfo.deepdive.core.model.DeepDiveResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * 会话级对比结果缓存 (Caffeine)
 * 写入后 TTL 过期，同时按条目数上限淘汰；时间源来自 Clock，测试可推进时间
 */
public class ResultCache {

    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    private final Cache<CacheKey, CacheEntry> cache;
    private final Duration ttl;
    private final Clock clock;

    public ResultCache(Duration ttl, long maxEntries, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxEntries)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .recordStats()
                .build();

        log.debug("[Result Cache] Initialized with TTL={}, MaxSize={}", ttl, maxEntries);
    }

    /**
     * 获取缓存，过期条目不返回
     */
    public CacheEntry get(CacheKey key) {
        CacheEntry entry = cache.getIfPresent(key);
        if (entry != null && entry.isFresh(clock.instant(), ttl)) {
            log.debug("[Result Cache] Hit: {}", key);
            return entry;
        }
        if (entry != null) {
            cache.invalidate(key);
        }
        log.debug("[Result Cache] Miss: {}", key);
        return null;
    }

    public void put(CacheKey key, CacheEntry entry) {
        cache.put(key, entry);
        log.debug("[Result Cache] Put: {}", key);
    }

    /**
     * 以当前时间为 fetchedAt 写入一次对比结果
     */
    public CacheEntry put(CacheKey key, DeepDiveResult result) {
        CacheEntry entry = new CacheEntry(key, result.records(), result.summary(), now());
        put(key, entry);
        return entry;
    }

    public Instant now() {
        return clock.instant();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("[Result Cache] Invalidated all");
    }

    /**
     * 获取缓存统计
     */
    public String getStats() {
        var stats = cache.stats();
        return String.format("Result Cache Stats: hitRate=%.2f%%, size=%d, hits=%d, misses=%d",
                stats.hitRate() * 100,
                cache.estimatedSize(),
                stats.hitCount(),
                stats.missCount());
    }
}
