package com.asiainfo.deepdive.infra.cache;

import com.asiainfo.deepdive.core.model.ComparisonRecord;
import com.asiainfo.deepdive.core.model.DeepDiveSummary;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 一次对比的缓存结果
 */
public record CacheEntry(
    CacheKey key,
    List<ComparisonRecord> data,
    DeepDiveSummary summary,
    Instant fetchedAt
) {
    public CacheEntry {
        data = List.copyOf(data);
    }

    public boolean isFresh(Instant now, Duration ttl) {
        return Duration.between(fetchedAt, now).compareTo(ttl) < 0;
    }
}
