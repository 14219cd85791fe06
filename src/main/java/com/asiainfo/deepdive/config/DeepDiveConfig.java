package com.asiainfo.deepdive.config;

import com.asiainfo.deepdive.shared.DeepDiveConstants;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Deep Dive 配置管理
 * 统一管理结果缓存、会话、查询和数据仓库的配置项
 */
@ApplicationScoped
public class DeepDiveConfig {

    private static final Logger log = LoggerFactory.getLogger(DeepDiveConfig.class);

    // 结果缓存
    @ConfigProperty(name = "deepdive.cache.ttl-minutes", defaultValue = "5")
    long cacheTtlMinutes;

    @ConfigProperty(name = "deepdive.cache.max-entries", defaultValue = "200")
    long cacheMaxEntries;

    // 下钻会话
    @ConfigProperty(name = "deepdive.session.idle-minutes", defaultValue = "30")
    long sessionIdleMinutes;

    @ConfigProperty(name = "deepdive.session.max-sessions", defaultValue = "1000")
    long maxSessions;

    // 查询
    @ConfigProperty(name = "deepdive.fetch.pool-size", defaultValue = "8")
    int fetchPoolSize;

    @ConfigProperty(name = "deepdive.fetch.timeout-seconds", defaultValue = "60")
    long fetchTimeoutSeconds;

    // 数据仓库
    @ConfigProperty(name = "deepdive.warehouse.table", defaultValue = "agg_monthly_with_pic")
    String warehouseTable;

    @ConfigProperty(name = "deepdive.warehouse.init-schema", defaultValue = "true")
    boolean initSchema;

    @PostConstruct
    void init() {
        if (!DeepDiveConstants.SQL_IDENTIFIER.matcher(warehouseTable).matches()) {
            throw new IllegalStateException("Invalid warehouse table name: " + warehouseTable);
        }
        log.info("=== Deep Dive Configuration ===");
        log.info("Result cache: TTL={}min, MaxEntries={}", cacheTtlMinutes, cacheMaxEntries);
        log.info("Sessions:     Idle={}min, MaxSessions={}", sessionIdleMinutes, maxSessions);
        log.info("Fetch:        PoolSize={}, Timeout={}s", fetchPoolSize, fetchTimeoutSeconds);
        log.info("Warehouse:    Table={}, InitSchema={}", warehouseTable, initSchema);
        log.info("===============================");
    }

    // Getters
    public Duration getCacheTtl() {
        return Duration.ofMinutes(cacheTtlMinutes);
    }

    public long getCacheMaxEntries() {
        return cacheMaxEntries;
    }

    public Duration getSessionIdle() {
        return Duration.ofMinutes(sessionIdleMinutes);
    }

    public long getMaxSessions() {
        return maxSessions;
    }

    public int getFetchPoolSize() {
        return fetchPoolSize;
    }

    public long getFetchTimeoutSeconds() {
        return fetchTimeoutSeconds;
    }

    public String getWarehouseTable() {
        return warehouseTable;
    }

    public boolean isInitSchema() {
        return initSchema;
    }
}
