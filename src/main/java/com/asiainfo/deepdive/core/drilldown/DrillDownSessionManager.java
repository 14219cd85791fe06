package com.asiainfo.deepdive.core.drilldown;

import com.asiainfo.deepdive.config.DeepDiveConfig;
import com.asiainfo.deepdive.core.engine.DeepDiveEngine;
import com.asiainfo.deepdive.core.model.DeepDiveFilters;
import com.asiainfo.deepdive.core.model.PeriodRange;
import com.asiainfo.deepdive.core.model.Perspective;
import com.asiainfo.deepdive.infra.cache.ResultCache;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.UUID;

/**
 * 下钻会话管理
 * 每个会话持有自己的结果缓存；空闲超时或超过上限的会话被淘汰
 */
@ApplicationScoped
public class DrillDownSessionManager {

    private static final Logger log = LoggerFactory.getLogger(DrillDownSessionManager.class);

    @Inject
    DeepDiveConfig config;

    @Inject
    DeepDiveEngine engine;

    Clock clock = Clock.systemUTC();

    private Cache<String, DrillDownSession> sessions;

    @PostConstruct
    void init() {
        sessions = Caffeine.newBuilder()
                .expireAfterAccess(config.getSessionIdle())
                .maximumSize(config.getMaxSessions())
                .removalListener((String id, DrillDownSession session, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        log.info("[Session] Evicted {} ({})", id, cause);
                    }
                })
                .build();

        log.info("[Session] Manager initialized with Idle={}, MaxSessions={}",
                config.getSessionIdle(), config.getMaxSessions());
    }

    /**
     * 创建会话，不触发查询；首次加载由调用方执行 refresh()
     */
    public DrillDownSession create(Perspective perspective, PeriodRange period1, PeriodRange period2,
            DeepDiveFilters filters) {
        String id = UUID.randomUUID().toString();
        ResultCache cache = new ResultCache(config.getCacheTtl(), config.getCacheMaxEntries(), clock);
        DrillDownSession session = new DrillDownSession(id, perspective, period1, period2, filters,
                engine::analyze, cache);
        sessions.put(id, session);
        log.info("[Session] Created {} perspective={}, p1={}, p2={}", id, perspective.id(), period1, period2);
        return session;
    }

    public DrillDownSession get(String id) {
        DrillDownSession session = sessions.getIfPresent(id);
        if (session == null) {
            throw new SessionNotFoundException(id);
        }
        return session;
    }

    public void remove(String id) {
        if (sessions.asMap().remove(id) == null) {
            throw new SessionNotFoundException(id);
        }
        log.info("[Session] Closed {}", id);
    }

    public long activeSessions() {
        sessions.cleanUp();
        return sessions.estimatedSize();
    }
}
