package com.asiainfo.deepdive.core.drilldown;

import com.asiainfo.deepdive.core.model.DeepDiveFilters;
import com.asiainfo.deepdive.core.model.DeepDiveQuery;
import com.asiainfo.deepdive.core.model.DeepDiveResult;
import com.asiainfo.deepdive.core.model.PeriodRange;
import com.asiainfo.deepdive.core.model.Perspective;
import com.asiainfo.deepdive.infra.cache.CacheEntry;
import com.asiainfo.deepdive.infra.cache.CacheKey;
import com.asiainfo.deepdive.infra.cache.ResultCache;
import com.asiainfo.deepdive.shared.InvariantViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 下钻会话
 *
 * <p>维护当前视角、两个周期、基础过滤条件和下钻路径。每个事件先在锁内校验并提交状态，
 * 然后在锁外执行查询；每次查询分配递增的 generation，完成时若已不是最新一次，
 * 结果仍写入缓存，但不替换当前视图。
 *
 * <p>只有返回上级（onBack / onBreadcrumb）会读取缓存，其它事件总是重新查询。
 * 查询失败时不写缓存，当前视图保持不变。
 */
public class DrillDownSession {

    private static final Logger log = LoggerFactory.getLogger(DrillDownSession.class);

    private final String id;
    private final ComparisonFetcher fetcher;
    private final ResultCache cache;
    private final Instant createdAt;

    // 以下状态由 this 保护
    private Perspective perspective;
    private PeriodRange period1;
    private PeriodRange period2;
    private DeepDiveFilters baseFilters;
    private DrillDownPath path = DrillDownPath.empty();
    private DrillDownView currentView;
    private long generation;

    /**
     * 一次待执行的查询，状态提交时生成快照
     */
    private record FetchPlan(
        long generation,
        Perspective perspective,
        PeriodRange period1,
        PeriodRange period2,
        DeepDiveFilters filters,
        List<BreadcrumbEntry> breadcrumbs,
        boolean useCache
    ) {
        DeepDiveQuery query(DeepDiveFilters f) {
            return new DeepDiveQuery(perspective, period1, period2, f);
        }
    }

    public DrillDownSession(String id, Perspective perspective, PeriodRange period1, PeriodRange period2,
            DeepDiveFilters filters, ComparisonFetcher fetcher, ResultCache cache) {
        if (perspective == null || period1 == null || period2 == null) {
            throw new InvariantViolationException("Session requires perspective and both periods");
        }
        DeepDiveFilters base = filters == null ? DeepDiveFilters.none() : filters;
        validateFilterKeys(perspective, base);

        this.id = id;
        this.perspective = perspective;
        this.period1 = period1;
        this.period2 = period2;
        this.baseFilters = base;
        this.fetcher = fetcher;
        this.cache = cache;
        this.createdAt = cache.now();
    }

    // ======================== 事件 ========================

    /**
     * 下钻到当前视角的下级视角
     */
    public DrillDownView onDrillDown(String entityId, String displayName) {
        Perspective current = getPerspective();
        if (current.isLeaf()) {
            throw new InvariantViolationException("Cannot drill down from leaf perspective: " + current.id());
        }
        return descend(current.child(), entityId, displayName);
    }

    /**
     * 下钻，child 必须是当前视角的下级视角
     */
    public DrillDownView descend(Perspective child, String entityId, String displayName) {
        if (entityId == null || entityId.isBlank()) {
            throw new InvariantViolationException("Drill-down requires an entity id");
        }
        FetchPlan plan;
        synchronized (this) {
            if (perspective.isLeaf() || child != perspective.child()) {
                throw new InvariantViolationException(String.format(
                        "Invalid drill-down from '%s' to '%s'",
                        perspective.id(), child != null ? child.id() : null));
            }
            String name = displayName == null || displayName.isBlank() ? entityId : displayName;
            path = path.push(new BreadcrumbEntry(perspective, entityId, name));
            perspective = child;
            plan = nextPlan(false);
        }
        log.info("[Drill Down] session={} descend to {} ({} breadcrumbs)", id, child.id(), plan.breadcrumbs().size());
        return execute(plan);
    }

    public DrillDownView onBack() {
        return ascend();
    }

    /**
     * 返回上一级，恢复被弹出面包屑所在的视角
     * 在下级设置的、对上级视角不合法的过滤条件一并丢弃
     */
    public DrillDownView ascend() {
        FetchPlan plan;
        synchronized (this) {
            BreadcrumbEntry top = path.peek();
            if (top == null) {
                throw new InvariantViolationException("Cannot ascend: drill-down path is empty");
            }
            path = path.pop();
            perspective = top.perspective();
            baseFilters = baseFilters.retainValidFor(perspective);
            plan = nextPlan(true);
        }
        log.info("[Drill Down] session={} ascend to {}", id, plan.perspective().id());
        return execute(plan);
    }

    /**
     * 点击面包屑：回到指定深度（0 为根），与 onBack 一样优先使用缓存
     */
    public DrillDownView onBreadcrumb(int depth) {
        FetchPlan plan;
        synchronized (this) {
            if (depth == path.depth()) {
                throw new InvariantViolationException("Already at breadcrumb depth " + depth);
            }
            DrillDownPath truncated = path.truncate(depth);
            perspective = path.breadcrumbs().get(depth).perspective();
            path = truncated;
            baseFilters = baseFilters.retainValidFor(perspective);
            plan = nextPlan(true);
        }
        log.info("[Drill Down] session={} jump to depth {} ({})", id, depth, plan.perspective().id());
        return execute(plan);
    }

    /**
     * 切换视角：清空下钻路径，只保留对新视角仍然合法的过滤条件
     */
    public DrillDownView onPerspectiveChange(Perspective newPerspective) {
        if (newPerspective == null) {
            throw new InvariantViolationException("Perspective is required");
        }
        FetchPlan plan;
        synchronized (this) {
            perspective = newPerspective;
            path = DrillDownPath.empty();
            baseFilters = baseFilters.retainValidFor(newPerspective);
            plan = nextPlan(false);
        }
        log.info("[Drill Down] session={} perspective changed to {}", id, newPerspective.id());
        return execute(plan);
    }

    public DrillDownView onPeriodChange(PeriodRange newPeriod1, PeriodRange newPeriod2) {
        if (newPeriod1 == null || newPeriod2 == null) {
            throw new InvariantViolationException("Both periods are required");
        }
        FetchPlan plan;
        synchronized (this) {
            period1 = newPeriod1;
            period2 = newPeriod2;
            plan = nextPlan(false);
        }
        log.info("[Drill Down] session={} periods changed to {} vs {}", id, newPeriod1, newPeriod2);
        return execute(plan);
    }

    /**
     * 替换基础过滤条件，下钻路径保持不变
     */
    public DrillDownView onFilterChange(DeepDiveFilters newFilters) {
        DeepDiveFilters filters = newFilters == null ? DeepDiveFilters.none() : newFilters;
        FetchPlan plan;
        synchronized (this) {
            validateFilterKeys(perspective, filters);
            baseFilters = filters;
            plan = nextPlan(false);
        }
        log.info("[Drill Down] session={} filters changed to {}", id, filters.dimensions());
        return execute(plan);
    }

    /**
     * 按当前状态重新查询（首次加载与失败重试）
     */
    public DrillDownView refresh() {
        FetchPlan plan;
        synchronized (this) {
            plan = nextPlan(false);
        }
        return execute(plan);
    }

    // ======================== 查询执行 ========================

    private FetchPlan nextPlan(boolean useCache) {
        generation++;
        return new FetchPlan(generation, perspective, period1, period2,
                effectiveFilters(), path.breadcrumbs(), useCache);
    }

    private DrillDownView execute(FetchPlan plan) {
        List<String> selected = plan.filters().valuesFor(plan.perspective());
        DrillDownView view;
        try {
            view = selected.size() > 1 ? executeSegmented(plan, selected) : executeUnified(plan);
        } catch (RuntimeException e) {
            log.error("[Drill Down] session={} generation={} fetch failed, keeping previous view: {}",
                    id, plan.generation(), e.getMessage());
            throw e;
        }
        return publish(plan, view);
    }

    private DrillDownView executeUnified(FetchPlan plan) {
        CacheKey key = CacheKey.of(plan.perspective(), plan.filters(), plan.period1(), plan.period2());
        DeepDiveQuery query = plan.query(plan.filters());

        CacheEntry entry = plan.useCache() ? cache.get(key) : null;
        boolean fromCache = entry != null;
        if (entry == null) {
            entry = cache.put(key, fetcher.fetch(query));
        }
        DeepDiveResult result = new DeepDiveResult(entry.data(), entry.summary(), query);
        return new DrillDownView(plan.generation(), plan.perspective(), plan.period1(), plan.period2(),
                ViewMode.UNIFIED, result, List.of(), plan.breadcrumbs(), fromCache, false, entry.fetchedAt());
    }

    /**
     * 每个选中实体单独查询并各自缓存；全部成功后才写缓存
     */
    private DrillDownView executeSegmented(FetchPlan plan, List<String> selected) {
        Map<String, CacheEntry> cached = new LinkedHashMap<>();
        Map<String, DeepDiveResult> fetched = new LinkedHashMap<>();
        Map<String, CacheKey> keys = new LinkedHashMap<>();

        for (String entityId : selected) {
            DeepDiveFilters segmentFilters = plan.filters().with(plan.perspective(), List.of(entityId));
            CacheKey key = CacheKey.of(plan.perspective(), segmentFilters, plan.period1(), plan.period2());
            keys.put(entityId, key);

            CacheEntry entry = plan.useCache() ? cache.get(key) : null;
            if (entry != null) {
                cached.put(entityId, entry);
            } else {
                fetched.put(entityId, fetcher.fetch(plan.query(segmentFilters)));
            }
        }

        List<Segment> segments = new ArrayList<>(selected.size());
        Instant oldest = null;
        for (String entityId : selected) {
            CacheEntry entry = cached.get(entityId);
            boolean fromCache = entry != null;
            if (entry == null) {
                entry = cache.put(keys.get(entityId), fetched.get(entityId));
            }
            DeepDiveResult result = new DeepDiveResult(entry.data(), entry.summary(),
                    plan.query(plan.filters().with(plan.perspective(), List.of(entityId))));
            segments.add(new Segment(entityId, result, fromCache, entry.fetchedAt()));
            if (oldest == null || entry.fetchedAt().isBefore(oldest)) {
                oldest = entry.fetchedAt();
            }
        }

        log.debug("[Drill Down] session={} segmented view: {} segments, {} from cache",
                id, segments.size(), cached.size());
        return new DrillDownView(plan.generation(), plan.perspective(), plan.period1(), plan.period2(),
                ViewMode.SEGMENTED, null, segments, plan.breadcrumbs(), fetched.isEmpty(), false, oldest);
    }

    /**
     * 只有最新一次查询可以替换当前视图
     */
    private synchronized DrillDownView publish(FetchPlan plan, DrillDownView view) {
        if (plan.generation() != generation) {
            log.warn("[Drill Down] session={} discarding stale response generation={} (current={})",
                    id, plan.generation(), generation);
            return view.asSuperseded();
        }
        currentView = view;
        return view;
    }

    // ======================== 状态 ========================

    private DeepDiveFilters effectiveFilters() {
        return baseFilters.withScope(path.scope());
    }

    private static void validateFilterKeys(Perspective perspective, DeepDiveFilters filters) {
        for (Perspective key : filters.dimensions().keySet()) {
            if (key != perspective && !key.isAncestorOf(perspective)) {
                throw new InvariantViolationException(String.format(
                        "Filter key '%s' is not valid for perspective '%s'", key.groupingKey(), perspective.id()));
            }
        }
    }

    public String getId() {
        return id;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized Perspective getPerspective() {
        return perspective;
    }

    public synchronized PeriodRange getPeriod1() {
        return period1;
    }

    public synchronized PeriodRange getPeriod2() {
        return period2;
    }

    public synchronized DeepDiveFilters getBaseFilters() {
        return baseFilters;
    }

    public synchronized DeepDiveFilters getEffectiveFilters() {
        return effectiveFilters();
    }

    public synchronized DrillDownPath getPath() {
        return path;
    }

    public synchronized DrillDownView getCurrentView() {
        return currentView;
    }

    public synchronized long getGeneration() {
        return generation;
    }

    public ResultCache getCache() {
        return cache;
    }
}
