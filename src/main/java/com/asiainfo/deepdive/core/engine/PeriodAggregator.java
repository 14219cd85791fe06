package com.asiainfo.deepdive.core.engine;

import com.asiainfo.deepdive.config.DeepDiveConfig;
import com.asiainfo.deepdive.config.FetchExecutorConfig;
import com.asiainfo.deepdive.core.filter.FilterPredicateBuilder;
import com.asiainfo.deepdive.core.filter.WherePredicate;
import com.asiainfo.deepdive.core.model.DeepDiveFilters;
import com.asiainfo.deepdive.core.model.EntityAggregate;
import com.asiainfo.deepdive.core.model.PeriodRange;
import com.asiainfo.deepdive.core.model.Perspective;
import com.asiainfo.deepdive.infra.persistence.AggregateQuery;
import com.asiainfo.deepdive.infra.persistence.DataSourceException;
import com.asiainfo.deepdive.infra.persistence.WarehouseClient;
import com.asiainfo.deepdive.infra.persistence.WarehouseRow;
import com.asiainfo.deepdive.shared.InvariantViolationException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 单周期聚合
 * 按视角分组键汇总一个周期内的请求、填充、收入和 CPM
 */
@ApplicationScoped
public class PeriodAggregator {

    private static final Logger log = LoggerFactory.getLogger(PeriodAggregator.class);

    @Inject
    WarehouseClient warehouseClient;

    @Inject
    FilterPredicateBuilder predicateBuilder;

    @Inject
    DeepDiveConfig config;

    @Inject
    FetchExecutorConfig executorConfig;

    /**
     * 两期聚合结果
     */
    public record PeriodPair(List<EntityAggregate> period1, List<EntityAggregate> period2) {
    }

    public List<EntityAggregate> aggregate(Perspective perspective, PeriodRange range, DeepDiveFilters filters) {
        validateScope(perspective, filters);
        WherePredicate predicate = predicateBuilder.build(filters);

        List<WarehouseRow> rows = warehouseClient.queryAggregates(
                new AggregateQuery(config.getWarehouseTable(), perspective, range, predicate));

        List<EntityAggregate> aggregates = toAggregates(rows);
        log.debug("Aggregated {} entities for perspective={}, range={}", aggregates.size(), perspective.id(), range);
        return aggregates;
    }

    /**
     * 并行查询两个周期，任一失败则整体失败
     */
    public PeriodPair aggregateBoth(Perspective perspective, PeriodRange period1, PeriodRange period2,
            DeepDiveFilters filters) {
        // 校验在提交任务前完成，非法范围不会发出任何查询
        validateScope(perspective, filters);

        var executor = executorConfig.getFetchExecutor();
        CompletableFuture<List<EntityAggregate>> f1 =
                CompletableFuture.supplyAsync(() -> aggregate(perspective, period1, filters), executor);
        CompletableFuture<List<EntityAggregate>> f2 =
                CompletableFuture.supplyAsync(() -> aggregate(perspective, period2, filters), executor);

        try {
            CompletableFuture.allOf(f1, f2).get(config.getFetchTimeoutSeconds(), TimeUnit.SECONDS);
            return new PeriodPair(f1.join(), f2.join());
        } catch (TimeoutException e) {
            f1.cancel(true);
            f2.cancel(true);
            throw new DataSourceException("Warehouse query timed out after "
                    + config.getFetchTimeoutSeconds() + "s", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DataSourceException("Warehouse query interrupted", e);
        } catch (ExecutionException | CompletionException e) {
            throw unwrap(e.getCause() != null ? e.getCause() : e);
        }
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException re) {
            return re;
        }
        return new DataSourceException(cause.getMessage(), cause);
    }

    /**
     * 范围过滤只能引用自身或上级视角的分组键
     */
    public static void validateScope(Perspective perspective, DeepDiveFilters filters) {
        for (Perspective key : filters.dimensions().keySet()) {
            if (key != perspective && !key.isAncestorOf(perspective)) {
                throw new InvariantViolationException(String.format(
                        "Filter key '%s' is not an ancestor of perspective '%s'",
                        key.groupingKey(), perspective.id()));
            }
        }
    }

    /**
     * 行 -> 聚合值；null 数值按 0 处理，同一分组键出现多次时累加，CPM 取各行的算术平均
     */
    static List<EntityAggregate> toAggregates(List<WarehouseRow> rows) {
        Map<String, RowAccumulator> byId = new LinkedHashMap<>();
        for (WarehouseRow row : rows) {
            if (row.groupingKey() == null) {
                continue;
            }
            byId.computeIfAbsent(row.groupingKey(), k -> new RowAccumulator(k,
                    row.displayName() != null ? row.displayName() : k)).add(row);
        }
        List<EntityAggregate> result = new ArrayList<>(byId.size());
        byId.values().forEach(acc -> result.add(acc.toAggregate()));
        return result;
    }

    private static final class RowAccumulator {
        private final String entityId;
        private final String displayName;
        private long requests;
        private long paid;
        private double revenue;
        private double cpmSum;
        private int rowCount;
        private int childCount;

        RowAccumulator(String entityId, String displayName) {
            this.entityId = entityId;
            this.displayName = displayName;
        }

        void add(WarehouseRow row) {
            requests += Math.max(0, row.requests() != null ? row.requests() : 0L);
            paid += Math.max(0, row.paid() != null ? row.paid() : 0L);
            revenue += Math.max(0, row.revenue() != null ? row.revenue() : 0.0);
            cpmSum += row.cpm() != null ? row.cpm() : 0.0;
            childCount += row.childCount() != null ? row.childCount() : 0;
            rowCount++;
        }

        EntityAggregate toAggregate() {
            return new EntityAggregate(entityId, displayName, requests, paid, revenue,
                    rowCount == 0 ? 0.0 : cpmSum / rowCount, childCount);
        }
    }
}
