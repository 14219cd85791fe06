package com.asiainfo.deepdive.core.engine;

import com.asiainfo.deepdive.config.DeepDiveConfig;
import com.asiainfo.deepdive.config.FetchExecutorConfig;
import com.asiainfo.deepdive.core.filter.FilterPredicateBuilder;
import com.asiainfo.deepdive.core.model.DeepDiveFilters;
import com.asiainfo.deepdive.core.model.EntityAggregate;
import com.asiainfo.deepdive.core.model.Perspective;
import com.asiainfo.deepdive.infra.persistence.AggregateQuery;
import com.asiainfo.deepdive.infra.persistence.DataSourceException;
import com.asiainfo.deepdive.infra.persistence.WarehouseClient;
import com.asiainfo.deepdive.infra.persistence.WarehouseRow;
import com.asiainfo.deepdive.shared.InvariantViolationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.asiainfo.deepdive.support.Fixtures.OCTOBER;
import static com.asiainfo.deepdive.support.Fixtures.SEPTEMBER;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * PeriodAggregator 单元测试
 */
class PeriodAggregatorTest {

    private PeriodAggregator aggregator;
    private WarehouseClient warehouse;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        warehouse = Mockito.mock(WarehouseClient.class);

        DeepDiveConfig config = Mockito.mock(DeepDiveConfig.class);
        when(config.getWarehouseTable()).thenReturn("agg_monthly_with_pic");
        when(config.getFetchTimeoutSeconds()).thenReturn(5L);

        FetchExecutorConfig executorConfig = Mockito.mock(FetchExecutorConfig.class);
        when(executorConfig.getFetchExecutor()).thenReturn(executor);

        aggregator = new PeriodAggregator();
        aggregator.warehouseClient = warehouse;
        aggregator.predicateBuilder = new FilterPredicateBuilder();
        aggregator.config = config;
        aggregator.executorConfig = executorConfig;
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testNullMetricsBecomeZero() {
        when(warehouse.queryAggregates(any())).thenReturn(List.of(
                new WarehouseRow("101", "Publisher 101", null, null, null, null, null),
                new WarehouseRow("102", null, 100L, 80L, 2.5, 1.2, 3)));

        List<EntityAggregate> result = aggregator.aggregate(Perspective.PID, OCTOBER, DeepDiveFilters.none());

        assertEquals(2, result.size());
        EntityAggregate first = result.get(0);
        assertEquals(0, first.requests());
        assertEquals(0.0, first.revenue());
        assertEquals("102", result.get(1).displayName(), "missing name falls back to id");
        assertEquals(3, result.get(1).childCount());
    }

    @Test
    void testDuplicateRowsSummedAndCpmAveraged() {
        when(warehouse.queryAggregates(any())).thenReturn(List.of(
                new WarehouseRow("7", "Zone 7", 100L, 50L, 1.0, 1.0, 0),
                new WarehouseRow("7", "Zone 7", 200L, 100L, 2.0, 2.0, 0),
                new WarehouseRow("7", "Zone 7", 300L, 150L, 3.0, 6.0, 0)));

        List<EntityAggregate> result = aggregator.aggregate(Perspective.ZONE, OCTOBER, DeepDiveFilters.none());

        assertEquals(1, result.size());
        EntityAggregate zone = result.get(0);
        assertEquals(600, zone.requests());
        assertEquals(300, zone.paid());
        assertEquals(6.0, zone.revenue(), 1e-9);
        assertEquals(3.0, zone.avgCpm(), 1e-9);
    }

    @Test
    void testScopeFiltersArePassedAsPredicate() {
        when(warehouse.queryAggregates(any())).thenReturn(List.of());
        DeepDiveFilters filters = DeepDiveFilters.of(Map.of(Perspective.TEAM, List.of("APAC")));

        aggregator.aggregate(Perspective.PID, OCTOBER, filters);

        ArgumentCaptor<AggregateQuery> captor = ArgumentCaptor.forClass(AggregateQuery.class);
        verify(warehouse).queryAggregates(captor.capture());
        AggregateQuery query = captor.getValue();
        assertEquals("agg_monthly_with_pic", query.table());
        assertEquals(Perspective.PID, query.perspective());
        assertEquals("team = ?", query.predicate().sql());
        assertEquals(List.of("APAC"), query.predicate().params());
    }

    @Test
    void testNonAncestorFilterRejected() {
        DeepDiveFilters filters = DeepDiveFilters.of(Map.of(Perspective.ZONE, List.of("7")));

        assertThrows(InvariantViolationException.class,
                () -> aggregator.aggregate(Perspective.PID, OCTOBER, filters));
        assertThrows(InvariantViolationException.class,
                () -> aggregator.aggregateBoth(Perspective.PRODUCT, SEPTEMBER, OCTOBER,
                        DeepDiveFilters.of(Map.of(Perspective.TEAM, List.of("APAC")))));
        verify(warehouse, never()).queryAggregates(any());
    }

    @Test
    void testOwnKeyAllowedForMultiSelect() {
        when(warehouse.queryAggregates(any())).thenReturn(List.of());
        DeepDiveFilters filters = DeepDiveFilters.of(Map.of(Perspective.PID, List.of("1", "2")));

        assertDoesNotThrow(() -> aggregator.aggregate(Perspective.PID, OCTOBER, filters));
    }

    @Test
    void testAggregateBothQueriesEachPeriod() {
        when(warehouse.queryAggregates(any())).thenAnswer(inv -> {
            AggregateQuery q = inv.getArgument(0);
            double revenue = q.range().equals(SEPTEMBER) ? 10 : 20;
            return List.of(new WarehouseRow("1", "one", 100L, 50L, revenue, 1.0, 0));
        });

        PeriodAggregator.PeriodPair pair =
                aggregator.aggregateBoth(Perspective.TEAM, SEPTEMBER, OCTOBER, DeepDiveFilters.none());

        assertEquals(10.0, pair.period1().get(0).revenue());
        assertEquals(20.0, pair.period2().get(0).revenue());
        verify(warehouse, times(2)).queryAggregates(any());
    }

    @Test
    void testFailureInEitherPeriodFailsWhole() {
        when(warehouse.queryAggregates(any())).thenAnswer(inv -> {
            AggregateQuery q = inv.getArgument(0);
            if (q.range().equals(OCTOBER)) {
                throw new DataSourceException("quota exceeded");
            }
            return List.of();
        });

        DataSourceException e = assertThrows(DataSourceException.class,
                () -> aggregator.aggregateBoth(Perspective.TEAM, SEPTEMBER, OCTOBER, DeepDiveFilters.none()));
        assertEquals("quota exceeded", e.getMessage());
    }
}
