package com.asiainfo.deepdive.core.engine;

import com.asiainfo.deepdive.core.model.ComparisonRecord;
import com.asiainfo.deepdive.core.model.DeepDiveQuery;
import com.asiainfo.deepdive.core.model.DeepDiveResult;
import com.asiainfo.deepdive.core.model.DeepDiveSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Deep Dive 对比引擎
 * 两期聚合 -> 合并 -> 分层 -> 告警 -> 分层过滤 -> 汇总
 */
@ApplicationScoped
public class DeepDiveEngine {

    private static final Logger log = LoggerFactory.getLogger(DeepDiveEngine.class);

    @Inject
    PeriodAggregator aggregator;

    @Inject
    ComparisonMerger merger;

    @Inject
    TierClassifier classifier;

    @Inject
    WarningAnalyzer warningAnalyzer;

    @Inject
    SummaryCalculator summaryCalculator;

    @Inject
    MeterRegistry registry;

    public DeepDiveResult analyze(DeepDiveQuery query) {
        log.info("[Deep Dive] perspective={}, p1={}, p2={}, filters={}",
                query.perspective().id(), query.period1(), query.period2(), query.filters().dimensions());
        Timer.Sample sample = Timer.start(registry);

        PeriodAggregator.PeriodPair periods = aggregator.aggregateBoth(
                query.perspective(), query.period1(), query.period2(), query.filters());

        List<ComparisonRecord> records = merger.merge(periods.period1(), periods.period2());
        records = classifier.classify(records);
        records = warningAnalyzer.annotate(records);

        if (!query.tierFilter().isEmpty()) {
            records = records.stream()
                    .filter(r -> query.tierFilter().contains(r.displayTier()))
                    .toList();
        }

        DeepDiveSummary summary = summaryCalculator.summarize(records);

        sample.stop(registry.timer("deepdive.analyze", "perspective", query.perspective().id()));
        log.info("[Deep Dive] Completed: p1Rows={}, p2Rows={}, items={}, tiers={}",
                periods.period1().size(), periods.period2().size(), records.size(), summary.tierCounts());
        return new DeepDiveResult(records, summary, query);
    }
}
