package com.asiainfo.deepdive.core.engine;

import com.asiainfo.deepdive.core.model.ComparisonRecord;
import com.asiainfo.deepdive.core.model.DeepDiveSummary;
import com.asiainfo.deepdive.core.model.DisplayTier;
import com.asiainfo.deepdive.core.model.MetricDeltas;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 对比结果汇总：总量、变化率、按展示分组的数量与当期收入
 */
@ApplicationScoped
public class SummaryCalculator {

    public DeepDiveSummary summarize(List<ComparisonRecord> records) {
        double revenueP1 = 0;
        double revenueP2 = 0;
        long requestsP1 = 0;
        long requestsP2 = 0;

        Map<DisplayTier, Integer> tierCounts = new EnumMap<>(DisplayTier.class);
        Map<DisplayTier, Double> tierRevenue = new EnumMap<>(DisplayTier.class);
        for (DisplayTier t : DisplayTier.values()) {
            tierCounts.put(t, 0);
            tierRevenue.put(t, 0.0);
        }

        for (ComparisonRecord r : records) {
            revenueP1 += r.revenueP1();
            revenueP2 += r.revenueP2();
            requestsP1 += r.period1() != null ? r.period1().requests() : 0;
            requestsP2 += r.period2() != null ? r.period2().requests() : 0;

            DisplayTier tier = r.displayTier();
            if (tier != null) {
                tierCounts.merge(tier, 1, Integer::sum);
                tierRevenue.merge(tier, r.revenueP2(), Double::sum);
            }
        }

        double ecpmP1 = requestsP1 > 0 ? revenueP1 / requestsP1 * 1000 : 0;
        double ecpmP2 = requestsP2 > 0 ? revenueP2 / requestsP2 * 1000 : 0;

        return new DeepDiveSummary(
                records.size(),
                revenueP1,
                revenueP2,
                MetricDeltas.percentChange(revenueP1, revenueP2),
                requestsP1,
                requestsP2,
                MetricDeltas.percentChange(requestsP1, requestsP2),
                ecpmP1,
                ecpmP2,
                MetricDeltas.percentChange(ecpmP1, ecpmP2),
                tierCounts,
                tierRevenue);
    }
}
