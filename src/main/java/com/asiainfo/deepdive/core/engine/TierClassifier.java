package com.asiainfo.deepdive.core.engine;

import com.asiainfo.deepdive.core.model.ComparisonRecord;
import com.asiainfo.deepdive.core.model.LifecycleStatus;
import com.asiainfo.deepdive.core.model.Tier;
import com.asiainfo.deepdive.shared.DeepDiveConstants;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 按累计收入占比分层 (80/15/5)
 *
 * <p>existing 与 new 一起按当期收入排名，lost 单独按基期收入排名。
 * 排名按收入降序、entityId 升序。实体加入前的累计占比低于 80% 记为 A，
 * 低于 95% 记为 B，否则为 C；因此跨过阈值的那个实体仍属于上一层。
 * 组内总收入为 0 时全部为 C。
 */
@ApplicationScoped
public class TierClassifier {

    static final Comparator<ComparisonRecord> RANKING =
            Comparator.comparingDouble(ComparisonRecord::rankingRevenue).reversed()
                    .thenComparing(ComparisonRecord::entityId);

    public List<ComparisonRecord> classify(List<ComparisonRecord> records) {
        List<ComparisonRecord> current = new ArrayList<>();
        List<ComparisonRecord> lost = new ArrayList<>();
        for (ComparisonRecord r : records) {
            if (r.lifecycleStatus() == LifecycleStatus.LOST) {
                lost.add(r);
            } else {
                current.add(r);
            }
        }

        List<ComparisonRecord> result = new ArrayList<>(records.size());
        result.addAll(classifyGroup(current));
        result.addAll(classifyGroup(lost));
        return result;
    }

    private List<ComparisonRecord> classifyGroup(List<ComparisonRecord> group) {
        if (group.isEmpty()) {
            return List.of();
        }
        List<ComparisonRecord> sorted = new ArrayList<>(group);
        sorted.sort(RANKING);

        double total = 0;
        for (ComparisonRecord r : sorted) {
            total += Math.max(0, r.rankingRevenue());
        }

        List<ComparisonRecord> result = new ArrayList<>(sorted.size());
        double cumulative = 0;
        for (ComparisonRecord r : sorted) {
            double revenue = Math.max(0, r.rankingRevenue());
            double before = total > 0 ? cumulative / total : 1.0;
            cumulative += revenue;
            double after = total > 0 ? cumulative / total : 0.0;

            Tier.Rank rank = revenue > 0 ? rankFor(before) : Tier.Rank.C;
            result.add(r.withTier(Tier.of(r.lifecycleStatus(), rank), after * 100));
        }
        return result;
    }

    static Tier.Rank rankFor(double shareBefore) {
        if (shareBefore < DeepDiveConstants.TIER_A_THRESHOLD) {
            return Tier.Rank.A;
        }
        if (shareBefore < DeepDiveConstants.TIER_B_THRESHOLD) {
            return Tier.Rank.B;
        }
        return Tier.Rank.C;
    }
}
