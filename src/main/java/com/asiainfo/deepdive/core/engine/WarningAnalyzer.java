package com.asiainfo.deepdive.core.engine;

import com.asiainfo.deepdive.core.model.ActionableWarning;
import com.asiainfo.deepdive.core.model.ComparisonRecord;
import com.asiainfo.deepdive.core.model.EntityAggregate;
import com.asiainfo.deepdive.core.model.LifecycleStatus;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * 可执行告警
 *
 * <p>只分析 existing 实体；请求量、eCPM、收入按变化百分比判断，填充率按百分点变化判断。
 * 同时命中多条时返回优先级最高（priority 最小）且最先命中的一条。
 */
@ApplicationScoped
public class WarningAnalyzer {

    static final double CRITICAL_DROP = -40;
    static final double WARNING_DROP = -25;
    static final double INFO_DROP = -15;
    static final double FILL_RATE_CRITICAL_LEVEL = 50;

    public List<ComparisonRecord> annotate(List<ComparisonRecord> records) {
        return records.stream().map(r -> r.withWarning(analyze(r))).toList();
    }

    public ActionableWarning analyze(ComparisonRecord record) {
        if (record.lifecycleStatus() != LifecycleStatus.EXISTING) {
            return ActionableWarning.healthy();
        }
        EntityAggregate p1 = record.period1();
        EntityAggregate p2 = record.period2();

        double reqChange = change(p1.requests(), p2.requests());
        double revChange = change(p1.revenue(), p2.revenue());
        double ecpmChange = change(p1.ecpm(), p2.ecpm());
        double fillP2 = p2.fillRate();
        double fillChange = fillP2 - p1.fillRate();

        List<ActionableWarning> hits = new ArrayList<>();

        // priority 1
        if (reqChange <= CRITICAL_DROP) {
            hits.add(ActionableWarning.critical(format(
                    "Request volume dropped %.1f%% - Contact publisher immediately to check integration",
                    -reqChange), "requests"));
        }
        if (ecpmChange <= CRITICAL_DROP) {
            hits.add(ActionableWarning.critical(format(
                    "eCPM dropped %.1f%% - Urgent floor price review or demand partner check needed",
                    -ecpmChange), "ecpm"));
        }
        if (reqChange <= WARNING_DROP && ecpmChange <= WARNING_DROP) {
            hits.add(ActionableWarning.critical(format(
                    "Revenue crisis: Requests down %.1f%%, eCPM down %.1f%% - Immediate investigation required",
                    -reqChange, -ecpmChange), "requests", "ecpm", "revenue"));
        }
        if (fillP2 < FILL_RATE_CRITICAL_LEVEL && fillChange <= -15) {
            hits.add(ActionableWarning.critical(format(
                    "Fill rate critically low at %.1f%% - Check demand partner health immediately",
                    fillP2), "fill_rate"));
        }

        // priority 2
        if (reqChange > CRITICAL_DROP && reqChange <= WARNING_DROP) {
            hits.add(ActionableWarning.warning(format(
                    "Traffic dropped %.1f%% - Verify publisher ad tag implementation", -reqChange), "requests"));
        }
        if (ecpmChange > CRITICAL_DROP && ecpmChange <= WARNING_DROP) {
            hits.add(ActionableWarning.warning(format(
                    "eCPM declining %.1f%% - Consider floor price optimization", -ecpmChange), "ecpm"));
        }
        if (revChange <= WARNING_DROP && revChange > CRITICAL_DROP) {
            if (reqChange <= INFO_DROP && ecpmChange > -10) {
                hits.add(ActionableWarning.warning(format(
                        "Revenue down %.1f%% due to traffic drop - Contact publisher about ad inventory",
                        -revChange), "revenue", "requests"));
            } else if (ecpmChange <= INFO_DROP && reqChange > -10) {
                hits.add(ActionableWarning.warning(format(
                        "Revenue down %.1f%% due to eCPM decline - Review pricing strategy",
                        -revChange), "revenue", "ecpm"));
            }
        }
        if (fillChange <= -15 && fillChange > -30 && fillP2 >= FILL_RATE_CRITICAL_LEVEL) {
            hits.add(ActionableWarning.warning(format(
                    "Fill rate dropped %.1fpp - Monitor demand partner performance", -fillChange), "fill_rate"));
        }

        // priority 3
        if (reqChange > WARNING_DROP && reqChange <= INFO_DROP) {
            hits.add(ActionableWarning.info(format(
                    "Requests declining %.1f%% - Monitor for continued trend", -reqChange), "requests"));
        }
        if (ecpmChange > WARNING_DROP && ecpmChange <= INFO_DROP) {
            hits.add(ActionableWarning.info(format(
                    "eCPM slightly down %.1f%% - Within normal market fluctuation range", -ecpmChange), "ecpm"));
        }
        if (fillChange <= -10 && fillChange > -15) {
            hits.add(ActionableWarning.info(format(
                    "Fill rate decreased %.1fpp - Continue monitoring", -fillChange), "fill_rate"));
        }

        return hits.stream()
                .min(Comparator.comparingInt(ActionableWarning::priority))
                .orElse(ActionableWarning.healthy());
    }

    /**
     * 基期为 0 时不产生告警，按 0 处理
     */
    private static double change(double v1, double v2) {
        return v1 > 0 ? (v2 - v1) / v1 * 100 : 0;
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
