package com.asiainfo.deepdive.core.model;

import java.util.List;

/**
 * 针对单个实体的可执行告警，priority 越小越紧急
 */
public record ActionableWarning(
    WarningSeverity severity,
    String message,
    List<String> metrics,
    int priority
) {
    private static final ActionableWarning HEALTHY =
            new ActionableWarning(WarningSeverity.HEALTHY, null, List.of(), Integer.MAX_VALUE);

    public ActionableWarning {
        metrics = metrics == null ? List.of() : List.copyOf(metrics);
    }

    public static ActionableWarning healthy() {
        return HEALTHY;
    }

    public static ActionableWarning critical(String message, String... metrics) {
        return new ActionableWarning(WarningSeverity.CRITICAL, message, List.of(metrics), 1);
    }

    public static ActionableWarning warning(String message, String... metrics) {
        return new ActionableWarning(WarningSeverity.WARNING, message, List.of(metrics), 2);
    }

    public static ActionableWarning info(String message, String... metrics) {
        return new ActionableWarning(WarningSeverity.INFO, message, List.of(metrics), 3);
    }
}
