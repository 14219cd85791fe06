package com.asiainfo.deepdive.core.filter;

import java.util.ArrayList;
import java.util.List;

/**
 * 参数化的 WHERE 片段，sql 中的 ? 与 params 一一对应
 */
public record WherePredicate(
    String sql,
    List<Object> params
) {
    private static final WherePredicate ALWAYS_TRUE = new WherePredicate("1=1", List.of());

    public WherePredicate {
        params = List.copyOf(params);
    }

    public static WherePredicate alwaysTrue() {
        return ALWAYS_TRUE;
    }

    public boolean isAlwaysTrue() {
        return ALWAYS_TRUE.sql.equals(sql) && params.isEmpty();
    }

    public WherePredicate and(WherePredicate other) {
        if (other == null || other.isAlwaysTrue()) {
            return this;
        }
        if (isAlwaysTrue()) {
            return other;
        }
        List<Object> merged = new ArrayList<>(params);
        merged.addAll(other.params);
        return new WherePredicate(sql + " AND " + other.sql, merged);
    }
}
