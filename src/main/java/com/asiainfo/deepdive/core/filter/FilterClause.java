package com.asiainfo.deepdive.core.filter;

/**
 * 单个过滤条件，value 可以是单值或数组（in / not_in / between）
 */
public record FilterClause(
    FilterField field,
    FilterOperator operator,
    Object value,
    Boolean enabled // 缺省视为启用
) {
    public static FilterClause of(FilterField field, FilterOperator operator, Object value) {
        return new FilterClause(field, operator, value, Boolean.TRUE);
    }

    public boolean effectivelyEnabled() {
        return enabled == null || enabled;
    }
}
