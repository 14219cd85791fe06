package com.asiainfo.deepdive.core.filter;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * 扁平的结构化过滤条件
 * INCLUDE 生成 (...)，EXCLUDE 生成 NOT (...)；clauseLogic 决定各条件之间用 AND 还是 OR
 */
public record SimplifiedFilter(
    String name,
    Mode includeExclude,
    Logic clauseLogic,
    List<FilterClause> clauses
) {
    public enum Mode { INCLUDE, EXCLUDE }

    public enum Logic { AND, OR }

    private static final SimplifiedFilter NONE = new SimplifiedFilter(null, Mode.INCLUDE, Logic.AND, List.of());

    public SimplifiedFilter {
        includeExclude = includeExclude == null ? Mode.INCLUDE : includeExclude;
        clauseLogic = clauseLogic == null ? Logic.AND : clauseLogic;
        clauses = clauses == null ? List.of() : List.copyOf(clauses);
    }

    public static SimplifiedFilter none() {
        return NONE;
    }

    public static SimplifiedFilter include(Logic logic, FilterClause... clauses) {
        return new SimplifiedFilter(null, Mode.INCLUDE, logic, List.of(clauses));
    }

    public static SimplifiedFilter exclude(Logic logic, FilterClause... clauses) {
        return new SimplifiedFilter(null, Mode.EXCLUDE, logic, List.of(clauses));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return clauses.stream().noneMatch(FilterClause::effectivelyEnabled);
    }
}
