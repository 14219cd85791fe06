package com.asiainfo.deepdive.core.filter;

import com.asiainfo.deepdive.core.model.DeepDiveFilters;
import com.asiainfo.deepdive.core.model.Perspective;
import com.asiainfo.deepdive.shared.InvariantViolationException;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 结构化过滤条件 -> 参数化 WHERE 片段
 * 所有值都通过 JDBC 绑定参数传入，不拼接字面量；相同的输入总是得到相同的输出
 */
@ApplicationScoped
public class FilterPredicateBuilder {

    private static final char LIKE_ESCAPE = '\\';

    public WherePredicate build(DeepDiveFilters filters) {
        if (filters == null) {
            return WherePredicate.alwaysTrue();
        }
        return buildDimensions(filters.dimensions()).and(buildSimplified(filters.simplifiedFilter()));
    }

    /**
     * 维度选中值：单值生成 key = ?，多值生成 key IN (?, ...)
     * EnumMap 按视角声明顺序迭代，保证输出稳定
     */
    public WherePredicate buildDimensions(Map<Perspective, List<String>> dimensions) {
        WherePredicate result = WherePredicate.alwaysTrue();
        for (Map.Entry<Perspective, List<String>> entry : dimensions.entrySet()) {
            List<String> values = entry.getValue();
            if (values == null || values.isEmpty()) {
                continue;
            }
            String column = entry.getKey().groupingKey();
            if (values.size() == 1) {
                result = result.and(new WherePredicate(column + " = ?", List.of(values.get(0))));
            } else {
                result = result.and(new WherePredicate(
                        column + " IN (" + placeholders(values.size()) + ")", new ArrayList<>(values)));
            }
        }
        return result;
    }

    public WherePredicate buildSimplified(SimplifiedFilter filter) {
        if (filter == null || filter.isEmpty()) {
            return WherePredicate.alwaysTrue();
        }

        List<String> fragments = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        for (FilterClause clause : filter.clauses()) {
            if (!clause.effectivelyEnabled()) {
                continue;
            }
            fragments.add(buildClause(clause, params));
        }

        String joiner = filter.clauseLogic() == SimplifiedFilter.Logic.OR ? " OR " : " AND ";
        String body = "(" + String.join(joiner, fragments) + ")";
        if (filter.includeExclude() == SimplifiedFilter.Mode.EXCLUDE) {
            body = "NOT " + body;
        }
        return new WherePredicate(body, params);
    }

    private String buildClause(FilterClause clause, List<Object> params) {
        if (clause.field() == null || clause.operator() == null) {
            throw new InvariantViolationException("Filter clause requires field and operator: " + clause);
        }
        FilterField field = clause.field();
        String column = field.column();

        switch (clause.operator()) {
            case IS_NULL:
                return column + " IS NULL";
            case IS_NOT_NULL:
                return column + " IS NOT NULL";
            case EQUALS:
                params.add(coerce(field, single(clause)));
                return column + " = ?";
            case NOT_EQUALS:
                params.add(coerce(field, single(clause)));
                return column + " <> ?";
            case GREATER_THAN:
                params.add(coerce(field, single(clause)));
                return column + " > ?";
            case GREATER_THAN_OR_EQUAL:
                params.add(coerce(field, single(clause)));
                return column + " >= ?";
            case LESS_THAN:
                params.add(coerce(field, single(clause)));
                return column + " < ?";
            case LESS_THAN_OR_EQUAL:
                params.add(coerce(field, single(clause)));
                return column + " <= ?";
            case IN:
            case NOT_IN: {
                List<Object> values = multiple(clause);
                if (values.isEmpty()) {
                    throw new InvariantViolationException("Operator " + clause.operator().code()
                            + " requires at least one value for field " + column);
                }
                values.forEach(v -> params.add(coerce(field, v)));
                String op = clause.operator() == FilterOperator.IN ? " IN (" : " NOT IN (";
                return column + op + placeholders(values.size()) + ")";
            }
            case BETWEEN: {
                List<Object> values = multiple(clause);
                if (values.size() != 2) {
                    throw new InvariantViolationException(
                            "Operator between requires exactly two values for field " + column);
                }
                params.add(coerce(field, values.get(0)));
                params.add(coerce(field, values.get(1)));
                return column + " BETWEEN ? AND ?";
            }
            case CONTAINS:
                params.add("%" + escapeLike(String.valueOf(single(clause))) + "%");
                return column + " LIKE ? ESCAPE '" + LIKE_ESCAPE + "'";
            case STARTS_WITH:
                params.add(escapeLike(String.valueOf(single(clause))) + "%");
                return column + " LIKE ? ESCAPE '" + LIKE_ESCAPE + "'";
            case ENDS_WITH:
                params.add("%" + escapeLike(String.valueOf(single(clause))));
                return column + " LIKE ? ESCAPE '" + LIKE_ESCAPE + "'";
            default:
                throw new InvariantViolationException("Unsupported operator: " + clause.operator());
        }
    }

    private Object single(FilterClause clause) {
        Object value = clause.value();
        if (value instanceof Collection<?> c) {
            if (c.size() != 1) {
                throw new InvariantViolationException("Operator " + clause.operator().code()
                        + " expects a single value for field " + clause.field().column());
            }
            value = c.iterator().next();
        }
        if (value == null) {
            throw new InvariantViolationException("Missing value for field " + clause.field().column());
        }
        return value;
    }

    private List<Object> multiple(FilterClause clause) {
        Object value = clause.value();
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> c) {
            return new ArrayList<>(c);
        }
        // "a, b, c" 形式的多值字符串
        if (value instanceof String s) {
            List<Object> values = new ArrayList<>();
            for (String part : s.split(",")) {
                String trimmed = part.trim();
                if (!trimmed.isEmpty()) {
                    values.add(trimmed);
                }
            }
            return values;
        }
        return List.of(value);
    }

    private Object coerce(FilterField field, Object value) {
        if (value == null) {
            throw new InvariantViolationException("Null value for field " + field.column());
        }
        switch (field.dataType()) {
            case NUMBER:
                if (value instanceof Double || value instanceof Float) {
                    return ((Number) value).doubleValue();
                }
                if (value instanceof Number n) {
                    return n.longValue();
                }
                try {
                    String s = String.valueOf(value).trim();
                    if (s.contains(".")) {
                        return Double.parseDouble(s);
                    }
                    return Long.parseLong(s);
                } catch (NumberFormatException e) {
                    throw new InvariantViolationException(String.format(
                            "Field '%s' expects a number but received invalid value: %s", field.column(), value), e);
                }
            case DATE:
                try {
                    return LocalDate.parse(String.valueOf(value).trim()).toString();
                } catch (DateTimeParseException e) {
                    throw new InvariantViolationException(String.format(
                            "Field '%s' expects an ISO date but received: %s", field.column(), value), e);
                }
            default:
                return String.valueOf(value);
        }
    }

    private static String escapeLike(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                sb.append(LIKE_ESCAPE);
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }
}
