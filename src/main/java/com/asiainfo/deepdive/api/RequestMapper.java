package com.asiainfo.deepdive.api;

import com.asiainfo.deepdive.api.dto.DeepDiveRequest;
import com.asiainfo.deepdive.core.filter.SimplifiedFilter;
import com.asiainfo.deepdive.core.model.DeepDiveFilters;
import com.asiainfo.deepdive.core.model.DeepDiveQuery;
import com.asiainfo.deepdive.core.model.DisplayTier;
import com.asiainfo.deepdive.core.model.Perspective;
import com.asiainfo.deepdive.shared.InvariantViolationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 请求 DTO -> 领域对象
 */
final class RequestMapper {

    private RequestMapper() {
    }

    static DeepDiveQuery toQuery(DeepDiveRequest request) {
        if (request == null) {
            throw new InvariantViolationException("Request body is required");
        }
        return new DeepDiveQuery(
                perspective(request.perspective()),
                request.period1() != null ? request.period1().toRange("period1") : missing("period1"),
                request.period2() != null ? request.period2().toRange("period2") : missing("period2"),
                toFilters(request.filters(), request.simplifiedFilter()),
                toTierFilter(request.tierFilter()));
    }

    static Perspective perspective(String id) {
        if (id == null || id.isBlank()) {
            throw new InvariantViolationException("Perspective is required");
        }
        return Perspective.fromGroupingKey(id);
    }

    /**
     * 键可以是视角 id 或分组键；值为单个 id、数组或数字，空值忽略
     */
    static DeepDiveFilters toFilters(Map<String, Object> filters, SimplifiedFilter simplifiedFilter) {
        Map<Perspective, List<String>> dimensions = new EnumMap<>(Perspective.class);
        if (filters != null) {
            filters.forEach((key, value) -> {
                List<String> values = values(value);
                if (!values.isEmpty()) {
                    dimensions.put(Perspective.fromGroupingKey(key), values);
                }
            });
        }
        return new DeepDiveFilters(dimensions, simplifiedFilter);
    }

    static Set<DisplayTier> toTierFilter(List<String> tiers) {
        if (tiers == null || tiers.isEmpty()) {
            return Set.of();
        }
        Set<DisplayTier> result = EnumSet.noneOf(DisplayTier.class);
        for (String t : tiers) {
            result.add(DisplayTier.fromCode(t));
        }
        return result;
    }

    private static List<String> values(Object value) {
        List<String> values = new ArrayList<>();
        if (value instanceof Collection<?> c) {
            for (Object v : c) {
                if (v != null && !String.valueOf(v).isBlank()) {
                    values.add(String.valueOf(v).trim());
                }
            }
        } else if (value != null && !String.valueOf(value).isBlank()) {
            values.add(String.valueOf(value).trim());
        }
        return values;
    }

    private static <T> T missing(String field) {
        throw new InvariantViolationException(field + " is required");
    }
}
