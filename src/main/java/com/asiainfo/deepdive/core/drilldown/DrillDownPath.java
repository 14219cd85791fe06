package com.asiainfo.deepdive.core.drilldown;

import com.asiainfo.deepdive.core.model.Perspective;
import com.asiainfo.deepdive.shared.InvariantViolationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 下钻路径（不可变）
 * 范围过滤由面包屑推导，二者始终一一对应：每个面包屑贡献 scope[perspective] = entityId
 */
public final class DrillDownPath {

    private static final DrillDownPath EMPTY = new DrillDownPath(List.of());

    private final List<BreadcrumbEntry> breadcrumbs;

    private DrillDownPath(List<BreadcrumbEntry> breadcrumbs) {
        this.breadcrumbs = List.copyOf(breadcrumbs);
    }

    public static DrillDownPath empty() {
        return EMPTY;
    }

    public DrillDownPath push(BreadcrumbEntry entry) {
        for (BreadcrumbEntry b : breadcrumbs) {
            if (b.perspective() == entry.perspective()) {
                throw new InvariantViolationException(
                        "Perspective already scoped in drill-down path: " + entry.perspective().id());
            }
        }
        List<BreadcrumbEntry> next = new ArrayList<>(breadcrumbs);
        next.add(entry);
        return new DrillDownPath(next);
    }

    public DrillDownPath pop() {
        if (breadcrumbs.isEmpty()) {
            throw new InvariantViolationException("Cannot ascend: drill-down path is empty");
        }
        return new DrillDownPath(breadcrumbs.subList(0, breadcrumbs.size() - 1));
    }

    /**
     * 截断到指定深度，0 表示回到根
     */
    public DrillDownPath truncate(int depth) {
        if (depth < 0 || depth > breadcrumbs.size()) {
            throw new InvariantViolationException(String.format(
                    "Breadcrumb depth %d out of range [0, %d]", depth, breadcrumbs.size()));
        }
        return new DrillDownPath(breadcrumbs.subList(0, depth));
    }

    public BreadcrumbEntry peek() {
        return breadcrumbs.isEmpty() ? null : breadcrumbs.get(breadcrumbs.size() - 1);
    }

    public boolean isEmpty() {
        return breadcrumbs.isEmpty();
    }

    public int depth() {
        return breadcrumbs.size();
    }

    public List<BreadcrumbEntry> breadcrumbs() {
        return breadcrumbs;
    }

    public Map<Perspective, String> scope() {
        Map<Perspective, String> scope = new EnumMap<>(Perspective.class);
        for (BreadcrumbEntry b : breadcrumbs) {
            scope.put(b.perspective(), b.entityId());
        }
        return Collections.unmodifiableMap(scope);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DrillDownPath other && breadcrumbs.equals(other.breadcrumbs);
    }

    @Override
    public int hashCode() {
        return breadcrumbs.hashCode();
    }

    @Override
    public String toString() {
        return breadcrumbs.isEmpty() ? "<root>" : breadcrumbs.stream()
                .map(b -> b.perspective().id() + "=" + b.entityId())
                .reduce((a, b) -> a + " > " + b)
                .orElse("");
    }
}
