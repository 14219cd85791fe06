package com.asiainfo.deepdive.core.engine;

import com.asiainfo.deepdive.core.model.ComparisonRecord;
import com.asiainfo.deepdive.core.model.EntityAggregate;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 两期结果按 entityId 全外连接
 */
@ApplicationScoped
public class ComparisonMerger {

    public List<ComparisonRecord> merge(List<EntityAggregate> period1, List<EntityAggregate> period2) {
        Map<String, EntityAggregate> p1 = index(period1);
        Map<String, EntityAggregate> p2 = index(period2);

        Set<String> ids = new LinkedHashSet<>(p2.keySet());
        ids.addAll(p1.keySet());

        List<ComparisonRecord> records = new ArrayList<>(ids.size());
        for (String id : ids) {
            EntityAggregate a1 = p1.get(id);
            EntityAggregate a2 = p2.get(id);
            records.add(ComparisonRecord.of(id, displayName(id, a1, a2), a1, a2));
        }
        return records;
    }

    /**
     * 名称优先取当期，为空时回退到基期
     */
    static String displayName(String id, EntityAggregate a1, EntityAggregate a2) {
        if (a2 != null && a2.displayName() != null && !a2.displayName().isBlank()) {
            return a2.displayName();
        }
        if (a1 != null && a1.displayName() != null && !a1.displayName().isBlank()) {
            return a1.displayName();
        }
        return id;
    }

    private static Map<String, EntityAggregate> index(List<EntityAggregate> aggregates) {
        Map<String, EntityAggregate> map = new LinkedHashMap<>();
        if (aggregates != null) {
            for (EntityAggregate agg : aggregates) {
                map.put(agg.entityId(), agg);
            }
        }
        return map;
    }
}
