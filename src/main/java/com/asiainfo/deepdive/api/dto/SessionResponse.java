package com.asiainfo.deepdive.api.dto;

import com.asiainfo.deepdive.core.drilldown.DrillDownSession;
import com.asiainfo.deepdive.core.drilldown.DrillDownView;
import com.asiainfo.deepdive.core.model.Perspective;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 下钻会话状态与当前视图
 */
@RegisterForReflection
public record SessionResponse(
    String status,
    String sessionId,
    String perspective,
    Map<String, String> scope, // 分组键 -> 选中的实体 id
    List<String> drillableTo,  // 可下钻的下级视角，叶子视角为空
    DrillDownView view
) {
    public static SessionResponse of(DrillDownSession session, DrillDownView view) {
        Perspective perspective = view != null ? view.perspective() : session.getPerspective();
        Map<String, String> scope = new LinkedHashMap<>();
        session.getPath().scope().forEach((k, v) -> scope.put(k.groupingKey(), v));
        List<String> children = perspective.isLeaf() ? List.of() : List.of(perspective.child().id());
        return new SessionResponse("success", session.getId(), perspective.id(), scope, children, view);
    }
}
