package com.asiainfo.deepdive.api.dto;

import com.asiainfo.deepdive.core.model.ComparisonRecord;
import com.asiainfo.deepdive.core.model.DeepDiveResult;
import com.asiainfo.deepdive.core.model.DeepDiveSummary;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

@RegisterForReflection
public record DeepDiveResponse(
    String status,
    String perspective,
    List<ComparisonRecord> data,
    DeepDiveSummary summary
) {
    public static DeepDiveResponse success(DeepDiveResult result) {
        return new DeepDiveResponse("success", result.query().perspective().id(),
                result.records(), result.summary());
    }
}
