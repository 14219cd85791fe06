package com.asiainfo.deepdive.core.model;

import java.util.List;

public record DeepDiveResult(
    List<ComparisonRecord> records,
    DeepDiveSummary summary,
    DeepDiveQuery query
) {
    public DeepDiveResult {
        records = List.copyOf(records);
    }
}
