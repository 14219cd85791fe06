package com.asiainfo.deepdive.api.dto;

import com.asiainfo.deepdive.core.model.PeriodRange;
import com.asiainfo.deepdive.shared.InvariantViolationException;
import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * 周期，日期格式 yyyy-MM-dd
 */
@RegisterForReflection
public record PeriodDto(
    String start,
    String end
) {
    public PeriodRange toRange(String label) {
        if (start == null || end == null) {
            throw new InvariantViolationException(label + " requires start and end");
        }
        return PeriodRange.of(start, end);
    }
}
