package com.asiainfo.deepdive.api.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;

@RegisterForReflection
public record PeriodChangeRequest(
    PeriodDto period1,
    PeriodDto period2
) {
}
